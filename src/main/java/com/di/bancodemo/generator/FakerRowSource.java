package com.di.bancodemo.generator;

import com.di.bancodemo.config.BancoDemoProperties;
import com.di.bancodemo.exception.SchemaException;
import com.di.bancodemo.schema.SparkTypeMapper;
import lombok.extern.slf4j.Slf4j;
import net.datafaker.Faker;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;
import org.joda.time.Instant;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.UUID;

/**
 * Default {@link RowSource}: fills every column from Datafaker, picking the value kind
 * from the column name first and from the column type otherwise.
 * <p>
 * With {@code bancodemo.generator-seed} set, the same table always gets the same rows.
 */
@Slf4j
@Component
public class FakerRowSource implements RowSource {

    private static final String[] CATEGORIES = {
            "alimentacao", "transporte", "saude", "educacao", "lazer", "vestuario", "servicos", "viagem"
    };

    private final Locale locale;
    private final Long seed;
    private final Clock clock;

    @Autowired
    public FakerRowSource(BancoDemoProperties properties, Clock clock) {
        this(Locale.forLanguageTag(properties.getGeneratorLocale()), properties.getGeneratorSeed(), clock);
    }

    public FakerRowSource(Locale locale, Long seed, Clock clock) {
        this.locale = locale;
        this.seed = seed;
        this.clock = clock;
    }

    @Override
    public List<Row> generate(String tableName, Schema schema, long count) {
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Cannot generate more than " + Integer.MAX_VALUE + " rows in memory, got " + count);
        }
        Random random = seed == null ? new Random() : new Random(seed ^ tableName.hashCode());
        Faker faker = new Faker(locale, random);
        LocalDate today = LocalDate.now(clock);

        List<Row> rows = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            List<Object> values = new ArrayList<>(schema.getFieldCount());
            for (Schema.Field field : schema.getFields()) {
                values.add(valueFor(field, i, faker, random, today));
            }
            rows.add(Row.withSchema(schema).addValues(values).build());
        }
        log.debug("[GENERATOR] {} rows for '{}'", rows.size(), tableName);
        return rows;
    }

    private Object valueFor(Schema.Field field, long index, Faker faker, Random random, LocalDate today) {
        String name = field.getName().toLowerCase(Locale.ROOT);
        Schema.FieldType type = field.getType();

        if (SparkTypeMapper.isDate(type)) {
            return name.contains("nascimento")
                    ? today.minusYears(18 + random.nextInt(60)).minusDays(random.nextInt(365))
                    : today.minusDays(random.nextInt(3 * 365));
        }
        switch (type.getTypeName()) {
            case STRING:
                return text(name, faker, random);
            case INT16:
                return (short) (index + 1);
            case BYTE:
                return (byte) random.nextInt(Byte.MAX_VALUE);
            case INT32:
                return name.startsWith("id_") ? (int) (index + 1) : random.nextInt(1_000);
            case INT64:
                return name.startsWith("id_") ? index + 1 : (long) random.nextInt(1_000_000);
            case DOUBLE:
                return amount(name, random);
            case FLOAT:
                return (float) amount(name, random);
            case BOOLEAN:
                return random.nextBoolean();
            case DATETIME:
                return Instant.ofEpochMilli(clock.millis() - (long) random.nextInt(90 * 24 * 3600) * 1000L);
            case BYTES:
                return UUID.randomUUID().toString().getBytes(StandardCharsets.UTF_8);
            default:
                throw new SchemaException("Cannot generate values for column '" + field.getName() + "' of type " + type);
        }
    }

    private static String text(String name, Faker faker, Random random) {
        if (name.equals("id_uf") || name.equals("uf") || name.contains("estado")) {
            return faker.address().stateAbbr();
        }
        if (name.startsWith("id_")) {
            return new UUID(random.nextLong(), random.nextLong()).toString();
        }
        if (name.contains("email")) {
            return faker.internet().emailAddress();
        }
        if (name.contains("cpf")) {
            return faker.cpf().valid();
        }
        if (name.contains("estabelecimento") || name.contains("empresa")) {
            return faker.company().name();
        }
        if (name.contains("nome")) {
            return faker.name().fullName();
        }
        if (name.contains("cidade")) {
            return faker.address().city();
        }
        if (name.contains("endereco")) {
            return faker.address().streetAddress();
        }
        if (name.contains("telefone") || name.contains("celular")) {
            return faker.phoneNumber().cellPhone();
        }
        if (name.contains("categoria")) {
            return CATEGORIES[random.nextInt(CATEGORIES.length)];
        }
        return faker.lorem().word();
    }

    private static double amount(String name, Random random) {
        double max = name.contains("limite") ? 50_000d : 5_000d;
        double raw = 1d + random.nextDouble() * (max - 1d);
        return Math.round(raw * 100d) / 100d;
    }
}
