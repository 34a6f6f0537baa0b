package com.di.bancodemo.reconcile;

import com.di.bancodemo.exception.DataException;
import com.di.bancodemo.exception.SchemaException;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.schemas.transforms.Select;
import org.apache.beam.sdk.transforms.Count;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.View;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.PCollectionView;
import org.apache.beam.sdk.values.Row;
import org.apache.beam.sdk.values.TupleTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Re-keys a fact table's foreign key from a dimension table that may be much smaller.
 * <p>
 * The dimension keys are shuffled and virtually replicated into a {@link KeyPool} of
 * {@code keys * max(1, ceil(facts / keys))} slots; fact rows take consecutive slots starting at a
 * random offset, so keys are handed out round-robin. Every fact row comes out exactly once with
 * its foreign key replaced in place (the column takes the dimension key's type); all other
 * columns are untouched.
 * <p>
 * Input is a {@link PCollectionTuple} with {@link #DIMENSION} and {@link #FACT}. The pipeline fails
 * with a {@link DataException} when the dimension is empty or when the output row count differs
 * from the fact row count. An empty fact table gives an empty output.
 */
public class CardinalityReconciler extends PTransform<PCollectionTuple, PCollection<Row>> {

    public static final TupleTag<Row> DIMENSION = new TupleTag<>("dimension");
    public static final TupleTag<Row> FACT = new TupleTag<>("fact");

    private final String dimensionKey;
    private final String factKey;
    private final Long seed;

    private CardinalityReconciler(String dimensionKey, String factKey, Long seed) {
        super("CardinalityReconciler");
        this.dimensionKey = dimensionKey;
        this.factKey = factKey;
        this.seed = seed;
    }

    public static CardinalityReconciler of(String dimensionKey, String factKey) {
        return new CardinalityReconciler(dimensionKey, factKey, null);
    }

    /** Fixes the shuffle and the starting offsets: the same input split into the same bundles gets the same keys. */
    public CardinalityReconciler withSeed(Long seed) {
        return new CardinalityReconciler(dimensionKey, factKey, seed);
    }

    public PCollection<Row> reconcile(PCollection<Row> dimension, PCollection<Row> fact) {
        return PCollectionTuple.of(DIMENSION, dimension).and(FACT, fact).apply(this);
    }

    @Override
    public PCollection<Row> expand(PCollectionTuple input) {
        PCollection<Row> dimension = input.get(DIMENSION);
        PCollection<Row> fact = input.get(FACT);
        Schema outputSchema = outputSchema(dimension.getSchema(), fact.getSchema());

        dimension
                .apply("CountDimension", Count.<Row>globally())
                .apply("RequireDimensionRows", ParDo.of(new RequireNonEmptyFn()));

        PCollectionView<List<Row>> keysView = dimension
                .apply("SelectDimensionKey", Select.fieldNames(dimensionKey))
                .apply("DimensionKeysView", View.asList());
        PCollectionView<Long> factCountView = fact
                .apply("CountFacts", Count.<Row>globally())
                .apply("FactCountView", View.asSingleton());

        PCollection<Row> rekeyed = fact
                .apply("AssignKeys", ParDo.of(new AssignKeysFn(keysView, factCountView, factKey, outputSchema, seed))
                        .withSideInputs(keysView, factCountView))
                .setRowSchema(outputSchema);

        rekeyed
                .apply("CountRekeyed", Count.<Row>globally())
                .apply("VerifyCardinality", ParDo.of(new VerifyCountFn(factCountView)).withSideInputs(factCountView));
        return rekeyed;
    }

    /**
     * The fact schema with the foreign key column retyped to the dimension key's type.
     *
     * @throws SchemaException when either key column is missing
     */
    public Schema outputSchema(Schema dimensionSchema, Schema factSchema) {
        requireColumn(dimensionSchema, dimensionKey, "dimension");
        requireColumn(factSchema, factKey, "fact");
        return rekeyedSchema(factSchema, factKey, dimensionSchema.getField(dimensionKey).getType());
    }

    static Schema rekeyedSchema(Schema factSchema, String factKey, Schema.FieldType keyType) {
        Schema.Builder builder = Schema.builder();
        for (Schema.Field field : factSchema.getFields()) {
            builder.addField(field.getName().equals(factKey) ? field.withType(keyType) : field);
        }
        return builder.build();
    }

    private static void requireColumn(Schema schema, String column, String side) {
        if (!schema.hasField(column)) {
            throw new SchemaException(String.format("Key column '%s' is not a column of the %s table (columns: %s)",
                    column, side, schema.getFieldNames()));
        }
    }

    static class RequireNonEmptyFn extends DoFn<Long, Void> {
        @ProcessElement
        public void process(@Element Long count) {
            if (count == 0L) {
                throw new DataException("Dimension table is empty; there are no keys to assign");
            }
        }
    }

    static class VerifyCountFn extends DoFn<Long, Void> {
        private static final Logger LOG = LoggerFactory.getLogger(VerifyCountFn.class);
        private final PCollectionView<Long> factCountView;

        VerifyCountFn(PCollectionView<Long> factCountView) {
            this.factCountView = factCountView;
        }

        @ProcessElement
        public void process(ProcessContext c) {
            long output = c.element();
            long expected = c.sideInput(factCountView);
            if (output != expected) {
                throw new DataException(String.format(
                        "Reconciled table has %d rows, fact table has %d", output, expected));
            }
            LOG.info("[RECONCILE] {} fact rows re-keyed", output);
        }
    }

    /**
     * Builds the key pool once per instance. Each bundle starts at its own offset; with a seed
     * the offset is drawn from the seed, the bundle ordinal and the bundle's first row, so
     * parallel instances do not walk the pool in step.
     */
    static class AssignKeysFn extends DoFn<Row, Row> {
        private final PCollectionView<List<Row>> keysView;
        private final PCollectionView<Long> factCountView;
        private final String factKey;
        private final Schema outputSchema;
        private final Long seed;

        private transient Random random;
        private transient KeyPool pool;
        private transient long bundles;
        private transient boolean offsetDrawn;
        private transient long slot;

        AssignKeysFn(PCollectionView<List<Row>> keysView, PCollectionView<Long> factCountView,
                     String factKey, Schema outputSchema, Long seed) {
            this.keysView = keysView;
            this.factCountView = factCountView;
            this.factKey = factKey;
            this.outputSchema = outputSchema;
            this.seed = seed;
        }

        @Setup
        public void setup() {
            random = seed == null ? new Random() : new Random(seed);
            pool = null;
            bundles = 0L;
        }

        @StartBundle
        public void startBundle() {
            bundles++;
            offsetDrawn = false;
        }

        @ProcessElement
        public void process(ProcessContext c) {
            Row fact = c.element();
            if (pool == null) {
                pool = buildPool(c.sideInput(keysView), c.sideInput(factCountView));
            }
            if (!offsetDrawn) {
                slot = bundleRandom(fact).nextInt(pool.keyCount());
                offsetDrawn = true;
            }
            Object key = pool.get(slot++);

            List<Object> values = new ArrayList<>(fact.getValues());
            values.set(outputSchema.indexOf(factKey), key);
            c.output(Row.withSchema(outputSchema).addValues(values).build());
        }

        private KeyPool buildPool(List<Row> keyRows, long factCount) {
            if (keyRows.isEmpty()) {
                throw new DataException("Dimension table is empty; there are no keys to assign");
            }
            List<Object> keys = new ArrayList<>(keyRows.size());
            for (Row keyRow : keyRows) {
                keys.add(keyRow.getValue(0));
            }
            return KeyPool.inflate(keys, factCount, random);
        }

        private Random bundleRandom(Row firstRow) {
            if (seed == null) {
                return random;
            }
            long mixed = seed ^ (bundles * 0x9E3779B97F4A7C15L) ^ Objects.hashCode(firstRow.getValues());
            return new Random(mixed);
        }
    }
}
