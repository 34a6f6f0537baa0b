package com.di.bancodemo.util;

import com.di.bancodemo.schema.SparkTypeMapper;
import org.apache.beam.sdk.schemas.Schema;
import org.joda.time.Instant;
import org.joda.time.ReadableInstant;

import java.nio.ByteBuffer;
import java.time.LocalDate;

/**
 * Converts values read back from Avro/Parquet records to the Java types Beam expects for
 * a schema field.
 * <p>
 * Parquet files carry no short or byte columns, dates come back as epoch days or as
 * date objects depending on the reader, timestamps as epoch millis, strings as
 * {@link CharSequence} (Avro {@code Utf8}) and binary as {@link ByteBuffer}.
 */
public final class TypeConverter {

    private TypeConverter() {
    }

    /**
     * @return the converted value, or null for null input
     * @throws IllegalArgumentException when the value cannot represent the field type
     */
    public static Object convertToSchemaType(Object value, Schema.Field field) {
        if (value == null) {
            return null;
        }
        Schema.FieldType type = field.getType();
        if (SparkTypeMapper.isDate(type)) {
            return convertToLocalDate(value, field.getName());
        }
        switch (type.getTypeName()) {
            case STRING:
                return value.toString();
            case INT64:
                return ((Number) requireNumber(value, field)).longValue();
            case INT32:
                return ((Number) requireNumber(value, field)).intValue();
            case INT16:
                return ((Number) requireNumber(value, field)).shortValue();
            case BYTE:
                return ((Number) requireNumber(value, field)).byteValue();
            case DOUBLE:
                return ((Number) requireNumber(value, field)).doubleValue();
            case FLOAT:
                return ((Number) requireNumber(value, field)).floatValue();
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                return Boolean.parseBoolean(value.toString());
            case DATETIME:
                return convertToInstant(value, field.getName());
            case BYTES:
                if (value instanceof ByteBuffer buffer) {
                    ByteBuffer copy = buffer.duplicate();
                    byte[] bytes = new byte[copy.remaining()];
                    copy.get(bytes);
                    return bytes;
                }
                if (value instanceof byte[]) {
                    return value;
                }
                throw cannotConvert(value, field);
            default:
                throw cannotConvert(value, field);
        }
    }

    static LocalDate convertToLocalDate(Object value, String fieldName) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof Integer days) {
            return LocalDate.ofEpochDay(days);
        }
        if (value instanceof ReadableInstant instant) {
            return LocalDate.ofEpochDay(Math.floorDiv(instant.getMillis(), 86_400_000L));
        }
        if (value instanceof CharSequence text) {
            return LocalDate.parse(text.toString());
        }
        throw new IllegalArgumentException(String.format("Cannot convert %s to DATE for field '%s'",
                value.getClass().getSimpleName(), fieldName));
    }

    static Instant convertToInstant(Object value, String fieldName) {
        if (value instanceof ReadableInstant instant) {
            return instant.toInstant();
        }
        if (value instanceof Long millis) {
            return Instant.ofEpochMilli(millis);
        }
        if (value instanceof java.time.Instant instant) {
            return Instant.ofEpochMilli(instant.toEpochMilli());
        }
        throw new IllegalArgumentException(String.format("Cannot convert %s to DATETIME for field '%s'",
                value.getClass().getSimpleName(), fieldName));
    }

    private static Object requireNumber(Object value, Schema.Field field) {
        if (!(value instanceof Number)) {
            throw cannotConvert(value, field);
        }
        return value;
    }

    private static IllegalArgumentException cannotConvert(Object value, Schema.Field field) {
        return new IllegalArgumentException(String.format("Cannot convert %s to %s for field '%s'",
                value.getClass().getSimpleName(), field.getType().getTypeName(), field.getName()));
    }
}
