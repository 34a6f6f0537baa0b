package com.di.bancodemo.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.Row;
import org.joda.time.ReadableInstant;

import java.time.temporal.TemporalAccessor;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One JSON object per row, keys in schema order. Dates and timestamps are ISO-8601 strings,
 * binary columns are Base64.
 */
class RowJsonFn implements SerializableFunction<Row, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String apply(Row row) {
        Map<String, Object> json = new LinkedHashMap<>();
        for (Schema.Field field : row.getSchema().getFields()) {
            json.put(field.getName(), toJsonValue(row.getValue(field.getName())));
        }
        try {
            return MAPPER.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize row to JSON: " + e.getMessage(), e);
        }
    }

    static Object toJsonValue(Object value) {
        if (value instanceof TemporalAccessor || value instanceof ReadableInstant) {
            return value.toString();
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        return value;
    }
}
