package com.di.bancodemo.generator;

import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;

import java.util.List;

/**
 * Produces synthetic rows for a table.
 * <p>
 * Implementations must return exactly {@code count} rows, each built with {@code schema};
 * the materializer treats any other size as a data error.
 */
public interface RowSource {

    List<Row> generate(String tableName, Schema schema, long count);
}
