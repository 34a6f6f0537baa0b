package com.di.bancodemo.schema;

import org.apache.beam.sdk.schemas.Schema;

/**
 * Resolves a table name to the column schema its generated rows must follow.
 */
public interface SchemaRegistry {

    /**
     * @throws com.di.bancodemo.exception.SchemaException when no usable schema exists for the table
     */
    Schema schemaFor(String tableName);
}
