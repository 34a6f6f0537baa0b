package com.di.bancodemo.sink;

import com.di.bancodemo.materialize.WriteDecision;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.values.PBegin;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;

import java.time.Duration;

/**
 * Everything a sink needs to write one table once.
 */
@Value
@Builder(toBuilder = true)
public class TableWrite {

    @NonNull
    String tableName;
    /** Catalog database; null for flat-file writes. */
    String databaseName;
    /** Schema of the rows {@link #source} produces. */
    @NonNull
    Schema schema;
    /** Builds the rows to write inside the write pipeline. */
    @NonNull
    PTransform<PBegin, PCollection<Row>> source;
    @NonNull
    WriteDecision decision;
    @NonNull
    FileFormat format;
    /** Final directory of the table, with a trailing slash. */
    @NonNull
    String location;
    /** Scratch directory for staged overwrites and engine temp files, with a trailing slash. */
    @NonNull
    String stagingRoot;
    /** Longest the engine may run before the write is cancelled; null waits until it ends. */
    Duration deadline;

    public String qualifiedName() {
        return databaseName == null ? tableName : databaseName + "." + tableName;
    }
}
