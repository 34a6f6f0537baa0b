package com.di.bancodemo.config;

import lombok.Builder;
import lombok.Value;

/**
 * Per-table settings from the table's own section of the data configuration file.
 */
@Value
@Builder(toBuilder = true)
public class TableSpec {

    public static final String DEFAULT_BUCKET_COLUMN = "id_uf";

    String name;
    /** Rows generated per run. */
    long numRecords;
    /** Partition the output by execution date. Wins over {@link #bucketed} when both are set. */
    boolean partitioned;
    boolean bucketed;
    /** Bucket count; only meaningful when {@link #bucketed}. */
    @Builder.Default
    int numBuckets = 1;
    /** Natural key hashed into buckets. */
    @Builder.Default
    String bucketColumn = DEFAULT_BUCKET_COLUMN;
}
