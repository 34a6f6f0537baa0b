package com.di.bancodemo.materialize;

import com.di.bancodemo.config.TableSpec;
import com.di.bancodemo.config.TargetKind;
import com.di.bancodemo.exception.SchemaException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.apache.beam.sdk.schemas.Schema;

import java.io.Serializable;

/**
 * How one table is written in one run: create-or-append, and which layout.
 * Recomputed on every materialization from the table settings, the target kind and
 * whether the catalog already knows the table.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WriteDecision implements Serializable {

    WriteMode mode;
    LayoutKind layout;
    /** Only set for {@link LayoutKind#BUCKET_BY_KEY}. */
    String bucketColumn;
    int numBuckets;

    public static WriteDecision of(WriteMode mode) {
        return new WriteDecision(mode, LayoutKind.NONE, null, 0);
    }

    public static WriteDecision partitioned(WriteMode mode) {
        return new WriteDecision(mode, LayoutKind.PARTITION_BY_DATE, null, 0);
    }

    public static WriteDecision bucketed(WriteMode mode, String bucketColumn, int numBuckets) {
        if (numBuckets <= 0) {
            throw new IllegalArgumentException("numBuckets must be > 0, got " + numBuckets);
        }
        return new WriteDecision(mode, LayoutKind.BUCKET_BY_KEY, bucketColumn, numBuckets);
    }

    /**
     * Partitioning wins when a table asks for both partitioning and bucketing.
     * Flat files are always overwritten; catalog tables are created once and appended to afterwards.
     *
     * @param schema the schema being written, used to check the bucket column
     * @throws SchemaException when the bucket column is not a column of {@code schema}
     */
    public static WriteDecision decide(TableSpec spec, TargetKind kind, boolean tableExists, Schema schema) {
        WriteMode mode = kind == TargetKind.FLAT_FILE || !tableExists ? WriteMode.OVERWRITE : WriteMode.APPEND;
        if (spec.isPartitioned()) {
            return partitioned(mode);
        }
        if (spec.isBucketed()) {
            if (!schema.hasField(spec.getBucketColumn())) {
                throw new SchemaException(String.format("Bucket column '%s' is not a column of '%s' (columns: %s)",
                        spec.getBucketColumn(), spec.getName(), schema.getFieldNames()));
            }
            return bucketed(mode, spec.getBucketColumn(), spec.getNumBuckets());
        }
        return of(mode);
    }
}
