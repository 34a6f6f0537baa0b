package com.di.bancodemo.materialize;

/**
 * Physical layout of a written table.
 */
public enum LayoutKind {
    NONE,
    /** One directory per execution date: {@code data_execucao=yyyy-MM-dd/}. */
    PARTITION_BY_DATE,
    /** A fixed number of files, rows assigned by hashing the bucket column. */
    BUCKET_BY_KEY
}
