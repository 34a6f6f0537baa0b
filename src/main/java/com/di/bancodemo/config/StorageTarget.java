package com.di.bancodemo.config;

import lombok.Builder;
import lombok.Value;

/**
 * The single write target of a run, resolved from the DEFAULT and storage sections.
 */
@Value
@Builder
public class StorageTarget {

    TargetKind kind;
    StorageProvider provider;
    /** Prefix every output location starts with, e.g. s3a://bucket/bancodemo/. */
    String basePath;
    /** Format of flat-file dumps. Catalog tables are always Parquet. */
    String fileFormat;
    /** Catalog database the tables are registered in. */
    String databaseName;

    public boolean isCatalog() {
        return kind == TargetKind.CATALOG;
    }

    /** Output directory of a flat-file dump: the base path followed by the table name. */
    public String filePath(String tableName) {
        return withTrailingSlash(basePath + tableName);
    }

    /** Warehouse directory of a catalog table. */
    public String catalogLocation(String tableName) {
        return withTrailingSlash(basePath + databaseName + ".db/" + tableName);
    }

    /** Scratch area for staged overwrites, outside every table location. */
    public String stagingRoot() {
        return withTrailingSlash(basePath + "_staging");
    }

    static String withTrailingSlash(String path) {
        return path.endsWith("/") ? path : path + "/";
    }
}
