package com.di.bancodemo.sink;

/**
 * A metadata catalog that keeps named tables over Parquet files.
 */
public interface CatalogSink {

    boolean tableExists(String databaseName, String tableName);

    /**
     * Makes the catalog drop cached file listings for the table before new files are appended.
     */
    void refreshMetadata(String databaseName, String tableName);

    /**
     * Writes the rows as Parquet and registers the table (and its partitions) in the catalog.
     *
     * @return number of rows written
     */
    long write(TableWrite write);
}
