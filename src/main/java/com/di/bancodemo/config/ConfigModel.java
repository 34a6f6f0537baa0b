package com.di.bancodemo.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the data configuration file, built once at startup by
 * {@link ConfigLoaderService} and passed to the runners.
 * <p>
 * Tables listed in {@code tabelas} without a section of their own are kept in
 * {@link #tableNames} but have no {@link TableSpec}; the runner skips them with a warning.
 */
@Value
@Builder
public class ConfigModel {

    public static final String DEFAULT_FILE_FORMAT = "parquet";
    public static final String DEFAULT_DATABASE = "bancodemo";
    public static final String DEFAULT_STORAGE_TYPE = "S3";

    /** apenas_arquivos: write bare files instead of catalog tables. */
    boolean filesOnly;
    String fileFormat;
    String databaseName;
    /** Tables to process, in configuration order. */
    @Singular
    List<String> tableNames;
    @Singular
    Map<String, TableSpec> tables;
    /** Raw storage.storage_type; resolved per table by {@link #storageTarget()}. */
    String storageType;
    String basePath;

    public Optional<TableSpec> tableSpec(String tableName) {
        return Optional.ofNullable(tables.get(tableName));
    }

    /**
     * Resolves the write target of this run.
     *
     * @throws com.di.bancodemo.exception.ConfigurationException when the storage type is not S3 or ADLS
     */
    public StorageTarget storageTarget() {
        return StorageTarget.builder()
                .kind(filesOnly ? TargetKind.FLAT_FILE : TargetKind.CATALOG)
                .provider(StorageProvider.from(storageType))
                .basePath(basePath)
                .fileFormat(fileFormat)
                .databaseName(databaseName)
                .build();
    }
}
