package com.di.bancodemo.sink;

import com.di.bancodemo.exception.ConfigurationException;

import java.util.Locale;

/**
 * File formats a table can be written in. Catalog tables are always {@link #PARQUET}.
 */
public enum FileFormat {
    PARQUET(".parquet"),
    AVRO(".avro"),
    JSON(".json");

    private final String suffix;

    FileFormat(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * @throws ConfigurationException for formats the writer has no sink for (csv, orc, ...)
     */
    public static FileFormat from(String formatName) {
        if (formatName == null || formatName.isBlank()) {
            throw new ConfigurationException("formato_arquivo is blank");
        }
        try {
            return valueOf(formatName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported file format: " + formatName.trim(), e);
        }
    }
}
