package com.di.bancodemo.config;

import com.di.bancodemo.exception.ConfigurationException;

import java.util.Locale;

/**
 * Object stores the base path may point at (storage.storage_type).
 */
public enum StorageProvider {
    S3,
    ADLS;

    /**
     * Resolves the configured storage type, case-insensitively.
     *
     * @throws ConfigurationException for any other value (e.g. GCS)
     */
    public static StorageProvider from(String storageType) {
        if (storageType == null || storageType.isBlank()) {
            throw new ConfigurationException("storage.storage_type is blank");
        }
        String normalized = storageType.trim().toUpperCase(Locale.ROOT);
        for (StorageProvider provider : values()) {
            if (provider.name().equals(normalized)) {
                return provider;
            }
        }
        throw new ConfigurationException("Unsupported storage type: " + storageType.trim());
    }
}
