package com.di.bancodemo.config;

import com.di.bancodemo.exception.ConfigurationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the data configuration file and turns it into a validated {@link ConfigModel}.
 * <ul>
 *   <li>{@code DEFAULT}: apenas_arquivos, formato_arquivo, dbname, tabelas. Inherited by every section.</li>
 *   <li>{@code storage}: storage_type (S3 or ADLS), base_path.</li>
 *   <li>one section per table: num_records, particionamento, bucketing, num_buckets, bucket_column.</li>
 * </ul>
 * Missing required keys fail here, at startup, rather than halfway through a run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigLoaderService {

    static final String DEFAULT_SECTION = "DEFAULT";
    static final String STORAGE_SECTION = "storage";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final ResourceLoader resourceLoader;
    private final BancoDemoProperties properties;

    /**
     * Reads {@code bancodemo.config-file}.
     *
     * @throws ConfigurationException when the file is missing, unreadable or incomplete
     */
    public ConfigModel load() {
        String path = properties.getConfigFile();
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            Map<String, Map<String, Object>> sections =
                    YAML_MAPPER.readValue(in, new TypeReference<LinkedHashMap<String, Map<String, Object>>>() {});
            ConfigModel model = fromSections(sections);
            log.info("[CONFIG] Loaded {} (sections={}, tables={}, filesOnly={}, format={}, database={})",
                    path, sections == null ? 0 : sections.keySet(), model.getTableNames(),
                    model.isFilesOnly(), model.getFileFormat(), model.getDatabaseName());
            return model;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds the model from already-parsed sections (section name -> key -> value).
     */
    public static ConfigModel fromSections(Map<String, Map<String, Object>> sections) {
        if (sections == null || sections.isEmpty()) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> defaults = sections.get(DEFAULT_SECTION);
        ConfigSection defaultSection = new ConfigSection(DEFAULT_SECTION, defaults, Map.of());

        if (!sections.containsKey(STORAGE_SECTION)) {
            throw new ConfigurationException("Missing section [" + STORAGE_SECTION + "]");
        }
        ConfigSection storage = new ConfigSection(STORAGE_SECTION, sections.get(STORAGE_SECTION), defaults);

        ConfigModel.ConfigModelBuilder builder = ConfigModel.builder()
                .filesOnly(defaultSection.getBoolean("apenas_arquivos", false))
                .fileFormat(defaultSection.getString("formato_arquivo", ConfigModel.DEFAULT_FILE_FORMAT))
                .databaseName(defaultSection.getString("dbname", ConfigModel.DEFAULT_DATABASE))
                .storageType(storage.getString("storage_type", ConfigModel.DEFAULT_STORAGE_TYPE))
                .basePath(storage.getRequiredString("base_path"));

        for (String tableName : splitTableList(defaultSection.getString("tabelas", ""))) {
            builder.tableName(tableName);
            if (sections.containsKey(tableName)) {
                builder.table(tableName, toTableSpec(new ConfigSection(tableName, sections.get(tableName), defaults)));
            }
        }
        return builder.build();
    }

    static TableSpec toTableSpec(ConfigSection section) {
        long numRecords = section.getRequiredLong("num_records");
        if (numRecords < 0) {
            throw new ConfigurationException("[" + section.name() + "] num_records must be >= 0, got " + numRecords);
        }
        boolean bucketed = section.getRequiredBoolean("bucketing");
        int numBuckets = bucketed ? section.getRequiredInt("num_buckets") : section.getInt("num_buckets", 1);
        if (bucketed && numBuckets <= 0) {
            throw new ConfigurationException("[" + section.name() + "] num_buckets must be > 0, got " + numBuckets);
        }
        return TableSpec.builder()
                .name(section.name())
                .numRecords(numRecords)
                .partitioned(section.getRequiredBoolean("particionamento"))
                .bucketed(bucketed)
                .numBuckets(numBuckets)
                .bucketColumn(section.getString("bucket_column", TableSpec.DEFAULT_BUCKET_COLUMN))
                .build();
    }

    static List<String> splitTableList(String tabelas) {
        List<String> out = new ArrayList<>();
        for (String t : tabelas.split(",")) {
            String trimmed = t.trim();
            if (!trimmed.isEmpty()) out.add(trimmed);
        }
        return out;
    }
}
