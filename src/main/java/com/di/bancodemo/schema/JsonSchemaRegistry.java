package com.di.bancodemo.schema;

import com.di.bancodemo.config.BancoDemoProperties;
import com.di.bancodemo.exception.SchemaException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.schemas.Schema;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads {@code <schema-dir>/<table>.json}, a Spark {@code StructType} document:
 * <pre>
 * {"type": "struct", "fields": [{"name": "id_usuario", "type": "string", "nullable": false, "metadata": {}}]}
 * </pre>
 * Parsed schemas are cached for the life of the process.
 */
@Slf4j
@Component
public class JsonSchemaRegistry implements SchemaRegistry {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ResourceLoader resourceLoader;
    private final String schemaDir;
    private final Map<String, Schema> cache = new ConcurrentHashMap<>();

    @Autowired
    public JsonSchemaRegistry(ResourceLoader resourceLoader, BancoDemoProperties properties) {
        this(resourceLoader, properties.getSchemaDir());
    }

    public JsonSchemaRegistry(ResourceLoader resourceLoader, String schemaDir) {
        this.resourceLoader = resourceLoader;
        this.schemaDir = schemaDir.endsWith("/") ? schemaDir : schemaDir + "/";
    }

    @Override
    public Schema schemaFor(String tableName) {
        return cache.computeIfAbsent(tableName, this::load);
    }

    private Schema load(String tableName) {
        String path = schemaDir + tableName + ".json";
        log.info("[SCHEMA] Loading schema for '{}' from {}", tableName, path);
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new SchemaException("Schema file not found: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            Schema schema = parse(MAPPER.readTree(in), path);
            log.info("[SCHEMA] '{}' has {} column(s): {}", tableName, schema.getFieldCount(), schema.getFieldNames());
            return schema;
        } catch (IOException e) {
            throw new SchemaException("Cannot read schema file " + path + ": " + e.getMessage(), e);
        }
    }

    static Schema parse(JsonNode root, String source) {
        JsonNode fields = root == null ? null : root.get("fields");
        if (fields == null || !fields.isArray() || fields.isEmpty()) {
            throw new SchemaException("Schema " + source + " has no 'fields' array");
        }
        Schema.Builder builder = Schema.builder();
        for (JsonNode field : fields) {
            String name = field.path("name").asText("");
            if (name.isBlank()) {
                throw new SchemaException("Schema " + source + " has a field without a name");
            }
            JsonNode type = field.get("type");
            if (type == null || !type.isTextual()) {
                throw new SchemaException(
                        String.format("Schema %s: column '%s' must have a primitive type", source, name));
            }
            Schema.FieldType fieldType = SparkTypeMapper.toFieldType(type.asText(), name);
            builder.addField(Schema.Field.of(name, fieldType.withNullable(field.path("nullable").asBoolean(true))));
        }
        return builder.build();
    }
}
