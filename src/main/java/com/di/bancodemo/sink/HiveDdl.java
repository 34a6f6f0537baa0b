package com.di.bancodemo.sink;

import com.di.bancodemo.exception.SchemaException;
import com.di.bancodemo.materialize.LayoutKind;
import com.di.bancodemo.materialize.WriteDecision;
import com.di.bancodemo.schema.SparkTypeMapper;
import org.apache.beam.sdk.schemas.Schema;

import java.util.ArrayList;
import java.util.List;

import static com.di.bancodemo.materialize.GeneratedBatch.EXECUTION_DATE_COLUMN;

/**
 * HiveQL statements for external Parquet tables.
 * <p>
 * Partitioned tables keep {@code data_execucao} in the data files as well; Hive resolves
 * Parquet columns by name, so the extra file column is ignored and the partition value
 * comes from the directory.
 * <p>
 * Bucketed tables are not declared {@code CLUSTERED BY}: the files group rows by a Java hash
 * and Hive would read bucket ids from file names and its own hash. The bucket column and count
 * go into {@code TBLPROPERTIES} instead.
 */
final class HiveDdl {

    static final String BUCKET_COLUMN_PROPERTY = "bancodemo.bucket_column";
    static final String NUM_BUCKETS_PROPERTY = "bancodemo.num_buckets";

    private HiveDdl() {
    }

    static String createDatabase(String database) {
        return "CREATE DATABASE IF NOT EXISTS " + quote(database);
    }

    static String createExternalTable(String database, String table, Schema schema,
                                      WriteDecision decision, String location) {
        boolean partitioned = decision.getLayout() == LayoutKind.PARTITION_BY_DATE;
        List<String> columns = new ArrayList<>();
        for (Schema.Field field : schema.getFields()) {
            if (partitioned && field.getName().equals(EXECUTION_DATE_COLUMN)) {
                continue;
            }
            columns.add(quote(field.getName()) + " " + hiveType(field));
        }

        StringBuilder sql = new StringBuilder()
                .append("CREATE EXTERNAL TABLE IF NOT EXISTS ").append(qualified(database, table))
                .append(" (").append(String.join(", ", columns)).append(")");
        if (partitioned) {
            sql.append(" PARTITIONED BY (").append(quote(EXECUTION_DATE_COLUMN)).append(" DATE)");
        }
        sql.append(" STORED AS PARQUET LOCATION ").append(literal(location));
        if (decision.getLayout() == LayoutKind.BUCKET_BY_KEY) {
            sql.append(" TBLPROPERTIES (")
                    .append(literal(BUCKET_COLUMN_PROPERTY)).append("=").append(literal(decision.getBucketColumn()))
                    .append(", ")
                    .append(literal(NUM_BUCKETS_PROPERTY)).append("=").append(literal(String.valueOf(decision.getNumBuckets())))
                    .append(")");
        }
        return sql.toString();
    }

    /** Registers every partition directory found under the table location. */
    static String repairPartitions(String database, String table) {
        return "MSCK REPAIR TABLE " + qualified(database, table);
    }

    static String qualified(String database, String table) {
        return quote(database) + "." + quote(table);
    }

    static String hiveType(Schema.Field field) {
        Schema.FieldType type = field.getType();
        if (SparkTypeMapper.isDate(type)) {
            return "DATE";
        }
        switch (type.getTypeName()) {
            case STRING:
                return "STRING";
            case INT16:
                return "SMALLINT";
            case BYTE:
                return "TINYINT";
            case INT32:
                return "INT";
            case INT64:
                return "BIGINT";
            case DOUBLE:
                return "DOUBLE";
            case FLOAT:
                return "FLOAT";
            case BOOLEAN:
                return "BOOLEAN";
            case DATETIME:
                return "TIMESTAMP";
            case BYTES:
                return "BINARY";
            default:
                throw new SchemaException("No catalog type for column '" + field.getName() + "' of type " + type);
        }
    }

    private static String literal(String value) {
        return "'" + value.replace("'", "\\'") + "'";
    }

    private static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }
}
