package com.di.bancodemo.schema;

import com.di.bancodemo.exception.SchemaException;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.schemas.logicaltypes.SqlTypes;

import java.util.Locale;

/**
 * Maps the type names of a Spark {@code StructType} JSON document to Beam field types.
 * <p>
 * Supported: string, integer/int, long/bigint, short/smallint, byte/tinyint, double, float,
 * boolean, date, timestamp, binary. {@code decimal(p,s)} columns are carried as DOUBLE.
 * Nested types (struct, array, map) are rejected.
 */
public final class SparkTypeMapper {

    private SparkTypeMapper() {
    }

    public static Schema.FieldType toFieldType(String sparkType, String column) {
        if (sparkType == null || sparkType.isBlank()) {
            throw new SchemaException("Column '" + column + "' has no type");
        }
        String type = sparkType.trim().toLowerCase(Locale.ROOT);
        if (type.startsWith("decimal")) {
            return Schema.FieldType.DOUBLE;
        }
        switch (type) {
            case "string":
            case "varchar":
            case "char":
                return Schema.FieldType.STRING;
            case "integer":
            case "int":
                return Schema.FieldType.INT32;
            case "long":
            case "bigint":
                return Schema.FieldType.INT64;
            case "short":
            case "smallint":
                return Schema.FieldType.INT16;
            case "byte":
            case "tinyint":
                return Schema.FieldType.BYTE;
            case "double":
                return Schema.FieldType.DOUBLE;
            case "float":
                return Schema.FieldType.FLOAT;
            case "boolean":
                return Schema.FieldType.BOOLEAN;
            case "date":
                return Schema.FieldType.logicalType(SqlTypes.DATE);
            case "timestamp":
                return Schema.FieldType.DATETIME;
            case "binary":
                return Schema.FieldType.BYTES;
            default:
                throw new SchemaException(
                        String.format("Column '%s' has unsupported type '%s'", column, sparkType));
        }
    }

    /** True for the execution-date style DATE logical type. */
    public static boolean isDate(Schema.FieldType fieldType) {
        return fieldType.getTypeName().isLogicalType()
                && SqlTypes.DATE.getIdentifier().equals(fieldType.getLogicalType().getIdentifier());
    }
}
