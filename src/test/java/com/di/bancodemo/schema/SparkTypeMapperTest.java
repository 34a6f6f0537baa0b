package com.di.bancodemo.schema;

import com.di.bancodemo.exception.SchemaException;
import org.apache.beam.sdk.schemas.Schema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SparkTypeMapper Tests")
class SparkTypeMapperTest {

    @ParameterizedTest
    @DisplayName("Should map Spark primitive type names to Beam types")
    @CsvSource({
            "string, STRING",
            "integer, INT32",
            "int, INT32",
            "long, INT64",
            "bigint, INT64",
            "short, INT16",
            "byte, BYTE",
            "double, DOUBLE",
            "float, FLOAT",
            "boolean, BOOLEAN",
            "timestamp, DATETIME",
            "binary, BYTES",
            "'decimal(10,2)', DOUBLE",
            "STRING, STRING"
    })
    void testToFieldType(String sparkType, Schema.TypeName expected) {
        assertEquals(expected, SparkTypeMapper.toFieldType(sparkType, "c").getTypeName());
    }

    @Test
    @DisplayName("Should map date to the DATE logical type")
    void testToFieldType_Date() {
        assertTrue(SparkTypeMapper.isDate(SparkTypeMapper.toFieldType("date", "d")));
        assertFalse(SparkTypeMapper.isDate(Schema.FieldType.DATETIME));
        assertFalse(SparkTypeMapper.isDate(Schema.FieldType.STRING));
    }

    @Test
    @DisplayName("Should reject unknown or missing types")
    void testToFieldType_Unsupported() {
        assertThrows(SchemaException.class, () -> SparkTypeMapper.toFieldType("interval", "c"));
        assertThrows(SchemaException.class, () -> SparkTypeMapper.toFieldType(" ", "c"));
        assertThrows(SchemaException.class, () -> SparkTypeMapper.toFieldType(null, "c"));
    }
}
