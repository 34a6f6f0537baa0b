package com.di.bancodemo.materialize;

import com.di.bancodemo.config.StorageProvider;
import com.di.bancodemo.config.StorageTarget;
import com.di.bancodemo.config.TableSpec;
import com.di.bancodemo.config.TargetKind;
import com.di.bancodemo.exception.ConfigurationException;
import com.di.bancodemo.exception.DataException;
import com.di.bancodemo.exception.SchemaException;
import com.di.bancodemo.generator.RowSource;
import com.di.bancodemo.sink.CatalogSink;
import com.di.bancodemo.sink.FileFormat;
import com.di.bancodemo.sink.FileSink;
import com.di.bancodemo.sink.TableWrite;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableMaterializer Tests")
class TableMaterializerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-10T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);

    private static final Schema CLIENTES = Schema.builder()
            .addStringField("id_usuario")
            .addStringField("nome")
            .addStringField("id_uf")
            .build();

    private final RecordingCatalogSink catalog = new RecordingCatalogSink();
    private final RecordingFileSink files = new RecordingFileSink();

    private static StorageTarget target(TargetKind kind, String format) {
        return StorageTarget.builder()
                .kind(kind)
                .provider(StorageProvider.S3)
                .basePath("s3a://bucket/data/")
                .fileFormat(format)
                .databaseName("bancodemo")
                .build();
    }

    private static TableSpec spec(String name, long records, boolean partitioned, boolean bucketed) {
        return TableSpec.builder().name(name).numRecords(records).partitioned(partitioned).bucketed(bucketed).numBuckets(4).build();
    }

    private TableMaterializer materializer(RowSource rowSource) {
        return new TableMaterializer(rowSource, catalog, files, CLOCK);
    }

    // ============================================================================
    // Catalog target
    // ============================================================================

    @Test
    @DisplayName("Should overwrite a new catalog table with no layout (100 rows + data_execucao)")
    void testMaterialize_NewCatalogTable() {
        MaterializationResult result = materializer(new CountingRowSource())
                .materialize("clientes", spec("clientes", 100, false, false), CLIENTES, target(TargetKind.CATALOG, "avro"));

        assertEquals(List.of("exists:clientes", "write:clientes"), catalog.calls);
        TableWrite write = catalog.writes.get(0);
        assertEquals(WriteMode.OVERWRITE, write.getDecision().getMode());
        assertEquals(LayoutKind.NONE, write.getDecision().getLayout());
        assertEquals(FileFormat.PARQUET, write.getFormat());
        assertEquals("bancodemo", write.getDatabaseName());
        assertEquals("s3a://bucket/data/bancodemo.db/clientes/", write.getLocation());
        assertEquals(List.of("id_usuario", "nome", "id_uf", "data_execucao"), write.getSchema().getFieldNames());

        GeneratedBatch batch = (GeneratedBatch) write.getSource();
        assertEquals(100, batch.getRows().size());
        assertEquals(100L, result.getRowCount());
        assertEquals(TODAY, result.getExecutionDate());
        assertTrue(files.writes.isEmpty());
    }

    @Test
    @DisplayName("Should refresh, then append partitioned rows to an existing catalog table")
    void testMaterialize_ExistingPartitionedCatalogTable() {
        catalog.existing = true;

        materializer(new CountingRowSource())
                .materialize("transacoes_cartao", spec("transacoes_cartao", 20, true, false), CLIENTES,
                        target(TargetKind.CATALOG, "parquet"));

        assertEquals(List.of("exists:transacoes_cartao", "refresh:transacoes_cartao", "write:transacoes_cartao"),
                catalog.calls);
        WriteDecision decision = catalog.writes.get(0).getDecision();
        assertEquals(WriteMode.APPEND, decision.getMode());
        assertEquals(LayoutKind.PARTITION_BY_DATE, decision.getLayout());
    }

    @Test
    @DisplayName("Should not refresh when overwriting a new catalog table")
    void testMaterialize_NoRefreshOnOverwrite() {
        materializer(new CountingRowSource())
                .materialize("clientes", spec("clientes", 3, false, true), CLIENTES, target(TargetKind.CATALOG, "parquet"));

        assertFalse(catalog.calls.contains("refresh:clientes"));
        assertEquals(LayoutKind.BUCKET_BY_KEY, catalog.writes.get(0).getDecision().getLayout());
    }

    // ============================================================================
    // Flat-file target
    // ============================================================================

    @Test
    @DisplayName("Should always overwrite flat files in the configured format without asking the catalog")
    void testMaterialize_FlatFile() {
        catalog.existing = true;

        materializer(new CountingRowSource())
                .materialize("clientes", spec("clientes", 5, true, true), CLIENTES, target(TargetKind.FLAT_FILE, "json"));

        assertTrue(catalog.calls.isEmpty());
        TableWrite write = files.writes.get(0);
        assertEquals(WriteMode.OVERWRITE, write.getDecision().getMode());
        assertEquals(LayoutKind.PARTITION_BY_DATE, write.getDecision().getLayout());
        assertEquals(FileFormat.JSON, write.getFormat());
        assertNull(write.getDatabaseName());
        assertEquals("s3a://bucket/data/clientes/", write.getLocation());
        assertEquals("s3a://bucket/data/_staging/", write.getStagingRoot());
    }

    @Test
    @DisplayName("Should reject an unsupported flat-file format before generating anything")
    void testMaterialize_UnsupportedFormat() {
        CountingRowSource rows = new CountingRowSource();

        assertThrows(ConfigurationException.class, () -> materializer(rows)
                .materialize("clientes", spec("clientes", 5, false, false), CLIENTES, target(TargetKind.FLAT_FILE, "csv")));
        assertEquals(0, rows.calls);
        assertTrue(files.writes.isEmpty());
    }

    // ============================================================================
    // Rows and schema
    // ============================================================================

    @Test
    @DisplayName("Should stamp every row with the same execution date")
    void testMaterialize_UniformExecutionDate() {
        materializer(new CountingRowSource())
                .materialize("clientes", spec("clientes", 30, false, false), CLIENTES, target(TargetKind.FLAT_FILE, "parquet"));

        GeneratedBatch batch = (GeneratedBatch) files.writes.get(0).getSource();
        assertEquals(TODAY, batch.getExecutionDate());
        for (Row row : batch.getRows()) {
            assertEquals(TODAY, row.getLogicalTypeValue(GeneratedBatch.EXECUTION_DATE_COLUMN, LocalDate.class));
        }
    }

    @Test
    @DisplayName("Should fail with DataException when the generator returns the wrong number of rows")
    void testMaterialize_CountMismatch() {
        RowSource shortSource = (table, schema, count) -> new CountingRowSource().generate(table, schema, count - 1);

        assertThrows(DataException.class, () -> materializer(shortSource)
                .materialize("clientes", spec("clientes", 10, false, false), CLIENTES, target(TargetKind.CATALOG, "parquet")));
        assertTrue(catalog.writes.isEmpty());
    }

    @Test
    @DisplayName("Should fail with SchemaException when the schema already has data_execucao")
    void testMaterialize_ReservedColumn() {
        Schema schema = Schema.builder().addStringField("id").addStringField("data_execucao").build();

        assertThrows(SchemaException.class, () -> materializer(new CountingRowSource())
                .materialize("t", spec("t", 1, false, false), schema, target(TargetKind.CATALOG, "parquet")));
        assertTrue(catalog.calls.isEmpty());
    }

    @Test
    @DisplayName("Should fail with SchemaException when the bucket column is missing")
    void testMaterialize_MissingBucketColumn() {
        Schema schema = Schema.builder().addStringField("id").build();

        assertThrows(SchemaException.class, () -> materializer(new CountingRowSource())
                .materialize("t", spec("t", 1, false, true), schema, target(TargetKind.FLAT_FILE, "parquet")));
        assertTrue(files.writes.isEmpty());
    }

    // ============================================================================
    // Fakes
    // ============================================================================

    static class CountingRowSource implements RowSource {
        int calls;

        @Override
        public List<Row> generate(String tableName, Schema schema, long count) {
            calls++;
            List<Row> rows = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                List<Object> values = new ArrayList<>();
                for (Schema.Field field : schema.getFields()) {
                    values.add(field.getName() + "-" + i);
                }
                rows.add(Row.withSchema(schema).addValues(values).build());
            }
            return rows;
        }
    }

    static class RecordingCatalogSink implements CatalogSink {
        boolean existing;
        final List<String> calls = new ArrayList<>();
        final List<TableWrite> writes = new ArrayList<>();

        @Override
        public boolean tableExists(String databaseName, String tableName) {
            calls.add("exists:" + tableName);
            return existing;
        }

        @Override
        public void refreshMetadata(String databaseName, String tableName) {
            calls.add("refresh:" + tableName);
        }

        @Override
        public long write(TableWrite write) {
            calls.add("write:" + write.getTableName());
            writes.add(write);
            return ((GeneratedBatch) write.getSource()).getRows().size();
        }
    }

    static class RecordingFileSink implements FileSink {
        final List<TableWrite> writes = new ArrayList<>();

        @Override
        public long write(TableWrite write) {
            writes.add(write);
            return ((GeneratedBatch) write.getSource()).getRows().size();
        }
    }
}
