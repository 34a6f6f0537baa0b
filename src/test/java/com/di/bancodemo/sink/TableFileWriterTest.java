package com.di.bancodemo.sink;

import com.di.bancodemo.engine.ExecutionSession;
import com.di.bancodemo.exception.WriteException;
import com.di.bancodemo.materialize.GeneratedBatch;
import com.di.bancodemo.materialize.WriteDecision;
import com.di.bancodemo.materialize.WriteMode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PBegin;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TableFileWriter Tests")
class TableFileWriterTest {

    private static final Schema SCHEMA = Schema.builder()
            .addStringField("id_usuario")
            .addStringField("id_uf")
            .addNullableField("limite", Schema.FieldType.DOUBLE)
            .build();
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);
    private static final String[] UFS = {"SP", "RJ", "MG", "BA", "PR"};

    private static ExecutionSession session;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void createSession() {
        session = new ExecutionSession(List.of("--runner=DirectRunner"));
    }

    private static GeneratedBatch batch(int rows, String idPrefix) {
        List<Row> generated = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            generated.add(Row.withSchema(SCHEMA).addValues(idPrefix + i, UFS[i % UFS.length], i * 1.5).build());
        }
        return GeneratedBatch.stamp(SCHEMA, generated, TODAY);
    }

    private TableWrite write(GeneratedBatch batch, WriteDecision decision, FileFormat format) {
        return TableWrite.builder()
                .tableName("clientes")
                .schema(batch.getSchema())
                .source(batch)
                .decision(decision)
                .format(format)
                .location(tableDir().toString() + "/")
                .stagingRoot(tempDir.resolve("_staging").toString() + "/")
                .build();
    }

    private Path tableDir() {
        return tempDir.resolve("out/clientes");
    }

    private List<Path> files(String suffix) {
        if (!Files.exists(tableDir())) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(tableDir())) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private List<JsonNode> jsonLines() {
        ObjectMapper mapper = new ObjectMapper();
        List<JsonNode> out = new ArrayList<>();
        for (Path file : files(".json")) {
            try {
                for (String line : Files.readAllLines(file)) {
                    if (!line.isBlank()) {
                        out.add(mapper.readTree(line));
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return out;
    }

    // ============================================================================
    // Modes
    // ============================================================================

    @Test
    @DisplayName("Should write one JSON object per row with the execution date")
    void testWrite_JsonNoLayout() {
        long rows = new TableFileWriter(session).write(write(batch(5, "u"), WriteDecision.of(WriteMode.OVERWRITE), FileFormat.JSON));

        assertEquals(5, rows);
        List<JsonNode> lines = jsonLines();
        assertEquals(5, lines.size());
        for (JsonNode line : lines) {
            assertEquals("2024-05-10", line.get("data_execucao").asText());
            assertTrue(line.get("id_usuario").asText().startsWith("u"));
        }
    }

    @Test
    @DisplayName("Should replace previous files on overwrite")
    void testWrite_OverwriteReplaces() {
        TableFileWriter writer = new TableFileWriter(session);
        writer.write(write(batch(5, "first-"), WriteDecision.of(WriteMode.OVERWRITE), FileFormat.JSON));
        writer.write(write(batch(3, "second-"), WriteDecision.of(WriteMode.OVERWRITE), FileFormat.JSON));

        List<JsonNode> lines = jsonLines();
        assertEquals(3, lines.size());
        lines.forEach(line -> assertTrue(line.get("id_usuario").asText().startsWith("second-")));
    }

    @Test
    @DisplayName("Should keep previous files on append")
    void testWrite_AppendKeeps() {
        TableFileWriter writer = new TableFileWriter(session);
        writer.write(write(batch(5, "first-"), WriteDecision.of(WriteMode.OVERWRITE), FileFormat.JSON));
        writer.write(write(batch(3, "second-"), WriteDecision.of(WriteMode.APPEND), FileFormat.JSON));

        assertEquals(8, jsonLines().size());
    }

    @Test
    @DisplayName("Should cancel a write that outlasts its deadline and never publish its files")
    void testWrite_DeadlineCancels() throws InterruptedException {
        TableFileWriter writer = new TableFileWriter(session);
        writer.write(write(batch(5, "first-"), WriteDecision.of(WriteMode.OVERWRITE), FileFormat.JSON));

        GeneratedBatch slow = batch(3, "slow-");
        TableWrite late = write(slow, WriteDecision.of(WriteMode.APPEND), FileFormat.JSON).toBuilder()
                .source(new SlowSource(slow, 1_000))
                .deadline(Duration.ofMillis(200))
                .build();

        WriteException e = assertThrows(WriteException.class, () -> writer.write(late));
        assertTrue(e.getMessage().contains("did not finish within"), e.getMessage());

        // long enough for every slow element to have been processed had the run kept going
        Thread.sleep(3_500);
        List<JsonNode> lines = jsonLines();
        assertEquals(5, lines.size());
        lines.forEach(line -> assertTrue(line.get("id_usuario").asText().startsWith("first-")));
    }

    @Test
    @DisplayName("Should finish normally when the write is within its deadline")
    void testWrite_WithinDeadline() {
        TableWrite write = write(batch(4, "u"), WriteDecision.of(WriteMode.OVERWRITE), FileFormat.JSON).toBuilder()
                .deadline(Duration.ofMinutes(2))
                .build();

        assertEquals(4, new TableFileWriter(session).write(write));
        assertEquals(4, jsonLines().size());
    }

    // ============================================================================
    // Layouts
    // ============================================================================

    @Test
    @DisplayName("Should put partitioned rows under data_execucao=<date>")
    void testWrite_Partitioned() {
        new TableFileWriter(session).write(write(batch(4, "u"), WriteDecision.partitioned(WriteMode.OVERWRITE), FileFormat.JSON));

        assertTrue(Files.isDirectory(tableDir().resolve("data_execucao=2024-05-10")));
        List<Path> files = files(".json");
        assertFalse(files.isEmpty());
        files.forEach(f -> assertEquals("data_execucao=2024-05-10", f.getParent().getFileName().toString()));
        assertEquals(4, jsonLines().size());
    }

    @Test
    @DisplayName("Should write one file per bucket, every row hashed into its bucket")
    void testWrite_Bucketed() throws IOException {
        new TableFileWriter(session).write(write(batch(20, "u"), WriteDecision.bucketed(WriteMode.OVERWRITE, "id_uf", 3), FileFormat.JSON));

        List<Path> files = files(".json");
        assertFalse(files.isEmpty());
        assertTrue(files.size() <= 3);
        ObjectMapper mapper = new ObjectMapper();
        int total = 0;
        for (Path file : files) {
            String name = file.getFileName().toString();
            assertTrue(name.contains("bucket-"), name);
            for (String line : Files.readAllLines(file)) {
                if (line.isBlank()) {
                    continue;
                }
                String uf = mapper.readTree(line).get("id_uf").asText();
                String expectedBucket = String.format("bucket-%05d", TableFileWriter.bucketOf(uf, 3));
                assertTrue(name.contains(expectedBucket), name + " holds " + uf);
                total++;
            }
        }
        assertEquals(20, total);
    }

    @Test
    @DisplayName("Should keep every id_uf value in files of a single bucket across an append")
    void testWrite_BucketedAppendKeepsGrouping() throws IOException {
        TableFileWriter writer = new TableFileWriter(session);
        writer.write(write(batch(10, "a"), WriteDecision.bucketed(WriteMode.OVERWRITE, "id_uf", 2), FileFormat.JSON));
        writer.write(write(batch(10, "b"), WriteDecision.bucketed(WriteMode.APPEND, "id_uf", 2), FileFormat.JSON));

        ObjectMapper mapper = new ObjectMapper();
        Map<String, Set<String>> bucketsPerUf = new HashMap<>();
        int total = 0;
        for (Path file : files(".json")) {
            String name = file.getFileName().toString();
            int at = name.indexOf("bucket-");
            assertTrue(at >= 0, name);
            String bucket = name.substring(at, at + "bucket-00000".length());
            for (String line : Files.readAllLines(file)) {
                if (line.isBlank()) {
                    continue;
                }
                bucketsPerUf.computeIfAbsent(mapper.readTree(line).get("id_uf").asText(), k -> new HashSet<>()).add(bucket);
                total++;
            }
        }
        assertEquals(20, total);
        assertEquals(UFS.length, bucketsPerUf.size());
        bucketsPerUf.forEach((uf, buckets) -> assertEquals(1, buckets.size(), uf + " spread over " + buckets));
    }

    // ============================================================================
    // Formats
    // ============================================================================

    @Test
    @DisplayName("Should write Avro files")
    void testWrite_Avro() {
        long rows = new TableFileWriter(session).write(write(batch(6, "u"), WriteDecision.of(WriteMode.OVERWRITE), FileFormat.AVRO));

        assertEquals(6, rows);
        assertFalse(files(".avro").isEmpty());
    }

    @Test
    @DisplayName("Should write Parquet that reads back with the same rows")
    void testWrite_ParquetReadBack() {
        GeneratedBatch batch = batch(7, "u");
        new TableFileWriter(session).write(write(batch, WriteDecision.partitioned(WriteMode.OVERWRITE), FileFormat.PARQUET));
        assertFalse(files(".parquet").isEmpty());

        Pipeline pipeline = Pipeline.create();
        PCollection<Row> read = pipeline.apply(TableFileReader.parquet(tableDir().toString(), batch.getSchema()));
        PAssert.that(read).containsInAnyOrder(batch.getRows());
        pipeline.run().waitUntilFinish();
    }

    @Test
    @DisplayName("Should write nothing for an empty batch and clear the old files on overwrite")
    void testWrite_Empty() {
        TableFileWriter writer = new TableFileWriter(session);
        writer.write(write(batch(2, "u"), WriteDecision.of(WriteMode.OVERWRITE), FileFormat.JSON));

        long rows = writer.write(write(batch(0, "u"), WriteDecision.of(WriteMode.OVERWRITE), FileFormat.JSON));

        assertEquals(0, rows);
        assertTrue(jsonLines().isEmpty());
    }

    /** The batch's rows, each held back for a while before it reaches the writer. */
    static class SlowSource extends PTransform<PBegin, PCollection<Row>> {
        private final GeneratedBatch batch;
        private final long delayMillis;

        SlowSource(GeneratedBatch batch, long delayMillis) {
            this.batch = batch;
            this.delayMillis = delayMillis;
        }

        @Override
        public PCollection<Row> expand(PBegin input) {
            return input.apply("Rows", batch)
                    .apply("Delay", ParDo.of(new DelayFn(delayMillis)))
                    .setRowSchema(batch.getSchema());
        }
    }

    static class DelayFn extends DoFn<Row, Row> {
        private final long delayMillis;

        DelayFn(long delayMillis) {
            this.delayMillis = delayMillis;
        }

        @ProcessElement
        public void process(@Element Row row, OutputReceiver<Row> out) throws InterruptedException {
            Thread.sleep(delayMillis);
            out.output(row);
        }
    }
}
