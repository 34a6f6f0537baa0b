package com.di.bancodemo.sink;

import com.di.bancodemo.engine.ExecutionSession;
import com.di.bancodemo.exception.BancoDemoException;
import com.di.bancodemo.exception.WriteException;
import com.di.bancodemo.materialize.LayoutKind;
import com.di.bancodemo.materialize.WriteDecision;
import com.di.bancodemo.materialize.WriteMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.generic.GenericRecord;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.extensions.avro.io.AvroIO;
import org.apache.beam.sdk.extensions.avro.schemas.utils.AvroUtils;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.io.FileSystems;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.io.fs.EmptyMatchTreatment;
import org.apache.beam.sdk.io.fs.MatchResult;
import org.apache.beam.sdk.io.fs.MoveOptions;
import org.apache.beam.sdk.io.fs.ResolveOptions.StandardResolveOptions;
import org.apache.beam.sdk.io.fs.ResourceId;
import org.apache.beam.sdk.io.parquet.ParquetIO;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.MetricNameFilter;
import org.apache.beam.sdk.metrics.MetricQueryResults;
import org.apache.beam.sdk.metrics.MetricResult;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.metrics.MetricsFilter;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.Contextful;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.SerializableFunction;
import org.apache.beam.sdk.values.Row;
import org.joda.time.Duration;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.StreamSupport;

import static com.di.bancodemo.materialize.GeneratedBatch.EXECUTION_DATE_COLUMN;

/**
 * Runs one write pipeline: source rows, a row counter, and a dynamic {@link FileIO} write
 * whose destinations follow the layout (a {@code data_execucao=<date>} directory per
 * partition, or one {@code bucket-NNNNN} file per bucket).
 * <p>
 * Appends add files with a per-run name prefix next to the existing ones. Overwrites are
 * written under the staging root first and only replace the table's files once the engine
 * has finished, so a pipeline may read the table it overwrites.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableFileWriter {

    static final String METRICS_NAMESPACE = "bancodemo";
    static final String ROWS_WRITTEN = "rows_written";

    private final ExecutionSession session;

    /**
     * @return rows written, as counted by the engine
     * @throws WriteException when the engine fails or the staged files cannot be moved into place
     */
    public long write(TableWrite write) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        boolean staged = write.getDecision().getMode() == WriteMode.OVERWRITE;
        String outputDir = staged
                ? write.getStagingRoot() + write.getTableName() + "/" + runId + "/"
                : write.getLocation();

        long rows;
        try {
            Pipeline pipeline = session.newPipeline();
            pipeline.apply("Read_" + write.getTableName(), write.getSource())
                    .apply("CountRows", ParDo.of(new CountRowsFn()))
                    .setRowSchema(write.getSchema())
                    .apply("Write_" + write.getTableName(), fileWrite(write, outputDir, "part-" + runId));

            PipelineResult result = pipeline.run();
            awaitEngine(result, write);
            rows = rowsWritten(result);
        } catch (Pipeline.PipelineExecutionException e) {
            if (e.getCause() instanceof BancoDemoException cause) {
                throw cause;
            }
            throw new WriteException("Engine failed writing '" + write.getTableName() + "': " + rootMessage(e), e);
        } catch (BancoDemoException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WriteException("Engine failed writing '" + write.getTableName() + "': " + rootMessage(e), e);
        }

        if (staged) {
            try {
                replaceContents(outputDir, write.getLocation());
            } catch (IOException e) {
                throw new WriteException("Cannot move staged files of '" + write.getTableName() + "' from "
                        + outputDir + " to " + write.getLocation() + ": " + e.getMessage(), e);
            }
        }
        log.info("[WRITER] '{}' -> {} ({} rows, mode={}, layout={}, format={})", write.getTableName(),
                write.getLocation(), rows, write.getDecision().getMode(), write.getDecision().getLayout(),
                write.getFormat());
        return rows;
    }

    /**
     * Waits for the engine; past the write's deadline the run is cancelled, so nothing of it is
     * moved into place and nothing keeps running once this returns.
     */
    private static void awaitEngine(PipelineResult result, TableWrite write) {
        if (write.getDeadline() == null) {
            result.waitUntilFinish();
            return;
        }
        PipelineResult.State state = result.waitUntilFinish(Duration.millis(write.getDeadline().toMillis()));
        if (state != null && state.isTerminal()) {
            return;
        }
        try {
            state = result.cancel();
        } catch (IOException | UnsupportedOperationException e) {
            throw new WriteException("'" + write.getTableName() + "' did not finish within " + write.getDeadline()
                    + " and could not be cancelled: " + e.getMessage(), e);
        }
        log.warn("[WRITER] '{}' cancelled after {} (state={})", write.getTableName(), write.getDeadline(), state);
        throw new WriteException("'" + write.getTableName() + "' did not finish within " + write.getDeadline());
    }

    private FileIO.Write<String, Row> fileWrite(TableWrite write, String outputDir, String filePrefix) {
        WriteDecision decision = write.getDecision();
        FileIO.Write<String, Row> fileWrite = FileIO.<String, Row>writeDynamic()
                .by(new LayoutDestinationFn(decision))
                .withDestinationCoder(StringUtf8Coder.of())
                .to(outputDir)
                .withTempDirectory(write.getStagingRoot() + "_tmp/")
                .withNaming(new LayoutNaming(decision.getLayout(), filePrefix, write.getFormat().suffix()));
        if (decision.getLayout() == LayoutKind.BUCKET_BY_KEY) {
            fileWrite = fileWrite.withNumShards(1);
        }

        Schema schema = write.getSchema();
        switch (write.getFormat()) {
            case PARQUET: {
                org.apache.avro.Schema avroSchema = AvroUtils.toAvroSchema(schema);
                return fileWrite.via(Contextful.fn(AvroUtils.getRowToGenericRecordFunction(avroSchema)),
                        ParquetIO.sink(avroSchema));
            }
            case AVRO: {
                org.apache.avro.Schema avroSchema = AvroUtils.toAvroSchema(schema);
                SerializableFunction<Row, GenericRecord> toRecord = AvroUtils.getRowToGenericRecordFunction(avroSchema);
                return fileWrite.via(Contextful.fn(toRecord), AvroIO.sink(avroSchema));
            }
            case JSON:
                return fileWrite.via(Contextful.fn(new RowJsonFn()), TextIO.sink());
            default:
                throw new IllegalStateException("No sink for " + write.getFormat());
        }
    }

    /**
     * Deletes every file under {@code targetDir}, then renames the staged files into it,
     * keeping their paths relative to {@code stagingDir}.
     */
    static void replaceContents(String stagingDir, String targetDir) throws IOException {
        List<ResourceId> existing = matchFiles(targetDir);
        if (!existing.isEmpty()) {
            FileSystems.delete(existing, MoveOptions.StandardMoveOptions.IGNORE_MISSING_FILES);
        }
        String stagingBase = FileSystems.matchNewResource(stagingDir, true).toString();
        ResourceId target = FileSystems.matchNewResource(targetDir, true);
        List<ResourceId> sources = matchFiles(stagingDir);
        List<ResourceId> destinations = new ArrayList<>(sources.size());
        for (ResourceId source : sources) {
            String relative = source.toString().substring(stagingBase.length());
            destinations.add(target.resolve(relative, StandardResolveOptions.RESOLVE_FILE));
        }
        if (!sources.isEmpty()) {
            FileSystems.rename(sources, destinations, MoveOptions.StandardMoveOptions.IGNORE_MISSING_FILES);
        }
        log.debug("[WRITER] Replaced {} file(s) in {} with {} staged file(s)", existing.size(), targetDir, sources.size());
    }

    private static List<ResourceId> matchFiles(String directory) throws IOException {
        List<MatchResult> results = FileSystems.match(List.of(directory + "**"), EmptyMatchTreatment.ALLOW);
        List<ResourceId> files = new ArrayList<>();
        for (MatchResult result : results) {
            if (result.status() == MatchResult.Status.NOT_FOUND) {
                continue;
            }
            for (MatchResult.Metadata metadata : result.metadata()) {
                files.add(metadata.resourceId());
            }
        }
        return files;
    }

    private static long rowsWritten(PipelineResult result) {
        MetricQueryResults mqr = result.metrics().queryMetrics(
                MetricsFilter.builder()
                        .addNameFilter(MetricNameFilter.named(METRICS_NAMESPACE, ROWS_WRITTEN))
                        .build());
        return StreamSupport.stream(mqr.getCounters().spliterator(), false)
                .map(MetricResult::getAttempted)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .sum();
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }

    static class CountRowsFn extends DoFn<Row, Row> {
        private final Counter counter = Metrics.counter(METRICS_NAMESPACE, ROWS_WRITTEN);

        @ProcessElement
        public void process(@Element Row row, OutputReceiver<Row> out) {
            counter.inc();
            out.output(row);
        }
    }

    /**
     * Destination of a row: its partition directory, its bucket, or "" for an unlaid-out table.
     */
    static class LayoutDestinationFn implements SerializableFunction<Row, String> {
        private final LayoutKind layout;
        private final String bucketColumn;
        private final int numBuckets;

        LayoutDestinationFn(WriteDecision decision) {
            this.layout = decision.getLayout();
            this.bucketColumn = decision.getBucketColumn();
            this.numBuckets = decision.getNumBuckets();
        }

        @Override
        public String apply(Row row) {
            switch (layout) {
                case PARTITION_BY_DATE:
                    return EXECUTION_DATE_COLUMN + "=" + row.getValue(EXECUTION_DATE_COLUMN);
                case BUCKET_BY_KEY:
                    return String.format("bucket-%05d", bucketOf(row.getValue(bucketColumn), numBuckets));
                default:
                    return "";
            }
        }
    }

    static int bucketOf(Object value, int numBuckets) {
        return Math.floorMod(Objects.hashCode(value), numBuckets);
    }

    static class LayoutNaming implements SerializableFunction<String, FileIO.Write.FileNaming> {
        private final LayoutKind layout;
        private final String prefix;
        private final String suffix;

        LayoutNaming(LayoutKind layout, String prefix, String suffix) {
            this.layout = layout;
            this.prefix = prefix;
            this.suffix = suffix;
        }

        @Override
        public FileIO.Write.FileNaming apply(String destination) {
            switch (layout) {
                case PARTITION_BY_DATE:
                    return FileIO.Write.defaultNaming(destination + "/" + prefix, suffix);
                case BUCKET_BY_KEY:
                    return FileIO.Write.defaultNaming(prefix + "-" + destination, suffix);
                default:
                    return FileIO.Write.defaultNaming(prefix, suffix);
            }
        }
    }
}
