package com.di.bancodemo.materialize;

import com.di.bancodemo.config.StorageTarget;
import com.di.bancodemo.config.TableSpec;
import com.di.bancodemo.exception.DataException;
import com.di.bancodemo.generator.RowSource;
import com.di.bancodemo.sink.CatalogSink;
import com.di.bancodemo.sink.FileFormat;
import com.di.bancodemo.sink.FileSink;
import com.di.bancodemo.sink.TableWrite;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.values.Row;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Generates one table's rows and writes them to the run's target.
 * <ol>
 *   <li>catalog targets: ask whether the table exists (flat files never are asked)</li>
 *   <li>generate {@code numRecords} rows and stamp them with today's {@code data_execucao}</li>
 *   <li>decide mode and layout ({@link WriteDecision#decide})</li>
 *   <li>appends to a catalog table refresh its metadata first</li>
 *   <li>write: Parquet for the catalog, {@code formato_arquivo} for flat files</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableMaterializer {

    private final RowSource rowSource;
    private final CatalogSink catalogSink;
    private final FileSink fileSink;
    private final Clock clock;

    public MaterializationResult materialize(String tableName, TableSpec spec, Schema schema, StorageTarget target) {
        return materialize(tableName, spec, schema, target, null);
    }

    /**
     * @param deadline bound on the engine run of the write; null waits until it ends
     * @throws com.di.bancodemo.exception.BancoDemoException on any failure; nothing is written
     *         unless every step before the write succeeded
     */
    public MaterializationResult materialize(String tableName, TableSpec spec, Schema schema, StorageTarget target,
                                             Duration deadline) {
        FileFormat format = target.isCatalog() ? FileFormat.PARQUET : FileFormat.from(target.getFileFormat());
        Schema stampedSchema = GeneratedBatch.withExecutionDate(schema);

        boolean exists = target.isCatalog() && catalogSink.tableExists(target.getDatabaseName(), tableName);

        List<Row> rows = rowSource.generate(tableName, schema, spec.getNumRecords());
        if (rows.size() != spec.getNumRecords()) {
            throw new DataException(String.format("Generator returned %d rows for '%s', expected %d",
                    rows.size(), tableName, spec.getNumRecords()));
        }
        LocalDate executionDate = LocalDate.now(clock);
        GeneratedBatch batch = GeneratedBatch.stamp(schema, rows, executionDate);

        WriteDecision decision = WriteDecision.decide(spec, target.getKind(), exists, stampedSchema);
        log.info("[MATERIALIZE] '{}': target={}, exists={}, mode={}, layout={}, rows={}, data_execucao={}",
                tableName, target.getKind(), exists, decision.getMode(), decision.getLayout(),
                rows.size(), executionDate);

        String location = target.isCatalog() ? target.catalogLocation(tableName) : target.filePath(tableName);
        TableWrite write = TableWrite.builder()
                .tableName(tableName)
                .databaseName(target.isCatalog() ? target.getDatabaseName() : null)
                .schema(batch.getSchema())
                .source(batch)
                .decision(decision)
                .format(format)
                .location(location)
                .stagingRoot(target.stagingRoot())
                .deadline(deadline)
                .build();

        long written;
        if (target.isCatalog()) {
            if (decision.getMode() == WriteMode.APPEND) {
                catalogSink.refreshMetadata(target.getDatabaseName(), tableName);
            }
            written = catalogSink.write(write);
        } else {
            written = fileSink.write(write);
        }

        return MaterializationResult.builder()
                .tableName(tableName)
                .decision(decision)
                .rowCount(written)
                .executionDate(executionDate)
                .location(location)
                .build();
    }
}
