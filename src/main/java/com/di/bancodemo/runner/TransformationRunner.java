package com.di.bancodemo.runner;

import com.di.bancodemo.config.BancoDemoProperties;
import com.di.bancodemo.config.ConfigModel;
import com.di.bancodemo.config.StorageTarget;
import com.di.bancodemo.config.TableSpec;
import com.di.bancodemo.exception.BancoDemoException;
import com.di.bancodemo.exception.ConfigurationException;
import com.di.bancodemo.exception.DataException;
import com.di.bancodemo.materialize.GeneratedBatch;
import com.di.bancodemo.materialize.WriteDecision;
import com.di.bancodemo.reconcile.CardinalityReconciler;
import com.di.bancodemo.schema.SchemaRegistry;
import com.di.bancodemo.sink.CatalogSink;
import com.di.bancodemo.sink.FileFormat;
import com.di.bancodemo.sink.FileSink;
import com.di.bancodemo.sink.TableFileReader;
import com.di.bancodemo.sink.TableWrite;
import com.di.bancodemo.util.MdcKeys;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.values.PBegin;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Re-keys the fact table's foreign key from the dimension table, both read back from where
 * the materialize job left them, and overwrites the fact table in place with the same layout.
 * <p>
 * Reads Parquet only: catalog tables always are, flat files only when {@code formato_arquivo=parquet}.
 */
@Slf4j
@Service
public class TransformationRunner {

    private final SchemaRegistry schemaRegistry;
    private final CatalogSink catalogSink;
    private final FileSink fileSink;
    private final BancoDemoProperties.Reconcile settings;
    private final Long seed;

    public TransformationRunner(SchemaRegistry schemaRegistry, CatalogSink catalogSink, FileSink fileSink,
                                BancoDemoProperties properties) {
        this.schemaRegistry = schemaRegistry;
        this.catalogSink = catalogSink;
        this.fileSink = fileSink;
        this.settings = properties.getReconcile();
        this.seed = properties.getGeneratorSeed();
    }

    /**
     * @return true when the fact table was rewritten; false when reconciliation failed and the
     *         tables were left as they were
     */
    public boolean run(ConfigModel config) {
        String dimensionTable = settings.getDimensionTable();
        String factTable = settings.getFactTable();
        MDC.put(MdcKeys.RUN_ID, "run-" + UUID.randomUUID());
        MDC.put(MdcKeys.TABLE, factTable);
        try {
            log.info("[RECONCILE] Re-keying {}.{} from {}.{}", factTable, settings.getFactKey(),
                    dimensionTable, settings.getDimensionKey());
            StorageTarget target = config.storageTarget();
            if (!target.isCatalog() && FileFormat.from(target.getFileFormat()) != FileFormat.PARQUET) {
                throw new ConfigurationException("Reconciliation reads Parquet; flat files are "
                        + target.getFileFormat());
            }
            if (target.isCatalog()) {
                requireTable(target, dimensionTable);
                requireTable(target, factTable);
            }

            Schema dimensionSchema = GeneratedBatch.withExecutionDate(schemaRegistry.schemaFor(dimensionTable));
            Schema factSchema = GeneratedBatch.withExecutionDate(schemaRegistry.schemaFor(factTable));
            CardinalityReconciler reconciler = CardinalityReconciler
                    .of(settings.getDimensionKey(), settings.getFactKey())
                    .withSeed(seed);
            Schema outputSchema = reconciler.outputSchema(dimensionSchema, factSchema);

            TableSpec factSpec = config.tableSpec(factTable)
                    .orElseGet(() -> TableSpec.builder().name(factTable).build());
            // An absent table always resolves to OVERWRITE, which is what a rewrite in place needs.
            WriteDecision decision = WriteDecision.decide(factSpec, target.getKind(), false, outputSchema);

            TableWrite write = TableWrite.builder()
                    .tableName(factTable)
                    .databaseName(target.isCatalog() ? target.getDatabaseName() : null)
                    .schema(outputSchema)
                    .source(new ReconcileSource(location(target, dimensionTable), dimensionSchema,
                            location(target, factTable), factSchema, reconciler))
                    .decision(decision)
                    .format(FileFormat.PARQUET)
                    .location(location(target, factTable))
                    .stagingRoot(target.stagingRoot())
                    .build();

            long rows = target.isCatalog() ? catalogSink.write(write) : fileSink.write(write);
            log.info("[RECONCILE] {} rewritten with {} re-keyed rows (layout={})", factTable, rows, decision.getLayout());
            return true;
        } catch (BancoDemoException e) {
            log.error("[RECONCILE] Failed, {} left unchanged: {}", factTable, e.getMessage(), e);
            return false;
        } finally {
            MDC.remove(MdcKeys.TABLE);
            MDC.remove(MdcKeys.RUN_ID);
        }
    }

    private void requireTable(StorageTarget target, String tableName) {
        if (!catalogSink.tableExists(target.getDatabaseName(), tableName)) {
            throw new DataException(String.format("Table %s.%s does not exist; run the materialize job first",
                    target.getDatabaseName(), tableName));
        }
    }

    private static String location(StorageTarget target, String tableName) {
        return target.isCatalog() ? target.catalogLocation(tableName) : target.filePath(tableName);
    }

    /**
     * Reads both tables and re-keys the fact rows inside the write pipeline.
     */
    static class ReconcileSource extends PTransform<PBegin, PCollection<Row>> {
        private final String dimensionLocation;
        private final Schema dimensionSchema;
        private final String factLocation;
        private final Schema factSchema;
        private final CardinalityReconciler reconciler;

        ReconcileSource(String dimensionLocation, Schema dimensionSchema, String factLocation, Schema factSchema,
                        CardinalityReconciler reconciler) {
            this.dimensionLocation = dimensionLocation;
            this.dimensionSchema = dimensionSchema;
            this.factLocation = factLocation;
            this.factSchema = factSchema;
            this.reconciler = reconciler;
        }

        @Override
        public PCollection<Row> expand(PBegin input) {
            PCollection<Row> dimension = input.apply("ReadDimension", TableFileReader.parquet(dimensionLocation, dimensionSchema));
            PCollection<Row> fact = input.apply("ReadFact", TableFileReader.parquet(factLocation, factSchema));
            return reconciler.reconcile(dimension, fact);
        }
    }
}
