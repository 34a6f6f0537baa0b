package com.di.bancodemo.runner;

import com.di.bancodemo.config.BancoDemoProperties;
import com.di.bancodemo.config.ConfigModel;
import com.di.bancodemo.config.StorageTarget;
import com.di.bancodemo.config.TableSpec;
import com.di.bancodemo.materialize.MaterializationResult;
import com.di.bancodemo.materialize.TableMaterializer;
import com.di.bancodemo.schema.SchemaRegistry;
import com.di.bancodemo.util.MdcKeys;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.schemas.Schema;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Materializes every table listed in {@code DEFAULT.tabelas}, one at a time, in configuration order.
 * A failing table is logged and the run moves on; tables without a section are skipped with a warning.
 * With {@code bancodemo.table-timeout} set, a write whose engine run outlasts it is cancelled before
 * the next table starts.
 */
@Slf4j
@Service
public class DataGenerationRunner {

    private final SchemaRegistry schemaRegistry;
    private final TableMaterializer materializer;
    private final Duration tableTimeout;

    @Autowired
    public DataGenerationRunner(SchemaRegistry schemaRegistry, TableMaterializer materializer,
                                BancoDemoProperties properties) {
        this(schemaRegistry, materializer, properties.getTableTimeout());
    }

    public DataGenerationRunner(SchemaRegistry schemaRegistry, TableMaterializer materializer, Duration tableTimeout) {
        this.schemaRegistry = schemaRegistry;
        this.materializer = materializer;
        this.tableTimeout = tableTimeout;
    }

    public RunSummary run(ConfigModel config) {
        String runId = "run-" + UUID.randomUUID();
        MDC.put(MdcKeys.RUN_ID, runId);
        RunSummary summary = new RunSummary(runId);
        try {
            if (config.getTableNames().isEmpty()) {
                log.error("[RUNNER] DEFAULT.tabelas lists no tables; nothing to do");
                return summary;
            }
            log.info("[RUNNER] Materializing {} table(s): {}", config.getTableNames().size(), config.getTableNames());
            for (String tableName : config.getTableNames()) {
                MDC.put(MdcKeys.TABLE, tableName);
                try {
                    Optional<TableSpec> spec = config.tableSpec(tableName);
                    if (spec.isEmpty()) {
                        log.warn("[RUNNER] No section [{}] in the configuration file; skipping", tableName);
                        summary.skipped(tableName);
                        continue;
                    }
                    StorageTarget target = config.storageTarget();
                    Schema schema = schemaRegistry.schemaFor(tableName);
                    MaterializationResult result = materializer.materialize(tableName, spec.get(), schema, target, tableTimeout);
                    log.info("[RUNNER] '{}' done: {} rows, mode={}, layout={}, location={}", tableName,
                            result.getRowCount(), result.getDecision().getMode(), result.getDecision().getLayout(),
                            result.getLocation());
                    summary.succeeded(result);
                } catch (RuntimeException e) {
                    log.error("[RUNNER] '{}' failed: {}", tableName, e.getMessage(), e);
                    summary.failed(tableName, e.getMessage());
                } finally {
                    MDC.remove(MdcKeys.TABLE);
                }
            }
            log.info("[RUNNER] Finished {}", summary);
            return summary;
        } finally {
            MDC.remove(MdcKeys.RUN_ID);
        }
    }
}
