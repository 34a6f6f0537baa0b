package com.di.bancodemo.sink;

import com.di.bancodemo.config.BancoDemoProperties;
import com.di.bancodemo.exception.WriteException;
import com.di.bancodemo.materialize.LayoutKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;

/**
 * {@link CatalogSink} over a Hive-compatible JDBC endpoint (HiveServer2, Spark Thrift Server,
 * Kyuubi). Data files are written by {@link TableFileWriter}; the catalog only gets the DDL
 * that points an external table at them.
 */
@Slf4j
@Component
public class JdbcCatalogSink implements CatalogSink {

    private final JdbcTemplate jdbcTemplate;
    private final TableFileWriter writer;
    private final String refreshStatement;

    public JdbcCatalogSink(JdbcTemplate catalogJdbcTemplate, TableFileWriter writer, BancoDemoProperties properties) {
        this.jdbcTemplate = catalogJdbcTemplate;
        this.writer = writer;
        this.refreshStatement = properties.getCatalog().getRefreshStatement();
    }

    @Override
    public boolean tableExists(String databaseName, String tableName) {
        try {
            Boolean exists = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
                try (ResultSet tables = connection.getMetaData().getTables(null, databaseName, tableName, null)) {
                    return tables.next();
                }
            });
            log.info("[CATALOG] {}.{} exists={}", databaseName, tableName, exists);
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            throw new WriteException("Catalog lookup failed for " + databaseName + "." + tableName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void refreshMetadata(String databaseName, String tableName) {
        String sql = String.format(refreshStatement, HiveDdl.qualified(databaseName, tableName));
        log.info("[CATALOG] Refreshing metadata: {}", sql);
        execute(sql);
    }

    @Override
    public long write(TableWrite write) {
        if (write.getFormat() != FileFormat.PARQUET) {
            throw new IllegalArgumentException("Catalog tables are Parquet, got " + write.getFormat());
        }
        long rows = writer.write(write);

        execute(HiveDdl.createDatabase(write.getDatabaseName()));
        execute(HiveDdl.createExternalTable(write.getDatabaseName(), write.getTableName(), write.getSchema(),
                write.getDecision(), write.getLocation()));
        if (write.getDecision().getLayout() == LayoutKind.PARTITION_BY_DATE) {
            execute(HiveDdl.repairPartitions(write.getDatabaseName(), write.getTableName()));
        }
        log.info("[CATALOG] {} registered at {} ({} rows, mode={})", write.qualifiedName(), write.getLocation(),
                rows, write.getDecision().getMode());
        return rows;
    }

    private void execute(String sql) {
        try {
            log.debug("[CATALOG] {}", sql);
            jdbcTemplate.execute(sql);
        } catch (DataAccessException e) {
            throw new WriteException("Catalog statement failed: " + sql + ": " + e.getMessage(), e);
        }
    }
}
