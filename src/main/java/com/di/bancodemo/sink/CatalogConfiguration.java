package com.di.bancodemo.sink;

import com.di.bancodemo.config.BancoDemoProperties;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Connection pool for the catalog. The pool connects lazily: a files-only run never opens a
 * connection, and an unreachable catalog fails the first table that needs it instead of startup.
 */
@Slf4j
@Configuration
public class CatalogConfiguration {

    @Bean(destroyMethod = "close")
    public HikariDataSource catalogDataSource(BancoDemoProperties properties) {
        BancoDemoProperties.Catalog catalog = properties.getCatalog();
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("bancodemo-catalog");
        dataSource.setJdbcUrl(catalog.getJdbcUrl());
        dataSource.setUsername(catalog.getUsername());
        dataSource.setPassword(catalog.getPassword());
        if (catalog.getDriverClassName() != null && !catalog.getDriverClassName().isBlank()) {
            dataSource.setDriverClassName(catalog.getDriverClassName());
        }
        dataSource.setMaximumPoolSize(catalog.getMaximumPoolSize());
        dataSource.setMinimumIdle(0);
        dataSource.setConnectionTimeout(catalog.getConnectionTimeoutMs());
        dataSource.setInitializationFailTimeout(-1);
        // Hive drivers reject setAutoCommit(false)
        dataSource.setAutoCommit(true);
        log.info("[CATALOG] Pool configured for {}", catalog.getJdbcUrl().isBlank() ? "<unset>" : catalog.getJdbcUrl());
        return dataSource;
    }

    @Bean
    public JdbcTemplate catalogJdbcTemplate(HikariDataSource catalogDataSource) {
        return new JdbcTemplate(catalogDataSource);
    }
}
