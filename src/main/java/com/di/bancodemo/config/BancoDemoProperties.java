package com.di.bancodemo.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Job-level settings from application.yml / application-{profile}.yml.
 * <p>
 * The table list, per-table record counts and the storage location live in the data
 * configuration file ({@link #configFile}); this class only holds what the process needs
 * to find that file and to talk to the engine and the catalog.
 *
 * <pre>
 * bancodemo:
 *   config-file: file:/app/mount/bancodemo_config.yml
 *   schema-dir: file:/app/mount/
 *   job: materialize
 *   table-timeout: 30m
 *   engine-args: --runner=DirectRunner
 *   catalog:
 *     jdbc-url: jdbc:hive2://metastore:10000/default
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "bancodemo")
public class BancoDemoProperties {

    /** Data configuration file (DEFAULT, storage and one section per table). */
    @NotBlank
    private String configFile = "classpath:bancodemo_config.yml";

    /** Directory holding one {@code <table>.json} schema per table. */
    @NotBlank
    private String schemaDir = "classpath:schemas/";

    /** Which job to run: materialize (generate and write tables) or reconcile (re-key the fact table). */
    @NotBlank
    private String job = "materialize";

    /** Optional deadline for a single table materialization. Null = wait until the engine returns. */
    private Duration tableTimeout;

    /** Seed for the synthetic value generator. Null = different values every run. */
    private Long generatorSeed;

    /** Locale for generated names, addresses and documents. */
    private String generatorLocale = "pt-BR";

    /** Beam pipeline options, in command-line form. */
    private List<String> engineArgs = new ArrayList<>(List.of("--runner=DirectRunner"));

    @Valid
    private Catalog catalog = new Catalog();

    @Valid
    private Reconcile reconcile = new Reconcile();

    @Data
    public static class Catalog {
        /** JDBC URL of the Hive-compatible catalog service. Only used when apenas_arquivos=false. */
        private String jdbcUrl = "";
        private String username = "";
        private String password = "";
        /** Driver class; leave blank to let DriverManager resolve it from the URL. */
        private String driverClassName = "";
        private int maximumPoolSize = 2;
        private long connectionTimeoutMs = 30_000L;
        /** Statement issued before appending to an existing table; %s is the qualified table name. */
        private String refreshStatement = "REFRESH TABLE %s";
    }

    @Data
    public static class Reconcile {
        @NotBlank
        private String dimensionTable = "clientes";
        @NotBlank
        private String dimensionKey = "id_usuario";
        @NotBlank
        private String factTable = "transacoes_cartao";
        @NotBlank
        private String factKey = "id_usuario";
    }
}
