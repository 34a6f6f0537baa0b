package com.di.bancodemo.runner;

import com.di.bancodemo.config.BancoDemoProperties;
import com.di.bancodemo.config.ConfigLoaderService;
import com.di.bancodemo.config.ConfigModel;
import com.di.bancodemo.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Loads the data configuration and runs the job named by {@code bancodemo.job}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobLauncher {

    public static final String MATERIALIZE = "materialize";
    public static final String RECONCILE = "reconcile";

    private final BancoDemoProperties properties;
    private final ConfigLoaderService configLoader;
    private final DataGenerationRunner dataGenerationRunner;
    private final TransformationRunner transformationRunner;

    /**
     * Table-level and reconciliation failures are logged and do not fail the process.
     *
     * @throws ConfigurationException when the configuration file cannot be loaded or the job is unknown
     */
    public void launch() {
        String job = properties.getJob().trim().toLowerCase(Locale.ROOT);
        if (!job.equals(MATERIALIZE) && !job.equals(RECONCILE)) {
            throw new ConfigurationException("Unknown job '" + properties.getJob() + "'; expected "
                    + MATERIALIZE + " or " + RECONCILE);
        }
        ConfigModel config = configLoader.load();
        log.info("[LAUNCHER] Running job '{}'", job);
        if (job.equals(MATERIALIZE)) {
            dataGenerationRunner.run(config);
        } else {
            transformationRunner.run(config);
        }
    }
}
