package com.di.bancodemo;

import com.di.bancodemo.config.BancoDemoProperties;
import com.di.bancodemo.exception.ConfigurationException;
import com.di.bancodemo.exception.SessionInitializationException;
import com.di.bancodemo.runner.JobLauncher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@Slf4j
@SpringBootApplication(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
})
@EnableConfigurationProperties(BancoDemoProperties.class)
public class BancoDemoApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs one job and returns the process exit code: 1 when the configuration or the engine
     * session cannot be set up, 0 otherwise (including runs where some tables failed).
     */
    static int run(String[] args) {
        ConfigurableApplicationContext ctx;
        try {
            ctx = new SpringApplicationBuilder(BancoDemoApplication.class)
                    .web(WebApplicationType.NONE)
                    .run(args);
        } catch (RuntimeException e) {
            log.error("[STARTUP] Application context failed to start: {}", e.getMessage(), e);
            return 1;
        }
        try (ctx) {
            ctx.getBean(JobLauncher.class).launch();
            return 0;
        } catch (ConfigurationException | SessionInitializationException e) {
            log.error("[STARTUP] {}", e.getMessage(), e);
            return 1;
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
