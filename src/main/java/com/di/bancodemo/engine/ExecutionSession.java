package com.di.bancodemo.engine;

import com.di.bancodemo.config.BancoDemoProperties;
import com.di.bancodemo.exception.SessionInitializationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.runners.direct.DirectOptions;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.io.FileSystems;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The process-wide engine session: one set of {@link PipelineOptions}, parsed once from
 * {@code bancodemo.engine-args}, from which every materialization builds its own pipeline.
 * Registering the options with {@link FileSystems} is what makes s3:// and azfs:// paths
 * resolvable outside a running pipeline (existence checks, staged renames).
 */
@Slf4j
@Component
public class ExecutionSession {

    private final PipelineOptions options;

    @Autowired
    public ExecutionSession(BancoDemoProperties properties) {
        this(properties.getEngineArgs());
    }

    public ExecutionSession(List<String> engineArgs) {
        try {
            this.options = PipelineOptionsFactory.fromArgs(engineArgs.toArray(new String[0]))
                    .withValidation()
                    .create();
            // run() returns at once; writers wait on the result themselves, with or without a deadline
            options.as(DirectOptions.class).setBlockOnRun(false);
            FileSystems.setDefaultPipelineOptions(options);
        } catch (RuntimeException e) {
            throw new SessionInitializationException("Cannot create engine session from " + engineArgs + ": " + e.getMessage(), e);
        }
        log.info("[ENGINE] Session ready (runner={})", options.getRunner().getSimpleName());
    }

    public Pipeline newPipeline() {
        return Pipeline.create(options);
    }

    public PipelineOptions options() {
        return options;
    }
}
