package io.feedpercolator.api.service;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once when the application starts. A failed run fails startup.
 */
@Component
@ConditionalOnProperty(prefix = "percolator.processing", name = "run-on-startup", havingValue = "true")
public class StartupPipelineRunner implements ApplicationRunner {

    private final PipelineService pipelineService;

    public StartupPipelineRunner(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public void run(ApplicationArguments args) {
        pipelineService.run();
    }
}
