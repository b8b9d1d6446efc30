package io.feedpercolator.api.service;

import io.feedpercolator.api.exception.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(prefix = "percolator.processing", name = "enable-scheduling", havingValue = "true")
public class ScheduledPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledPipelineService.class);

    private final PipelineService pipelineService;

    public ScheduledPipelineService(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Scheduled(
            fixedRateString = "#{@percolatorProps.scheduleIntervalMs}",
            initialDelayString = "#{@percolatorProps.initialDelayMs}"
    )
    public void runScheduled() {
        logger.debug("Starting scheduled pipeline run");
        try {
            pipelineService.run();
        } catch (PipelineException e) {
            // already logged by PipelineService; the next tick starts from scratch
            logger.warn("Scheduled pipeline run aborted ({})", e.getCategory());
        }
    }
}
