package io.feedpercolator.api.service;

import io.feedpercolator.api.dto.PipelineRunSummary;
import io.feedpercolator.api.dto.kafka.PipelineCompletedEvent;
import io.feedpercolator.config.KafkaProperties;
import io.feedpercolator.config.PercolatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties kafkaProperties;
    private final boolean enabled;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate,
                                 KafkaProperties kafkaProperties,
                                 PercolatorConfig config) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
        this.enabled = config.events().enabled();
    }

    /**
     * Announces a finished run. Failures are logged only; the run itself has already succeeded.
     */
    public void publishPipelineCompleted(PipelineRunSummary summary) {
        if (!enabled) {
            logger.debug("Event publishing disabled, skipping pipeline completed event");
            return;
        }

        try {
            PipelineCompletedEvent event = PipelineCompletedEvent.create(summary);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.pipelineCompleted(), event.runId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent pipeline completed event: {} ({} of {} items kept)",
                            event.runId(), event.outputItems(), event.fetchedItems());
                } else {
                    logger.error("Failed to send pipeline completed event: {}", event.runId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing pipeline completed event", e);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }
}
