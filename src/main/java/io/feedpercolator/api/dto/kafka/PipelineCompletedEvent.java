package io.feedpercolator.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.feedpercolator.api.dto.PipelineRunSummary;

import java.time.LocalDateTime;

public record PipelineCompletedEvent(
        @JsonProperty("runId") String runId,
        @JsonProperty("sources") int sources,
        @JsonProperty("fetchedItems") int fetchedItems,
        @JsonProperty("outputItems") int outputItems,
        @JsonProperty("written") boolean written,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("completedAt")
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime completedAt
) {
    public static PipelineCompletedEvent create(PipelineRunSummary summary) {
        return new PipelineCompletedEvent(
                "RUN-" + summary.startedAt().toEpochMilli(),
                summary.sources(),
                summary.fetchedItems(),
                summary.outputItems(),
                summary.written(),
                summary.durationMs(),
                LocalDateTime.now()
        );
    }
}
