package io.feedpercolator.api.dto;

import java.time.Instant;

public record PipelineRunSummary(
        int sources,
        int fetchedItems,
        int outputItems,
        boolean written,
        Instant startedAt,
        long durationMs
) {}
