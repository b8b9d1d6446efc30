package io.feedpercolator.api.util;

import io.feedpercolator.config.PercolatorConfig;
import org.springframework.stereotype.Component;

@Component
public class PercolatorProps {
    private final long scheduleIntervalMs;
    private final long initialDelayMs;

    public PercolatorProps(PercolatorConfig config) {
        this.scheduleIntervalMs = config.processing().getScheduleIntervalMs();
        this.initialDelayMs = config.processing().getInitialDelayMs();
    }

    // schedule
    public long getScheduleIntervalMs() { return scheduleIntervalMs; }
    public long getInitialDelayMs() { return initialDelayMs; }
}
