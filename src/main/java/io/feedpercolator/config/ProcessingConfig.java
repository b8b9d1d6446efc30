package io.feedpercolator.config;

import java.time.Duration;

public record ProcessingConfig(
        Duration scheduleInterval,
        Duration initialDelay,
        boolean enableScheduling,
        boolean runOnStartup
) {
    public ProcessingConfig {
        scheduleInterval = scheduleInterval == null ? Duration.ofMinutes(30) : scheduleInterval;
        initialDelay = initialDelay == null ? Duration.ofSeconds(30) : initialDelay;
    }

    public static ProcessingConfig defaults() {
        return new ProcessingConfig(null, null, false, false);
    }

    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
