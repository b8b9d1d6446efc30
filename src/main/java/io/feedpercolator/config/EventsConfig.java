package io.feedpercolator.config;

public record EventsConfig(boolean enabled) {}
