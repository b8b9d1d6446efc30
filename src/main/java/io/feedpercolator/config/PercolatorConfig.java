package io.feedpercolator.config;

import io.feedpercolator.api.dto.PipelineSettings;
import io.feedpercolator.api.exception.ErrorCategory;
import io.feedpercolator.api.exception.SourceFetchException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

@ConfigurationProperties(prefix = "percolator")
public record PercolatorConfig(
        List<String> inputs,
        String output,
        String title,
        String description,
        HttpConfig http,
        ProcessingConfig processing,
        EventsConfig events,
        List<FilterRule> filters
) {
    public PercolatorConfig {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        http = http == null ? HttpConfig.defaults() : http;
        processing = processing == null ? ProcessingConfig.defaults() : processing;
        events = events == null ? new EventsConfig(false) : events;
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    /**
     * Settings for one run. Absent inputs and output stay null.
     */
    public PipelineSettings toSettings() {
        List<URI> sources = inputs == null
                ? null
                : inputs.stream().map(PercolatorConfig::toSourceUri).toList();
        Path target = output == null || output.isBlank() ? null : Path.of(output.trim());

        return new PipelineSettings(sources, target, title, description);
    }

    private static URI toSourceUri(String input) {
        try {
            return URI.create(input.trim());
        } catch (IllegalArgumentException e) {
            throw new SourceFetchException(null, "Invalid source URL: " + input, e, ErrorCategory.INVALID_URL);
        }
    }

    public int sourceCount() {
        return inputs == null ? 0 : inputs.size();
    }
}
