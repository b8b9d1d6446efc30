package io.feedpercolator.api.dto;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * Parameters of a single run.
 *
 * @param inputs      source feeds; null or empty means the run has no items
 * @param output      target file; null means nothing is written
 * @param title       title of the merged feed
 * @param description description of the merged feed
 */
public record PipelineSettings(
        List<URI> inputs,
        Path output,
        String title,
        String description
) {
    public boolean hasInputs() {
        return inputs != null && !inputs.isEmpty();
    }

    public boolean hasOutput() {
        return output != null;
    }
}
