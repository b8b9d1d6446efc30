package io.feedpercolator.api.exception;

import java.net.URI;

/**
 * A source could not be retrieved or parsed.
 */
public class SourceFetchException extends PipelineException {
    private final URI source;

    public SourceFetchException(URI source, String message, ErrorCategory category) {
        super(message, category);
        this.source = source;
    }

    public SourceFetchException(URI source, String message, Throwable cause, ErrorCategory category) {
        super(message, cause, category);
        this.source = source;
    }

    public URI getSource() {
        return source;
    }
}
