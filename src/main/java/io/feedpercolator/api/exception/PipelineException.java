package io.feedpercolator.api.exception;

/**
 * Base for every error that aborts a pipeline run.
 */
public class PipelineException extends RuntimeException {
    private final ErrorCategory category;

    public PipelineException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public PipelineException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
