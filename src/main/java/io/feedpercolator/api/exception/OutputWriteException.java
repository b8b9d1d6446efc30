package io.feedpercolator.api.exception;

public class OutputWriteException extends PipelineException {

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause, ErrorCategory.OUTPUT_ERROR);
    }
}
