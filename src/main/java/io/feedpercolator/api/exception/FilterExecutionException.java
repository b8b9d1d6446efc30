package io.feedpercolator.api.exception;

public class FilterExecutionException extends PipelineException {
    private final String filterName;

    public FilterExecutionException(String filterName, String itemId, Throwable cause) {
        super(String.format("Filter '%s' failed on item %s: %s", filterName, itemId, cause.getMessage()),
                cause, ErrorCategory.FILTER_ERROR);
        this.filterName = filterName;
    }

    public String getFilterName() {
        return filterName;
    }
}
