package io.feedpercolator.api.filter;

public enum FilterAction {
    /** No opinion; the running decision is left as it is. */
    ABSTAIN,
    INCLUDE,
    EXCLUDE
}
