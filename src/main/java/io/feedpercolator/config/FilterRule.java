package io.feedpercolator.config;

import io.feedpercolator.api.filter.FilterAction;

/**
 * A configured pattern filter. Rules run in the order they are listed.
 */
public record FilterRule(
        String name,
        Field field,
        String pattern,
        FilterAction action
) {
    public FilterRule {
        field = field == null ? Field.ANY : field;
        name = name == null || name.isBlank() ? field.name().toLowerCase() + "~" + pattern : name;
    }

    public enum Field {
        TITLE,
        CONTENT,
        LINK,
        ANY
    }
}
