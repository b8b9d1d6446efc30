package io.feedpercolator.api.filter;

import io.feedpercolator.api.dto.FeedItem;
import io.feedpercolator.api.dto.FeedLink;
import io.feedpercolator.config.FilterRule;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Returns its configured action when the pattern is found in the selected field, and abstains otherwise.
 */
public final class PatternFilter implements Filter {

    private final String name;
    private final FilterRule.Field field;
    private final Pattern pattern;
    private final FilterAction action;

    public PatternFilter(String name, FilterRule.Field field, String regex, FilterAction action) {
        if (action == null || action == FilterAction.ABSTAIN) {
            throw new IllegalArgumentException("Filter '" + name + "' must INCLUDE or EXCLUDE, got " + action);
        }
        this.name = name;
        this.field = Objects.requireNonNull(field, "field");
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "pattern"),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.action = action;
    }

    public static PatternFilter from(FilterRule rule) {
        return new PatternFilter(rule.name(), rule.field(), rule.pattern(), rule.action());
    }

    @Override
    public FilterAction apply(FeedItem item) {
        boolean matched = values(item)
                .filter(Objects::nonNull)
                .anyMatch(text -> pattern.matcher(text).find());

        return matched ? action : FilterAction.ABSTAIN;
    }

    @Override
    public String name() {
        return name;
    }

    private Stream<String> values(FeedItem item) {
        return switch (field) {
            case TITLE -> Stream.of(item.title());
            case CONTENT -> Stream.of(item.content());
            case LINK -> links(item);
            case ANY -> Stream.concat(Stream.of(item.title(), item.content()), links(item));
        };
    }

    private static Stream<String> links(FeedItem item) {
        return item.links().stream()
                .map(FeedLink::href)
                .map(Object::toString);
    }

    @Override
    public String toString() {
        return "PatternFilter[" + name + ": " + field + " ~ /" + pattern.pattern() + "/ -> " + action + "]";
    }
}
