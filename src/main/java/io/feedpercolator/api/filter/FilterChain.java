package io.feedpercolator.api.filter;

import io.feedpercolator.api.dto.FeedItem;
import io.feedpercolator.api.exception.FilterExecutionException;

import java.util.List;

/**
 * Runs filters from first to last. Every item starts as {@link FilterAction#INCLUDE} and each filter that does
 * not abstain overwrites the decision, so later filters win. Put broad filters first and narrow ones after them.
 */
public final class FilterChain {

    private final List<Filter> filters;

    public FilterChain(List<? extends Filter> filters) {
        this.filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public FilterAction evaluate(FeedItem item) {
        FilterAction result = FilterAction.INCLUDE;

        for (Filter filter : filters) {
            FilterAction action = apply(filter, item);
            if (action != FilterAction.ABSTAIN) {
                result = action;
            }
        }

        return result;
    }

    public boolean includes(FeedItem item) {
        return evaluate(item) == FilterAction.INCLUDE;
    }

    public int size() {
        return filters.size();
    }

    private static FilterAction apply(Filter filter, FeedItem item) {
        FilterAction action;
        try {
            action = filter.apply(item);
        } catch (RuntimeException e) {
            throw new FilterExecutionException(filter.name(), item.id(), e);
        }
        if (action == null) {
            throw new FilterExecutionException(filter.name(), item.id(),
                    new IllegalStateException("filter returned no action"));
        }
        return action;
    }
}
