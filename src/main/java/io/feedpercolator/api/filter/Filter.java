package io.feedpercolator.api.filter;

import io.feedpercolator.api.dto.FeedItem;

/**
 * Decides about one item. Implementations are stateless and must not throw for ordinary input.
 */
@FunctionalInterface
public interface Filter {

    FilterAction apply(FeedItem item);

    default String name() {
        return getClass().getSimpleName();
    }
}
