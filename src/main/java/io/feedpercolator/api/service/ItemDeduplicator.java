package io.feedpercolator.api.service;

import io.feedpercolator.api.dto.FeedItem;

import java.net.URI;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Drops items whose id, title (ignoring case) or alternate link was already seen during this run.
 * <p>
 * Not thread-safe and not reusable across runs: create one per run.
 */
public final class ItemDeduplicator {

    private final Set<String> ids = new HashSet<>();
    private final Set<String> titles = new HashSet<>();
    private final Set<URI> links = new HashSet<>();

    /**
     * Lazily passes through the first occurrence of each item, in encounter order.
     */
    public Stream<FeedItem> deduplicate(Stream<FeedItem> items) {
        return items.sequential().filter(this::isNew);
    }

    /**
     * Records the item's keys and reports whether it is new on all of them. Checks stop at the first key that
     * was already seen, so later keys of a rejected item are not recorded. An item without a title is never
     * rejected on its title.
     */
    boolean isNew(FeedItem item) {
        if (!ids.add(item.id())) {
            return false;
        }
        if (item.hasTitle() && !titles.add(item.title().toLowerCase(Locale.ROOT))) {
            return false;
        }

        Optional<URI> link = item.alternateLink();
        return link.isEmpty() || links.add(link.get());
    }
}
