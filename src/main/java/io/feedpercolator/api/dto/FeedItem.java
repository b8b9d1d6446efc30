package io.feedpercolator.api.dto;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One syndication entry. {@code title}, {@code publishedAt}, {@code content} and {@code source} may be null.
 */
public record FeedItem(
        String id,
        String title,
        List<FeedLink> links,
        Instant publishedAt,
        String content,
        URI source
) {
    public FeedItem {
        Objects.requireNonNull(id, "id");
        links = links == null ? List.of() : List.copyOf(links);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    /**
     * First link tagged {@value FeedLink#ALTERNATE}, if any.
     */
    public Optional<URI> alternateLink() {
        return links.stream()
                .filter(FeedLink::isAlternate)
                .map(FeedLink::href)
                .findFirst();
    }
}
