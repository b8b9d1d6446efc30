package io.feedpercolator.api.dto;

import java.net.URI;
import java.util.Objects;

public record FeedLink(String rel, URI href) {

    public static final String ALTERNATE = "alternate";

    public FeedLink {
        Objects.requireNonNull(href, "href");
        rel = rel == null || rel.isBlank() ? ALTERNATE : rel.trim();
    }

    public static FeedLink alternate(URI href) {
        return new FeedLink(ALTERNATE, href);
    }

    public boolean isAlternate() {
        return ALTERNATE.equalsIgnoreCase(rel);
    }
}
