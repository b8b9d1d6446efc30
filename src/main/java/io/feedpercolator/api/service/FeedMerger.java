package io.feedpercolator.api.service;

import io.feedpercolator.api.dto.FeedItem;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

@Service
public class FeedMerger {

    /** Undated items first; ties keep their encounter order. */
    static final Comparator<FeedItem> BY_PUBLISHED =
            Comparator.comparing(FeedItem::publishedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    public List<FeedItem> merge(Stream<FeedItem> items) {
        List<FeedItem> merged = items.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
        merged.sort(BY_PUBLISHED);
        return Collections.unmodifiableList(merged);
    }
}
