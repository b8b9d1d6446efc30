package io.feedpercolator.api.service;

import io.feedpercolator.api.dto.FeedItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FeedMergerTest {

    private final FeedMerger merger = new FeedMerger();

    @Test
    @DisplayName("Should order items by publish time ascending")
    void shouldOrderItemsByPublishTimeAscending() {
        FeedItem late = item("late", "2026-10-19T10:00:00Z");
        FeedItem early = item("early", "2026-10-19T06:00:00Z");
        FeedItem middle = item("middle", "2026-10-19T08:00:00Z");

        List<FeedItem> merged = merger.merge(Stream.of(late, early, middle));

        assertThat(merged).containsExactly(early, middle, late);
        assertThat(merged).isSortedAccordingTo(FeedMerger.BY_PUBLISHED);
    }

    @Test
    @DisplayName("Should keep encounter order for equal timestamps")
    void shouldKeepEncounterOrderForEqualTimestamps() {
        FeedItem first = item("first", "2026-10-19T08:00:00Z");
        FeedItem second = item("second", "2026-10-19T08:00:00Z");
        FeedItem earlier = item("earlier", "2026-10-19T07:00:00Z");
        FeedItem third = item("third", "2026-10-19T08:00:00Z");

        assertThat(merger.merge(Stream.of(first, second, earlier, third)))
                .containsExactly(earlier, first, second, third);
    }

    @Test
    @DisplayName("Should put undated items first")
    void shouldPutUndatedItemsFirst() {
        FeedItem dated = item("dated", "2026-10-19T08:00:00Z");
        FeedItem undated = new FeedItem("undated", "Undated", List.of(), null, null, null);

        assertThat(merger.merge(Stream.of(dated, undated))).containsExactly(undated, dated);
    }

    @Test
    @DisplayName("Should return an empty list for an empty stream")
    void shouldReturnEmptyListForEmptyStream() {
        assertThat(merger.merge(Stream.empty())).isEmpty();
    }

    private static FeedItem item(String id, String publishedAt) {
        return new FeedItem(id, id, List.of(), Instant.parse(publishedAt), null, null);
    }
}
