package io.feedpercolator.api.service;

import io.feedpercolator.api.dto.FeedItem;
import io.feedpercolator.api.dto.FeedLink;
import io.feedpercolator.api.exception.ErrorCategory;
import io.feedpercolator.api.exception.SourceFetchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedParserTest {

    private static final URI SOURCE = URI.create("https://feeds.example.com/feed.xml");

    private final FeedParser parser = new FeedParser();

    @Test
    @DisplayName("Should parse RSS 2.0 items in document order")
    void shouldParseRss20ItemsInDocumentOrder() throws IOException {
        List<FeedItem> items = parseFixture("rss20.xml");

        assertThat(items).extracting(FeedItem::id).containsExactly("world-1", "world-2");

        FeedItem first = items.get(0);
        assertThat(first.title()).isEqualTo("Summit opens in Geneva");
        assertThat(first.alternateLink()).contains(URI.create("https://world.example.com/news/summit"));
        assertThat(first.publishedAt()).isEqualTo(Instant.parse("2026-10-19T08:00:00Z"));
        assertThat(first.content()).isEqualTo("<p>Leaders arrive.</p>");
        assertThat(first.source()).isEqualTo(SOURCE);
    }

    @Test
    @DisplayName("Should parse Atom entries with their links and dates")
    void shouldParseAtomEntriesWithTheirLinksAndDates() throws IOException {
        List<FeedItem> items = parseFixture("atom10.xml");

        assertThat(items).extracting(FeedItem::id).containsExactly("urn:tech:1", "urn:tech:2");

        FeedItem compiler = items.get(0);
        assertThat(compiler.alternateLink()).contains(URI.create("https://tech.example.com/compiler"));
        assertThat(compiler.links()).extracting(FeedLink::rel).contains("alternate", "related");
        assertThat(compiler.publishedAt()).isEqualTo(Instant.parse("2026-10-19T06:30:00Z"));
        assertThat(compiler.content()).isEqualTo("<b>Faster builds</b>");

        FeedItem updatedOnly = items.get(1);
        assertThat(updatedOnly.publishedAt()).isEqualTo(Instant.parse("2026-10-19T05:00:00Z"));
        assertThat(updatedOnly.content()).isEqualTo("Summary text");
    }

    @Test
    @DisplayName("Should read legacy RSS 1.0 documents")
    void shouldReadLegacyRss10Documents() throws IOException {
        List<FeedItem> items = parseFixture("rss10.xml");

        assertThat(items).hasSize(1);
        FeedItem story = items.get(0);
        assertThat(story.title()).isEqualTo("Legacy story");
        assertThat(story.alternateLink()).contains(URI.create("https://legacy.example.com/story/1"));
        assertThat(story.publishedAt()).isEqualTo(Instant.parse("2026-10-18T12:00:00Z"));
    }

    @Test
    @DisplayName("Should derive distinct ids for entries that carry none")
    void shouldDeriveDistinctIdsForEntriesThatCarryNone() throws IOException {
        List<FeedItem> items = parseFixture("no-guid.xml");

        assertThat(items).hasSize(3);
        assertThat(items).extracting(FeedItem::id)
                .allMatch(id -> id.startsWith(FeedParser.DERIVED_ID_PREFIX))
                .doesNotHaveDuplicates();
        assertThat(items.get(2).hasTitle()).isFalse();
        assertThat(items.get(2).title()).isNull();
    }

    @Test
    @DisplayName("Should keep description-only items apart")
    void shouldKeepDescriptionOnlyItemsApart() {
        String bare = """
                <?xml version="1.0"?>
                <rss version="2.0"><channel><title>Bare</title><link>https://bare.example.com/</link>
                <description>Bare</description>
                <item><description>Earthquake in A</description></item>
                <item><description>Flood in B</description></item>
                <item><description></description></item>
                <item><description></description></item>
                </channel></rss>
                """;

        List<FeedItem> items = parse(bare);

        assertThat(items).extracting(FeedItem::id).doesNotHaveDuplicates();
        assertThat(new ItemDeduplicator().deduplicate(items.stream()).toList()).hasSize(4);
    }

    @Test
    @DisplayName("Should not fetch the DTD declared by legacy RSS 0.91 documents")
    void shouldNotFetchDtdDeclaredByLegacyRss091Documents() {
        String legacy = """
                <?xml version="1.0"?>
                <!DOCTYPE rss PUBLIC "-//Netscape Communications//DTD RSS 0.91//EN"
                    "http://localhost:1/dtd/rss-0.91.dtd">
                <rss version="0.91"><channel><title>Legacy</title><link>https://old.example.com/</link>
                <description>Old</description><language>en-us</language>
                <item><title>Old news</title><link>https://old.example.com/1</link></item>
                </channel></rss>
                """;

        List<FeedItem> items = parse(legacy);

        assertThat(items).extracting(FeedItem::title).containsExactly("Old news");
    }

    @Test
    @DisplayName("Should fail with a parse error on malformed XML")
    void shouldFailWithParseErrorOnMalformedXml() {
        assertThatThrownBy(() -> parseFixture("malformed.xml"))
                .isInstanceOf(SourceFetchException.class)
                .satisfies(e -> {
                    SourceFetchException error = (SourceFetchException) e;
                    assertThat(error.getCategory()).isEqualTo(ErrorCategory.PARSE_ERROR);
                    assertThat(error.getSource()).isEqualTo(SOURCE);
                });
    }

    @Test
    @DisplayName("Should fail with a parse error on documents that are not feeds")
    void shouldFailWithParseErrorOnDocumentsThatAreNotFeeds() {
        assertThatThrownBy(() -> parseFixture("not-a-feed.xml"))
                .isInstanceOf(SourceFetchException.class)
                .extracting(e -> ((SourceFetchException) e).getCategory())
                .isEqualTo(ErrorCategory.PARSE_ERROR);
    }

    @Test
    @DisplayName("Should return no items for a feed without entries")
    void shouldReturnNoItemsForFeedWithoutEntries() {
        String empty = """
                <?xml version="1.0"?>
                <rss version="2.0"><channel><title>Empty</title><link>https://e.example.com</link>
                <description>none</description></channel></rss>
                """;

        List<FeedItem> items = parser.parse(SOURCE,
                new ByteArrayInputStream(empty.getBytes(StandardCharsets.UTF_8)));

        assertThat(items).isEmpty();
    }

    private List<FeedItem> parse(String document) {
        return parser.parse(SOURCE, new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8)));
    }

    private List<FeedItem> parseFixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/feeds/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return parser.parse(SOURCE, in);
        }
    }
}
