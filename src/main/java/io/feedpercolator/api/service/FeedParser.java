package io.feedpercolator.api.service;

import com.rometools.rome.feed.WireFeed;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndFeedImpl;
import com.rometools.rome.feed.synd.SyndLink;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import com.rometools.rome.io.impl.RSS10Parser;
import io.feedpercolator.api.dto.FeedItem;
import io.feedpercolator.api.dto.FeedLink;
import io.feedpercolator.api.exception.ErrorCategory;
import io.feedpercolator.api.exception.SourceFetchException;
import org.apache.commons.codec.digest.DigestUtils;
import org.jdom2.Document;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Turns one syndication document into items. RSS 1.0 is tried first, anything else goes through ROME's
 * auto-detection (RSS 0.9x/2.0, Atom).
 */
@Service
public class FeedParser {

    private static final Logger logger = LoggerFactory.getLogger(FeedParser.class);

    static final String DERIVED_ID_PREFIX = "urn:md5:";

    public List<FeedItem> parse(URI source, InputStream body) {
        SyndFeed feed = readFeed(source, body);

        if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.warn("Feed {} has no entries", source);
            return Collections.emptyList();
        }

        List<SyndEntry> entries = feed.getEntries();
        return IntStream.range(0, entries.size())
                .mapToObj(position -> convertToItem(source, entries.get(position), position))
                .toList();
    }

    private SyndFeed readFeed(URI source, InputStream body) {
        try {
            Document document = newSaxBuilder().build(new XmlReader(body));

            RSS10Parser rss10 = new RSS10Parser();
            if (rss10.isMyType(document)) {
                logger.debug("Reading {} as RSS 1.0", source);
                WireFeed wireFeed = rss10.parse(document, false, Locale.US);
                return new SyndFeedImpl(wireFeed);
            }

            return new SyndFeedInput().build(document);

        } catch (JDOMException e) {
            throw new SourceFetchException(source, "Malformed XML from " + source + ": " + e.getMessage(),
                    e, ErrorCategory.PARSE_ERROR);
        } catch (FeedException | IllegalArgumentException e) {
            throw new SourceFetchException(source, "Unsupported feed format from " + source + ": " + e.getMessage(),
                    e, ErrorCategory.PARSE_ERROR);
        } catch (IOException e) {
            throw new SourceFetchException(source, "I/O error reading " + source + ": " + e.getMessage(),
                    e, ErrorCategory.IO_ERROR);
        }
    }

    private static SAXBuilder newSaxBuilder() {
        SAXBuilder builder = new SAXBuilder();
        builder.setExpandEntities(false);
        builder.setFeature("http://xml.org/sax/features/external-general-entities", false);
        builder.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        builder.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        return builder;
    }

    FeedItem convertToItem(URI source, SyndEntry entry, int position) {
        String title = entry.getTitle() != null && !entry.getTitle().isBlank() ? entry.getTitle().trim() : null;
        List<FeedLink> links = collectLinks(source, entry);

        String content = content(entry);

        String id = entry.getUri() != null && !entry.getUri().isBlank()
                ? entry.getUri().trim()
                : deriveId(source, links, title, content, position);

        return new FeedItem(
                id,
                title,
                links,
                publishedAt(entry),
                content,
                source
        );
    }

    private List<FeedLink> collectLinks(URI source, SyndEntry entry) {
        List<FeedLink> links = new ArrayList<>();

        if (entry.getLinks() != null) {
            for (SyndLink link : entry.getLinks()) {
                URI href = toUri(source, link.getHref());
                if (href != null) {
                    links.add(new FeedLink(link.getRel(), href));
                }
            }
        }

        // RSS <link> is only exposed through getLink()
        boolean hasAlternate = links.stream().anyMatch(FeedLink::isAlternate);
        if (!hasAlternate && entry.getLink() != null) {
            URI href = toUri(source, entry.getLink());
            if (href != null) {
                links.add(FeedLink.alternate(href));
            }
        }

        return links;
    }

    private static URI toUri(URI source, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        try {
            return URI.create(href.trim());
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping invalid link '{}' in {}: {}", href, source, e.getMessage());
            return null;
        }
    }

    private static Instant publishedAt(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : null;
    }

    private static String content(SyndEntry entry) {
        if (entry.getContents() != null) {
            for (SyndContent content : entry.getContents()) {
                if (content != null && content.getValue() != null) {
                    return content.getValue();
                }
            }
        }
        return entry.getDescription() != null ? entry.getDescription().getValue() : null;
    }

    /**
     * Id for entries that carry none. Built from the source, alternate link, title and content; the position in
     * the feed is only folded in when the entry has none of those, so that bare entries stay apart.
     */
    private static String deriveId(URI source, List<FeedLink> links, String title, String content, int position) {
        String link = links.stream()
                .filter(FeedLink::isAlternate)
                .map(l -> l.href().toString())
                .findFirst()
                .orElse("");

        String key = String.join("\n",
                Objects.toString(source, ""), link, Objects.toString(title, ""), Objects.toString(content, ""));
        if (link.isEmpty() && title == null && (content == null || content.isBlank())) {
            key = key + "\n#" + position;
        }

        return DERIVED_ID_PREFIX + DigestUtils.md5Hex(key);
    }
}
