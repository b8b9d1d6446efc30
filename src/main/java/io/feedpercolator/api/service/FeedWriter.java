package io.feedpercolator.api.service;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndContentImpl;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndEntryImpl;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndFeedImpl;
import com.rometools.rome.feed.synd.SyndLink;
import com.rometools.rome.feed.synd.SyndLinkImpl;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedOutput;
import io.feedpercolator.api.dto.FeedItem;
import io.feedpercolator.api.dto.FeedLink;
import io.feedpercolator.api.exception.OutputWriteException;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Serializes the merged items as an Atom 1.0 document.
 */
@Service
public class FeedWriter {

    private static final Logger logger = LoggerFactory.getLogger(FeedWriter.class);

    static final String FEED_TYPE = "atom_1.0";

    private final Clock clock;

    public FeedWriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Writes to a temporary file next to {@code target} and moves it into place, so the target is either
     * replaced completely or left untouched.
     */
    public void write(List<FeedItem> items, String title, String description, Path target) {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;

        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");

            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                write(items, title, description, writer);
            }
            move(temp, absolute);

            logger.info("Wrote {} items to {}", items.size(), absolute);

        } catch (IOException e) {
            throw new OutputWriteException("Failed to write feed to " + absolute + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    public void write(List<FeedItem> items, String title, String description, Writer writer) {
        SyndFeed feed = toFeed(items, title, description);

        try {
            new SyndFeedOutput().output(feed, writer);
        } catch (FeedException | IOException e) {
            throw new OutputWriteException("Failed to serialize feed '" + title + "': " + e.getMessage(), e);
        }
    }

    SyndFeed toFeed(List<FeedItem> items, String title, String description) {
        SyndFeed feed = new SyndFeedImpl();
        feed.setFeedType(FEED_TYPE);
        feed.setUri("urn:md5:" + DigestUtils.md5Hex(Objects.toString(title, "")));
        feed.setTitleEx(plainText(Objects.toString(title, "")));
        if (description != null) {
            feed.setDescriptionEx(plainText(description));
        }
        // Atom <updated>
        feed.setPublishedDate(Date.from(clock.instant()));
        feed.setEntries(items.stream().map(FeedWriter::toEntry).toList());
        return feed;
    }

    private static SyndEntry toEntry(FeedItem item) {
        SyndEntry entry = new SyndEntryImpl();
        entry.setUri(item.id());

        if (item.title() != null) {
            entry.setTitleEx(plainText(item.title()));
        }

        List<SyndLink> links = item.links().stream()
                .map(FeedWriter::toLink)
                .toList();
        entry.setLinks(links);
        item.alternateLink().ifPresent(href -> entry.setLink(href.toString()));

        if (item.publishedAt() != null) {
            Date published = Date.from(item.publishedAt());
            entry.setPublishedDate(published);
            entry.setUpdatedDate(published);
        }

        if (item.content() != null) {
            SyndContent content = new SyndContentImpl();
            content.setType("html");
            content.setValue(item.content());
            entry.setContents(List.of(content));
        }

        return entry;
    }

    private static SyndLink toLink(FeedLink link) {
        SyndLink syndLink = new SyndLinkImpl();
        syndLink.setRel(link.rel());
        syndLink.setHref(link.href().toString());
        return syndLink;
    }

    private static SyndContent plainText(String value) {
        SyndContent content = new SyndContentImpl();
        content.setType("text");
        content.setValue(value);
        return content;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
