package io.feedpercolator.api.service;

import io.feedpercolator.api.dto.FeedItem;
import io.feedpercolator.api.dto.PipelineRunSummary;
import io.feedpercolator.api.dto.PipelineSettings;
import io.feedpercolator.api.filter.Filter;
import io.feedpercolator.api.filter.FilterChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * One full run: fetch, filter, deduplicate, sort by publish time and write. Nothing is kept between runs.
 */
@Service
public class PipelineEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineEvaluator.class);

    private final FeedFetcher feedFetcher;
    private final FeedMerger feedMerger;
    private final FeedWriter feedWriter;
    private final Clock clock;

    public PipelineEvaluator(FeedFetcher feedFetcher, FeedMerger feedMerger, FeedWriter feedWriter, Clock clock) {
        this.feedFetcher = feedFetcher;
        this.feedMerger = feedMerger;
        this.feedWriter = feedWriter;
        this.clock = clock;
    }

    /**
     * @param filters  applied in list order; null or empty keeps every item
     * @param settings sources, target and feed metadata
     * @throws io.feedpercolator.api.exception.PipelineException if any stage fails; nothing is written then
     */
    public PipelineRunSummary execute(List<? extends Filter> filters, PipelineSettings settings) {
        Instant startedAt = clock.instant();
        int sources = settings.hasInputs() ? settings.inputs().size() : 0;

        logger.info("Starting pipeline run for {} sources", sources);

        List<FeedItem> fetched = settings.hasInputs()
                ? feedFetcher.fetchAll(settings.inputs()).toList()
                : List.of();

        FilterChain filterChain = new FilterChain(filters);
        Stream<FeedItem> filtered = fetched.stream().filter(filterChain::includes);
        Stream<FeedItem> deduplicated = new ItemDeduplicator().deduplicate(filtered);
        List<FeedItem> merged = feedMerger.merge(deduplicated);

        boolean written = false;
        if (settings.hasOutput()) {
            feedWriter.write(merged, settings.title(), settings.description(), settings.output());
            written = true;
        }

        long duration = clock.millis() - startedAt.toEpochMilli();

        logger.info("Pipeline run completed: {} fetched, {} kept after {} filters and deduplication in {}ms",
                fetched.size(), merged.size(), filterChain.size(), duration);

        return new PipelineRunSummary(sources, fetched.size(), merged.size(), written, startedAt, duration);
    }
}
