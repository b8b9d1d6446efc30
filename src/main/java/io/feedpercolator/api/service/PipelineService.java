package io.feedpercolator.api.service;

import io.feedpercolator.api.dto.PipelineRunSummary;
import io.feedpercolator.api.exception.PipelineException;
import io.feedpercolator.api.filter.Filter;
import io.feedpercolator.api.filter.PatternFilter;
import io.feedpercolator.config.PercolatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Runs the configured pipeline. Configured pattern rules come first, then any {@link Filter} beans in their
 * {@code @Order}. Runs never overlap.
 */
@Service
public class PipelineService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineService.class);

    private final PipelineEvaluator pipelineEvaluator;
    private final EventPublisherService eventPublisher;
    private final PercolatorConfig config;
    private final List<Filter> filters;

    private volatile PipelineRunSummary lastRun;

    public PipelineService(PipelineEvaluator pipelineEvaluator,
                           EventPublisherService eventPublisher,
                           PercolatorConfig config,
                           ObjectProvider<Filter> filterBeans) {
        this.pipelineEvaluator = pipelineEvaluator;
        this.eventPublisher = eventPublisher;
        this.config = config;

        List<Filter> all = new ArrayList<>();
        config.filters().stream().map(PatternFilter::from).forEach(all::add);
        filterBeans.orderedStream().forEach(all::add);
        this.filters = Collections.unmodifiableList(all);

        logger.info("Pipeline configured with {} sources and {} filters", config.sourceCount(), filters.size());
    }

    public synchronized PipelineRunSummary run() {
        try {
            PipelineRunSummary summary = pipelineEvaluator.execute(filters, config.toSettings());
            lastRun = summary;
            eventPublisher.publishPipelineCompleted(summary);
            return summary;

        } catch (PipelineException e) {
            logger.error("Pipeline run failed: {} (category: {})", e.getMessage(), e.getCategory());
            throw e;
        }
    }

    public Optional<PipelineRunSummary> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    public List<Filter> getFilters() {
        return filters;
    }
}
