package io.feedpercolator.api.service;

import io.feedpercolator.api.dto.FeedItem;
import io.feedpercolator.api.exception.ErrorCategory;
import io.feedpercolator.api.exception.SourceFetchException;
import io.feedpercolator.config.PercolatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.SocketException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * Retrieves all sources at once over a shared client and fails as soon as any one of them fails.
 */
@Service
public class FeedFetcher {

    private static final Logger logger = LoggerFactory.getLogger(FeedFetcher.class);

    private static final String ACCEPT = "application/rss+xml, application/atom+xml, application/rdf+xml, "
            + "application/xml, text/xml, */*";

    private final HttpClient httpClient;
    private final FeedParser feedParser;
    private final String userAgent;

    public FeedFetcher(HttpClient httpClient, FeedParser feedParser, PercolatorConfig config) {
        this.httpClient = httpClient;
        this.feedParser = feedParser;
        this.userAgent = config.http().userAgent();
    }

    /**
     * Fetches every source in parallel and blocks until all are done.
     *
     * @return items of all feeds, feeds in the given order
     * @throws SourceFetchException for the first source that fails; results of the others are discarded
     */
    public Stream<FeedItem> fetchAll(List<URI> sources) {
        List<CompletableFuture<List<FeedItem>>> tasks = sources.stream()
                .map(this::fetch)
                .toList();

        List<List<FeedItem>> feeds = joinFailFast(tasks);

        return feeds.stream().flatMap(List::stream);
    }

    CompletableFuture<List<FeedItem>> fetch(URI source) {
        logger.debug("Fetching feed from: {}", source);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(source)
                    .header("User-Agent", userAgent)
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new SourceFetchException(source, "Invalid source URL: " + source, e, ErrorCategory.INVALID_URL));
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream())
                .handle((response, error) -> {
                    if (error != null) {
                        throw categorize(source, unwrap(error));
                    }
                    return parseResponse(source, response);
                });
    }

    private List<FeedItem> parseResponse(URI source, HttpResponse<InputStream> response) {
        try (InputStream raw = response.body()) {
            validateHttpResponse(source, response.statusCode());

            InputStream body = isGzip(response) ? new GZIPInputStream(raw) : raw;
            List<FeedItem> items = feedParser.parse(source, body);

            logger.debug("Fetched {} items from {}", items.size(), source);
            return items;

        } catch (IOException e) {
            throw new SourceFetchException(source, "I/O error reading: " + source, e, ErrorCategory.IO_ERROR);
        }
    }

    private static boolean isGzip(HttpResponse<?> response) {
        return response.headers()
                .firstValue("Content-Encoding")
                .map("gzip"::equalsIgnoreCase)
                .orElse(false);
    }

    private static void validateHttpResponse(URI source, int statusCode) {
        switch (statusCode) {
            case HttpURLConnection.HTTP_NOT_FOUND:
                throw new SourceFetchException(source, "Feed not found (404): " + source, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new SourceFetchException(source, "Access forbidden (403): " + source,
                        ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw new SourceFetchException(source, "Authentication required (401): " + source,
                        ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw new SourceFetchException(source, "Rate limited (429): " + source, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw new SourceFetchException(source, "Server error (500): " + source, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw new SourceFetchException(source,
                        "Server temporarily unavailable (" + statusCode + "): " + source,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                if (statusCode >= 400) {
                    throw new SourceFetchException(source,
                            String.format("HTTP error %d: %s", statusCode, source), ErrorCategory.HTTP_ERROR);
                }
        }
    }

    private static SourceFetchException categorize(URI source, Throwable error) {
        if (error instanceof SourceFetchException sourceError) {
            return sourceError;
        }
        if (error instanceof HttpTimeoutException) {
            return new SourceFetchException(source, "Connection timeout for: " + source, error, ErrorCategory.TIMEOUT);
        }
        if (error instanceof ConnectException) {
            return new SourceFetchException(source, "Connection refused: " + source, error,
                    ErrorCategory.CONNECTION_REFUSED);
        }
        if (error instanceof UnknownHostException) {
            return new SourceFetchException(source, "Unknown host: " + source, error, ErrorCategory.DNS_ERROR);
        }
        if (error instanceof SocketException) {
            return new SourceFetchException(source, "Network error: " + source, error, ErrorCategory.NETWORK_ERROR);
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return new SourceFetchException(source, "I/O error reading: " + source, error, ErrorCategory.IO_ERROR);
        }
        return new SourceFetchException(source, "Unexpected error: " + source, error, ErrorCategory.UNKNOWN);
    }

    /**
     * Waits for all tasks, but completes exceptionally with the first failure instead of waiting for the rest.
     */
    private static <T> List<T> joinFailFast(List<CompletableFuture<T>> tasks) {
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        for (CompletableFuture<T> task : tasks) {
            task.whenComplete((result, error) -> {
                if (error != null) {
                    firstFailure.completeExceptionally(unwrap(error));
                }
            });
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new));

        try {
            CompletableFuture.anyOf(all, firstFailure).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException(null, "Interrupted while fetching feeds", e, ErrorCategory.UNKNOWN);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            if (cause instanceof SourceFetchException sourceError) {
                throw sourceError;
            }
            throw new SourceFetchException(null, "Feed fetch failed: " + cause.getMessage(), cause,
                    ErrorCategory.UNKNOWN);
        }

        return tasks.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
