package fun.fengwk.searxng.core.facade.impl;

import fun.fengwk.searxng.core.facade.SearchFacade;
import fun.fengwk.searxng.core.facade.SearchToolProperties;
import fun.fengwk.searxng.core.facade.model.SearchRequest;
import fun.fengwk.searxng.core.facade.model.SearchResultItem;
import fun.fengwk.searxng.core.facade.model.SearchSummary;
import fun.fengwk.searxng.core.search.SearchResponseDecodeException;
import fun.fengwk.searxng.core.search.SearchTransportException;
import fun.fengwk.searxng.core.search.SearxngSearch;
import fun.fengwk.searxng.core.search.codec.SearchParametersCodec;
import fun.fengwk.searxng.core.search.model.SearchParameters;
import fun.fengwk.searxng.core.search.model.SearchResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author fengwk
 */
@Slf4j
@Component
public class SearchFacadeImpl implements SearchFacade {

    private final SearxngSearch searxngSearch;
    private final SearchToolProperties properties;
    private final ExecutorService searchExecutor;

    @Autowired
    public SearchFacadeImpl(SearxngSearch searxngSearch, SearchToolProperties properties) {
        this(searxngSearch, properties, newSearchExecutor(properties));
    }

    SearchFacadeImpl(SearxngSearch searxngSearch, SearchToolProperties properties, ExecutorService searchExecutor) {
        this.searxngSearch = searxngSearch;
        this.properties = properties;
        this.searchExecutor = searchExecutor;
    }

    @Override
    public SearchSummary search(SearchRequest request) {
        // Validate request and normalize defaults.
        if (request == null || !StringUtils.hasText(request.getQuery())) {
            return SearchSummary.builder()
                .statusCode(400)
                .error("query is blank")
                .build();
        }

        String query = request.getQuery().trim();
        int limit = normalizeLimit(request.getLimit());
        SearchParameters parameters;
        try {
            parameters = buildParameters(query, request);
        } catch (IllegalArgumentException ex) {
            return SearchSummary.builder()
                .statusCode(400)
                .query(query)
                .error(ex.getMessage())
                .build();
        }
        return execute(query, parameters, limit);
    }

    @PreDestroy
    public void shutdown() {
        searchExecutor.shutdownNow();
    }

    private SearchSummary execute(String query, SearchParameters parameters, int limit) {
        SearchSummary.SearchSummaryBuilder builder = SearchSummary.builder().query(query);
        Future<List<SearchResult>> future;
        try {
            future = searchExecutor.submit(() -> searxngSearch.search(query)
                .withParameters(parameters)
                .sendGetNum(limit));
        } catch (RejectedExecutionException ex) {
            log.warn("search rejected, query={}", query);
            return builder.statusCode(503).error("search is busy").build();
        }

        try {
            List<SearchResult> results = future.get(properties.getDeadlineMs(), TimeUnit.MILLISECONDS);
            return builder.statusCode(200).results(toItems(results)).build();
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("search deadline exceeded, query={}, deadlineMs={}", query, properties.getDeadlineMs());
            return builder.statusCode(504)
                .error("search timed out after " + properties.getDeadlineMs() + " ms")
                .build();
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return builder.statusCode(500).error("search interrupted").build();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof SearchResponseDecodeException || cause instanceof SearchTransportException) {
                log.warn("search failed, query={}, error={}", query, cause.getMessage());
                return builder.statusCode(502).error(cause.getMessage()).build();
            }
            log.error("search failed unexpectedly, query={}", query, cause);
            return builder.statusCode(500).error(String.valueOf(cause.getMessage())).build();
        }
    }

    private int normalizeLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return properties.getDefaultLimit();
        }
        return Math.min(limit, properties.getMaxLimit());
    }

    private SearchParameters buildParameters(String query, SearchRequest request) {
        SearchParameters.SearchParametersBuilder builder = searxngSearch.search(query)
            .getParameters()
            .toBuilder()
            .categories(SearchParametersCodec.splitList(request.getCategories()))
            .engines(SearchParametersCodec.splitList(request.getEngines()));
        if (StringUtils.hasText(request.getLanguage())) {
            builder.languageTag(request.getLanguage());
        }
        return builder.build();
    }

    private static List<SearchResultItem> toItems(List<SearchResult> results) {
        List<SearchResultItem> items = new ArrayList<>(results.size());
        for (SearchResult result : results) {
            items.add(SearchResultItem.builder()
                .title(result.getTitle())
                .url(result.getUrl())
                .content(result.getContent())
                .engines(result.getEngines())
                .shape(result.getShape().name().toLowerCase(Locale.ROOT))
                .build());
        }
        return items;
    }

    private static ExecutorService newSearchExecutor(SearchToolProperties properties) {
        int concurrency = Math.max(properties.getConcurrency(), 1);
        AtomicInteger threadIdGen = new AtomicInteger(1);
        return new ThreadPoolExecutor(
            concurrency,
            concurrency,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(Math.max(properties.getQueueCapacity(), 1)),
            runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("searxng-search-" + threadIdGen.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            });
    }

}
