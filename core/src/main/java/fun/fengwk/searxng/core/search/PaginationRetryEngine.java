package fun.fengwk.searxng.core.search;

import fun.fengwk.searxng.core.client.SearxngProperties;
import fun.fengwk.searxng.core.search.model.SearchParameters;
import fun.fengwk.searxng.core.search.model.SearchResponse;
import fun.fengwk.searxng.core.search.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects results across pages until enough have been gathered or the backend runs dry.
 *
 * <p>Pages are requested one at a time, in increasing order starting at 1. Each page is attempted up to
 * {@link SearxngProperties#getEmptyRetryTimes()} times while it comes back empty; a page that stays empty
 * ends the collection with whatever has been gathered. Transport failures are retried on the same page
 * without using up those attempts, bounded only by {@link SearxngProperties#getMaxTransportRetries()}
 * and the interrupt status of the calling thread. Decode failures are never retried.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaginationRetryEngine {

    private final SearchPageFetcher searchPageFetcher;
    private final SearxngProperties properties;

    /**
     * Collect at most {@code num} results for the parameters, ignoring their page number.
     *
     * @return page results in request order, shorter than {@code num} only when the backend is exhausted
     * @throws SearchResponseDecodeException if a page does not match the response schema
     * @throws SearchTransportException if transport retries are capped and used up, or the thread is interrupted
     */
    public List<SearchResult> collect(SearchParameters parameters, int num) {
        List<SearchResult> collected = new ArrayList<>();
        int pageno = 1;
        while (collected.size() < num) {
            List<SearchResult> page = fetchNonEmptyPage(parameters.withPageno(pageno));
            if (page.isEmpty()) {
                log.info("searxng exhausted, query={}, pageno={}, collected={}/{}",
                    parameters.getQ(), pageno, collected.size(), num);
                break;
            }
            collected.addAll(page);
            pageno++;
        }
        return List.copyOf(collected.subList(0, Math.min(Math.max(num, 0), collected.size())));
    }

    private List<SearchResult> fetchNonEmptyPage(SearchParameters parameters) {
        int attempts = Math.max(properties.getEmptyRetryTimes(), 1);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            SearchResponse response = fetchWithTransportRetry(parameters);
            if (!response.getResults().isEmpty()) {
                return response.getResults();
            }
            log.debug("searxng empty page, pageno={}, attempt={}/{}", parameters.getPageno(), attempt, attempts);
        }
        return List.of();
    }

    private SearchResponse fetchWithTransportRetry(SearchParameters parameters) {
        int failures = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SearchTransportException("search interrupted at pageno " + parameters.getPageno(), 0);
            }
            try {
                return searchPageFetcher.fetch(parameters);
            } catch (SearchTransportException ex) {
                failures++;
                int maxRetries = properties.getMaxTransportRetries();
                if (maxRetries >= 0 && failures > maxRetries) {
                    log.warn("searxng transport retries used up, pageno={}, failures={}",
                        parameters.getPageno(), failures);
                    throw ex;
                }
                log.warn("searxng transport failure, retrying, pageno={}, failures={}, error={}",
                    parameters.getPageno(), failures, ex.getMessage());
                backoff(parameters);
            }
        }
    }

    private void backoff(SearchParameters parameters) {
        long backoffMs = properties.getTransportRetryBackoffMs();
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SearchTransportException("search interrupted at pageno " + parameters.getPageno(), 0, ex);
        }
    }

}
