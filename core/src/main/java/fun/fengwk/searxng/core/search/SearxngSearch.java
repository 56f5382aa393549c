package fun.fengwk.searxng.core.search;

import fun.fengwk.searxng.core.client.SearxngProperties;
import fun.fengwk.searxng.core.search.model.ResponseFormat;
import fun.fengwk.searxng.core.search.model.SearchParameters;
import fun.fengwk.searxng.core.search.model.SearchResponse;
import fun.fengwk.searxng.core.search.model.SearchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entry point for searches against the configured SearXNG instance.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class SearxngSearch {

    private final SearxngProperties properties;
    private final SearchPageFetcher searchPageFetcher;
    private final PaginationRetryEngine paginationRetryEngine;

    /**
     * Start a search for the query with every optional parameter unset.
     */
    public SearchRequestBuilder search(String query) {
        ResponseFormat format = ResponseFormat.fromValue(properties.getFormat());
        return new SearchRequestBuilder(this, SearchParameters.of(query, format));
    }

    SearchResponse send(SearchParameters parameters) {
        return searchPageFetcher.fetch(parameters);
    }

    List<SearchResult> sendGetNum(SearchParameters parameters, int num) {
        return paginationRetryEngine.collect(parameters, num);
    }

}
