package fun.fengwk.searxng.core.search;

import fun.fengwk.searxng.core.search.model.SearchParameters;
import fun.fengwk.searxng.core.search.model.SearchResponse;
import fun.fengwk.searxng.core.search.model.SearchResult;

import java.util.List;
import java.util.Objects;

/**
 * Immutable search request configuration, every {@code with} method returns a new builder.
 *
 * @author fengwk
 */
public final class SearchRequestBuilder {

    private final SearxngSearch searxngSearch;
    private final SearchParameters parameters;

    SearchRequestBuilder(SearxngSearch searxngSearch, SearchParameters parameters) {
        this.searxngSearch = Objects.requireNonNull(searxngSearch, "searxngSearch");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    public SearchParameters getParameters() {
        return parameters;
    }

    /**
     * Set the page number, the backend decides whether it is in range.
     */
    public SearchRequestBuilder withPage(int pageno) {
        return new SearchRequestBuilder(searxngSearch, parameters.withPageno(pageno));
    }

    /**
     * Replace the whole parameter set.
     */
    public SearchRequestBuilder withParameters(SearchParameters parameters) {
        return new SearchRequestBuilder(searxngSearch, parameters);
    }

    /**
     * Fetch a single page.
     */
    public SearchResponse send() {
        return searxngSearch.send(parameters);
    }

    /**
     * Fetch pages from the first one until {@code num} results are gathered or the backend is exhausted.
     *
     * @see PaginationRetryEngine#collect(SearchParameters, int)
     */
    public List<SearchResult> sendGetNum(int num) {
        return searxngSearch.sendGetNum(parameters, num);
    }

}
