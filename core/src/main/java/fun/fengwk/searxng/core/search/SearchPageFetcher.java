package fun.fengwk.searxng.core.search;

import fun.fengwk.searxng.core.client.SearxngClient;
import fun.fengwk.searxng.core.client.SearxngClientResponse;
import fun.fengwk.searxng.core.search.codec.SearchParametersCodec;
import fun.fengwk.searxng.core.search.codec.SearchResponseDecoder;
import fun.fengwk.searxng.core.search.model.SearchParameters;
import fun.fengwk.searxng.core.search.model.SearchResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Fetches and decodes a single search page.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class SearchPageFetcher {

    private final SearxngClient searxngClient;
    private final SearchResponseDecoder searchResponseDecoder;

    /**
     * @throws SearchTransportException if the request failed or returned a non-2xx status
     * @throws SearchResponseDecodeException if the body does not match the response schema
     */
    public SearchResponse fetch(SearchParameters parameters) {
        SearxngClientResponse response = searxngClient.search(SearchParametersCodec.encode(parameters));
        if (response.hasError()) {
            Throwable error = response.getError();
            throw new SearchTransportException("searxng request failed: " + error, response.getStatusCode(), error);
        }
        if (!response.isSuccessful()) {
            throw new SearchTransportException(
                "searxng responded with status " + response.getStatusCode(), response.getStatusCode());
        }
        return searchResponseDecoder.decode(response.getBody());
    }

}
