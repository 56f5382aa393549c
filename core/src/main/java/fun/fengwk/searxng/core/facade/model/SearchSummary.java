package fun.fengwk.searxng.core.facade.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Normalized search outcome.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearchSummary {

    /**
     * HTTP-like status: 200 ok, 400 bad request, 502 upstream failure, 503 busy, 504 deadline exceeded.
     */
    private int statusCode;

    /**
     * Query text after normalization.
     */
    private String query;

    /**
     * Collected result items.
     */
    private List<SearchResultItem> results;

    /**
     * Error message when the search fails.
     */
    private String error;

}
