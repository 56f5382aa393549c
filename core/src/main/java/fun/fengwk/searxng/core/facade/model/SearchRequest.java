package fun.fengwk.searxng.core.facade.model;

import lombok.Data;

/**
 * Search request input.
 *
 * @author fengwk
 */
@Data
public class SearchRequest {

    /**
     * Search keywords with optional engine operators.
     */
    private String query;

    /**
     * Number of results to collect across pages (default 10).
     */
    private Integer limit;

    /**
     * Comma-separated categories, e.g. general,news.
     */
    private String categories;

    /**
     * Comma-separated engines, e.g. duckduckgo,wikipedia.
     */
    private String engines;

    /**
     * BCP-47 language tag, e.g. en or zh-CN.
     */
    private String language;

}
