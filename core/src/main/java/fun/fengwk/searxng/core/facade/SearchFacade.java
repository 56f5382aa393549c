package fun.fengwk.searxng.core.facade;

import fun.fengwk.searxng.core.facade.model.SearchRequest;
import fun.fengwk.searxng.core.facade.model.SearchSummary;

/**
 * @author fengwk
 */
public interface SearchFacade {

    /**
     * Execute a paginated search under the configured deadline.
     */
    SearchSummary search(SearchRequest request);

}
