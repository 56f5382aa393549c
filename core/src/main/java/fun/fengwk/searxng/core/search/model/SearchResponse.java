package fun.fengwk.searxng.core.search.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Decoded response of one search page.
 *
 * @author fengwk
 */
@Value
@Builder
public class SearchResponse {

    /**
     * Query echoed by the backend.
     */
    String query;

    /**
     * Estimated total across all engines, independent of {@code results.size()}.
     */
    long numberOfResults;

    @Singular("result")
    List<SearchResult> results;

    /**
     * Instant answer groups.
     */
    @Singular("answer")
    List<List<Answer>> answers;

    @Singular("correction")
    List<String> corrections;

    @Singular("infobox")
    List<Infobox> infoboxes;

    @Singular("suggestion")
    List<String> suggestions;

    @Singular("unresponsiveEngine")
    List<EngineError> unresponsiveEngines;

}
