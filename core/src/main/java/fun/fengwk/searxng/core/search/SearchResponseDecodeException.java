package fun.fengwk.searxng.core.search;

import lombok.Getter;

import java.util.Set;

/**
 * Exception thrown when a response body does not match any known schema.
 *
 * @author fengwk
 */
@Getter
public class SearchResponseDecodeException extends SearchException {

    /**
     * Index of the offending element in {@code results}, -1 for top-level failures.
     */
    private final int resultIndex;

    /**
     * Fields of the offending element that belong to no known result shape.
     */
    private final Set<String> unmatchedFields;

    public SearchResponseDecodeException(String message) {
        this(message, -1, Set.of(), null);
    }

    public SearchResponseDecodeException(String message, Throwable cause) {
        this(message, -1, Set.of(), cause);
    }

    public SearchResponseDecodeException(String message, int resultIndex, Set<String> unmatchedFields,
                                         Throwable cause) {
        super(message, cause);
        this.resultIndex = resultIndex;
        this.unmatchedFields = unmatchedFields;
    }

}
