package fun.fengwk.searxng.core.search;

/**
 * Base exception of a failed search call.
 *
 * @author fengwk
 */
public class SearchException extends RuntimeException {

    public SearchException(String message) {
        super(message);
    }

    public SearchException(String message, Throwable cause) {
        super(message, cause);
    }

}
