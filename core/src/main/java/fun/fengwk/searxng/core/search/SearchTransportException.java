package fun.fengwk.searxng.core.search;

import lombok.Getter;

/**
 * Exception thrown when a page could not be fetched: connection error, unreadable body or non-2xx status.
 *
 * @author fengwk
 */
@Getter
public class SearchTransportException extends SearchException {

    /**
     * HTTP status, 0 when no response was received.
     */
    private final int statusCode;

    public SearchTransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SearchTransportException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

}
