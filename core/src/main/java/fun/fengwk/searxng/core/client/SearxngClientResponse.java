package fun.fengwk.searxng.core.client;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Raw response from SearXNG.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearxngClientResponse {

    private int statusCode;
    private Map<String, List<String>> headers;
    private String body;
    private Throwable error;

    public boolean hasError() {
        return error != null;
    }

    public boolean isSuccessful() {
        return !hasError() && statusCode >= 200 && statusCode < 300;
    }

}
