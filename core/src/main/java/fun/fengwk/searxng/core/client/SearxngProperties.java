package fun.fengwk.searxng.core.client;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SearXNG configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "searxng.client")
public class SearxngProperties {

    /**
     * SearXNG base url, the search path is appended to it.
     */
    private String baseUrl = "";

    /**
     * Request timeout in milliseconds.
     */
    private int timeoutMs = 10000;

    /**
     * Request method: GET/POST.
     */
    private String method = "POST";

    /**
     * User-Agent header sent with every request.
     */
    private String userAgent = "searxng-java-client/0.1";

    /**
     * Response format requested from the backend.
     */
    private String format = "json";

    /**
     * Attempts per page before an empty page is taken as exhaustion.
     */
    private int emptyRetryTimes = 3;

    /**
     * Transport retries per page attempt, negative means retry until interrupted.
     */
    private int maxTransportRetries = -1;

    /**
     * Pause between transport retries in milliseconds, 0 means retry immediately.
     */
    private long transportRetryBackoffMs = 0;

}
