package fun.fengwk.searxng.core.facade;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Search tool specific configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "searxng.tool")
public class SearchToolProperties {

    /**
     * Number of results when the request gives no limit.
     */
    private int defaultLimit = 10;

    /**
     * Upper bound of the requested limit.
     */
    private int maxLimit = 50;

    /**
     * Deadline of one paginated search in milliseconds.
     */
    private long deadlineMs = 30000;

    /**
     * Searches running at the same time.
     */
    private int concurrency = 4;

    /**
     * Searches waiting for a free slot before new ones are rejected.
     */
    private int queueCapacity = 16;

    /**
     * Classpath directory holding the result templates.
     */
    private String templatePath = "/mcp/templates/";

    /**
     * Template rendering a search summary as tool output.
     */
    private String resultTemplate = "searxng_search_result.ftl";

}
