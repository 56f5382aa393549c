package fun.fengwk.searxng.core.mcp;

import fun.fengwk.searxng.core.facade.SearchFacade;
import fun.fengwk.searxng.core.facade.SearchToolProperties;
import fun.fengwk.searxng.core.facade.model.SearchRequest;
import fun.fengwk.searxng.core.facade.model.SearchSummary;
import fun.fengwk.searxng.core.utils.PlainTextToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class SearchMcp {

    private final SearchFacade searchFacade;
    private final McpFormatter mcpFormatter;
    private final SearchToolProperties properties;

    @Tool(name = "search",
        description = """
            Search the web through a SearXNG metasearch instance, collecting results across pages.
            Return format: numbered result list with title, url, engines and content excerpt; \
            or 'No results.'; or an error message.""",
        resultConverter = PlainTextToolCallResultConverter.class)
    public String search(
        @ToolParam(description = """
            Query syntax:
            - Basics: plain keywords, e.g. rust async.
            - Advanced: site:domain, e.g. site:github.com rust async.
            - Advanced: "phrase", e.g. "zero cost abstractions".""") String query,
        @ToolParam(description = "number of results to collect, default 10", required = false) Integer limit,
        @ToolParam(description = "comma-separated categories, e.g. general,news", required = false)
        String categories,
        @ToolParam(description = "comma-separated engines, e.g. duckduckgo,wikipedia", required = false)
        String engines,
        @ToolParam(description = "BCP-47 language tag, e.g. en or zh-CN", required = false) String language
    ) {
        SearchRequest request = new SearchRequest();
        request.setQuery(query);
        request.setLimit(limit);
        request.setCategories(categories);
        request.setEngines(engines);
        request.setLanguage(language);

        SearchSummary summary = searchFacade.search(request);
        return mcpFormatter.format(properties.getResultTemplate(), summary);
    }

}
