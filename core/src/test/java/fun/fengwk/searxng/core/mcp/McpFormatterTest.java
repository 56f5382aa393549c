package fun.fengwk.searxng.core.mcp;

import fun.fengwk.searxng.core.configuration.FreeMarkerConfiguration;
import fun.fengwk.searxng.core.facade.SearchToolProperties;
import fun.fengwk.searxng.core.facade.model.SearchResultItem;
import fun.fengwk.searxng.core.facade.model.SearchSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class McpFormatterTest {

    private McpFormatter mcpFormatter;

    @BeforeEach
    void setUp() {
        mcpFormatter = newFormatter(new SearchToolProperties());
    }

    @Test
    public void testFormatResults() {
        SearchSummary summary = SearchSummary.builder()
            .statusCode(200)
            .query("rust")
            .results(List.of(
                SearchResultItem.builder()
                    .title("The Rust Programming Language")
                    .url("https://www.rust-lang.org/")
                    .content("A language empowering everyone.")
                    .engines(List.of("duckduckgo", "wikipedia"))
                    .shape("main")
                    .build(),
                SearchResultItem.builder()
                    .title("rust-lang/rust")
                    .url("https://github.com/rust-lang/rust")
                    .content("")
                    .engines(List.of())
                    .shape("legacy")
                    .build()))
            .build();

        String text = mcpFormatter.format("searxng_search_result.ftl", summary);

        assertThat(text)
            .contains("1. The Rust Programming Language")
            .contains("URL: https://www.rust-lang.org/")
            .contains("Engines: duckduckgo, wikipedia")
            .contains("A language empowering everyone.")
            .contains("2. rust-lang/rust")
            .contains("URL: https://github.com/rust-lang/rust");
        assertThat(text).doesNotContain("No results.");
    }

    @Test
    public void testFormatEmpty() {
        SearchSummary summary = SearchSummary.builder()
            .statusCode(200)
            .query("rust")
            .results(List.of())
            .build();

        assertThat(mcpFormatter.format("searxng_search_result.ftl", summary)).contains("No results.");
    }

    @Test
    public void testFormatError() {
        SearchSummary summary = SearchSummary.builder()
            .statusCode(504)
            .query("rust")
            .error("search timed out after 30000 ms")
            .build();

        assertThat(mcpFormatter.format("searxng_search_result.ftl", summary))
            .contains("Error: search timed out after 30000 ms");
    }

    @Test
    public void testFormatMissingTemplate() {
        SearchSummary summary = SearchSummary.builder().statusCode(200).build();

        assertThat(mcpFormatter.format("missing.ftl", summary))
            .isEqualTo("format error: template not found: missing.ftl");
    }

    @Test
    public void testFormatNullModel() {
        assertThat(mcpFormatter.format("searxng_search_result.ftl", null)).isEqualTo("empty response");
    }

    @Test
    public void testFormatFromConfiguredTemplatePath() {
        SearchToolProperties properties = new SearchToolProperties();
        properties.setTemplatePath("/custom-templates/");
        SearchSummary summary = SearchSummary.builder()
            .statusCode(200)
            .query("rust")
            .results(List.of())
            .build();

        String text = newFormatter(properties).format(properties.getResultTemplate(), summary);

        assertThat(text.trim()).isEqualTo("custom rust 200 0");
    }

    @Test
    public void testFormatTemplateErrorIsReported() {
        SearchToolProperties properties = new SearchToolProperties();
        properties.setTemplatePath("/custom-templates/");

        String text = newFormatter(properties).format("broken.ftl", SearchSummary.builder().statusCode(200).build());

        assertThat(text).startsWith("format error:").contains("missingField");
    }

    private static McpFormatter newFormatter(SearchToolProperties properties) {
        return new McpFormatter(new FreeMarkerConfiguration().mcpTemplateConfiguration(properties));
    }

}
