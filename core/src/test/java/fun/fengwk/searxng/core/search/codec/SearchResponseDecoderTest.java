package fun.fengwk.searxng.core.search.codec;

import fun.fengwk.searxng.core.search.SearchResponseDecodeException;
import fun.fengwk.searxng.core.search.SearxngPayloads;
import fun.fengwk.searxng.core.search.model.EngineError;
import fun.fengwk.searxng.core.search.model.Infobox;
import fun.fengwk.searxng.core.search.model.LegacyResult;
import fun.fengwk.searxng.core.search.model.MainResult;
import fun.fengwk.searxng.core.search.model.SearchResponse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SearchResponseDecoder tests.
 *
 * @author fengwk
 */
class SearchResponseDecoderTest {

    private final SearchResponseDecoder decoder = new SearchResponseDecoder();

    @Test
    void shouldDecodeFullResponse() {
        String body = """
            {"query":"rust","number_of_results":123456,
             "results":[%s,%s],
             "answers":[[{"url":"https://rust-lang.org","engine":"wikidata","parsed_url":null,"answer":"Rust"}]],
             "corrections":["rust lang"],
             "infoboxes":[{"infobox":"Rust","id":"https://en.wikipedia.org/wiki/Rust","content":"A language",
               "urls":[{"title":"Official site","url":"https://www.rust-lang.org","official":true}],
               "attributes":[{"label":"Designed by","value":"Graydon Hoare","entity":"P287"}],
               "engine":"wikipedia","engines":["wikipedia","wikidata"],"score":1.0,"unknown_key":42}],
             "suggestions":["rust book","rust async"],
             "unresponsive_engines":[["google","timeout"],["bing","HTTP error 403"]],
             "search_time":0.42}"""
            .formatted(SearxngPayloads.legacyResult(1), SearxngPayloads.mainResult(2));

        SearchResponse response = decoder.decode(body);

        assertThat(response.getQuery()).isEqualTo("rust");
        assertThat(response.getNumberOfResults()).isEqualTo(123456L);
        assertThat(response.getResults()).hasSize(2);
        assertThat(response.getResults().get(0)).isInstanceOf(LegacyResult.class);
        assertThat(response.getResults().get(1)).isInstanceOf(MainResult.class);
        assertThat(response.getAnswers()).hasSize(1);
        assertThat(response.getAnswers().get(0).get(0).getEngine()).isEqualTo("wikidata");
        assertThat(response.getCorrections()).containsExactly("rust lang");
        assertThat(response.getSuggestions()).containsExactly("rust book", "rust async");

        Infobox infobox = response.getInfoboxes().get(0);
        assertThat(infobox.getInfobox()).isEqualTo("Rust");
        assertThat(infobox.getUrls()).hasSize(1);
        assertThat(infobox.getUrls().get(0).get("url").asText()).isEqualTo("https://www.rust-lang.org");
        assertThat(infobox.getUrls().get(0).get("official").asBoolean()).isTrue();
        assertThat(infobox.getAttributes().get(0).get("value").asText()).isEqualTo("Graydon Hoare");
        assertThat(infobox.getEngines()).containsExactly("wikipedia", "wikidata");

        assertThat(response.getUnresponsiveEngines()).containsExactly(
            new EngineError("google", "timeout"),
            new EngineError("bing", "HTTP error 403"));
    }

    @Test
    void shouldKeepEstimatedTotalIndependentOfResultCount() {
        SearchResponse response = decoder.decode(SearxngPayloads.response("rust", 0,
            List.of(SearxngPayloads.legacyResult(1), SearxngPayloads.legacyResult(2))));

        assertThat(response.getNumberOfResults()).isZero();
        assertThat(response.getResults()).hasSize(2);
    }

    @Test
    void shouldFailWhenTopLevelFieldIsMissing() {
        String body = """
            {"query":"rust","number_of_results":0,"results":[],"answers":[],"corrections":[],\
            "infoboxes":[],"suggestions":[]}""";

        assertThatThrownBy(() -> decoder.decode(body))
            .isInstanceOf(SearchResponseDecodeException.class)
            .hasMessageContaining("unresponsive_engines");
    }

    @Test
    void shouldFailWholePageWhenOneResultMatchesNoShape() {
        String unknown = SearxngPayloads.legacyResult(2).replace("\"pubdate\":null", "\"pubdate\":null,\"rank\":9");
        String body = SearxngPayloads.response("rust", 10, List.of(SearxngPayloads.legacyResult(1), unknown));

        assertThatThrownBy(() -> decoder.decode(body))
            .isInstanceOfSatisfying(SearchResponseDecodeException.class, ex -> {
                assertThat(ex.getResultIndex()).isEqualTo(1);
                assertThat(ex.getUnmatchedFields()).containsExactly("rank");
            });
    }

    @Test
    void shouldFailOnEngineErrorThatIsNotAPair() {
        String body = SearxngPayloads.response("rust", 0, List.of())
            .replace("\"unresponsive_engines\":[]", "\"unresponsive_engines\":[[\"google\"]]");

        assertThatThrownBy(() -> decoder.decode(body))
            .isInstanceOf(SearchResponseDecodeException.class)
            .hasMessageContaining("unresponsive_engines");
    }

    @Test
    void shouldFailOnMalformedOrEmptyBody() {
        assertThatThrownBy(() -> decoder.decode("<html>rate limited</html>"))
            .isInstanceOf(SearchResponseDecodeException.class)
            .hasMessageStartingWith("malformed json");
        assertThatThrownBy(() -> decoder.decode(" "))
            .isInstanceOf(SearchResponseDecodeException.class)
            .hasMessage("empty response body");
        assertThatThrownBy(() -> decoder.decode("[]"))
            .isInstanceOf(SearchResponseDecodeException.class)
            .hasMessageContaining("expected object");
    }

}
