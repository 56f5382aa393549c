package fun.fengwk.searxng.core.search.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Locale;

/**
 * Parameters of one search request.
 *
 * <p>Reference: <a href="https://docs.searxng.org/dev/search_api.html">SearXNG Search API</a>
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class SearchParameters {

    /**
     * Search query text.
     */
    @NonNull
    String q;

    @NonNull
    @Builder.Default
    ResponseFormat format = ResponseFormat.JSON;

    /**
     * Page number starting from 1, null means backend default.
     */
    @With
    Integer pageno;

    /**
     * Category filter, comma-joined on the wire.
     */
    @Singular("category")
    List<String> categories;

    /**
     * Engine filter, comma-joined on the wire.
     */
    @Singular("engine")
    List<String> engines;

    Locale language;

    Integer resultsOnNewTab;

    Boolean imageProxy;

    /**
     * Autocomplete backend name.
     */
    String autocomplete;

    /**
     * Safe search level, 0 none, 1 moderate, 2 strict.
     */
    Integer safesearch;

    String theme;

    public static SearchParameters of(String query, ResponseFormat format) {
        return SearchParameters.builder()
            .q(query)
            .format(format)
            .build();
    }

    public static class SearchParametersBuilder {

        /**
         * Set the language from a BCP-47 tag.
         *
         * @throws IllegalArgumentException if the tag is ill-formed
         */
        public SearchParametersBuilder languageTag(String tag) {
            return language(LanguageTags.parse(tag));
        }

    }

}
