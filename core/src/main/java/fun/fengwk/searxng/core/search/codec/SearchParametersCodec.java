package fun.fengwk.searxng.core.search.codec;

import fun.fengwk.searxng.core.search.model.LanguageTags;
import fun.fengwk.searxng.core.search.model.ResponseFormat;
import fun.fengwk.searxng.core.search.model.SearchParameters;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link SearchParameters} to and from the form fields of the search endpoint.
 *
 * @author fengwk
 */
public final class SearchParametersCodec {

    public static final String Q = "q";
    public static final String FORMAT = "format";
    public static final String PAGENO = "pageno";
    public static final String CATEGORIES = "categories";
    public static final String ENGINES = "engines";
    public static final String LANGUAGE = "language";
    public static final String RESULTS_ON_NEW_TAB = "results_on_new_tab";
    public static final String IMAGE_PROXY = "image_proxy";
    public static final String AUTOCOMPLETE = "autocomplete";
    public static final String SAFESEARCH = "safesearch";
    public static final String THEME = "theme";

    private static final String LIST_SEPARATOR = ",";

    private SearchParametersCodec() {
    }

    /**
     * Encode to ordered form fields, absent values and empty lists are omitted.
     */
    public static Map<String, String> encode(SearchParameters parameters) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put(Q, parameters.getQ());
        form.put(FORMAT, parameters.getFormat().getValue());
        putIfPresent(form, PAGENO, parameters.getPageno());
        putIfNotEmpty(form, CATEGORIES, parameters.getCategories());
        putIfNotEmpty(form, ENGINES, parameters.getEngines());
        if (parameters.getLanguage() != null) {
            form.put(LANGUAGE, parameters.getLanguage().toLanguageTag());
        }
        putIfPresent(form, RESULTS_ON_NEW_TAB, parameters.getResultsOnNewTab());
        putIfPresent(form, IMAGE_PROXY, parameters.getImageProxy());
        putIfPresent(form, AUTOCOMPLETE, parameters.getAutocomplete());
        putIfPresent(form, SAFESEARCH, parameters.getSafesearch());
        putIfPresent(form, THEME, parameters.getTheme());
        return form;
    }

    /**
     * Rebuild parameters from form fields produced by {@link #encode(SearchParameters)}.
     *
     * @throws IllegalArgumentException if a field cannot be parsed
     */
    public static SearchParameters decode(Map<String, String> form) {
        String query = form.get(Q);
        if (query == null) {
            throw new IllegalArgumentException("missing form field: " + Q);
        }
        SearchParameters.SearchParametersBuilder builder = SearchParameters.builder()
            .q(query)
            .format(ResponseFormat.fromValue(form.get(FORMAT)))
            .pageno(parseInteger(form, PAGENO))
            .categories(splitList(form.get(CATEGORIES)))
            .engines(splitList(form.get(ENGINES)))
            .resultsOnNewTab(parseInteger(form, RESULTS_ON_NEW_TAB))
            .imageProxy(parseBoolean(form, IMAGE_PROXY))
            .autocomplete(form.get(AUTOCOMPLETE))
            .safesearch(parseInteger(form, SAFESEARCH))
            .theme(form.get(THEME));
        if (StringUtils.hasText(form.get(LANGUAGE))) {
            builder.language(LanguageTags.parse(form.get(LANGUAGE)));
        }
        return builder.build();
    }

    /**
     * Split a comma-joined list, blank items are dropped.
     */
    public static List<String> splitList(String joined) {
        List<String> items = new ArrayList<>();
        if (!StringUtils.hasText(joined)) {
            return items;
        }
        for (String item : joined.split(LIST_SEPARATOR)) {
            if (StringUtils.hasText(item)) {
                items.add(item.trim());
            }
        }
        return items;
    }

    private static void putIfPresent(Map<String, String> form, String key, Object value) {
        if (value != null) {
            form.put(key, String.valueOf(value));
        }
    }

    private static void putIfNotEmpty(Map<String, String> form, String key, List<String> values) {
        if (!values.isEmpty()) {
            form.put(key, String.join(LIST_SEPARATOR, values));
        }
    }

    private static Integer parseInteger(Map<String, String> form, String key) {
        String value = form.get(key);
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid integer form field " + key + ": " + value, ex);
        }
    }

    private static Boolean parseBoolean(Map<String, String> form, String key) {
        String value = form.get(key);
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String normalized = value.trim();
        if ("true".equalsIgnoreCase(normalized)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(normalized)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("invalid boolean form field " + key + ": " + value);
    }

}
