package fun.fengwk.searxng.core.search.model;

import java.util.Set;

/**
 * Field shapes a result object may take on the wire.
 *
 * <p>Declaration order is the resolution order: the narrower legacy shape is tried before the main shape,
 * whose field set is a superset.
 *
 * @author fengwk
 */
public enum ResultShape {

    /**
     * Result shape emitted by older backend versions.
     */
    LEGACY(
        LegacyResult.class,
        Set.of("url", "template", "engine", "parsed_url", "title", "content", "img_src", "thumbnail",
            "priority", "engines", "positions", "score", "category", "publishedDate", "pubdate"),
        Set.of("template", "engine", "title", "content", "img_src", "thumbnail", "priority", "score",
            "category")
    ),

    /**
     * Current result shape with media fields, grouping flags and richer metadata.
     */
    MAIN(
        MainResult.class,
        Set.of("url", "engine", "parsed_url", "template", "title", "content", "img_src", "iframe_src",
            "audio_src", "thumbnail", "publishedDate", "pubdate", "length", "views", "author", "metadata",
            "priority", "engines", "open_group", "close_group", "positions", "score", "category"),
        Set.of("template", "title", "content", "img_src", "iframe_src", "audio_src", "thumbnail", "views",
            "author", "metadata", "priority", "open_group", "close_group", "score", "category")
    );

    private final Class<? extends SearchResult> resultType;
    private final Set<String> knownFields;
    private final Set<String> requiredFields;

    ResultShape(Class<? extends SearchResult> resultType, Set<String> knownFields, Set<String> requiredFields) {
        this.resultType = resultType;
        this.knownFields = knownFields;
        this.requiredFields = requiredFields;
    }

    public Class<? extends SearchResult> getResultType() {
        return resultType;
    }

    /**
     * Fields that must be present and non-null.
     */
    public Set<String> getRequiredFields() {
        return requiredFields;
    }

    /**
     * Whether this shape accepts a field of the given name.
     */
    public boolean isKnown(String field) {
        return knownFields.contains(field);
    }

}
