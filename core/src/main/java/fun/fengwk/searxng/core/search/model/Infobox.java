package fun.fengwk.searxng.core.search.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Sidebar entity box, e.g. a Wikipedia summary.
 *
 * @author fengwk
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Infobox {

    /**
     * Entity name.
     */
    String infobox;

    String id;

    String content;

    /**
     * Related links, keys are chosen by each engine.
     */
    @Builder.Default
    List<Map<String, JsonNode>> urls = List.of();

    /**
     * Structured attributes, keys are chosen by each engine.
     */
    @Builder.Default
    List<Map<String, JsonNode>> attributes = List.of();

    String engine;

    String url;

    @JsonProperty("img_src")
    String imgSrc;

    String template;

    @JsonProperty("parsed_url")
    List<String> parsedUrl;

    String title;

    String thumbnail;

    PriorityType priority;

    @Builder.Default
    List<String> engines = List.of();

    /**
     * Left untyped, backend versions disagree on whether this is a string or a list.
     */
    JsonNode positions;

    Double score;

    String category;

    @JsonProperty("publishedDate")
    LocalDateTime publishedDate;

    String pubdate;

}
