package fun.fengwk.searxng.core.search.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result in the current field set, a superset of {@link LegacyResult}.
 *
 * @author fengwk
 */
@Value
@Builder
@Jacksonized
public final class MainResult implements SearchResult {

    String url;

    String engine;

    @JsonProperty("parsed_url")
    List<String> parsedUrl;

    String template;

    String title;

    String content;

    @JsonProperty("img_src")
    String imgSrc;

    @JsonProperty("iframe_src")
    String iframeSrc;

    @JsonProperty("audio_src")
    String audioSrc;

    String thumbnail;

    @JsonProperty("publishedDate")
    LocalDateTime publishedDate;

    /**
     * Raw publication date, kept only while the backend still emits it. Prefer {@link #getPublishedDate()}.
     */
    String pubdate;

    /**
     * Media length, ISO-8601 duration on the wire, calendar parts included.
     */
    MediaLength length;

    String views;

    String author;

    String metadata;

    PriorityType priority;

    @Builder.Default
    List<String> engines = List.of();

    @JsonProperty("open_group")
    boolean openGroup;

    @JsonProperty("close_group")
    boolean closeGroup;

    @Builder.Default
    List<Integer> positions = List.of();

    double score;

    String category;

    @Override
    public ResultShape getShape() {
        return ResultShape.MAIN;
    }

}
