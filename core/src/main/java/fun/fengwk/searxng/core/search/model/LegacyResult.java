package fun.fengwk.searxng.core.search.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result in the narrower field set used by older backend versions.
 *
 * @author fengwk
 */
@Value
@Builder
@Jacksonized
public final class LegacyResult implements SearchResult {

    String url;

    String template;

    String engine;

    @JsonProperty("parsed_url")
    List<String> parsedUrl;

    String title;

    String content;

    @JsonProperty("img_src")
    String imgSrc;

    String thumbnail;

    PriorityType priority;

    @Builder.Default
    List<String> engines = List.of();

    @Builder.Default
    List<Integer> positions = List.of();

    double score;

    String category;

    @JsonProperty("publishedDate")
    LocalDateTime publishedDate;

    String pubdate;

    @Override
    public ResultShape getShape() {
        return ResultShape.LEGACY;
    }

}
