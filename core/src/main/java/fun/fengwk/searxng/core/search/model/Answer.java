package fun.fengwk.searxng.core.search.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Instant answer entry.
 *
 * @author fengwk
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Answer {

    String url;

    String engine;

    @JsonProperty("parsed_url")
    List<String> parsedUrl;

}
