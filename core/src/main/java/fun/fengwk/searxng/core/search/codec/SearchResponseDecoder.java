package fun.fengwk.searxng.core.search.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.searxng.core.search.SearchResponseDecodeException;
import fun.fengwk.searxng.core.search.model.Answer;
import fun.fengwk.searxng.core.search.model.EngineError;
import fun.fengwk.searxng.core.search.model.Infobox;
import fun.fengwk.searxng.core.search.model.SearchResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a search response body.
 *
 * <p>Unknown top-level fields are ignored; every known top-level field is required.
 *
 * @author fengwk
 */
@Component
public class SearchResponseDecoder {

    private static final List<String> REQUIRED_FIELDS = List.of(
        "query", "number_of_results", "results", "answers", "corrections", "infoboxes", "suggestions",
        "unresponsive_engines");

    private static final TypeReference<List<List<Answer>>> ANSWERS = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };
    private static final TypeReference<List<EngineError>> ENGINE_ERRORS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ResultVariantParser resultVariantParser;

    public SearchResponseDecoder() {
        this(SearxngObjectMappers.strict());
    }

    public SearchResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.resultVariantParser = new ResultVariantParser(objectMapper);
    }

    /**
     * Decode one page body.
     *
     * @throws SearchResponseDecodeException if the body is not JSON or does not match the response schema
     */
    public SearchResponse decode(String body) {
        if (!StringUtils.hasText(body)) {
            throw new SearchResponseDecodeException("empty response body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new SearchResponseDecodeException("malformed json: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new SearchResponseDecodeException(
                "response is " + JsonNodes.typeName(root) + ", expected object");
        }

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            JsonNode value = root.get(field);
            if (value == null || value.isNull()) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new SearchResponseDecodeException("missing required fields " + missing);
        }

        SearchResponse.SearchResponseBuilder builder = SearchResponse.builder()
            .query(bind(root, "query", String.class))
            .numberOfResults(bind(root, "number_of_results", Long.class))
            .answers(bind(root, "answers", ANSWERS))
            .corrections(bind(root, "corrections", STRINGS))
            .infoboxes(decodeInfoboxes(root.get("infoboxes")))
            .suggestions(bind(root, "suggestions", STRINGS))
            .unresponsiveEngines(bind(root, "unresponsive_engines", ENGINE_ERRORS));

        JsonNode results = root.get("results");
        if (!results.isArray()) {
            throw new SearchResponseDecodeException(
                "field results is " + JsonNodes.typeName(results) + ", expected array");
        }
        for (int i = 0; i < results.size(); i++) {
            builder.result(resultVariantParser.parse(results.get(i), i));
        }
        return builder.build();
    }

    private List<Infobox> decodeInfoboxes(JsonNode node) {
        if (!node.isArray()) {
            throw new SearchResponseDecodeException(
                "field infoboxes is " + JsonNodes.typeName(node) + ", expected array");
        }
        List<Infobox> infoboxes = new ArrayList<>();
        ArrayNode array = (ArrayNode) node;
        for (int i = 0; i < array.size(); i++) {
            JsonNode element = array.get(i);
            if (!element.isObject()) {
                throw new SearchResponseDecodeException(
                    "infoboxes[" + i + "] is " + JsonNodes.typeName(element) + ", expected object");
            }
            JsonNode infobox = JsonNodes.withoutNullFields((ObjectNode) element);
            Infobox decoded = bindValue(infobox, "infoboxes[" + i + "]", objectMapper.constructType(Infobox.class));
            infoboxes.add(decoded);
        }
        return infoboxes;
    }

    private <T> T bind(JsonNode root, String field, Class<T> type) {
        return bindValue(root.get(field), field, objectMapper.constructType(type));
    }

    private <T> T bind(JsonNode root, String field, TypeReference<T> type) {
        return bindValue(root.get(field), field, objectMapper.constructType(type));
    }

    private <T> T bindValue(JsonNode value, String label, JavaType type) {
        try {
            return objectMapper.readerFor(type).readValue(value);
        } catch (IOException ex) {
            throw new SearchResponseDecodeException("invalid field " + label + ": " + ex.getMessage(), ex);
        }
    }

}
