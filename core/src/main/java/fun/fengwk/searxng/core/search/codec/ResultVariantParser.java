package fun.fengwk.searxng.core.search.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.searxng.core.search.SearchResponseDecodeException;
import fun.fengwk.searxng.core.search.model.ResultShape;
import fun.fengwk.searxng.core.search.model.SearchResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Resolves one result element to the shape its fields describe.
 *
 * <p>Shapes are tried in {@link ResultShape} declaration order, {@link ResultShape#LEGACY} before
 * {@link ResultShape#MAIN}, and each attempt is strict: the element must carry no field outside the shape,
 * every required field must be present and non-null, and every value must bind to its declared type.
 * The order matters. Main is a superset of Legacy, so any element carrying a Main-only field fails the
 * Legacy attempt and resolves to Main, while an element carrying only Legacy fields lacks Main's required
 * media fields and can only resolve to Legacy.
 *
 * @author fengwk
 */
@Slf4j
public class ResultVariantParser {

    private final ObjectMapper objectMapper;

    public ResultVariantParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decode the element at {@code index} of the {@code results} array.
     *
     * @throws SearchResponseDecodeException if the element matches no known shape
     */
    public SearchResult parse(JsonNode element, int index) {
        if (element == null || !element.isObject()) {
            throw new SearchResponseDecodeException(
                "result[" + index + "] is " + JsonNodes.typeName(element) + ", expected object",
                index, Set.of(), null);
        }

        ObjectNode object = (ObjectNode) element;
        List<ShapeMismatch> mismatches = new ArrayList<>();
        for (ResultShape shape : ResultShape.values()) {
            ShapeMismatch mismatch = checkFields(object, shape);
            if (mismatch != null) {
                mismatches.add(mismatch);
                continue;
            }
            try {
                return objectMapper.treeToValue(JsonNodes.withoutNullFields(object), shape.getResultType());
            } catch (JsonProcessingException ex) {
                mismatches.add(new ShapeMismatch(shape, "invalid value: " + ex.getOriginalMessage()));
            }
        }

        Set<String> unmatched = unmatchedFields(object);
        StringJoiner reasons = new StringJoiner("; ");
        for (ShapeMismatch mismatch : mismatches) {
            reasons.add(mismatch.shape() + " " + mismatch.reason());
        }
        String message = "result[" + index + "] matches no known shape: " + reasons
            + (unmatched.isEmpty() ? "" : "; fields unknown to every shape " + unmatched);
        log.debug("result shape mismatch, index={}, fields={}", index, JsonNodes.fieldNames(object));
        throw new SearchResponseDecodeException(message, index, unmatched, null);
    }

    private ShapeMismatch checkFields(ObjectNode object, ResultShape shape) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String field : JsonNodes.fieldNames(object)) {
            if (!shape.isKnown(field)) {
                unknown.add(field);
            }
        }
        Set<String> missing = new LinkedHashSet<>();
        for (String field : shape.getRequiredFields()) {
            JsonNode value = object.get(field);
            if (value == null || value.isNull()) {
                missing.add(field);
            }
        }
        if (unknown.isEmpty() && missing.isEmpty()) {
            return null;
        }

        StringJoiner reason = new StringJoiner(", ");
        if (!unknown.isEmpty()) {
            reason.add("unknown fields " + unknown);
        }
        if (!missing.isEmpty()) {
            reason.add("missing required fields " + missing);
        }
        return new ShapeMismatch(shape, reason.toString());
    }

    private Set<String> unmatchedFields(ObjectNode object) {
        Set<String> unmatched = new LinkedHashSet<>();
        for (String field : JsonNodes.fieldNames(object)) {
            boolean known = false;
            for (ResultShape shape : ResultShape.values()) {
                known |= shape.isKnown(field);
            }
            if (!known) {
                unmatched.add(field);
            }
        }
        return unmatched;
    }

    private record ShapeMismatch(ResultShape shape, String reason) {
    }

}
