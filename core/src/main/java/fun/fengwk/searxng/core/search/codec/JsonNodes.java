package fun.fengwk.searxng.core.search.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * @author fengwk
 */
final class JsonNodes {

    private JsonNodes() {
    }

    /**
     * Copy of the object without null-valued fields, so absent and null bind the same way.
     */
    static ObjectNode withoutNullFields(ObjectNode node) {
        ObjectNode copy = node.deepCopy();
        List<String> nullFields = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = copy.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNull()) {
                nullFields.add(field.getKey());
            }
        }
        copy.remove(nullFields);
        return copy;
    }

    static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    static String typeName(JsonNode node) {
        return node == null ? "missing" : node.getNodeType().name().toLowerCase();
    }

}
