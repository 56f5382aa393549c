package fun.fengwk.searxng.core.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result priority, {@link #NONE} is an empty string on the wire.
 *
 * @author fengwk
 */
public enum PriorityType {

    NONE(""),
    HIGH("high"),
    LOW("low");

    private final String value;

    PriorityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PriorityType fromValue(String value) {
        for (PriorityType priority : values()) {
            if (priority.value.equals(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("unsupported priority: " + value);
    }

}
