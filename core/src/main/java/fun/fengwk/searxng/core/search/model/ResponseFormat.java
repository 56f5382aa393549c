package fun.fengwk.searxng.core.search.model;

import org.springframework.util.StringUtils;

/**
 * Response formats supported by the search endpoint.
 *
 * @author fengwk
 */
public enum ResponseFormat {

    JSON("json");

    private final String value;

    ResponseFormat(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ResponseFormat fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return JSON;
        }
        for (ResponseFormat format : values()) {
            if (format.value.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("unsupported format: " + value);
    }

}
