package fun.fengwk.searxng.core.search.model;

import org.springframework.util.StringUtils;

import java.util.IllformedLocaleException;
import java.util.Locale;

/**
 * BCP-47 language tag parsing.
 *
 * @author fengwk
 */
public final class LanguageTags {

    private LanguageTags() {
    }

    /**
     * Parse a well-formed BCP-47 tag such as {@code en}, {@code zh-CN} or {@code sr-Latn-RS}.
     *
     * @throws IllegalArgumentException if the tag is blank or ill-formed
     */
    public static Locale parse(String tag) {
        if (!StringUtils.hasText(tag)) {
            throw new IllegalArgumentException("language tag is blank");
        }
        try {
            return new Locale.Builder().setLanguageTag(tag.trim()).build();
        } catch (IllformedLocaleException ex) {
            throw new IllegalArgumentException("invalid language tag: " + tag, ex);
        }
    }

}
