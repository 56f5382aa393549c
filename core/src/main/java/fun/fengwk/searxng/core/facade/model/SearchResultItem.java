package fun.fengwk.searxng.core.facade.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Single search result item.
 *
 * @author fengwk
 */
@Data
@Builder
public class SearchResultItem {

    /**
     * Result title.
     */
    private String title;

    /**
     * Result URL.
     */
    private String url;

    /**
     * Result snippet/content.
     */
    private String content;

    /**
     * Engines that returned the result.
     */
    private List<String> engines;

    /**
     * Result shape name, legacy or main.
     */
    private String shape;

}
