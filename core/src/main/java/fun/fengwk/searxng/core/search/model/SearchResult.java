package fun.fengwk.searxng.core.search.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One search result, either a {@link LegacyResult} or a {@link MainResult}.
 *
 * <p>{@link #getShape()} is the tag telling the two implementations apart.
 *
 * @author fengwk
 */
public sealed interface SearchResult permits LegacyResult, MainResult {

    ResultShape getShape();

    String getUrl();

    /**
     * Engine that produced the result, always present for legacy results.
     */
    String getEngine();

    List<String> getParsedUrl();

    String getTemplate();

    String getTitle();

    String getContent();

    String getImgSrc();

    String getThumbnail();

    LocalDateTime getPublishedDate();

    String getPubdate();

    PriorityType getPriority();

    /**
     * Engines that returned this result, never null.
     */
    List<String> getEngines();

    /**
     * Positions in the engines' result lists, never null.
     */
    List<Integer> getPositions();

    double getScore();

    String getCategory();

}
