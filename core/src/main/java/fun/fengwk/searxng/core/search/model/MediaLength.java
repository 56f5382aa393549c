package fun.fengwk.searxng.core.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.springframework.util.StringUtils;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Period;
import java.util.Locale;

/**
 * Media length as an ISO-8601 duration, e.g. {@code PT4M5S} or {@code P1M}.
 *
 * <p>Years and months have no fixed length, so they are kept apart in {@link #getPeriod()}; weeks, days and
 * the time part are folded into {@link #getDuration()} with a day counted as 24 hours.
 *
 * @author fengwk
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MediaLength {

    /**
     * Text as received.
     */
    @JsonValue
    String text;

    /**
     * Years and months, zero for most media.
     */
    Period period;

    Duration duration;

    /**
     * @throws IllegalArgumentException if the text is not a non-negative ISO-8601 duration
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MediaLength parse(String text) {
        if (!StringUtils.hasText(text)) {
            throw new IllegalArgumentException("media length is blank");
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        if (!normalized.startsWith("P") || "P".equals(normalized)) {
            throw new IllegalArgumentException("invalid media length: " + text);
        }

        int timeStart = normalized.indexOf('T');
        String datePart = timeStart < 0 ? normalized : normalized.substring(0, timeStart);
        try {
            Period date = "P".equals(datePart) ? Period.ZERO : Period.parse(datePart);
            Duration time = timeStart < 0 ? Duration.ZERO : Duration.parse("P" + normalized.substring(timeStart));
            if (date.isNegative() || time.isNegative()) {
                throw new IllegalArgumentException("negative media length: " + text);
            }
            return new MediaLength(text,
                Period.of(date.getYears(), date.getMonths(), 0),
                Duration.ofDays(date.getDays()).plus(time));
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("invalid media length: " + text, ex);
        }
    }

    /**
     * Whether the length depends on the calendar, i.e. has a year or month part.
     */
    public boolean isCalendarBased() {
        return !period.isZero();
    }

}
