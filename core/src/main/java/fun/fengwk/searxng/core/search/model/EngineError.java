package fun.fengwk.searxng.core.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.List;

/**
 * Engine that failed to answer, a {@code [engine, error_msg]} pair on the wire.
 *
 * @author fengwk
 */
@Value
public class EngineError {

    String engine;

    String errorMsg;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EngineError fromPair(List<String> pair) {
        if (pair == null || pair.size() != 2) {
            throw new IllegalArgumentException("engine error must be a [engine, error_msg] pair: " + pair);
        }
        return new EngineError(pair.get(0), pair.get(1));
    }

    @JsonValue
    public List<String> toPair() {
        return List.of(engine, errorMsg);
    }

}
