package fun.fengwk.searxng.core.utils;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Passes rendered text through as the tool result instead of JSON-encoding it.
 *
 * @author fengwk
 */
public class PlainTextToolCallResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence text) {
            return text.toString();
        }
        throw new IllegalStateException("tool must return text, declared " + returnType
            + " but got " + result.getClass().getName());
    }

}
