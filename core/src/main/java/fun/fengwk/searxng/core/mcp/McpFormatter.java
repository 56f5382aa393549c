package fun.fengwk.searxng.core.mcp;

import freemarker.template.Configuration;
import freemarker.template.TemplateException;
import freemarker.template.TemplateNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

/**
 * Renders tool results with FreeMarker templates, the model is exposed to the template as {@code data}.
 *
 * <p>Never throws: rendering problems come back as text so the tool call still answers.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class McpFormatter {

    private final Configuration mcpTemplateConfiguration;

    public McpFormatter(@Qualifier("mcpTemplateConfiguration") Configuration mcpTemplateConfiguration) {
        this.mcpTemplateConfiguration = mcpTemplateConfiguration;
    }

    public String format(String templateName, Object model) {
        if (model == null) {
            return "empty response";
        }
        StringWriter out = new StringWriter(1024);
        try {
            mcpTemplateConfiguration.getTemplate(templateName).process(Map.of("data", model), out);
            return out.toString();
        } catch (TemplateNotFoundException ex) {
            log.error("template not found, template={}", templateName);
            return "format error: template not found: " + templateName;
        } catch (IOException | TemplateException ex) {
            log.warn("format failed, template={}", templateName, ex);
            return "format error: " + ex.getMessage();
        }
    }

}
