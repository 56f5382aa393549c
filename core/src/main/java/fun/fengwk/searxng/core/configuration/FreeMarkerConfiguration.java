package fun.fengwk.searxng.core.configuration;

import freemarker.template.Configuration;
import freemarker.template.TemplateExceptionHandler;
import fun.fengwk.searxng.core.facade.SearchToolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.ClassUtils;

import java.nio.charset.StandardCharsets;

/**
 * Template engine rendering search summaries for the tool surface.
 *
 * @author fengwk
 */
@org.springframework.context.annotation.Configuration
public class FreeMarkerConfiguration {

    @Bean(name = "mcpTemplateConfiguration")
    public Configuration mcpTemplateConfiguration(SearchToolProperties properties) {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_34);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), properties.getTemplatePath());
        cfg.setDefaultEncoding(StandardCharsets.UTF_8.name());
        // Errors surface to McpFormatter instead of being printed into the output.
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        // Plain digits for counts and scores, no locale grouping.
        cfg.setNumberFormat("computer");
        return cfg;
    }

}
