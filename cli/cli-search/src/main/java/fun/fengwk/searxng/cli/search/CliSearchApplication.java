package fun.fengwk.searxng.cli.search;

import fun.fengwk.searxng.core.mcp.SearchMcp;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.searxng")
public class CliSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliSearchApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "spring.ai.mcp.server", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ToolCallbackProvider searchTools(SearchMcp searchMcp) {
        return MethodToolCallbackProvider.builder()
            .toolObjects(searchMcp)
            .build();
    }

}
