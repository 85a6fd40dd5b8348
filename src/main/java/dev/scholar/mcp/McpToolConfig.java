package dev.scholar.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the {@code @Tool} methods of {@link McpToolService} to the Spring AI MCP server.
 *
 * @see McpToolService
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider scholarTools(McpToolService toolService) {
        return MethodToolCallbackProvider.builder().toolObjects(toolService).build();
    }
}
