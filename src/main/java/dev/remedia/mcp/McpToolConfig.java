package dev.remedia.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link McpToolService} as an MCP tool through Spring AI's MCP server
 * auto-configuration, which serves the {@code @Tool} method over the stdio transport.
 */
@Configuration
public class McpToolConfig {

  @Bean
  public ToolCallbackProvider remediaTools(McpToolService toolService) {
    return MethodToolCallbackProvider.builder().toolObjects(toolService).build();
  }
}
