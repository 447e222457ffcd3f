package org.tanzu.azureagent.config;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.tanzu.azureagent.tool.AzureAgentTools;

import java.util.List;

/**
 * Registers the agent's tools with the MCP server.
 */
@Configuration
public class McpToolConfig {

    /**
     * Creates ToolCallback objects from the @Tool methods of {@link AzureAgentTools}.
     * Spring AI's MCP server auto-configuration picks them up and publishes them.
     *
     * @param azureAgentTools The component holding the tool methods
     * @return the tool callbacks to expose
     */
    @Bean
    public List<ToolCallback> registerTools(AzureAgentTools azureAgentTools) {
        return List.of(ToolCallbacks.from(azureAgentTools));
    }
}
