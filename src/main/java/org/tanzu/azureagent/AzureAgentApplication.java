package org.tanzu.azureagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot application class for the Azure Agent.
 *
 * The agent is a natural-language front end over Azure Resource Manager. It
 * accepts free-text operator queries, classifies them by keyword and pattern
 * matching, runs the matching read-only inventory query and answers in Markdown.
 *
 * Key features:
 * - OpenAI-compatible /v1/chat/completions endpoint, so chat front ends can use the agent as a model
 * - MCP tool (queryAzure) for AI assistants
 * - Service principal authentication against Azure Resource Manager
 * - Supports Cloud Foundry deployment with service binding
 *
 * @author Azure Agent Team
 * @version 1.0.0
 */
@SpringBootApplication
@EnableConfigurationProperties
public class AzureAgentApplication {

    /**
     * Main application entry point.
     *
     * The MCP server identity is set programmatically so that it cannot be
     * overridden by stray environment configuration.
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.setProperty("spring.application.name", "azure-agent");
        System.setProperty("spring.ai.mcp.server.name", "azure-agent");
        System.setProperty("spring.ai.mcp.server.version", "1.0.0");

        SpringApplication.run(AzureAgentApplication.class, args);
    }
}
