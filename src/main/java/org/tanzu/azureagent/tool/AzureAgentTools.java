package org.tanzu.azureagent.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.tanzu.azureagent.intent.IntentHandler;

/**
 * MCP tools that let an AI assistant query the Azure inventory in natural language.
 *
 * The tool runs the same intent pipeline as the chat endpoint, in-process, and
 * hands the Markdown answer back to the calling model.
 */
@Component
public class AzureAgentTools {

    private static final Logger logger = LoggerFactory.getLogger(AzureAgentTools.class);

    private final IntentHandler intentHandler;

    public AzureAgentTools(IntentHandler intentHandler) {
        this.intentHandler = intentHandler;
    }

    /**
     * MCP tool: answers a natural-language question about the Azure subscription.
     *
     * Failures are returned as text so the calling assistant can relay them.
     *
     * @param query The question, e.g. "show all vms"
     * @return A Markdown answer with the Azure data
     */
    @Tool(description = "Query Azure infrastructure (VMs, status, metrics, resource groups, networks, public IPs "
            + "and 37 service aliases such as key vault or aks) using natural language. Examples: 'show all vms', "
            + "'status of vm MyVM', 'cpu for web-server', 'list resource groups', 'show key vaults'. "
            + "Returns a Markdown answer.")
    public String queryAzure(@ToolParam(description = "The question about Azure resources, in plain English") String query) {
        logger.info("=== MCP TOOL CALLED: queryAzure({}) ===", query);
        try {
            return intentHandler.processQuery(query);
        } catch (RuntimeException e) {
            logger.error("queryAzure failed for '{}': {}", query, e.getMessage(), e);
            return "Unexpected error: " + e.getMessage();
        }
    }
}
