package org.tanzu.azureagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the chat-facing side of the agent, bound from the "agent" prefix.
 */
@Component
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    /** Model id reported to chat front ends and used when a request omits one */
    private String modelId = "azure-agent";

    /** Service name reported by the health endpoint */
    private String serviceName = "Azure-Agent";

    private final Cors cors = new Cors();

    public String getModelId() { return modelId; }
    public void setModelId(String modelId) { this.modelId = modelId; }

    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }

    public Cors getCors() { return cors; }

    public static class Cors {

        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        public List<String> getAllowedOrigins() { return allowedOrigins; }
        public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
    }
}
