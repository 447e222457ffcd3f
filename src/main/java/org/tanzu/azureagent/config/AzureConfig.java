package org.tanzu.azureagent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Configuration class for Azure Resource Manager connection settings.
 *
 * This class uses Spring Boot's @ConfigurationProperties to automatically bind
 * Azure configuration from various sources including:
 * - application.properties file (which maps the AZURE_* environment variables)
 * - Environment variables
 * - Cloud Foundry service bindings (via AzureConfigProcessor)
 *
 * Configuration properties are bound using the "azure" prefix, so properties
 * like "azure.tenant-id", "azure.subscription-id", etc. are automatically mapped
 * to this class.
 */
@Component
@ConfigurationProperties(prefix = "azure")
public class AzureConfig {

    /** Microsoft Entra tenant that owns the service principal */
    private String tenantId;

    /** Application (client) ID of the service principal */
    private String clientId;

    /** Client secret of the service principal */
    private String clientSecret;

    /** Subscription whose inventory is queried */
    private String subscriptionId;

    /** Base URL of the Resource Manager endpoint */
    private String managementEndpoint = "https://management.azure.com";

    /** Base URL of the token authority */
    private String authorityHost = "https://login.microsoftonline.com";

    /** Upper bound for a single outbound call */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /** Largest response body buffered in memory */
    private DataSize maxResponseSize = DataSize.ofMegabytes(16);

    public String getTenantId() { return tenantId; }
    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }

    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }

    public String getSubscriptionId() { return subscriptionId; }
    public void setSubscriptionId(String subscriptionId) { this.subscriptionId = subscriptionId; }

    public String getManagementEndpoint() { return managementEndpoint; }
    public void setManagementEndpoint(String managementEndpoint) { this.managementEndpoint = managementEndpoint; }

    public String getAuthorityHost() { return authorityHost; }
    public void setAuthorityHost(String authorityHost) { this.authorityHost = authorityHost; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public DataSize getMaxResponseSize() { return maxResponseSize; }
    public void setMaxResponseSize(DataSize maxResponseSize) { this.maxResponseSize = maxResponseSize; }

    /**
     * Returns the OAuth2 scope requested for management-plane tokens.
     * @return the management endpoint followed by "/.default"
     */
    public String getTokenScope() {
        String endpoint = managementEndpoint.endsWith("/")
                ? managementEndpoint.substring(0, managementEndpoint.length() - 1)
                : managementEndpoint;
        return endpoint + "/.default";
    }

    /**
     * Returns a string representation of the configuration.
     *
     * The client secret is hidden to prevent it from appearing
     * in logs or debug output.
     *
     * @return String representation with the secret hidden
     */
    @Override
    public String toString() {
        return "AzureConfig{" +
                "tenantId='" + tenantId + '\'' +
                ", clientId='" + clientId + '\'' +
                ", clientSecret='[HIDDEN]'" +
                ", subscriptionId='" + subscriptionId + '\'' +
                ", managementEndpoint='" + managementEndpoint + '\'' +
                ", authorityHost='" + authorityHost + '\'' +
                ", requestTimeout=" + requestTimeout +
                ", maxResponseSize=" + maxResponseSize +
                '}';
    }
}
