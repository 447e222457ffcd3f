package org.tanzu.azureagent.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.util.ArrayList;
import java.util.List;

/**
 * Completes and validates the Azure service principal settings at startup.
 *
 * When the configuration bound from properties and environment variables is
 * incomplete, this component looks for an Azure service binding in the Cloud
 * Foundry VCAP_SERVICES variable and fills in only the missing values. It then
 * reports any settings that are still missing. An incomplete configuration never
 * aborts startup; management API calls simply fail until it is fixed.
 *
 * Configuration priority (highest to lowest):
 * 1. Environment variables / application.properties
 * 2. Cloud Foundry service binding (VCAP_SERVICES)
 */
@Component
public class AzureConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(AzureConfigProcessor.class);

    private final AzureConfig azureConfig;
    private final Environment environment;

    public AzureConfigProcessor(AzureConfig azureConfig, Environment environment) {
        this.azureConfig = azureConfig;
        this.environment = environment;
    }

    /**
     * Fills gaps from VCAP_SERVICES and logs the outcome of validation.
     */
    @PostConstruct
    public void processConfiguration() {
        logger.info("Starting Azure-Agent configuration check...");
        logger.info("Current config - Tenant: '{}', Client: '{}', Secret: '{}', Subscription: '{}'",
                azureConfig.getTenantId(),
                azureConfig.getClientId(),
                azureConfig.getClientSecret() != null ? "***" : "null",
                azureConfig.getSubscriptionId());

        if (!isConfigurationComplete()) {
            applyVcapServices();
        }

        List<String> missing = missingSettings();
        if (!missing.isEmpty()) {
            logger.error("Missing required environment variables: {}", String.join(", ", missing));
            logger.warn("Configuration is incomplete. Azure management calls will fail until it is properly configured.");
            return;
        }
        logger.info("Azure configuration is complete for subscription {}", azureConfig.getSubscriptionId());
    }

    /**
     * @return true if every required setting is present
     */
    public boolean isConfigurationComplete() {
        return missingSettings().isEmpty();
    }

    /**
     * Lists the environment variable names of required settings that are absent.
     *
     * A value counts as absent if it is null, blank, or still an unresolved
     * ${...} placeholder.
     *
     * @return names of the missing environment variables, in declaration order
     */
    public List<String> missingSettings() {
        List<String> missing = new ArrayList<>();
        if (!isValid(azureConfig.getTenantId())) missing.add("AZURE_TENANT_ID");
        if (!isValid(azureConfig.getClientId())) missing.add("AZURE_CLIENT_ID");
        if (!isValid(azureConfig.getClientSecret())) missing.add("AZURE_CLIENT_SECRET");
        if (!isValid(azureConfig.getSubscriptionId())) missing.add("AZURE_SUBSCRIPTION_ID");
        return missing;
    }

    private void applyVcapServices() {
        String vcapServices = environment.getProperty("VCAP_SERVICES");
        if (vcapServices == null || vcapServices.isEmpty()) {
            logger.debug("VCAP_SERVICES not available");
            return;
        }

        try {
            JsonNode vcapServicesNode = new ObjectMapper().readTree(vcapServices);
            JsonNode credentials = findAzureCredentials(vcapServicesNode);
            if (credentials == null) {
                logger.warn("No Azure service found in VCAP_SERVICES");
                return;
            }
            if (!isValid(azureConfig.getTenantId())) {
                azureConfig.setTenantId(credentials.path("tenant_id").asText(null));
                logger.info("Set tenant from VCAP: {}", azureConfig.getTenantId());
            }
            if (!isValid(azureConfig.getClientId())) {
                azureConfig.setClientId(credentials.path("client_id").asText(null));
                logger.info("Set client from VCAP: {}", azureConfig.getClientId());
            }
            if (!isValid(azureConfig.getClientSecret())) {
                azureConfig.setClientSecret(credentials.path("client_secret").asText(null));
                logger.info("Set client secret from VCAP: ***");
            }
            if (!isValid(azureConfig.getSubscriptionId())) {
                azureConfig.setSubscriptionId(credentials.path("subscription_id").asText(null));
                logger.info("Set subscription from VCAP: {}", azureConfig.getSubscriptionId());
            }
        } catch (Exception e) {
            logger.error("Error processing VCAP_SERVICES: {}", e.getMessage(), e);
        }
    }

    private JsonNode findAzureCredentials(JsonNode vcapServicesNode) {
        for (JsonNode serviceNode : vcapServicesNode) {
            for (JsonNode service : serviceNode) {
                String serviceName = service.path("name").asText();
                if (serviceName.toLowerCase().contains("azure")) {
                    logger.info("Found Azure service: {}", serviceName);
                    return service.path("credentials");
                }
            }
        }
        return null;
    }

    private static boolean isValid(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }
}
