/**
 * Configuration for the Azure Agent.
 *
 * <p>Provides Azure service principal settings ({@link org.tanzu.azureagent.config.AzureConfig}),
 * startup validation with Cloud Foundry VCAP_SERVICES fallback ({@link org.tanzu.azureagent.config.AzureConfigProcessor}),
 * WebClient setup with timeouts ({@link org.tanzu.azureagent.config.WebClientConfig}), CORS for browser front ends
 * and MCP tool registration.
 */
package org.tanzu.azureagent.config;
