package org.tanzu.azureagent.config;

import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Configuration class for the WebClient used to talk to Azure.
 *
 * The same builder backs both the token authority and the Resource Manager
 * endpoint. Each outbound call is bounded by the configured request timeout at
 * the connection level, so a stalled management call cannot hold a chat
 * request open indefinitely. Response bodies are buffered whole, up to
 * azure.max-response-size.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates a WebClient.Builder with JSON headers and Reactor Netty timeouts.
     *
     * @param azureConfig The Azure configuration containing the request timeout and response size limit
     * @return A configured WebClient.Builder
     */
    @Bean
    public WebClient.Builder webClientBuilder(AzureConfig azureConfig) {
        Duration timeout = azureConfig.getRequestTimeout();
        int maxInMemorySize = (int) Math.min(azureConfig.getMaxResponseSize().toBytes(), Integer.MAX_VALUE);
        logger.info("Configuring WebClient.Builder for Azure: {} (timeout={}, maxResponseSize={})",
                azureConfig.getManagementEndpoint(), timeout, azureConfig.getMaxResponseSize());

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE))
            .responseTimeout(timeout);

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
            .defaultHeader("Accept", "application/json");
    }
}
