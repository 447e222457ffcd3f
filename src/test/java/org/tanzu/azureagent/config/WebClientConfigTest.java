package org.tanzu.azureagent.config;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.springframework.util.unit.DataSize;
import org.tanzu.azureagent.azure.AzureClientException;
import org.tanzu.azureagent.azure.AzureManagementClient;
import org.tanzu.azureagent.azure.AzureService;
import org.tanzu.azureagent.intent.IntentClassifier;
import org.tanzu.azureagent.intent.IntentHandler;
import org.tanzu.azureagent.intent.ResourceTypeMatcher;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client built from {@link WebClientConfig} against a local HTTP server,
 * so response decoding goes through the configured codecs.
 */
class WebClientConfigTest {

    private static final int DEFAULT_BUFFER_LIMIT = 256 * 1024;

    private static final String TOKEN_BODY = "{\"token_type\":\"Bearer\",\"expires_in\":3599,\"access_token\":\"tok-1\"}";

    private DisposableServer server;
    private String catalog;
    private AzureConfig config;

    @BeforeEach
    void setUp() {
        catalog = providerCatalog(5000);
        server = HttpServer.create()
                .host("localhost")
                .port(0)
                .route(routes -> routes.route(request -> true, this::handle))
                .bindNow();

        String baseUrl = "http://localhost:" + server.port();
        config = new AzureConfig();
        config.setTenantId("tenant-1");
        config.setClientId("client-1");
        config.setClientSecret("secret-1");
        config.setSubscriptionId("sub-1");
        config.setManagementEndpoint(baseUrl);
        config.setAuthorityHost(baseUrl);
        config.setRequestTimeout(Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        server.disposeNow();
    }

    private Publisher<Void> handle(HttpServerRequest request, HttpServerResponse response) {
        String uri = request.uri();
        if (uri.endsWith("/oauth2/v2.0/token")) {
            return json(response, TOKEN_BODY);
        }
        if (uri.startsWith("/subscriptions/sub-1/providers?")) {
            return json(response, catalog);
        }
        if (uri.startsWith("/providers/Microsoft.ResourceGraph/resources")) {
            return json(response, "{\"totalRecords\":0,\"count\":0,\"data\":[]}");
        }
        return response.status(HttpResponseStatus.NOT_FOUND).send();
    }

    private static Publisher<Void> json(HttpServerResponse response, String body) {
        return response.header(HttpHeaderNames.CONTENT_TYPE, "application/json")
                .sendString(Mono.just(body));
    }

    /**
     * A provider list the size of a real subscription's: one provider with many
     * filler types, then Microsoft.Network with bastionHosts.
     */
    private static String providerCatalog(int fillerTypes) {
        StringBuilder sb = new StringBuilder("{\"value\":[{\"namespace\":\"Microsoft.Filler\",")
                .append("\"registrationState\":\"Registered\",\"resourceTypes\":[");
        for (int i = 0; i < fillerTypes; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append("{\"resourceType\":\"widget").append(i).append("Pools\",")
                    .append("\"locations\":[\"West Europe\",\"North Europe\"],")
                    .append("\"apiVersions\":[\"2024-01-01\"]}");
        }
        sb.append("]},{\"namespace\":\"Microsoft.Network\",\"registrationState\":\"Registered\",")
                .append("\"resourceTypes\":[{\"resourceType\":\"bastionHosts\"}]}]}");
        return sb.toString();
    }

    private AzureManagementClient client() {
        return new AzureManagementClient(config, new WebClientConfig().webClientBuilder(config));
    }

    @Test
    void fuzzyFallbackReadsCatalogLargerThanDefaultBuffer() {
        assertTrue(catalog.length() > DEFAULT_BUFFER_LIMIT);
        IntentHandler handler = new IntentHandler(new IntentClassifier(), new ResourceTypeMatcher(),
                new AzureService(client(), config));

        assertEquals("No `bastion hosts` resources found in the current subscription.",
                handler.processQuery("do we have bastion hosts"));
    }

    @Test
    void bodyOverConfiguredLimitIsReportedAsReadFailure() {
        config.setMaxResponseSize(DataSize.ofKilobytes(64));

        AzureClientException e = assertThrows(AzureClientException.class, () -> client().providers().list());

        assertTrue(e.getMessage().startsWith("Could not read Azure response: "), e.getMessage());
        assertEquals(200, e.getStatusCode());
    }
}
