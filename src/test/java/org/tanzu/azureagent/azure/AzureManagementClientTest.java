package org.tanzu.azureagent.azure;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.tanzu.azureagent.config.AzureConfig;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AzureManagementClientTest {

    private static final String TOKEN_BODY = "{\"token_type\":\"Bearer\",\"expires_in\":3599,\"access_token\":\"tok-1\"}";

    private final List<ClientRequest> requests = new ArrayList<>();
    private final Deque<ClientResponse> tokenResponses = new ArrayDeque<>();
    private final Deque<ClientResponse> managementResponses = new ArrayDeque<>();

    private AzureConfig config;
    private Throwable managementFailure;

    @BeforeEach
    void setUp() {
        config = new AzureConfig();
        config.setTenantId("tenant-1");
        config.setClientId("client-1");
        config.setClientSecret("secret-1");
        config.setSubscriptionId("sub-1");
        config.setManagementEndpoint("https://management.test");
        config.setAuthorityHost("https://login.test");
    }

    private AzureManagementClient client() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            if (managementFailure != null && "management.test".equals(request.url().getHost())) {
                return Mono.error(managementFailure);
            }
            Deque<ClientResponse> queue = "login.test".equals(request.url().getHost()) ? tokenResponses : managementResponses;
            ClientResponse response = queue.poll();
            if (response == null) {
                return Mono.error(new AssertionError("Unexpected request " + request.method() + " " + request.url()));
            }
            return Mono.just(response);
        });
        return new AzureManagementClient(config, builder);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build();
    }

    private List<ClientRequest> tokenRequests() {
        return requests.stream().filter(r -> "login.test".equals(r.url().getHost())).toList();
    }

    private List<ClientRequest> managementRequests() {
        return requests.stream().filter(r -> "management.test".equals(r.url().getHost())).toList();
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest mock = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(mock, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return mock.getBodyAsString().block();
    }

    @Test
    void listsVirtualMachinesAcrossPagesWithBearerToken() {
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        managementResponses.add(json(HttpStatus.OK, "{\"value\":[{\"name\":\"web-01\"}],"
                + "\"nextLink\":\"https://management.test/subscriptions/sub-1/providers/Microsoft.Compute/virtualMachines?api-version=2024-07-01&%24skiptoken=abc\"}"));
        managementResponses.add(json(HttpStatus.OK, "{\"value\":[{\"name\":\"db-01\"}]}"));

        List<JsonNode> vms = client().virtualMachines().list();

        assertEquals(2, vms.size());
        assertEquals("web-01", vms.get(0).path("name").asText());
        assertEquals("db-01", vms.get(1).path("name").asText());

        ClientRequest first = managementRequests().get(0);
        assertEquals(HttpMethod.GET, first.method());
        assertEquals("/subscriptions/sub-1/providers/Microsoft.Compute/virtualMachines", first.url().getPath());
        assertEquals("api-version=2024-07-01", first.url().getQuery());
        assertEquals("Bearer tok-1", first.headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertTrue(managementRequests().get(1).url().getRawQuery().contains("%24skiptoken=abc"));
    }

    @Test
    void requestsTokenWithClientCredentials() {
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        managementResponses.add(json(HttpStatus.OK, "{\"value\":[]}"));

        client().resourceGroups().list();

        ClientRequest token = tokenRequests().get(0);
        assertEquals(HttpMethod.POST, token.method());
        assertEquals("/tenant-1/oauth2/v2.0/token", token.url().getPath());
        String form = bodyOf(token);
        assertTrue(form.contains("grant_type=client_credentials"));
        assertTrue(form.contains("client_id=client-1"));
        assertTrue(form.contains("scope=https%3A%2F%2Fmanagement.test%2F.default"));
    }

    @Test
    void reusesCachedTokenAcrossCalls() {
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        managementResponses.add(json(HttpStatus.OK, "{\"value\":[]}"));
        managementResponses.add(json(HttpStatus.OK, "{\"value\":[]}"));

        AzureManagementClient client = client();
        client.resourceGroups().list();
        client.networks().listVirtualNetworks();

        assertEquals(1, tokenRequests().size());
        assertEquals(2, managementRequests().size());
    }

    @Test
    void retriesOnceWithFreshTokenAfterUnauthorized() {
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        tokenResponses.add(json(HttpStatus.OK, "{\"expires_in\":3599,\"access_token\":\"tok-2\"}"));
        managementResponses.add(json(HttpStatus.UNAUTHORIZED,
                "{\"error\":{\"code\":\"ExpiredAuthenticationToken\",\"message\":\"The access token expiry has passed.\"}}"));
        managementResponses.add(json(HttpStatus.OK, "{\"value\":[{\"name\":\"rg-1\",\"location\":\"westeurope\"}]}"));

        List<JsonNode> groups = client().resourceGroups().list();

        assertEquals(1, groups.size());
        assertEquals(2, tokenRequests().size());
        assertEquals("Bearer tok-2", managementRequests().get(1).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void translatesAzureErrorBody() {
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        managementResponses.add(json(HttpStatus.FORBIDDEN,
                "{\"error\":{\"code\":\"AuthorizationFailed\",\"message\":\"The client does not have authorization to perform action.\"}}"));

        AzureClientException e = assertThrows(AzureClientException.class, () -> client().networks().listPublicIpAddresses());

        assertEquals("The client does not have authorization to perform action.", e.getMessage());
        assertEquals(403, e.getStatusCode());
    }

    @Test
    void reportsTokenAuthorityErrorDescription() {
        tokenResponses.add(json(HttpStatus.UNAUTHORIZED,
                "{\"error\":\"invalid_client\",\"error_description\":\"AADSTS7000215: Invalid client secret provided.\"}"));

        AzureClientException e = assertThrows(AzureClientException.class, () -> client().virtualMachines().list());

        assertTrue(e.getMessage().startsWith("AADSTS7000215"));
        assertTrue(managementRequests().isEmpty());
    }

    @Test
    void failsFastWithoutCredentials() {
        config.setClientSecret("");

        AzureClientException e = assertThrows(AzureClientException.class, () -> client().virtualMachines().list());

        assertTrue(e.getMessage().contains("AZURE_CLIENT_SECRET"));
        assertTrue(requests.isEmpty());
    }

    @Test
    void getsVirtualMachineWithInstanceView() {
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        managementResponses.add(json(HttpStatus.OK, "{\"name\":\"web-01\",\"properties\":{}}"));

        JsonNode vm = client().virtualMachines().getWithInstanceView("rg-web", "web-01");

        assertEquals("web-01", vm.path("name").asText());
        ClientRequest request = managementRequests().get(0);
        assertEquals("/subscriptions/sub-1/resourceGroups/rg-web/providers/Microsoft.Compute/virtualMachines/web-01",
                request.url().getPath());
        assertTrue(request.url().getQuery().contains("$expand=instanceView"));
    }

    @Test
    void listsMetricsForResource() {
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        managementResponses.add(json(HttpStatus.OK, "{\"value\":[]}"));

        String resourceId = "/subscriptions/sub-1/resourceGroups/rg-web/providers/Microsoft.Compute/virtualMachines/web-01";
        client().monitor().list(resourceId, List.of("Percentage CPU"), "PT1H", "PT1M", "Average");

        ClientRequest request = managementRequests().get(0);
        assertEquals(resourceId + "/providers/Microsoft.Insights/metrics", request.url().getPath());
        String query = request.url().getQuery();
        assertTrue(query.contains("metricnames=Percentage CPU"));
        assertTrue(query.contains("timespan=PT1H"));
        assertTrue(query.contains("aggregation=Average"));
    }

    @Test
    void runsResourceGraphQueryAcrossSkipTokens() {
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        managementResponses.add(json(HttpStatus.OK,
                "{\"totalRecords\":2,\"count\":1,\"data\":[{\"name\":\"kv-1\"}],\"$skipToken\":\"page-2\"}"));
        managementResponses.add(json(HttpStatus.OK,
                "{\"totalRecords\":2,\"count\":1,\"data\":[{\"name\":\"kv-2\"}]}"));

        List<JsonNode> rows = client().resourceGraph().query("Resources | where type =~ 'microsoft.keyvault/vaults'");

        assertEquals(2, rows.size());
        ClientRequest first = managementRequests().get(0);
        assertEquals(HttpMethod.POST, first.method());
        assertEquals("/providers/Microsoft.ResourceGraph/resources", first.url().getPath());
        String firstBody = bodyOf(first);
        assertTrue(firstBody.contains("\"subscriptions\":[\"sub-1\"]"));
        assertTrue(firstBody.contains("\"resultFormat\":\"objectArray\""));
        assertFalse(firstBody.contains("$skipToken"));
        assertTrue(bodyOf(managementRequests().get(1)).contains("\"$skipToken\":\"page-2\""));
    }

    @Test
    void renewsTokenThatExpiresWithinMargin() {
        tokenResponses.add(json(HttpStatus.OK, "{\"expires_in\":60,\"access_token\":\"short-lived\"}"));
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        managementResponses.add(json(HttpStatus.OK, "{\"value\":[]}"));
        managementResponses.add(json(HttpStatus.OK, "{\"value\":[]}"));

        AzureManagementClient client = client();
        client.resourceGroups().list();
        client.resourceGroups().list();

        assertEquals(2, tokenRequests().size());
        assertEquals("Bearer short-lived", managementRequests().get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("Bearer tok-1", managementRequests().get(1).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void reportsTransportFailureAsConnectionIssue() {
        tokenResponses.add(json(HttpStatus.OK, TOKEN_BODY));
        managementFailure = new WebClientRequestException(new ConnectException("Connection refused"), HttpMethod.GET,
                URI.create("https://management.test/subscriptions/sub-1/resourcegroups"), HttpHeaders.EMPTY);

        AzureClientException e = assertThrows(AzureClientException.class, () -> client().resourceGroups().list());

        assertTrue(e.getMessage().startsWith("Connection issue when calling Azure: "), e.getMessage());
        assertTrue(e.getMessage().contains("Connection refused"));
        assertEquals(0, e.getStatusCode());
    }
}
