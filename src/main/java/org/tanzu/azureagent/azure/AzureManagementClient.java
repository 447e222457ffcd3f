package org.tanzu.azureagent.azure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import org.tanzu.azureagent.config.AzureConfig;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Client for the Azure Resource Manager REST API.
 *
 * This client speaks to the management plane directly over HTTPS using Spring
 * WebClient, authenticating as a service principal through the OAuth2
 * client-credentials grant. It handles:
 * - Access token acquisition and caching until shortly before expiry
 * - A single retry with a fresh token when Resource Manager answers 401
 * - Paging through nextLink (list APIs) and $skipToken (Resource Graph)
 * - Translation of Azure error bodies into {@link AzureClientException}
 *
 * Operations are grouped into sub-services mirroring the Resource Manager
 * providers they call. Every operation is read-only.
 */
@Component
public class AzureManagementClient {

    private static final Logger logger = LoggerFactory.getLogger(AzureManagementClient.class);

    static final String COMPUTE_API_VERSION = "2024-07-01";
    static final String NETWORK_API_VERSION = "2024-05-01";
    static final String RESOURCES_API_VERSION = "2021-04-01";
    static final String MONITOR_API_VERSION = "2018-01-01";
    static final String RESOURCE_GRAPH_API_VERSION = "2021-03-01";

    private static final String TOKEN_KEY = "management";

    /** Seconds shaved off a token's lifetime so it is renewed before Azure rejects it */
    private static final long TOKEN_EXPIRY_MARGIN_SECONDS = 60;

    private final AzureConfig azureConfig;
    private final WebClient managementClient;
    private final WebClient authorityClient;
    private final ObjectMapper objectMapper;

    /** Thread-safe cache for the management-plane access token */
    private final ConcurrentHashMap<String, AccessToken> accessTokens = new ConcurrentHashMap<>();

    private final VirtualMachineService virtualMachineService = new VirtualMachineService();
    private final ResourceGroupService resourceGroupService = new ResourceGroupService();
    private final NetworkService networkService = new NetworkService();
    private final MonitorService monitorService = new MonitorService();
    private final ResourceGraphService resourceGraphService = new ResourceGraphService();
    private final ProviderService providerService = new ProviderService();

    /**
     * Constructs a new client against the configured endpoints.
     *
     * @param azureConfig Service principal and endpoint settings
     * @param webClientBuilder Pre-configured WebClient.Builder with timeouts
     */
    public AzureManagementClient(AzureConfig azureConfig, WebClient.Builder webClientBuilder) {
        this.azureConfig = azureConfig;
        this.objectMapper = new ObjectMapper();

        logger.info("Initializing AzureManagementClient for {} (authority {})",
                azureConfig.getManagementEndpoint(), azureConfig.getAuthorityHost());

        this.managementClient = webClientBuilder.clone()
            .baseUrl(azureConfig.getManagementEndpoint())
            .build();
        this.authorityClient = webClientBuilder.clone()
            .baseUrl(azureConfig.getAuthorityHost())
            .build();
    }

    public VirtualMachineService virtualMachines() {
        return virtualMachineService;
    }

    public ResourceGroupService resourceGroups() {
        return resourceGroupService;
    }

    public NetworkService networks() {
        return networkService;
    }

    public MonitorService monitor() {
        return monitorService;
    }

    public ResourceGraphService resourceGraph() {
        return resourceGraphService;
    }

    public ProviderService providers() {
        return providerService;
    }

    /**
     * Virtual machine operations (Microsoft.Compute).
     */
    public class VirtualMachineService {

        /**
         * Lists every virtual machine in the subscription.
         *
         * @return the raw VM resources, all pages concatenated
         */
        public List<JsonNode> list() {
            logger.info("ARM: list virtual machines");
            return listAll(subscriptionPath("/providers/Microsoft.Compute/virtualMachines"),
                    apiVersion(COMPUTE_API_VERSION));
        }

        /**
         * Gets a single virtual machine including its instance view.
         *
         * @param resourceGroup Resource group of the VM
         * @param vmName Name of the VM
         * @return the VM resource with properties.instanceView populated
         */
        public JsonNode getWithInstanceView(String resourceGroup, String vmName) {
            logger.info("ARM: get virtual machine {}/{}", resourceGroup, vmName);
            Map<String, String> query = apiVersion(COMPUTE_API_VERSION);
            query.put("$expand", "instanceView");
            return get(subscriptionPath("/resourceGroups/" + resourceGroup
                    + "/providers/Microsoft.Compute/virtualMachines/" + vmName), query);
        }
    }

    /**
     * Resource group operations (Microsoft.Resources).
     */
    public class ResourceGroupService {

        public List<JsonNode> list() {
            logger.info("ARM: list resource groups");
            return listAll(subscriptionPath("/resourcegroups"), apiVersion(RESOURCES_API_VERSION));
        }
    }

    /**
     * Networking operations (Microsoft.Network).
     */
    public class NetworkService {

        public List<JsonNode> listVirtualNetworks() {
            logger.info("ARM: list virtual networks");
            return listAll(subscriptionPath("/providers/Microsoft.Network/virtualNetworks"),
                    apiVersion(NETWORK_API_VERSION));
        }

        public List<JsonNode> listPublicIpAddresses() {
            logger.info("ARM: list public IP addresses");
            return listAll(subscriptionPath("/providers/Microsoft.Network/publicIPAddresses"),
                    apiVersion(NETWORK_API_VERSION));
        }
    }

    /**
     * Azure Monitor metric operations (Microsoft.Insights).
     */
    public class MonitorService {

        /**
         * Lists metric time series for a resource.
         *
         * @param resourceId Full resource ID, starting with /subscriptions/
         * @param metricNames Metric names as Azure Monitor defines them, e.g. "Percentage CPU"
         * @param timespan ISO-8601 duration of the window ending now, e.g. "PT1H"
         * @param interval ISO-8601 grain, e.g. "PT1M"
         * @param aggregation Aggregation type, e.g. "Average"
         * @return the metrics response; its "value" array holds one entry per metric
         */
        public JsonNode list(String resourceId, List<String> metricNames, String timespan,
                             String interval, String aggregation) {
            logger.info("ARM: list metrics {} for {}", metricNames, resourceId);
            Map<String, String> query = apiVersion(MONITOR_API_VERSION);
            query.put("timespan", timespan);
            query.put("interval", interval);
            query.put("metricnames", String.join(",", metricNames));
            query.put("aggregation", aggregation);
            return get(resourceId + "/providers/Microsoft.Insights/metrics", query);
        }
    }

    /**
     * Resource Graph queries (Microsoft.ResourceGraph).
     */
    public class ResourceGraphService {

        /**
         * Runs a Resource Graph query scoped to the configured subscription.
         *
         * @param query Kusto query text
         * @return the result rows as objects, all pages concatenated
         */
        public List<JsonNode> query(String query) {
            logger.info("ARM: resource graph query [{}]", query);
            List<JsonNode> rows = new ArrayList<>();
            String skipToken = null;
            do {
                ObjectNode body = objectMapper.createObjectNode();
                body.putArray("subscriptions").add(requireSubscriptionId());
                body.put("query", query);
                ObjectNode options = body.putObject("options");
                options.put("resultFormat", "objectArray");
                if (skipToken != null) {
                    options.put("$skipToken", skipToken);
                }

                JsonNode response = post("/providers/Microsoft.ResourceGraph/resources",
                        apiVersion(RESOURCE_GRAPH_API_VERSION), body);
                response.path("data").forEach(rows::add);
                skipToken = response.path("$skipToken").asText(null);
            } while (skipToken != null && !skipToken.isEmpty());
            logger.debug("Resource graph returned {} rows", rows.size());
            return rows;
        }
    }

    /**
     * Resource provider catalog operations (Microsoft.Resources).
     */
    public class ProviderService {

        /**
         * Lists the resource providers of the subscription with their resource types.
         *
         * @return provider entries carrying namespace, registrationState and resourceTypes
         */
        public List<JsonNode> list() {
            logger.info("ARM: list resource providers");
            return listAll(subscriptionPath("/providers"), apiVersion(RESOURCES_API_VERSION));
        }
    }

    private List<JsonNode> listAll(String path, Map<String, String> query) {
        List<JsonNode> items = new ArrayList<>();
        JsonNode page = get(path, query);
        int pages = 1;
        while (true) {
            page.path("value").forEach(items::add);
            String nextLink = page.path("nextLink").asText(null);
            if (nextLink == null || nextLink.isEmpty()) {
                break;
            }
            pages++;
            logger.debug("Following nextLink (page {}) for {}", pages, path);
            URI next = URI.create(nextLink);
            page = execute("GET " + path, token -> managementClient.get()
                    .uri(next)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token));
        }
        logger.debug("Listed {} items from {} in {} page(s)", items.size(), path, pages);
        return items;
    }

    private JsonNode get(String path, Map<String, String> query) {
        return execute("GET " + path, token -> managementClient.get()
                .uri(uri(path, query))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token));
    }

    private JsonNode post(String path, Map<String, String> query, JsonNode body) {
        String requestBody = writeJson(body);
        return execute("POST " + path, token -> managementClient.post()
                .uri(uri(path, query))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody));
    }

    /**
     * Sends a request with the cached token, retrying once with a fresh token on 401.
     */
    private JsonNode execute(String description, Function<String, WebClient.RequestHeadersSpec<?>> request) {
        try {
            try {
                return send(request, getValidAccessToken());
            } catch (WebClientResponseException.Unauthorized e) {
                logger.warn("Received 401 Unauthorized for {}, clearing cached access token and retrying once", description);
                accessTokens.remove(TOKEN_KEY);
                return send(request, getValidAccessToken());
            }
        } catch (WebClientException e) {
            throw translate(description, e);
        }
    }

    private JsonNode send(Function<String, WebClient.RequestHeadersSpec<?>> request, String token) {
        String response = request.apply(token)
            .retrieve()
            .bodyToMono(String.class)
            .block();
        if (response == null || response.trim().isEmpty()) {
            return objectMapper.createObjectNode();
        }
        return readJson(response);
    }

    /**
     * Returns a cached access token, requesting a new one when it is missing or about to expire.
     */
    private String getValidAccessToken() {
        AccessToken cached = accessTokens.get(TOKEN_KEY);
        if (cached != null && cached.isValidAt(Instant.now())) {
            return cached.value;
        }

        logger.info("No valid cached access token, requesting a new one for tenant {}", azureConfig.getTenantId());
        if (isBlank(azureConfig.getTenantId()) || isBlank(azureConfig.getClientId())
                || isBlank(azureConfig.getClientSecret())) {
            throw new AzureClientException(
                    "Azure credentials are not configured (AZURE_TENANT_ID, AZURE_CLIENT_ID, AZURE_CLIENT_SECRET)");
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", azureConfig.getClientId());
        form.add("client_secret", azureConfig.getClientSecret());
        form.add("scope", azureConfig.getTokenScope());

        String response;
        try {
            response = authorityClient.post()
                .uri("/{tenant}/oauth2/v2.0/token", azureConfig.getTenantId())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(String.class)
                .block();
        } catch (WebClientException e) {
            throw translate("token request", e);
        }

        JsonNode tokenNode = readJson(response == null ? "{}" : response);
        String token = tokenNode.path("access_token").asText(null);
        if (token == null || token.isEmpty()) {
            throw new AzureClientException("Token response did not contain an access_token");
        }
        long expiresIn = tokenNode.path("expires_in").asLong(3600);
        Instant expiresAt = Instant.now().plusSeconds(Math.max(0, expiresIn - TOKEN_EXPIRY_MARGIN_SECONDS));
        accessTokens.put(TOKEN_KEY, new AccessToken(token, expiresAt));
        logger.info("Obtained access token, valid until {}", expiresAt);
        return token;
    }

    private AzureClientException translate(String description, WebClientException e) {
        if (e instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) e;
            if (response.getStatusCode().is2xxSuccessful()) {
                // the call succeeded but its body could not be read, e.g. it exceeded the buffer limit
                String cause = response.getMostSpecificCause().getMessage();
                logger.error("Azure call {} returned a body that could not be read: {}", description, cause, e);
                return new AzureClientException("Could not read Azure response: " + cause,
                        response.getStatusCode().value(), e);
            }
            String message = extractErrorMessage(response.getResponseBodyAsString());
            if (message == null) {
                message = response.getStatusCode().value() + " " + response.getStatusText();
            }
            logger.error("Azure call {} failed with {}: {}", description, response.getStatusCode().value(), message);
            return new AzureClientException(message, response.getStatusCode().value(), e);
        }
        logger.error("Azure call {} failed: {}", description, e.getMessage(), e);
        return new AzureClientException("Connection issue when calling Azure: " + e.getMessage(), e);
    }

    /**
     * Pulls the human-readable message out of an Azure error body.
     *
     * Resource Manager uses {"error":{"code":..,"message":..}} while the token
     * authority uses {"error":"..","error_description":".."}.
     */
    private String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode error = node.path("error");
            if (error.isObject() && error.hasNonNull("message")) {
                return error.get("message").asText();
            }
            if (node.hasNonNull("error_description")) {
                return node.get("error_description").asText();
            }
            if (error.isTextual()) {
                return error.asText();
            }
        } catch (JsonProcessingException e) {
            logger.debug("Azure error body is not JSON: {}", body);
        }
        return null;
    }

    private String subscriptionPath(String suffix) {
        return "/subscriptions/" + requireSubscriptionId() + suffix;
    }

    private String requireSubscriptionId() {
        String subscriptionId = azureConfig.getSubscriptionId();
        if (isBlank(subscriptionId)) {
            throw new AzureClientException("Azure subscription is not configured (AZURE_SUBSCRIPTION_ID)");
        }
        return subscriptionId;
    }

    private static Map<String, String> apiVersion(String version) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("api-version", version);
        return query;
    }

    private static Function<UriBuilder, URI> uri(String path, Map<String, String> query) {
        return builder -> {
            builder.path(path);
            query.forEach((name, value) -> builder.queryParam(name, value));
            return builder.build();
        };
    }

    private JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AzureClientException("Invalid JSON received from Azure: " + e.getOriginalMessage(), e);
        }
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AzureClientException("Could not serialize request body: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Cached bearer token with the instant after which it must be renewed.
     */
    private static final class AccessToken {
        private final String value;
        private final Instant renewAt;

        private AccessToken(String value, Instant renewAt) {
            this.value = value;
            this.renewAt = renewAt;
        }

        private boolean isValidAt(Instant now) {
            return now.isBefore(renewAt);
        }
    }
}
