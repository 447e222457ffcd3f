package org.tanzu.azureagent.azure;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.tanzu.azureagent.config.AzureConfig;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Read-only inventory operations over the Azure subscription.
 *
 * This service sits between the intent handler and the raw Resource Manager
 * client. It turns JSON responses into small typed records and resolves
 * user-friendly VM names to resources. Every method either returns data or
 * throws {@link AzureClientException}; failures are logged here before they
 * propagate.
 */
@Service
public class AzureService {

    private static final Logger logger = LoggerFactory.getLogger(AzureService.class);

    /** Number of most recent data points kept per metric */
    static final int METRIC_POINTS = 5;

    private static final Pattern RESOURCE_TYPE_PATTERN = Pattern.compile("[A-Za-z0-9.]+(/[A-Za-z0-9]+)+");

    private final AzureManagementClient client;
    private final AzureConfig azureConfig;

    public AzureService(AzureManagementClient client, AzureConfig azureConfig) {
        this.client = client;
        this.azureConfig = azureConfig;
        logger.info("AzureService initialized with AzureManagementClient");
    }

    /**
     * @return the subscription the inventory is read from
     */
    public String getSubscriptionId() {
        return azureConfig.getSubscriptionId();
    }

    /**
     * Lists all virtual machines in the subscription.
     *
     * The power state is not part of the list response; use {@link #getVmStatus}
     * for it.
     *
     * @return one VmInfo per virtual machine
     */
    public List<VmInfo> listVms() {
        try {
            List<VmInfo> result = new ArrayList<>();
            for (JsonNode vm : client.virtualMachines().list()) {
                JsonNode properties = vm.path("properties");
                String id = vm.path("id").asText(null);
                result.add(new VmInfo(
                    vm.path("name").asText(),
                    resourceGroupOf(id),
                    vm.path("location").asText(),
                    properties.path("hardwareProfile").path("vmSize").asText(""),
                    properties.path("storageProfile").path("osDisk").path("osType").asText(""),
                    properties.path("provisioningState").asText(""),
                    id
                ));
            }
            logger.info("Retrieved {} VMs from subscription {}", result.size(), getSubscriptionId());
            return result;
        } catch (AzureClientException e) {
            logger.error("Error listing VMs: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Finds a virtual machine by name, ignoring case.
     *
     * When several VMs share the name (in different resource groups) the first
     * one listed wins and a warning is logged.
     *
     * @param vmName The friendly name of the VM
     * @return the matching VM, or null if there is none
     */
    public VmInfo findVmByName(String vmName) {
        VmInfo found = null;
        int matchCount = 0;
        for (VmInfo vm : listVms()) {
            if (vm.getName().equalsIgnoreCase(vmName)) {
                if (found == null) {
                    found = vm;
                }
                matchCount++;
            }
        }
        if (matchCount > 1) {
            logger.warn("Found {} VMs with the same name '{}'. Using the one in resource group '{}'.",
                    matchCount, vmName, found.getResourceGroup());
        }
        return found;
    }

    /**
     * Gets the runtime status of a virtual machine from its instance view.
     *
     * @param resourceGroup Resource group of the VM
     * @param vmName Name of the VM
     * @return the VM status; power state is "Unknown" when Azure reports none
     */
    public VmStatus getVmStatus(String resourceGroup, String vmName) {
        try {
            JsonNode vm = client.virtualMachines().getWithInstanceView(resourceGroup, vmName);
            JsonNode properties = vm.path("properties");

            String powerState = "Unknown";
            for (JsonNode status : properties.path("instanceView").path("statuses")) {
                if (status.path("code").asText("").startsWith("PowerState/")) {
                    powerState = status.path("displayStatus").asText(powerState);
                    break;
                }
            }

            return new VmStatus(
                vm.path("name").asText(vmName),
                powerState,
                properties.path("provisioningState").asText(""),
                properties.path("hardwareProfile").path("vmSize").asText(""),
                vm.path("location").asText("")
            );
        } catch (AzureClientException e) {
            logger.error("Error getting VM status for {}/{}: {}", resourceGroup, vmName, e.getMessage());
            throw e;
        }
    }

    /**
     * Fetches the latest averaged values of the given metrics for a resource.
     *
     * @param resourceId Full resource ID
     * @param metricNames Azure Monitor metric names
     * @param timespan ISO-8601 window ending now, e.g. "PT1H"
     * @return one series per metric returned, each with at most the last five values
     */
    public List<MetricSeries> getMetrics(String resourceId, List<String> metricNames, String timespan) {
        try {
            JsonNode response = client.monitor().list(resourceId, metricNames, timespan, "PT1M", "Average");
            List<MetricSeries> result = new ArrayList<>();
            for (JsonNode metric : response.path("value")) {
                String name = metric.path("name").path("localizedValue").asText(metric.path("name").path("value").asText());
                List<Double> values = new ArrayList<>();
                JsonNode timeseries = metric.path("timeseries");
                if (timeseries.size() > 0) {
                    for (JsonNode point : timeseries.get(0).path("data")) {
                        JsonNode average = point.get("average");
                        if (average != null && average.isNumber()) {
                            values.add(round(average.asDouble()));
                        }
                    }
                }
                List<Double> latest = values.size() > METRIC_POINTS
                        ? new ArrayList<>(values.subList(values.size() - METRIC_POINTS, values.size()))
                        : values;
                result.add(new MetricSeries(name, metric.path("unit").asText(""), latest));
            }
            logger.info("Retrieved {} metric series for {}", result.size(), resourceId);
            return result;
        } catch (AzureClientException e) {
            logger.error("Error fetching metrics for {}: {}", resourceId, e.getMessage());
            throw e;
        }
    }

    /**
     * Lists the resource groups of the subscription.
     *
     * @return one ResourceGroupInfo per group
     */
    public List<ResourceGroupInfo> listResourceGroups() {
        try {
            List<ResourceGroupInfo> result = new ArrayList<>();
            for (JsonNode group : client.resourceGroups().list()) {
                result.add(new ResourceGroupInfo(group.path("name").asText(), group.path("location").asText()));
            }
            logger.info("Retrieved {} resource groups", result.size());
            return result;
        } catch (AzureClientException e) {
            logger.error("Error listing resource groups: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Lists all virtual networks with their address prefixes.
     *
     * @return one VnetInfo per virtual network
     */
    public List<VnetInfo> listVirtualNetworks() {
        try {
            List<VnetInfo> result = new ArrayList<>();
            for (JsonNode vnet : client.networks().listVirtualNetworks()) {
                List<String> prefixes = new ArrayList<>();
                vnet.path("properties").path("addressSpace").path("addressPrefixes")
                        .forEach(prefix -> prefixes.add(prefix.asText()));
                String id = vnet.path("id").asText(null);
                result.add(new VnetInfo(vnet.path("name").asText(), resourceGroupOf(id),
                        vnet.path("location").asText(), prefixes));
            }
            logger.info("Retrieved {} virtual networks", result.size());
            return result;
        } catch (AzureClientException e) {
            logger.error("Error listing virtual networks: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Lists all public IP addresses; unassigned ones report "N/A".
     *
     * @return one PublicIpInfo per address resource
     */
    public List<PublicIpInfo> listPublicIps() {
        try {
            List<PublicIpInfo> result = new ArrayList<>();
            for (JsonNode ip : client.networks().listPublicIpAddresses()) {
                String id = ip.path("id").asText(null);
                result.add(new PublicIpInfo(
                    ip.path("name").asText(),
                    ip.path("properties").path("ipAddress").asText("N/A"),
                    resourceGroupOf(id),
                    ip.path("location").asText(),
                    ip.path("sku").path("name").asText("")
                ));
            }
            logger.info("Retrieved {} public IP addresses", result.size());
            return result;
        } catch (AzureClientException e) {
            logger.error("Error listing public IPs: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Lists resources of one provider type through Resource Graph.
     *
     * @param providerType Resource type such as "Microsoft.KeyVault/vaults"; matched case-insensitively
     * @return the matching resources ordered by name
     */
    public List<GenericResource> queryResources(String providerType) {
        if (providerType == null || !RESOURCE_TYPE_PATTERN.matcher(providerType).matches()) {
            throw new IllegalArgumentException("Not a resource provider type: " + providerType);
        }
        String query = "Resources | where type =~ '" + providerType + "'"
                + " | project name, resourceGroup, location, type | order by name asc";
        try {
            List<GenericResource> result = new ArrayList<>();
            for (JsonNode row : client.resourceGraph().query(query)) {
                result.add(new GenericResource(
                    row.path("name").asText(),
                    row.path("resourceGroup").asText(),
                    row.path("location").asText(),
                    row.path("type").asText(providerType)
                ));
            }
            logger.info("Resource graph found {} resources of type {}", result.size(), providerType);
            return result;
        } catch (AzureClientException e) {
            logger.error("Error querying resources of type {}: {}", providerType, e.getMessage());
            throw e;
        }
    }

    /**
     * Lists the top-level resource types of every registered provider.
     *
     * Nested types such as "virtualMachines/extensions" are left out.
     *
     * @return the live resource-type catalog of the subscription
     */
    public List<ResourceTypeInfo> listResourceTypes() {
        try {
            List<ResourceTypeInfo> result = new ArrayList<>();
            for (JsonNode provider : client.providers().list()) {
                if (!"Registered".equalsIgnoreCase(provider.path("registrationState").asText())) {
                    continue;
                }
                String namespace = provider.path("namespace").asText();
                for (JsonNode type : provider.path("resourceTypes")) {
                    String resourceType = type.path("resourceType").asText("");
                    if (!resourceType.isEmpty() && !resourceType.contains("/")) {
                        result.add(new ResourceTypeInfo(namespace, resourceType));
                    }
                }
            }
            logger.info("Resource type catalog has {} top-level types", result.size());
            return result;
        } catch (AzureClientException e) {
            logger.error("Error listing resource providers: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Extracts the resource group segment of a resource ID.
     *
     * @param resourceId ID of the form /subscriptions/{sub}/resourceGroups/{rg}/...
     * @return the resource group, or "Unknown" when the ID is absent or too short
     */
    static String resourceGroupOf(String resourceId) {
        if (resourceId == null || resourceId.isEmpty()) {
            return "Unknown";
        }
        String[] segments = resourceId.split("/");
        return segments.length > 4 ? segments[4] : "Unknown";
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Summary of a virtual machine as returned by the subscription-wide list.
     */
    public static class VmInfo {
        private final String name;
        private final String resourceGroup;
        private final String location;
        private final String size;
        private final String osType;
        private final String provisioningState;
        private final String id;

        public VmInfo(String name, String resourceGroup, String location, String size,
                      String osType, String provisioningState, String id) {
            this.name = name;
            this.resourceGroup = resourceGroup;
            this.location = location;
            this.size = size;
            this.osType = osType;
            this.provisioningState = provisioningState;
            this.id = id;
        }

        public String getName() { return name; }
        public String getResourceGroup() { return resourceGroup; }
        public String getLocation() { return location; }
        public String getSize() { return size; }
        public String getOsType() { return osType; }
        public String getProvisioningState() { return provisioningState; }
        public String getId() { return id; }

        @Override
        public String toString() {
            return "VmInfo{name='" + name + "', resourceGroup='" + resourceGroup + "', location='" + location
                    + "', size='" + size + "', osType='" + osType + "', provisioningState='" + provisioningState + "'}";
        }
    }

    /**
     * Runtime status of a virtual machine.
     */
    public static class VmStatus {
        private final String name;
        private final String powerState;
        private final String provisioningState;
        private final String size;
        private final String location;

        public VmStatus(String name, String powerState, String provisioningState, String size, String location) {
            this.name = name;
            this.powerState = powerState;
            this.provisioningState = provisioningState;
            this.size = size;
            this.location = location;
        }

        public String getName() { return name; }
        public String getPowerState() { return powerState; }
        public String getProvisioningState() { return provisioningState; }
        public String getSize() { return size; }
        public String getLocation() { return location; }

        @Override
        public String toString() {
            return "VmStatus{name='" + name + "', powerState='" + powerState + "', provisioningState='"
                    + provisioningState + "', size='" + size + "', location='" + location + "'}";
        }
    }

    /**
     * Latest averaged values of one metric, oldest first.
     */
    public static class MetricSeries {
        private final String name;
        private final String unit;
        private final List<Double> values;

        public MetricSeries(String name, String unit, List<Double> values) {
            this.name = name;
            this.unit = unit;
            this.values = List.copyOf(values);
        }

        public String getName() { return name; }
        public String getUnit() { return unit; }
        public List<Double> getValues() { return values; }

        @Override
        public String toString() {
            return "MetricSeries{name='" + name + "', unit='" + unit + "', values=" + values + "}";
        }
    }

    public static class ResourceGroupInfo {
        private final String name;
        private final String location;

        public ResourceGroupInfo(String name, String location) {
            this.name = name;
            this.location = location;
        }

        public String getName() { return name; }
        public String getLocation() { return location; }

        @Override
        public String toString() {
            return "ResourceGroupInfo{name='" + name + "', location='" + location + "'}";
        }
    }

    public static class VnetInfo {
        private final String name;
        private final String resourceGroup;
        private final String location;
        private final List<String> addressPrefixes;

        public VnetInfo(String name, String resourceGroup, String location, List<String> addressPrefixes) {
            this.name = name;
            this.resourceGroup = resourceGroup;
            this.location = location;
            this.addressPrefixes = List.copyOf(addressPrefixes);
        }

        public String getName() { return name; }
        public String getResourceGroup() { return resourceGroup; }
        public String getLocation() { return location; }
        public List<String> getAddressPrefixes() { return addressPrefixes; }

        @Override
        public String toString() {
            return "VnetInfo{name='" + name + "', resourceGroup='" + resourceGroup + "', location='" + location
                    + "', addressPrefixes=" + addressPrefixes + "}";
        }
    }

    public static class PublicIpInfo {
        private final String name;
        private final String ipAddress;
        private final String resourceGroup;
        private final String location;
        private final String sku;

        public PublicIpInfo(String name, String ipAddress, String resourceGroup, String location, String sku) {
            this.name = name;
            this.ipAddress = ipAddress;
            this.resourceGroup = resourceGroup;
            this.location = location;
            this.sku = sku;
        }

        public String getName() { return name; }
        public String getIpAddress() { return ipAddress; }
        public String getResourceGroup() { return resourceGroup; }
        public String getLocation() { return location; }
        public String getSku() { return sku; }

        @Override
        public String toString() {
            return "PublicIpInfo{name='" + name + "', ipAddress='" + ipAddress + "', resourceGroup='"
                    + resourceGroup + "', location='" + location + "', sku='" + sku + "'}";
        }
    }

    /**
     * A resource of any type as projected by Resource Graph.
     */
    public static class GenericResource {
        private final String name;
        private final String resourceGroup;
        private final String location;
        private final String type;

        public GenericResource(String name, String resourceGroup, String location, String type) {
            this.name = name;
            this.resourceGroup = resourceGroup;
            this.location = location;
            this.type = type;
        }

        public String getName() { return name; }
        public String getResourceGroup() { return resourceGroup; }
        public String getLocation() { return location; }
        public String getType() { return type; }

        /**
         * @return the last segment of the type, e.g. "vaults" for Microsoft.KeyVault/vaults
         */
        public String getShortType() {
            int slash = type.lastIndexOf('/');
            return slash >= 0 ? type.substring(slash + 1) : type;
        }

        @Override
        public String toString() {
            return "GenericResource{name='" + name + "', resourceGroup='" + resourceGroup + "', location='"
                    + location + "', type='" + type + "'}";
        }
    }

    /**
     * One entry of the resource-type catalog, e.g. Microsoft.Network / bastionHosts.
     */
    public static class ResourceTypeInfo {
        private final String namespace;
        private final String resourceType;

        public ResourceTypeInfo(String namespace, String resourceType) {
            this.namespace = namespace;
            this.resourceType = resourceType;
        }

        public String getNamespace() { return namespace; }
        public String getResourceType() { return resourceType; }
        public String getFullType() { return namespace + "/" + resourceType; }

        @Override
        public String toString() {
            return "ResourceTypeInfo{" + getFullType() + "}";
        }
    }
}
