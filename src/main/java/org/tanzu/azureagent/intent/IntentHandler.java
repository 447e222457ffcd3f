package org.tanzu.azureagent.intent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.tanzu.azureagent.azure.AzureClientException;
import org.tanzu.azureagent.azure.AzureService;
import org.tanzu.azureagent.azure.AzureService.GenericResource;
import org.tanzu.azureagent.azure.AzureService.MetricSeries;
import org.tanzu.azureagent.azure.AzureService.PublicIpInfo;
import org.tanzu.azureagent.azure.AzureService.ResourceGroupInfo;
import org.tanzu.azureagent.azure.AzureService.ResourceTypeInfo;
import org.tanzu.azureagent.azure.AzureService.VmInfo;
import org.tanzu.azureagent.azure.AzureService.VmStatus;
import org.tanzu.azureagent.azure.AzureService.VnetInfo;
import org.tanzu.azureagent.intent.IntentClassifier.ClassifiedQuery;

import java.util.List;

/**
 * Answers an operator query: classifies it, runs the one matching read-only
 * inventory operation and renders the result as Markdown.
 *
 * Azure failures are turned into an "Error ..." answer instead of propagating,
 * so the chat surface always has something to show.
 */
@Service
public class IntentHandler {

    private static final Logger logger = LoggerFactory.getLogger(IntentHandler.class);

    static final String METRICS_TIMESPAN = "PT1H";

    private final IntentClassifier classifier;
    private final ResourceTypeMatcher resourceTypeMatcher;
    private final AzureService azure;

    public IntentHandler(IntentClassifier classifier, ResourceTypeMatcher resourceTypeMatcher, AzureService azure) {
        this.classifier = classifier;
        this.resourceTypeMatcher = resourceTypeMatcher;
        this.azure = azure;
    }

    /**
     * Parses a query, fetches the data and returns a Markdown answer.
     *
     * @param query free text such as "show all vms" or "cpu for web-01"
     * @return the answer; never null
     */
    public String processQuery(String query) {
        logger.info("Processing query: {}", query);
        ClassifiedQuery classified = classifier.classify(query);
        logger.debug("Classified as {}", classified);

        switch (classified.getIntent()) {
            case LIST_VMS:
                return handleListVms();
            case VM_STATUS:
                return handleVmStatus(classified.getTarget());
            case METRICS:
                return handleMetrics(classified.getTarget(), classified.getMetricKind());
            case LIST_RESOURCE_GROUPS:
                return handleListResourceGroups();
            case LIST_VNETS:
                return handleListVnets();
            case LIST_PUBLIC_IPS:
                return handleListPublicIps();
            case GENERIC_DISCOVERY:
                return handleGenericDiscovery(classified.getKeyword(), classified.getProviderType());
            default:
                return handleUnknown(query);
        }
    }

    private String handleListVms() {
        try {
            List<VmInfo> vms = azure.listVms();
            return MarkdownFormatter.virtualMachines(azure.getSubscriptionId(), vms);
        } catch (AzureClientException e) {
            return "Error fetching VMs: " + e.getMessage();
        }
    }

    private String handleVmStatus(String vmName) {
        try {
            VmInfo target = azure.findVmByName(vmName);
            if (target == null) {
                return "Could not find VM named `" + vmName + "` in the subscription.";
            }
            VmStatus status = azure.getVmStatus(target.getResourceGroup(), target.getName());
            return MarkdownFormatter.vmStatus(status, target.getResourceGroup());
        } catch (AzureClientException e) {
            return "Error fetching status for `" + vmName + "`: " + e.getMessage();
        }
    }

    private String handleMetrics(String resourceName, MetricKind metricKind) {
        try {
            VmInfo target = azure.findVmByName(resourceName);
            if (target == null) {
                return "Could not find a Virtual Machine named `" + resourceName + "` to fetch metrics.";
            }
            List<MetricSeries> metrics = azure.getMetrics(target.getId(), metricKind.getMetricNames(), METRICS_TIMESPAN);
            return MarkdownFormatter.metrics(target.getName(), metrics);
        } catch (AzureClientException e) {
            return "Error fetching metrics: " + e.getMessage();
        }
    }

    private String handleListResourceGroups() {
        try {
            List<ResourceGroupInfo> groups = azure.listResourceGroups();
            return MarkdownFormatter.resourceGroups(groups);
        } catch (AzureClientException e) {
            return "Error fetching Resource Groups: " + e.getMessage();
        }
    }

    private String handleListVnets() {
        try {
            List<VnetInfo> vnets = azure.listVirtualNetworks();
            return MarkdownFormatter.virtualNetworks(azure.getSubscriptionId(), vnets);
        } catch (AzureClientException e) {
            return "Error fetching VNets: " + e.getMessage();
        }
    }

    private String handleListPublicIps() {
        try {
            List<PublicIpInfo> ips = azure.listPublicIps();
            return MarkdownFormatter.publicIps(azure.getSubscriptionId(), ips);
        } catch (AzureClientException e) {
            return "Error fetching Public IPs: " + e.getMessage();
        }
    }

    private String handleGenericDiscovery(String keyword, String providerType) {
        try {
            List<GenericResource> resources = azure.queryResources(providerType);
            return MarkdownFormatter.genericResources(keyword, resources);
        } catch (AzureClientException e) {
            return "Error discovering " + keyword + ": " + e.getMessage();
        } catch (IllegalArgumentException e) {
            // catalog types are not guaranteed to pass the resource graph type check
            logger.warn("Skipping discovery of {}: {}", providerType, e.getMessage());
            return "Error discovering " + keyword + ": " + e.getMessage();
        }
    }

    /**
     * Falls back to the live resource-type catalog before giving up with the help text.
     */
    private String handleUnknown(String query) {
        List<ResourceTypeInfo> catalog;
        try {
            catalog = azure.listResourceTypes();
        } catch (AzureClientException e) {
            logger.error("Resource type catalog unavailable for fuzzy matching: {}", e.getMessage());
            return MarkdownFormatter.helpText();
        }

        ResourceTypeInfo match = resourceTypeMatcher.match(query, catalog);
        if (match == null) {
            return MarkdownFormatter.helpText();
        }
        return handleGenericDiscovery(ResourceTypeMatcher.displayName(match.getResourceType()), match.getFullType());
    }
}
