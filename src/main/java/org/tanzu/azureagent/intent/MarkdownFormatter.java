package org.tanzu.azureagent.intent;

import org.tanzu.azureagent.azure.AzureService.GenericResource;
import org.tanzu.azureagent.azure.AzureService.MetricSeries;
import org.tanzu.azureagent.azure.AzureService.PublicIpInfo;
import org.tanzu.azureagent.azure.AzureService.ResourceGroupInfo;
import org.tanzu.azureagent.azure.AzureService.VmInfo;
import org.tanzu.azureagent.azure.AzureService.VmStatus;
import org.tanzu.azureagent.azure.AzureService.VnetInfo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders inventory records as Markdown for chat front ends.
 */
public final class MarkdownFormatter {

    static final String HELP_TEXT =
            "I'm sorry, I couldn't determine the specific Azure action for that query.\n\n"
            + "Try asking things like:\n"
            + "- 'Show all VMs'\n"
            + "- 'Status of VM MyVMName'\n"
            + "- 'CPU for MyVMName'\n"
            + "- 'List resource groups'";

    private static final double BYTES_PER_MB = 1024d * 1024d;

    private MarkdownFormatter() {
    }

    /** Fixed answer listing the supported query kinds. */
    public static String helpText() {
        return HELP_TEXT;
    }

    /** VM table for the subscription, or a not-found sentence. */
    public static String virtualMachines(String subscriptionId, List<VmInfo> vms) {
        if (vms.isEmpty()) {
            return "No Virtual Machines found in the current subscription.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("### Virtual Machines (Subscription: `").append(subscriptionId).append("`)\n\n");
        header(sb, "Name", "Resource Group", "Location", "Size", "OS", "State");
        for (VmInfo vm : vms) {
            row(sb, vm.getName(), vm.getResourceGroup(), vm.getLocation(), vm.getSize(),
                    vm.getOsType(), vm.getProvisioningState());
        }
        return sb.toString();
    }

    /** Status block of one VM. */
    public static String vmStatus(VmStatus status, String resourceGroup) {
        return "### Health Status: `" + status.getName() + "`\n\n"
                + "- **Power State:** " + status.getPowerState() + "\n"
                + "- **Provisioning State:** " + status.getProvisioningState() + "\n"
                + "- **Resource Group:** " + resourceGroup + "\n"
                + "- **Size:** " + status.getSize() + "\n"
                + "- **Location:** " + status.getLocation();
    }

    /**
     * One bullet per metric series with its recent values.
     *
     * @param vmName name shown in the heading
     * @param series series as returned by the monitor API, possibly without values
     */
    public static String metrics(String vmName, List<MetricSeries> series) {
        StringBuilder sb = new StringBuilder();
        sb.append("### Latest Metrics for `").append(vmName).append("`\n\n");
        if (series.isEmpty()) {
            sb.append("No metric data available for this resource in the last hour.");
            return sb.toString();
        }
        for (MetricSeries metric : series) {
            String values = metric.getValues().isEmpty()
                    ? "N/A"
                    : metric.getValues().stream()
                        .map(value -> metricValue(value, metric.getUnit()))
                        .collect(Collectors.joining(", "));
            sb.append("- **").append(metric.getName()).append(":** ").append(values).append(" (Last 5 mins)\n");
        }
        return sb.toString();
    }

    /** Bulleted resource group list with locations. */
    public static String resourceGroups(List<ResourceGroupInfo> groups) {
        StringBuilder sb = new StringBuilder("### Resource Groups\n\n");
        for (ResourceGroupInfo group : groups) {
            sb.append("- `").append(group.getName()).append("` (").append(group.getLocation()).append(")\n");
        }
        return sb.toString();
    }

    /** Virtual network table with address prefixes, or a not-found sentence. */
    public static String virtualNetworks(String subscriptionId, List<VnetInfo> vnets) {
        if (vnets.isEmpty()) {
            return "No Virtual Networks found in the current subscription.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("### Virtual Networks (Subscription: `").append(subscriptionId).append("`)\n\n");
        header(sb, "Name", "Resource Group", "Location", "Address Prefix");
        for (VnetInfo vnet : vnets) {
            row(sb, vnet.getName(), vnet.getResourceGroup(), vnet.getLocation(),
                    String.join(", ", vnet.getAddressPrefixes()));
        }
        return sb.toString();
    }

    /** Public IP table; unassigned addresses show as N/A. */
    public static String publicIps(String subscriptionId, List<PublicIpInfo> ips) {
        if (ips.isEmpty()) {
            return "No Public IP Addresses found.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("### Public IP Addresses (Subscription: `").append(subscriptionId).append("`)\n\n");
        header(sb, "Name", "IP Address", "Resource Group", "Location", "SKU");
        for (PublicIpInfo ip : ips) {
            row(sb, ip.getName(), ip.getIpAddress(), ip.getResourceGroup(), ip.getLocation(), ip.getSku());
        }
        return sb.toString();
    }

    /**
     * Answer for a discovered resource type, or a not-found sentence when the list is empty.
     *
     * @param keyword the user's phrase for the type, shown back in the answer
     */
    public static String genericResources(String keyword, List<GenericResource> resources) {
        if (resources.isEmpty()) {
            return "No `" + keyword + "` resources found in the current subscription.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("### Azure ").append(titleCase(keyword)).append(" Resources\n\n");
        header(sb, "Name", "Resource Group", "Location", "Type");
        for (GenericResource resource : resources) {
            row(sb, resource.getName(), resource.getResourceGroup(), resource.getLocation(), resource.getShortType());
        }
        return sb.toString();
    }

    /**
     * Capitalizes the first letter of every word and lower-cases the rest.
     */
    static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }

    static String metricValue(double value, String unit) {
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "percent":
                return value + "%";
            case "bytes":
                return BigDecimal.valueOf(value / BYTES_PER_MB).setScale(2, RoundingMode.HALF_UP).doubleValue() + " MB";
            default:
                return String.valueOf(value);
        }
    }

    private static void header(StringBuilder sb, String... columns) {
        sb.append("| ").append(String.join(" | ", columns)).append(" |\n");
        sb.append("|");
        for (int i = 0; i < columns.length; i++) {
            sb.append(" :--- |");
        }
        sb.append("\n");
    }

    private static void row(StringBuilder sb, String... cells) {
        sb.append("| ").append(String.join(" | ", cells)).append(" |\n");
    }
}
