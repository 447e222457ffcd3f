package org.tanzu.azureagent.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered alias table from everyday service names to Azure resource provider types.
 *
 * Lookup walks the table in declaration order and the first alias contained in
 * the query wins, so broader aliases that would shadow more specific ones must
 * come later.
 */
public final class ServiceAliases {

    private static final Map<String, String> ALIASES;

    static {
        Map<String, String> aliases = new LinkedHashMap<>();

        // Compute
        aliases.put("vm", "Microsoft.Compute/virtualMachines");
        aliases.put("function", "Microsoft.Web/sites");
        aliases.put("web app", "Microsoft.Web/sites");
        aliases.put("app service", "Microsoft.Web/sites");
        aliases.put("aks", "Microsoft.ContainerService/managedClusters");
        aliases.put("kubernetes", "Microsoft.ContainerService/managedClusters");
        aliases.put("acr", "Microsoft.ContainerRegistry/registries");

        // Storage and data
        aliases.put("storage", "Microsoft.Storage/storageAccounts");
        aliases.put("sql", "Microsoft.Sql/servers/databases");
        aliases.put("cosmos", "Microsoft.DocumentDB/databaseAccounts");
        aliases.put("redis", "Microsoft.Cache/Redis");
        aliases.put("postgresql", "Microsoft.DBforPostgreSQL/servers");
        aliases.put("mysql", "Microsoft.DBforMySQL/servers");
        aliases.put("synapse", "Microsoft.Synapse/workspaces");
        aliases.put("databricks", "Microsoft.Databricks/workspaces");

        // Networking
        aliases.put("vnet", "Microsoft.Network/virtualNetworks");
        aliases.put("nsg", "Microsoft.Network/networkSecurityGroups");
        aliases.put("load balancer", "Microsoft.Network/loadBalancers");
        aliases.put("firewall", "Microsoft.Network/azureFirewalls");
        aliases.put("application gateway", "Microsoft.Network/applicationGateways");
        aliases.put("front door", "Microsoft.Network/frontdoors");
        aliases.put("cdn", "Microsoft.Cdn/profiles");

        // Security and management
        aliases.put("key vault", "Microsoft.KeyVault/vaults");
        aliases.put("monitor", "Microsoft.Insights/components");
        aliases.put("log analytics", "Microsoft.OperationalInsights/workspaces");
        aliases.put("automation", "Microsoft.Automation/automationAccounts");
        aliases.put("policy", "Microsoft.Authorization/policyDefinitions");
        aliases.put("sentinel", "Microsoft.OperationalInsights/workspaces");

        // Integration and AI
        aliases.put("service bus", "Microsoft.ServiceBus/namespaces");
        aliases.put("logic app", "Microsoft.Logic/workflows");
        aliases.put("event grid", "Microsoft.EventGrid/topics");
        aliases.put("event hub", "Microsoft.EventHub/namespaces");
        aliases.put("api management", "Microsoft.ApiManagement/service");
        aliases.put("search", "Microsoft.Search/searchServices");
        aliases.put("cognitive", "Microsoft.CognitiveServices/accounts");
        aliases.put("machine learning", "Microsoft.MachineLearningServices/workspaces");
        aliases.put("purview", "Microsoft.Purview/accounts");

        ALIASES = Collections.unmodifiableMap(aliases);
    }

    private ServiceAliases() {
    }

    /**
     * @return the alias table in lookup order
     */
    public static Map<String, String> all() {
        return ALIASES;
    }

    /**
     * Finds the first alias contained in a lower-cased query.
     *
     * @param lowerQuery the query, already lower-cased
     * @return the matching alias and its provider type, or null if none matches
     */
    public static Map.Entry<String, String> firstMatch(String lowerQuery) {
        for (Map.Entry<String, String> alias : ALIASES.entrySet()) {
            if (lowerQuery.contains(alias.getKey())) {
                return alias;
            }
        }
        return null;
    }
}
