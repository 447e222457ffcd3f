package org.tanzu.azureagent.intent;

import org.junit.jupiter.api.Test;
import org.tanzu.azureagent.intent.IntentClassifier.ClassifiedQuery;
import org.tanzu.azureagent.intent.IntentClassifier.Intent;

import static org.junit.jupiter.api.Assertions.*;

class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier();

    @Test
    void listVmKeywordsAreCaseInsensitive() {
        assertEquals(Intent.LIST_VMS, classifier.classify("Show all VMs please").getIntent());
        assertEquals(Intent.LIST_VMS, classifier.classify("get vms").getIntent());
    }

    @Test
    void vmStatusCapturesLowerCasedName() {
        ClassifiedQuery query = classifier.classify("What is the Health of virtual machine Web-Server-01?");

        assertEquals(Intent.VM_STATUS, query.getIntent());
        assertEquals("web-server-01", query.getTarget());
    }

    @Test
    void metricsCaptureWordAndTarget() {
        ClassifiedQuery cpu = classifier.classify("cpu for web-01");
        assertEquals(Intent.METRICS, cpu.getIntent());
        assertEquals("web-01", cpu.getTarget());
        assertEquals(MetricKind.CPU, cpu.getMetricKind());

        assertEquals(MetricKind.MEMORY, classifier.classify("memory of db_02").getMetricKind());
        assertEquals(MetricKind.ALL, classifier.classify("metrics for app1").getMetricKind());
    }

    @Test
    void listingKeywordsFollowFixedOrder() {
        assertEquals(Intent.LIST_RESOURCE_GROUPS, classifier.classify("list resource groups").getIntent());
        assertEquals(Intent.LIST_RESOURCE_GROUPS, classifier.classify("show rgs").getIntent());
        assertEquals(Intent.LIST_VNETS, classifier.classify("show virtual networks").getIntent());
        assertEquals(Intent.LIST_PUBLIC_IPS, classifier.classify("list public ips").getIntent());
        // "networks" is checked before "ips"
        assertEquals(Intent.LIST_VNETS, classifier.classify("ips and networks").getIntent());
    }

    @Test
    void listVmsWinsOverLaterMatchers() {
        assertEquals(Intent.LIST_VMS, classifier.classify("list vms and resource groups").getIntent());
    }

    @Test
    void aliasTableTriggersGenericDiscovery() {
        ClassifiedQuery query = classifier.classify("Show me my Key Vaults");

        assertEquals(Intent.GENERIC_DISCOVERY, query.getIntent());
        assertEquals("key vault", query.getKeyword());
        assertEquals("Microsoft.KeyVault/vaults", query.getProviderType());
    }

    @Test
    void firstAliasInTableOrderWins() {
        ClassifiedQuery query = classifier.classify("storage used by sql");

        assertEquals("storage", query.getKeyword());
        assertEquals("Microsoft.Storage/storageAccounts", query.getProviderType());
    }

    @Test
    void unmatchedAndNullQueriesAreUnknown() {
        assertEquals(Intent.UNKNOWN, classifier.classify("hello there").getIntent());
        assertEquals(Intent.UNKNOWN, classifier.classify(null).getIntent());
        assertEquals(Intent.UNKNOWN, classifier.classify("").getIntent());
    }

    @Test
    void aliasTableKeepsEveryServiceInOrder() {
        assertEquals(37, ServiceAliases.all().size());
        assertEquals("vm", ServiceAliases.all().keySet().iterator().next());
        assertEquals("Microsoft.Purview/accounts", ServiceAliases.all().get("purview"));
    }
}
