package org.tanzu.azureagent.intent;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies operator queries by intent using keyword and pattern matching.
 * Purely rule-based, no LLM call.
 *
 * Matchers run in a fixed order and the first hit wins:
 * LIST_VMS > VM_STATUS > METRICS > LIST_RESOURCE_GROUPS > LIST_VNETS >
 * LIST_PUBLIC_IPS > GENERIC_DISCOVERY > UNKNOWN
 */
@Component
public class IntentClassifier {

    public enum Intent {
        LIST_VMS,
        VM_STATUS,
        METRICS,
        LIST_RESOURCE_GROUPS,
        LIST_VNETS,
        LIST_PUBLIC_IPS,
        GENERIC_DISCOVERY,
        UNKNOWN
    }

    private static final List<String> LIST_VM_KEYWORDS = List.of(
            "list vms", "show vms", "show all vms", "get vms"
    );

    private static final List<String> RESOURCE_GROUP_KEYWORDS = List.of(
            "resource groups", "list rgs", "show rgs"
    );

    private static final List<String> VNET_KEYWORDS = List.of(
            "vnets", "networks", "virtual network"
    );

    private static final List<String> PUBLIC_IP_KEYWORDS = List.of(
            "public ips", "ip addresses", "ips"
    );

    private static final Pattern VM_STATUS_PATTERN = Pattern.compile(
            "(status|health|state) of (?:vm|virtual machine) ([\\w-]+)"
    );

    private static final Pattern METRICS_PATTERN = Pattern.compile(
            "(cpu|memory|metrics) (?:for|of) ([\\w-]+)"
    );

    /**
     * Classifies a raw query.
     *
     * @param query the operator's text, any case
     * @return the classification; never null
     */
    public ClassifiedQuery classify(String query) {
        String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);

        if (containsAny(lower, LIST_VM_KEYWORDS)) {
            return ClassifiedQuery.of(Intent.LIST_VMS);
        }

        Matcher status = VM_STATUS_PATTERN.matcher(lower);
        if (status.find()) {
            return ClassifiedQuery.forTarget(Intent.VM_STATUS, status.group(2));
        }

        Matcher metrics = METRICS_PATTERN.matcher(lower);
        if (metrics.find()) {
            return ClassifiedQuery.forMetrics(metrics.group(2), MetricKind.fromWord(metrics.group(1)));
        }

        if (containsAny(lower, RESOURCE_GROUP_KEYWORDS)) {
            return ClassifiedQuery.of(Intent.LIST_RESOURCE_GROUPS);
        }
        if (containsAny(lower, VNET_KEYWORDS)) {
            return ClassifiedQuery.of(Intent.LIST_VNETS);
        }
        if (containsAny(lower, PUBLIC_IP_KEYWORDS)) {
            return ClassifiedQuery.of(Intent.LIST_PUBLIC_IPS);
        }

        Map.Entry<String, String> alias = ServiceAliases.firstMatch(lower);
        if (alias != null) {
            return ClassifiedQuery.forDiscovery(alias.getKey(), alias.getValue());
        }

        return ClassifiedQuery.of(Intent.UNKNOWN);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    /**
     * Outcome of classification: the intent plus whatever the matcher captured.
     */
    public static final class ClassifiedQuery {
        private final Intent intent;
        private final String target;
        private final MetricKind metricKind;
        private final String keyword;
        private final String providerType;

        private ClassifiedQuery(Intent intent, String target, MetricKind metricKind,
                                String keyword, String providerType) {
            this.intent = intent;
            this.target = target;
            this.metricKind = metricKind;
            this.keyword = keyword;
            this.providerType = providerType;
        }

        static ClassifiedQuery of(Intent intent) {
            return new ClassifiedQuery(intent, null, null, null, null);
        }

        static ClassifiedQuery forTarget(Intent intent, String target) {
            return new ClassifiedQuery(intent, target, null, null, null);
        }

        static ClassifiedQuery forMetrics(String target, MetricKind metricKind) {
            return new ClassifiedQuery(Intent.METRICS, target, metricKind, null, null);
        }

        static ClassifiedQuery forDiscovery(String keyword, String providerType) {
            return new ClassifiedQuery(Intent.GENERIC_DISCOVERY, null, null, keyword, providerType);
        }

        public Intent getIntent() { return intent; }

        /** Resource name captured by VM_STATUS and METRICS, lower-cased */
        public String getTarget() { return target; }

        public MetricKind getMetricKind() { return metricKind; }

        /** Alias that triggered GENERIC_DISCOVERY */
        public String getKeyword() { return keyword; }

        public String getProviderType() { return providerType; }

        @Override
        public String toString() {
            return "ClassifiedQuery{intent=" + intent
                    + (target != null ? ", target='" + target + "'" : "")
                    + (metricKind != null ? ", metricKind=" + metricKind : "")
                    + (keyword != null ? ", keyword='" + keyword + "', providerType='" + providerType + "'" : "")
                    + "}";
        }
    }
}
