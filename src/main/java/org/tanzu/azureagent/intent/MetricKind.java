package org.tanzu.azureagent.intent;

import java.util.List;
import java.util.Locale;

/**
 * The metric word of a metrics query and the Azure Monitor metrics it stands for.
 */
public enum MetricKind {

    CPU(List.of("Percentage CPU")),
    MEMORY(List.of("Available Memory Bytes")),
    ALL(List.of("Percentage CPU", "Available Memory Bytes"));

    private final List<String> metricNames;

    MetricKind(List<String> metricNames) {
        this.metricNames = metricNames;
    }

    public List<String> getMetricNames() {
        return metricNames;
    }

    /**
     * Maps the word captured from the query ("cpu", "memory" or "metrics").
     */
    public static MetricKind fromWord(String word) {
        switch (word.toLowerCase(Locale.ROOT)) {
            case "cpu":
                return CPU;
            case "memory":
                return MEMORY;
            default:
                return ALL;
        }
    }
}
