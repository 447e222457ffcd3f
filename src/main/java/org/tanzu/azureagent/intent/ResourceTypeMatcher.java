package org.tanzu.azureagent.intent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.azureagent.azure.AzureService.ResourceTypeInfo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Last-resort matcher that maps a free-text query onto the live resource-type catalog.
 *
 * Resource type names are split on camelCase ("bastionHosts" becomes "bastion",
 * "host") and compared with the significant words of the query after both sides
 * are reduced to singular form. A word matches a token when it is equal to it or,
 * with at least four characters, a prefix of it. Hits on the resource type name
 * count double; hits on the provider namespace only break ties between types.
 */
@Component
public class ResourceTypeMatcher {

    private static final Logger logger = LoggerFactory.getLogger(ResourceTypeMatcher.class);

    private static final int MIN_PREFIX_LENGTH = 4;

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "my", "our", "all", "any", "me", "i", "we", "you",
            "show", "list", "get", "find", "display", "give", "tell", "see", "view",
            "what", "which", "where", "how", "many", "are", "is", "there", "do", "does", "have",
            "of", "in", "for", "on", "to", "with", "and", "or", "please", "can",
            "azure", "microsoft", "resource", "resources", "current", "subscription"
    );

    /**
     * Picks the catalog entry that best fits the query.
     *
     * @param query the operator's text
     * @param catalog top-level resource types of registered providers
     * @return the best match, or null when no type shares a word with the query
     */
    public ResourceTypeInfo match(String query, List<ResourceTypeInfo> catalog) {
        List<String> terms = queryTerms(query);
        if (terms.isEmpty() || catalog.isEmpty()) {
            return null;
        }

        ResourceTypeInfo best = null;
        int bestScore = 0;
        Comparator<ResourceTypeInfo> tieBreak = Comparator
                .comparingInt((ResourceTypeInfo type) -> type.getFullType().length())
                .thenComparing(ResourceTypeInfo::getFullType, String.CASE_INSENSITIVE_ORDER);

        for (ResourceTypeInfo type : catalog) {
            int typeHits = countHits(terms, tokens(type.getResourceType()));
            if (typeHits == 0) {
                continue;
            }
            int score = typeHits * 2 + countHits(terms, tokens(namespaceName(type.getNamespace())));
            if (score > bestScore || (score == bestScore && tieBreak.compare(type, best) < 0)) {
                best = type;
                bestScore = score;
            }
        }

        if (best != null) {
            logger.info("Fuzzy match for query terms {}: {} (score {})", terms, best.getFullType(), bestScore);
        } else {
            logger.info("No resource type in a catalog of {} matched query terms {}", catalog.size(), terms);
        }
        return best;
    }

    /**
     * Turns a resource type name into readable lower-case words, e.g. "bastionHosts" to "bastion hosts".
     */
    public static String displayName(String resourceType) {
        return String.join(" ", splitCamelCase(resourceType)).toLowerCase(Locale.ROOT);
    }

    static List<String> queryTerms(String query) {
        List<String> terms = new ArrayList<>();
        if (query == null) {
            return terms;
        }
        for (String word : query.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (word.length() < 2 || STOP_WORDS.contains(word)) {
                continue;
            }
            String singular = singular(word);
            if (!terms.contains(singular)) {
                terms.add(singular);
            }
        }
        return terms;
    }

    static List<String> tokens(String name) {
        List<String> tokens = new ArrayList<>();
        for (String part : splitCamelCase(name)) {
            tokens.add(singular(part.toLowerCase(Locale.ROOT)));
        }
        return tokens;
    }

    static String singular(String word) {
        if (word.length() > 4 && word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("sses") || word.endsWith("xes")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private static List<String> splitCamelCase(String name) {
        List<String> parts = new ArrayList<>();
        for (String part : name.split("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])|[^A-Za-z0-9]+")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }

    private static String namespaceName(String namespace) {
        int dot = namespace.indexOf('.');
        return dot >= 0 ? namespace.substring(dot + 1) : namespace;
    }

    private static int countHits(List<String> terms, List<String> tokens) {
        int hits = 0;
        for (String term : terms) {
            for (String token : tokens) {
                if (token.equals(term) || (term.length() >= MIN_PREFIX_LENGTH && token.startsWith(term))) {
                    hits++;
                    break;
                }
            }
        }
        return hits;
    }
}
