package com.flowsmith.core.catalog;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks a sensible default action when a request names a service but not
 * the operation. Richer output schemas and read-like names score up; write-like
 * names score heavily down so that an under-specified request never mutates data.
 */
@Component
public class ActionSelector {

    static final String DEFAULT_ACTION = "execute";

    private static final List<String> READ_VERBS = List.of("search", "list", "query", "read", "fetch", "get", "find", "retrieve");
    private static final List<String> WRITE_VERBS = List.of("send", "create", "update", "delete", "write", "remove", "insert", "post", "put");
    private static final Pattern READ_PREFIX = Pattern.compile("^(search|list|query|read|get)_");

    private final PluginCatalog catalog;

    public ActionSelector(PluginCatalog catalog) {
        this.catalog = catalog;
    }

    public String inferActionName(String pluginKey) {
        return catalog.find(pluginKey)
                .map(ActionSelector::bestAction)
                .orElse(DEFAULT_ACTION);
    }

    static String bestAction(PluginDefinition plugin) {
        String best = null;
        int bestScore = Integer.MIN_VALUE;
        for (Map.Entry<String, ActionDefinition> entry : plugin.actions().entrySet()) {
            int score = score(entry.getKey(), entry.getValue());
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
            }
        }
        return best == null ? DEFAULT_ACTION : best;
    }

    static int score(String actionName, ActionDefinition action) {
        int score = SchemaFieldExtractor.countFields(action.outputSchema()) * 10;
        String lower = actionName.toLowerCase(Locale.ROOT);
        if (READ_VERBS.stream().anyMatch(lower::contains)) {
            score += 50;
        }
        if (WRITE_VERBS.stream().anyMatch(lower::contains)) {
            score -= 100;
        }
        if (READ_PREFIX.matcher(lower).find()) {
            score += 30;
        }
        return score;
    }
}
