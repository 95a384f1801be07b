package com.catalog.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link NormalizationRule}s to a product name.
 * Lower priority numbers run first; the result is lower-cased with whitespace collapsed.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(NormalizationRule::priority)
                .thenComparing(NormalizationRule::name));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public String normalize(String name, PackSizeStripping policy) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(policy)) {
                String before = result;
                result = rule.apply(result);
                if (log.isTraceEnabled() && !before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
                }
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }
}
