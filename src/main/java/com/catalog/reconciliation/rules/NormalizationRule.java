package com.catalog.reconciliation.rules;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to product names before slugging.
 *
 * @param name        unique rule name, used in trace logs
 * @param pattern     case-insensitive pattern to replace
 * @param replacement replacement text, may use group references
 * @param priority    lower runs first
 * @param policies    pack-size policies the rule runs under; empty means all
 */
public record NormalizationRule(
        String name,
        Pattern pattern,
        String replacement,
        int priority,
        Set<PackSizeStripping> policies
) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        policies = policies == null ? Set.of() : Set.copyOf(policies);
    }

    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new NormalizationRule(name, pattern, replacement, priority, Set.of());
    }

    /**
     * Copy of this rule restricted to the given policies.
     */
    public NormalizationRule onlyFor(PackSizeStripping first, PackSizeStripping... rest) {
        return new NormalizationRule(name, pattern, replacement, priority, EnumSet.of(first, rest));
    }

    public boolean appliesTo(PackSizeStripping policy) {
        return policies.isEmpty() || policies.contains(policy);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }
}
