package com.catalog.reconciliation.scoring;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed per-domain trust bonus. Subdomains inherit the bonus of their parent
 * domain ({@code www.petfoodexpert.com} scores as {@code petfoodexpert.com}).
 */
public final class SourceTrustTable {

    private final Map<String, Integer> bonusByDomain;

    public SourceTrustTable(Map<String, Integer> bonusByDomain) {
        Objects.requireNonNull(bonusByDomain, "bonusByDomain is required");
        Map<String, Integer> normalized = new LinkedHashMap<>();
        bonusByDomain.forEach((domain, bonus) -> {
            if (bonus == null || bonus < 0) {
                throw new IllegalArgumentException("trust bonus for " + domain + " must be non-negative");
            }
            normalized.put(domain.trim().toLowerCase(Locale.ROOT), bonus);
        });
        this.bonusByDomain = Map.copyOf(normalized);
    }

    public static SourceTrustTable defaults() {
        return new SourceTrustTable(Map.of(
                "allaboutdogfood.co.uk", 5,
                "petfoodexpert.com", 3));
    }

    public static SourceTrustTable empty() {
        return new SourceTrustTable(Map.of());
    }

    public int bonusFor(String domain) {
        if (domain == null) {
            return 0;
        }
        String candidate = domain.trim().toLowerCase(Locale.ROOT);
        while (!candidate.isEmpty()) {
            Integer bonus = bonusByDomain.get(candidate);
            if (bonus != null) {
                return bonus;
            }
            int dot = candidate.indexOf('.');
            if (dot < 0) {
                break;
            }
            candidate = candidate.substring(dot + 1);
        }
        return 0;
    }

    public Map<String, Integer> asMap() {
        return bonusByDomain;
    }
}
