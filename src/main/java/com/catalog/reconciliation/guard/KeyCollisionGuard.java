package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.audit.KeyDecisionLog;
import com.catalog.reconciliation.audit.KeyDecisionType;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.merge.KeyCluster;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * No product key maps to more than one product. Products sharing a base key under
 * {@code ~n} suffixes pass only once a reviewer has confirmed the split.
 */
public class KeyCollisionGuard implements GuardRule {

    public static final String NAME = "key-collision";

    private final KeyDecisionLog decisions;

    public KeyCollisionGuard(KeyDecisionLog decisions) {
        this.decisions = decisions;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<GuardViolation> check(Collection<CanonicalProduct> products) {
        Map<String, TreeSet<String>> byBaseKey = new TreeMap<>();
        Map<String, Integer> exact = new TreeMap<>();
        for (CanonicalProduct product : products) {
            String key = product.getProductKey();
            exact.merge(key, 1, Integer::sum);
            byBaseKey.computeIfAbsent(KeyCluster.baseKeyOf(key), k -> new TreeSet<>()).add(key);
        }

        List<GuardViolation> violations = new ArrayList<>();
        exact.forEach((key, count) -> {
            if (count > 1) {
                violations.add(new GuardViolation(NAME, key, count + " products share product_key " + key));
            }
        });
        // distinct keys only; exact duplicates are reported above
        byBaseKey.forEach((baseKey, keys) -> {
            if (keys.size() > 1 && !decisions.isApproved(baseKey, KeyDecisionType.SPLIT)) {
                for (String key : keys) {
                    violations.add(new GuardViolation(NAME, key,
                            keys.size() + " products collide on " + baseKey + " without a confirmed split"));
                }
            }
        });
        violations.sort(Comparator.comparing(GuardViolation::productKey).thenComparing(GuardViolation::message));
        return violations;
    }
}
