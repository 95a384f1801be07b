package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.model.CanonicalKey;

import java.util.List;
import java.util.Objects;

/**
 * Candidates that will be merged into one product.
 *
 * @param key        canonical key the members share
 * @param productKey published key; carries a {@code ~n} suffix for every cluster but the first
 * @param members    members in rank order, the first being the cluster representative
 */
public record KeyCluster(CanonicalKey key, String productKey, List<PreparedCandidate> members) {

    public static final String SUFFIX_SEPARATOR = "~";

    public KeyCluster {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(productKey, "productKey is required");
        members = List.copyOf(members);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one member");
        }
    }

    public PreparedCandidate representative() {
        return members.get(0);
    }

    /**
     * Product key without any collision suffix.
     */
    public static String baseKeyOf(String productKey) {
        int idx = productKey.lastIndexOf(SUFFIX_SEPARATOR);
        return idx < 0 ? productKey : productKey.substring(0, idx);
    }

    public static String suffixed(String productKey, int ordinal) {
        return ordinal <= 1 ? productKey : productKey + SUFFIX_SEPARATOR + ordinal;
    }
}
