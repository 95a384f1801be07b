package com.catalog.reconciliation.merge;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Content-derived total order of candidates inside a group: quality score descending,
 * then {@code last_seen_at} descending (unknown last), then source id ascending.
 * Never depends on arrival order.
 */
public final class RecordRanking {

    public static final Comparator<PreparedCandidate> ORDER = Comparator
            .comparingInt(PreparedCandidate::score).reversed()
            .thenComparing(c -> c.record().getLastSeenAt(),
                    Comparator.<Instant>nullsLast(Comparator.reverseOrder()))
            .thenComparing(PreparedCandidate::sourceId);

    private RecordRanking() {
    }

    public static List<PreparedCandidate> rank(Collection<PreparedCandidate> candidates) {
        List<PreparedCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(ORDER);
        return ranked;
    }
}
