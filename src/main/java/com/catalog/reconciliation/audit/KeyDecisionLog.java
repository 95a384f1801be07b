package com.catalog.reconciliation.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only log of approved merge and split decisions for colliding product keys.
 * The latest decision for a key is the one in force.
 */
public class KeyDecisionLog {
    private static final Logger log = LoggerFactory.getLogger(KeyDecisionLog.class);

    private final List<KeyDecision> decisions = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public KeyDecisionLog() {
        this(Clock.systemUTC());
    }

    public KeyDecisionLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public KeyDecision record(String productKey, KeyDecisionType type, String decidedBy, String notes) {
        KeyDecision decision = new KeyDecision(productKey, type, decidedBy, notes, clock.instant());
        decisions.add(decision);
        log.info("key.decision.recorded productKey={} decision={} decidedBy={}", productKey, type, decidedBy);
        return decision;
    }

    public Optional<KeyDecision> latestFor(String productKey) {
        for (int i = decisions.size() - 1; i >= 0; i--) {
            KeyDecision decision = decisions.get(i);
            if (decision.productKey().equals(productKey)) {
                return Optional.of(decision);
            }
        }
        return Optional.empty();
    }

    public boolean isApproved(String productKey, KeyDecisionType type) {
        return latestFor(productKey).map(d -> d.type() == type).orElse(false);
    }

    public List<KeyDecision> getAllDecisions() {
        return Collections.unmodifiableList(new ArrayList<>(decisions));
    }

    public List<KeyDecision> getDecisions(KeyDecisionType type) {
        return decisions.stream()
                .filter(d -> d.type() == type)
                .collect(Collectors.toList());
    }

    public int size() {
        return decisions.size();
    }
}
