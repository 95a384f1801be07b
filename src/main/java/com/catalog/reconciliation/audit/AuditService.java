package com.catalog.reconciliation.audit;

import com.catalog.reconciliation.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Append-only audit trail shared by overrides, collision review, allowlist changes and runs.
 * Entries written inside a run pick up its id from the logging context.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public AuditService() {
        this(Clock.systemUTC());
    }

    public AuditService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public AuditEntry record(AuditAction action, String subject, String actorId, Map<String, Object> details) {
        AuditEntry entry = new AuditEntry(sequence.incrementAndGet(), action, subject, actorId,
                MDC.get(LogContext.RUN_ID), details, clock.instant());
        entries.add(entry);
        log.debug("audit.recorded seq={} action={} subject={} actor={}",
                entry.sequence(), action, subject, actorId);
        return entry;
    }

    public AuditEntry record(AuditAction action, String subject, String actorId) {
        return record(action, subject, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> getEntriesFor(String subject) {
        return select(e -> subject.equals(e.subject()));
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return select(e -> e.action() == action);
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return select(e -> e.belongsTo(runId));
    }

    public int size() {
        return entries.size();
    }

    private List<AuditEntry> select(Predicate<AuditEntry> filter) {
        return entries.stream().filter(filter).toList();
    }
}
