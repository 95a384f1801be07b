package com.catalog.reconciliation.override;

import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.lock.DistributedLock;
import com.catalog.reconciliation.lock.LocalDistributedLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link OverrideStore}. Every written version is kept in an append-only
 * history; the current version of each override is indexed by id.
 */
public class InMemoryOverrideStore implements OverrideStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryOverrideStore.class);

    private final Map<String, CatalogOverride> current = new ConcurrentHashMap<>();
    private final List<CatalogOverride> history = new CopyOnWriteArrayList<>();
    private final AtomicLong version = new AtomicLong();
    private final DistributedLock writeLock;
    private final AuditService auditService;

    public InMemoryOverrideStore() {
        this(new LocalDistributedLock(), new AuditService());
    }

    public InMemoryOverrideStore(DistributedLock writeLock, AuditService auditService) {
        this.writeLock = writeLock;
        this.auditService = auditService;
    }

    @Override
    public CatalogOverride save(CatalogOverride override, String actorId) {
        String lockKey = lockKey(override);
        writeLock.lock(lockKey);
        try {
            current.put(override.getId(), override);
            history.add(override);
            long v = version.incrementAndGet();
            auditService.record(AuditAction.OVERRIDE_CREATED, override.getTarget(), actorId,
                    Map.of("overrideId", override.getId(),
                            "fields", override.getValues().keySet().toString(),
                            "reason", String.valueOf(override.getReason())));
            log.info("override.saved overrideId={} scope={} target={} version={}",
                    override.getId(), override.getScope(), override.getTarget(), v);
            return override;
        } finally {
            writeLock.unlock(lockKey);
        }
    }

    @Override
    public CatalogOverride revoke(String overrideId, Instant at, String actorId) {
        CatalogOverride existing = current.get(overrideId);
        if (existing == null) {
            throw new IllegalArgumentException("Unknown override: " + overrideId);
        }
        String lockKey = lockKey(existing);
        writeLock.lock(lockKey);
        try {
            CatalogOverride revoked = current.get(overrideId).revoke(at);
            current.put(overrideId, revoked);
            history.add(revoked);
            version.incrementAndGet();
            auditService.record(AuditAction.OVERRIDE_REVOKED, revoked.getTarget(), actorId,
                    Map.of("overrideId", overrideId, "revokedAt", at.toString()));
            log.info("override.revoked overrideId={} target={}", overrideId, revoked.getTarget());
            return revoked;
        } finally {
            writeLock.unlock(lockKey);
        }
    }

    @Override
    public Optional<CatalogOverride> findById(String overrideId) {
        return Optional.ofNullable(current.get(overrideId));
    }

    @Override
    public List<CatalogOverride> snapshot(Instant watermark) {
        List<CatalogOverride> active = new ArrayList<>();
        for (CatalogOverride override : current.values()) {
            if (override.isActiveAt(watermark)) {
                active.add(override);
            }
        }
        active.sort(Comparator.comparing(CatalogOverride::getCreatedAt).thenComparing(CatalogOverride::getId));
        return active;
    }

    @Override
    public long getVersion() {
        return version.get();
    }

    /**
     * Every version ever written, oldest first.
     */
    public List<CatalogOverride> getHistory() {
        return List.copyOf(history);
    }

    private static String lockKey(CatalogOverride override) {
        return "override:" + override.getScope() + ":" + override.getTarget();
    }
}
