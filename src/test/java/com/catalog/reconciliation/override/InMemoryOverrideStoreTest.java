package com.catalog.reconciliation.override;

import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.core.model.CatalogField;
import com.catalog.reconciliation.lock.DistributedLock;
import com.catalog.reconciliation.lock.LocalDistributedLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("InMemoryOverrideStore Tests")
class InMemoryOverrideStoreTest {

    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-02T10:00:00Z");
    private static final Instant T3 = Instant.parse("2024-05-03T10:00:00Z");

    private AuditService auditService;
    private InMemoryOverrideStore store;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
        store = new InMemoryOverrideStore(new LocalDistributedLock(), auditService);
    }

    private CatalogOverride override(String id, Instant createdAt) {
        return CatalogOverride.forProduct("royal_canin::adult-15kg::dry")
                .id(id)
                .set(CatalogField.KCAL_PER_100G, 380.0)
                .reason("label photo")
                .createdAt(createdAt)
                .build();
    }

    @Test
    @DisplayName("Every write bumps the version")
    void versioning() {
        assertEquals(0, store.getVersion());

        store.save(override("ov-1", T1), "curator");
        store.revoke("ov-1", T2, "curator");

        assertEquals(2, store.getVersion());
        assertEquals(2, store.getHistory().size());
    }

    @Test
    @DisplayName("Snapshot only holds overrides active at the watermark")
    void snapshotByWatermark() {
        store.save(override("ov-1", T1), "curator");
        store.save(override("ov-2", T2), "curator");
        store.revoke("ov-1", T3, "curator");

        assertEquals(List.of(), store.snapshot(T1.minusSeconds(1)));
        assertEquals(List.of("ov-1"), ids(store.snapshot(T1)));
        assertEquals(List.of("ov-1", "ov-2"), ids(store.snapshot(T2)));
        assertEquals(List.of("ov-2"), ids(store.snapshot(T3)));
    }

    @Test
    @DisplayName("Revoking an unknown override fails")
    void revokeUnknown() {
        assertThrows(IllegalArgumentException.class, () -> store.revoke("missing", T1, "curator"));
    }

    @Test
    @DisplayName("Writes are audited")
    void audited() {
        store.save(override("ov-1", T1), "curator");
        store.revoke("ov-1", T2, "curator");

        assertEquals(1, auditService.getEntriesByAction(AuditAction.OVERRIDE_CREATED).size());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.OVERRIDE_REVOKED).size());
        assertEquals(2, auditService.getEntriesFor("royal_canin::adult-15kg::dry").size());
    }

    @Test
    @DisplayName("Writes hold the per-target lock")
    void locksPerTarget() {
        DistributedLock lock = mock(DistributedLock.class);
        InMemoryOverrideStore locked = new InMemoryOverrideStore(lock, auditService);

        locked.save(override("ov-1", T1), "curator");

        verify(lock).lock("override:PRODUCT_KEY:royal_canin::adult-15kg::dry");
        verify(lock).unlock("override:PRODUCT_KEY:royal_canin::adult-15kg::dry");
    }

    @Test
    @DisplayName("Lookup returns the current version")
    void findById() {
        store.save(override("ov-1", T1), "curator");
        store.revoke("ov-1", T2, "curator");

        assertEquals(T2, store.findById("ov-1").orElseThrow().getRevokedAt());
        assertTrue(store.findById("other").isEmpty());
    }

    private static List<String> ids(List<CatalogOverride> overrides) {
        return overrides.stream().map(CatalogOverride::getId).toList();
    }
}
