package com.catalog.reconciliation.override;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned store of overrides. Writes are serialized per target; reads are by watermark
 * so a run sees overrides as of the same instant as its candidate records.
 */
public interface OverrideStore {

    /**
     * Stores a new override, or replaces the current version of one with the same id.
     */
    CatalogOverride save(CatalogOverride override, String actorId);

    /**
     * Marks an override revoked at {@code at}.
     *
     * @throws IllegalArgumentException if no override has that id
     */
    CatalogOverride revoke(String overrideId, Instant at, String actorId);

    Optional<CatalogOverride> findById(String overrideId);

    /**
     * Overrides created at or before {@code watermark} and not revoked at or before it.
     */
    List<CatalogOverride> snapshot(Instant watermark);

    /**
     * Incremented on every write.
     */
    long getVersion();
}
