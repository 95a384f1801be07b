package com.catalog.reconciliation.store;

import com.catalog.reconciliation.core.model.RawCandidateRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Append-only store of raw candidate observations, written by harvesting and read by
 * reconciliation below a watermark.
 */
public interface RawRecordStore {

    /**
     * Appends an observation. Re-deliveries of the same {@code (source_id, last_seen_at)}
     * are ignored.
     *
     * @return true if the record was new
     */
    boolean append(RawCandidateRecord record);

    /**
     * Appends every record.
     *
     * @return how many were new
     */
    default int appendAll(Collection<RawCandidateRecord> records) {
        int added = 0;
        for (RawCandidateRecord record : records) {
            if (append(record)) {
                added++;
            }
        }
        return added;
    }

    /**
     * For every source id, its latest observation with {@code last_seen_at <= watermark}.
     * Records without {@code last_seen_at} are always included. Sorted by source id.
     */
    List<RawCandidateRecord> snapshot(Instant watermark);

    /**
     * Every observation ever stored for {@code sourceId}, oldest first.
     */
    List<RawCandidateRecord> history(String sourceId);

    int size();
}
