package com.catalog.reconciliation.store;

import com.catalog.reconciliation.core.model.RawCandidateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link RawRecordStore}. Observations are kept per source id ordered by
 * {@code last_seen_at}; nothing is ever overwritten.
 *
 * <p>Safe for harvesting writes concurrent with reconciliation reads.</p>
 */
public class InMemoryRawRecordStore implements RawRecordStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRawRecordStore.class);

    private final Map<String, ConcurrentSkipListMap<Instant, RawCandidateRecord>> bySource = new ConcurrentHashMap<>();
    private final AtomicInteger size = new AtomicInteger();

    @Override
    public boolean append(RawCandidateRecord record) {
        Instant seenAt = record.getLastSeenAt() != null ? record.getLastSeenAt() : Instant.EPOCH;
        RawCandidateRecord previous = bySource
                .computeIfAbsent(record.getSourceId(), k -> new ConcurrentSkipListMap<>())
                .putIfAbsent(seenAt, record);
        if (previous != null) {
            log.debug("store.duplicate_ignored sourceId={} lastSeenAt={}", record.getSourceId(), seenAt);
            return false;
        }
        size.incrementAndGet();
        return true;
    }

    @Override
    public List<RawCandidateRecord> snapshot(Instant watermark) {
        List<RawCandidateRecord> result = new ArrayList<>();
        for (ConcurrentSkipListMap<Instant, RawCandidateRecord> observations : bySource.values()) {
            Map.Entry<Instant, RawCandidateRecord> latest = observations.floorEntry(watermark);
            if (latest != null) {
                result.add(latest.getValue());
            }
        }
        result.sort(Comparator.comparing(RawCandidateRecord::getSourceId));
        return result;
    }

    @Override
    public List<RawCandidateRecord> history(String sourceId) {
        ConcurrentSkipListMap<Instant, RawCandidateRecord> observations = bySource.get(sourceId);
        return observations == null ? List.of() : List.copyOf(observations.values());
    }

    @Override
    public int size() {
        return size.get();
    }
}
