package com.catalog.reconciliation.store;

import com.catalog.reconciliation.CandidateRecords;
import com.catalog.reconciliation.core.model.RawCandidateRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryRawRecordStore Tests")
class InMemoryRawRecordStoreTest {

    private static final Instant DAY_1 = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant DAY_2 = Instant.parse("2024-05-02T00:00:00Z");
    private static final Instant DAY_3 = Instant.parse("2024-05-03T00:00:00Z");

    private InMemoryRawRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRawRecordStore();
    }

    @Test
    @DisplayName("Re-observing a source keeps both observations")
    void appendOnly() {
        RawCandidateRecord first = CandidateRecords.fullRoyalCanin();
        RawCandidateRecord second = first.reobservedAt(DAY_2);

        assertTrue(store.append(first));
        assertTrue(store.append(second));

        assertEquals(2, store.size());
        assertEquals(List.of(first, second), store.history(first.getSourceId()));
    }

    @Test
    @DisplayName("Same source and timestamp is stored once")
    void duplicateIgnored() {
        assertTrue(store.append(CandidateRecords.fullRoyalCanin()));
        assertFalse(store.append(CandidateRecords.fullRoyalCanin()));

        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("Snapshot holds the latest observation at or before the watermark")
    void snapshotByWatermark() {
        RawCandidateRecord day1 = CandidateRecords.fullRoyalCanin().toBuilder().lastSeenAt(DAY_1).build();
        RawCandidateRecord day3 = day1.toBuilder().kcalPer100g(370.0).lastSeenAt(DAY_3).build();
        store.append(day1);
        store.append(day3);

        assertEquals(365.0, store.snapshot(DAY_2).get(0).getKcalPer100g().doubleValue());
        assertEquals(370.0, store.snapshot(DAY_3).get(0).getKcalPer100g().doubleValue());
        assertTrue(store.snapshot(DAY_1.minusSeconds(1)).isEmpty());
    }

    @Test
    @DisplayName("Snapshot is ordered by source id")
    void snapshotOrder() {
        store.append(CandidateRecords.fullRoyalCanin());
        store.append(CandidateRecords.splitRoyalCanin());

        List<RawCandidateRecord> snapshot = store.snapshot(DAY_3);

        assertEquals("shop-a.example|/p/1", snapshot.get(0).getSourceId());
        assertEquals("shop-b.example|/p/2", snapshot.get(1).getSourceId());
    }

    @Test
    @DisplayName("Unknown source has no history")
    void unknownHistory() {
        assertTrue(store.history("nowhere|/").isEmpty());
    }
}
