package com.catalog.reconciliation.review;

import com.catalog.reconciliation.api.PageRequest;
import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.audit.KeyDecisionLog;
import com.catalog.reconciliation.audit.KeyDecisionType;
import com.catalog.reconciliation.merge.KeyCollision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReviewService Tests")
class ReviewServiceTest {

    private static final String KEY = "royal_canin::adult::any";

    private KeyDecisionLog decisions;
    private AuditService auditService;
    private ReviewService service;

    @BeforeEach
    void setUp() {
        decisions = new KeyDecisionLog();
        auditService = new AuditService();
        service = new ReviewService(new InMemoryReviewQueue(), decisions, auditService);
    }

    private static KeyCollision collision(boolean splitConfirmed) {
        return new KeyCollision(KEY, List.of(KEY, KEY + "~2"),
                List.of("shop-a.example|/p/1", "shop-b.example|/p/2"),
                List.of("Adult", "New Improved Formula Adult"), 0.42, splitConfirmed);
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("New collision is queued and audited")
        void queues() {
            CollisionReviewItem item = service.submit(collision(false)).orElseThrow();

            assertEquals(KEY, item.getProductKey());
            assertEquals(ReviewStatus.PENDING, item.getStatus());
            assertEquals(1, service.getPendingCount());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.KEY_COLLISION_SUBMITTED).size());
        }

        @Test
        @DisplayName("Resubmitting returns the pending item")
        void idempotent() {
            CollisionReviewItem first = service.submit(collision(false)).orElseThrow();
            CollisionReviewItem second = service.submit(collision(false)).orElseThrow();

            assertEquals(first.getId(), second.getId());
            assertEquals(1, service.getPendingCount());
        }

        @Test
        @DisplayName("Confirmed split is not queued again")
        void confirmedSplit() {
            assertEquals(Optional.empty(), service.submit(collision(true)));
            assertEquals(0, service.getPendingCount());
        }
    }

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        @Test
        @DisplayName("Approving records a MERGE decision")
        void approve() {
            CollisionReviewItem item = service.submit(collision(false)).orElseThrow();

            service.approveMerge(item.getId(), "reviewer-1", "same product, relabelled");

            assertTrue(decisions.isApproved(KEY, KeyDecisionType.MERGE));
            assertEquals(ReviewStatus.APPROVED, item.getStatus());
            assertEquals("reviewer-1", item.getReviewerId());
            assertEquals(0, service.getPendingCount());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.KEY_MERGE_APPROVED).size());
        }

        @Test
        @DisplayName("Rejecting records a SPLIT decision")
        void split() {
            CollisionReviewItem item = service.submit(collision(false)).orElseThrow();

            service.confirmSplit(item.getId(), "reviewer-1", null);

            assertTrue(decisions.isApproved(KEY, KeyDecisionType.SPLIT));
            assertEquals(ReviewStatus.REJECTED, item.getStatus());
        }

        @Test
        @DisplayName("Deciding twice fails")
        void alreadyDecided() {
            CollisionReviewItem item = service.submit(collision(false)).orElseThrow();
            service.confirmSplit(item.getId(), "reviewer-1", null);

            assertThrows(IllegalStateException.class,
                    () -> service.approveMerge(item.getId(), "reviewer-2", null));
        }

        @Test
        @DisplayName("Unknown review id fails")
        void unknownId() {
            assertThrows(IllegalArgumentException.class,
                    () -> service.approveMerge("missing", "reviewer-1", null));
        }
    }

    @Test
    @DisplayName("Pending reviews are paged")
    void pendingPage() {
        service.submit(collision(false));
        service.submit(new KeyCollision("acana::adult::dry", List.of("acana::adult::dry", "acana::adult::dry~2"),
                List.of("a|1", "b|2"), List.of("Adult", "Adult Light Senior"), 0.5, false));

        assertEquals(2, service.getPendingReviews(PageRequest.first(10)).content().size());
        assertEquals(1, service.getPendingReviews(PageRequest.first(1)).content().size());
    }
}
