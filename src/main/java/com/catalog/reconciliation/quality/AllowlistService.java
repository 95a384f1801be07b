package com.catalog.reconciliation.quality;

import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.core.model.AllowlistStatus;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.publish.BrandAllowlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maintains the versioned {@link BrandAllowlist}. Promotion to ACTIVE is gated on the
 * brand's quality metrics in a product view; every status change is audited and yields
 * a new allowlist version.
 *
 * <p>Transitions: PENDING to ACTIVE by {@link #promote}, ACTIVE to PAUSED by
 * {@link #pause}, PAUSED to ACTIVE by {@link #reactivate}, anything to REMOVED by
 * {@link #remove}, REMOVED back to PENDING by {@link #reactivate}.</p>
 */
public class AllowlistService {
    private static final Logger log = LoggerFactory.getLogger(AllowlistService.class);

    private final AtomicReference<BrandAllowlist> current;
    private final BrandQualityCalculator calculator;
    private final QualityGate gate;
    private final AuditService auditService;

    public AllowlistService(AuditService auditService) {
        this(BrandAllowlist.empty(), new BrandQualityCalculator(), QualityGate.defaults(), auditService);
    }

    public AllowlistService(BrandAllowlist initial, BrandQualityCalculator calculator, QualityGate gate,
                            AuditService auditService) {
        this.current = new AtomicReference<>(initial);
        this.calculator = calculator;
        this.gate = gate;
        this.auditService = auditService;
    }

    public BrandAllowlist current() {
        return current.get();
    }

    /**
     * Lists a new brand: ACTIVE when it already passes the gate in {@code view}, else PENDING.
     *
     * @throws IllegalStateException if the brand is already listed
     */
    public AllowlistChange add(String brandSlug, Collection<CanonicalProduct> view, String actorId) {
        if (current().statusOf(brandSlug).isPresent()) {
            throw new IllegalStateException("Brand already on the allowlist: " + brandSlug);
        }
        List<String> failures = gateFailures(brandSlug, view);
        AllowlistStatus status = failures.isEmpty() ? AllowlistStatus.ACTIVE : AllowlistStatus.PENDING;
        BrandAllowlist next = current.updateAndGet(list -> list.withStatus(brandSlug, status));
        auditService.record(AuditAction.BRAND_ALLOWLIST_ADDED, brandSlug, actorId,
                details(null, status, next.getVersion(), failures));
        log.info("allowlist.added brandSlug={} status={} version={}", brandSlug, status, next.getVersion());
        return new AllowlistChange(brandSlug, null, status, true, failures, next.getVersion());
    }

    /**
     * PENDING to ACTIVE when the brand passes the quality gate; otherwise the change is
     * refused and the failures are reported.
     */
    public AllowlistChange promote(String brandSlug, Collection<CanonicalProduct> view, String actorId) {
        AllowlistStatus from = require(brandSlug, Set.of(AllowlistStatus.PENDING));
        List<String> failures = gateFailures(brandSlug, view);
        if (!failures.isEmpty()) {
            log.info("allowlist.promotion_refused brandSlug={} failures={}", brandSlug, failures);
            return new AllowlistChange(brandSlug, from, from, false, failures, current().getVersion());
        }
        return transition(brandSlug, from, AllowlistStatus.ACTIVE, actorId, "promoted");
    }

    public AllowlistChange pause(String brandSlug, String actorId, String reason) {
        AllowlistStatus from = require(brandSlug, Set.of(AllowlistStatus.ACTIVE));
        return transition(brandSlug, from, AllowlistStatus.PAUSED, actorId, reason);
    }

    public AllowlistChange remove(String brandSlug, String actorId, String reason) {
        AllowlistStatus from = require(brandSlug,
                Set.of(AllowlistStatus.ACTIVE, AllowlistStatus.PENDING, AllowlistStatus.PAUSED));
        return transition(brandSlug, from, AllowlistStatus.REMOVED, actorId, reason);
    }

    public AllowlistChange reactivate(String brandSlug, String actorId) {
        AllowlistStatus from = require(brandSlug, Set.of(AllowlistStatus.PAUSED, AllowlistStatus.REMOVED));
        AllowlistStatus to = from == AllowlistStatus.PAUSED ? AllowlistStatus.ACTIVE : AllowlistStatus.PENDING;
        return transition(brandSlug, from, to, actorId, "reactivated");
    }

    public Optional<BrandQualityMetrics> metricsFor(String brandSlug, Collection<CanonicalProduct> view) {
        return calculator.calculate(brandSlug, view);
    }

    private List<String> gateFailures(String brandSlug, Collection<CanonicalProduct> view) {
        return calculator.calculate(brandSlug, view)
                .map(gate::failures)
                .orElse(List.of("no products with a resolved brand"));
    }

    private AllowlistStatus require(String brandSlug, Set<AllowlistStatus> allowed) {
        AllowlistStatus status = current().statusOf(brandSlug)
                .orElseThrow(() -> new IllegalStateException("Brand not on the allowlist: " + brandSlug));
        if (!allowed.contains(status)) {
            throw new IllegalStateException("Brand " + brandSlug + " is " + status + ", expected one of " + allowed);
        }
        return status;
    }

    private AllowlistChange transition(String brandSlug, AllowlistStatus from, AllowlistStatus to,
                                       String actorId, String reason) {
        BrandAllowlist next = current.updateAndGet(list -> list.withStatus(brandSlug, to));
        Map<String, Object> details = details(from, to, next.getVersion(), List.of());
        details.put("reason", String.valueOf(reason));
        auditService.record(AuditAction.BRAND_STATUS_CHANGED, brandSlug, actorId, details);
        log.info("allowlist.status_changed brandSlug={} from={} to={} version={}",
                brandSlug, from, to, next.getVersion());
        return new AllowlistChange(brandSlug, from, to, true, List.of(), next.getVersion());
    }

    private static Map<String, Object> details(AllowlistStatus from, AllowlistStatus to, long version,
                                               List<String> failures) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", String.valueOf(from));
        details.put("to", to.name());
        details.put("allowlistVersion", version);
        if (!failures.isEmpty()) {
            details.put("gateFailures", List.copyOf(failures));
        }
        return details;
    }

    /**
     * Outcome of an allowlist operation.
     *
     * @param applied  false when the change was refused by the quality gate
     * @param failures gate thresholds the brand misses
     * @param version  allowlist version after the operation
     */
    public record AllowlistChange(String brandSlug, AllowlistStatus from, AllowlistStatus to, boolean applied,
                                  List<String> failures, long version) {

        public AllowlistChange {
            failures = List.copyOf(failures);
        }
    }
}
