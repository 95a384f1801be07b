package com.catalog.reconciliation.publish;

import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.core.model.AllowlistStatus;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogView;
import com.catalog.reconciliation.core.model.RunStatus;
import com.catalog.reconciliation.guard.GuardReport;
import com.catalog.reconciliation.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Swaps a staged product set into the {@link PublishedCatalog}.
 *
 * <p>Every product is stamped with its brand's allowlist status. Production only ever
 * receives a set whose guard report is clean, restricted to ACTIVE brands; otherwise the
 * {@link PublishMode} decides whether preview is still refreshed.</p>
 */
public class Publisher {
    private static final Logger log = LoggerFactory.getLogger(Publisher.class);

    private final PublishedCatalog catalog;
    private final AuditService auditService;
    private final MetricsService metrics;

    public Publisher(PublishedCatalog catalog, AuditService auditService, MetricsService metrics) {
        this.catalog = catalog;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    public PublishDecision publish(CatalogSnapshot staged, GuardReport report, BrandAllowlist allowlist,
                                   PublishMode mode) {
        List<CanonicalProduct> preview = new ArrayList<>(staged.size());
        List<CanonicalProduct> production = new ArrayList<>();
        for (CanonicalProduct product : staged.getProducts()) {
            AllowlistStatus status = allowlist.statusOf(product.getBrandSlug()).orElse(null);
            CanonicalProduct stamped = product.getAllowlistStatus() == status ? product : product.withAllowlistStatus(status);
            preview.add(stamped);
            if (status != null && status.isProductionEligible()) {
                production.add(stamped);
            }
        }
        CatalogSnapshot previewSnapshot = staged.withProducts(preview);

        if (report.passed()) {
            catalog.swap(previewSnapshot, staged.withProducts(production));
            metrics.recordProductsPublished(CatalogView.PREVIEW, preview.size());
            metrics.recordProductsPublished(CatalogView.PRODUCTION, production.size());
            auditService.record(AuditAction.CATALOG_PUBLISHED, staged.getRunId(), "reconciliation",
                    Map.of("preview", preview.size(), "production", production.size(),
                            "allowlistVersion", allowlist.getVersion()));
            log.info("publish.completed runId={} preview={} production={}",
                    staged.getRunId(), preview.size(), production.size());
            return new PublishDecision(RunStatus.PUBLISHED, preview.size(), production.size());
        }

        auditService.record(AuditAction.PROMOTION_BLOCKED, staged.getRunId(), "reconciliation",
                Map.of("violations", report.totalViolations(), "mode", mode.name()));
        if (mode == PublishMode.PREVIEW_ON_VIOLATION) {
            catalog.swap(previewSnapshot, null);
            metrics.recordProductsPublished(CatalogView.PREVIEW, preview.size());
            log.warn("publish.preview_only runId={} violations={} preview={}",
                    staged.getRunId(), report.totalViolations(), preview.size());
            return new PublishDecision(RunStatus.PUBLISHED_PREVIEW_ONLY, preview.size(), 0);
        }
        log.warn("publish.blocked runId={} violations={}", staged.getRunId(), report.totalViolations());
        return new PublishDecision(RunStatus.BLOCKED_BY_GUARDS, 0, 0);
    }

    public PublishedCatalog getCatalog() {
        return catalog;
    }
}
