package com.catalog.reconciliation.publish;

import com.catalog.reconciliation.core.model.RunStatus;

/**
 * What the publisher did with a staged set.
 *
 * @param status          PUBLISHED, PUBLISHED_PREVIEW_ONLY or BLOCKED_BY_GUARDS
 * @param previewCount    products swapped into preview, 0 when blocked
 * @param productionCount products swapped into production, 0 unless promoted
 */
public record PublishDecision(RunStatus status, int previewCount, int productionCount) {
}
