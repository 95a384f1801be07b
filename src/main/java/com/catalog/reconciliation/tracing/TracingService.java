package com.catalog.reconciliation.tracing;

import java.util.Map;

/**
 * Starts spans for run stages. {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    String RUN = "reconcile.run";
    String MERGE = "reconcile.merge";
    String OVERRIDES = "reconcile.overrides";
    String GUARDS = "reconcile.guards";
    String PUBLISH = "reconcile.publish";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startStage(String stage, String runId) {
        return startSpan(stage, Map.of("runId", runId));
    }
}
