package com.catalog.reconciliation.bulk;

import com.catalog.reconciliation.guard.GuardReport;
import com.catalog.reconciliation.guard.GuardResult;
import com.catalog.reconciliation.guard.GuardViolation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Writes a {@link GuardReport} in the release-gate format: a JSON array of
 * {@code {guard_name, violation_count, sample_violations}} objects.
 *
 * <pre>
 * [
 *   {"guard_name": "split-brand", "violation_count": 1,
 *    "sample_violations": [{"product_key": "royal::canin-adult::dry", "message": "..."}]}
 * ]
 * </pre>
 */
public class GuardReportWriter {
    private static final Logger log = LoggerFactory.getLogger(GuardReportWriter.class);

    public static final int DEFAULT_SAMPLE_SIZE = 10;

    private final ObjectMapper mapper;
    private final int sampleSize;

    public GuardReportWriter() {
        this(DEFAULT_SAMPLE_SIZE);
    }

    public GuardReportWriter(int sampleSize) {
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must be >= 0");
        }
        this.mapper = CatalogJson.newMapper();
        this.sampleSize = sampleSize;
    }

    public ArrayNode toTree(GuardReport report) {
        ArrayNode guards = mapper.createArrayNode();
        for (GuardResult result : report.results()) {
            ObjectNode guard = guards.addObject();
            guard.put("guard_name", result.guardName());
            guard.put("violation_count", result.violationCount());
            ArrayNode samples = guard.putArray("sample_violations");
            for (GuardViolation violation : result.sample(sampleSize)) {
                samples.addObject()
                        .put("product_key", violation.productKey())
                        .put("message", violation.message());
            }
        }
        return guards;
    }

    public String toJson(GuardReport report) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Guard report could not be serialized", e);
        }
    }

    public void write(GuardReport report, Writer writer) {
        try {
            writer.write(toJson(report));
            writer.flush();
        } catch (IOException e) {
            log.error("guardreport.write_failed error={}", e.getMessage());
            throw new UncheckedIOException("Failed to write guard report", e);
        }
        log.debug("guardreport.written guards={} violations={}", report.results().size(), report.totalViolations());
    }
}
