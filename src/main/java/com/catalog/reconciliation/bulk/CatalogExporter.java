package com.catalog.reconciliation.bulk;

import com.catalog.reconciliation.api.Page;
import com.catalog.reconciliation.api.PageRequest;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogField;
import com.catalog.reconciliation.core.model.CatalogView;
import com.catalog.reconciliation.core.model.FieldProvenance;
import com.catalog.reconciliation.core.model.PriceBucket;
import com.catalog.reconciliation.core.model.SourceContribution;
import com.catalog.reconciliation.publish.PublishedCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes a published view as JSON Lines, one product per line, in product key order.
 *
 * <pre>
 * {"product_key": "royal_canin::adult-15kg::dry", "brand_slug": "royal_canin",
 *  "brand_confidence": "HIGH", "completeness_grade": "A", "allowlist_status": "ACTIVE",
 *  "fields": {"kcal_per_100g": 365.0, ...},
 *  "provenance": {"kcal_per_100g": "shop-b.example|/p/2", "price_bucket": "derived", ...},
 *  "sources": [{"source_id": "...", "fields_contributed": ["kcal_per_100g"], "score": 120}],
 *  "applied_overrides": []}
 * </pre>
 */
public class CatalogExporter {
    private static final Logger log = LoggerFactory.getLogger(CatalogExporter.class);
    private static final int PAGE_SIZE = 500;

    private final PublishedCatalog catalog;
    private final ObjectMapper mapper;

    public CatalogExporter(PublishedCatalog catalog) {
        this.catalog = catalog;
        this.mapper = CatalogJson.newMapper();
    }

    public ExportResult export(CatalogView view, OutputStream output, ProgressCallback callback) {
        return export(view, new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    public ExportResult export(CatalogView view, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        String runId = catalog.current(view).getRunId();

        long written = 0;
        long total = -1;
        try {
            BufferedWriter out = new BufferedWriter(writer);
            int page = 0;
            boolean hasMore = true;
            while (hasMore) {
                Page<CanonicalProduct> products = catalog.list(view, PageRequest.of(page, PAGE_SIZE));
                total = products.totalElements();
                for (CanonicalProduct product : products.content()) {
                    out.write(mapper.writeValueAsString(toTree(product)));
                    out.newLine();
                    written++;
                }
                hasMore = products.hasNext();
                page++;
                cb.onProgress(written, total, "Exported " + written + " products");
            }
            out.flush();
        } catch (IOException e) {
            log.error("export.failed view={} written={} error={}", view, written, e.getMessage());
            throw new UncheckedIOException("Failed to export " + view + " view", e);
        }

        ExportResult result = new ExportResult(written, runId);
        cb.onProgress(written, written, "Export completed");
        log.info("export.completed view={} result={}", view, result);
        return result;
    }

    ObjectNode toTree(CanonicalProduct product) {
        ObjectNode node = mapper.createObjectNode();
        node.put("product_key", product.getProductKey());
        node.put("brand_slug", product.getBrandSlug());
        node.put("brand_confidence", product.getBrandConfidence().name());
        node.put("completeness_grade", product.getCompletenessGrade().label());
        node.put("allowlist_status", product.getAllowlistStatus() != null ? product.getAllowlistStatus().name() : null);

        ObjectNode fields = node.putObject("fields");
        for (Map.Entry<CatalogField, Object> entry : product.getValues().entrySet()) {
            fields.set(entry.getKey().wireName(), mapper.valueToTree(wireValue(entry.getValue())));
        }
        ObjectNode provenance = node.putObject("provenance");
        for (Map.Entry<CatalogField, FieldProvenance> entry : product.getProvenance().entrySet()) {
            provenance.put(entry.getKey().wireName(), entry.getValue().label());
        }

        ArrayNode sources = node.putArray("sources");
        for (SourceContribution contribution : product.getSources()) {
            ObjectNode source = sources.addObject();
            source.put("source_id", contribution.sourceId());
            ArrayNode contributed = source.putArray("fields_contributed");
            contribution.fieldsContributed().forEach(f -> contributed.add(f.wireName()));
            source.put("score", contribution.score());
        }
        ArrayNode overrides = node.putArray("applied_overrides");
        product.getAppliedOverrideIds().forEach(overrides::add);
        return node;
    }

    private static Object wireValue(Object value) {
        return value instanceof PriceBucket bucket ? bucket.label() : value;
    }
}
