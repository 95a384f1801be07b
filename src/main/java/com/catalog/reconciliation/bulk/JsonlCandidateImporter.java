package com.catalog.reconciliation.bulk;

import com.catalog.reconciliation.core.model.RawCandidateRecord;
import com.catalog.reconciliation.store.RawRecordStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * JSON Lines importer for harvested candidate records.
 *
 * <p>Expected format: one object per line with snake_case fields.</p>
 * <pre>
 * {"source_domain": "shop.example", "source_url": "/p/1", "brand_raw": "Royal",
 *  "product_name_raw": "Canin Adult 15kg", "form_raw": "dry", "kcal_per_100g": null,
 *  "price": 54.99, "pack_sizes": ["15kg"], "available_countries": ["FR"],
 *  "last_seen_at": "2024-05-01T00:00:00Z"}
 * </pre>
 *
 * <p>A JSON array with one object per line is accepted as well. Rows that cannot be
 * read are reported in the {@link ImportResult} and the import carries on.</p>
 */
public class JsonlCandidateImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonlCandidateImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final RawRecordStore store;
    private final ObjectMapper mapper;

    public JsonlCandidateImporter(RawRecordStore store) {
        this.store = store;
        this.mapper = CatalogJson.newMapper();
    }

    public ImportResult importRecords(InputStream input, ProgressCallback callback) {
        return importRecords(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ImportResult importRecords(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();

        long totalRecords = 0;
        long imported = 0;
        long duplicates = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();

                // array brackets and separators
                if (line.isEmpty() || line.equals("[") || line.equals("]") || line.equals(",")) {
                    continue;
                }
                if (line.endsWith(",")) {
                    line = line.substring(0, line.length() - 1);
                }
                totalRecords++;

                String sourceId = "";
                try {
                    JsonNode node = mapper.readTree(line);
                    if (node == null || !node.isObject()) {
                        throw new IllegalArgumentException("expected a JSON object");
                    }
                    sourceId = node.path("source_id").asText(node.path("source_domain").asText(""));
                    RawCandidateRecord record = toRecord(node);
                    sourceId = record.getSourceId();
                    if (store.append(record)) {
                        imported++;
                    } else {
                        duplicates++;
                    }
                } catch (JsonProcessingException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, sourceId, "malformed JSON: " + e.getOriginalMessage()));
                    log.warn("import.error line={} error={}", lineNumber, e.getOriginalMessage());
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, sourceId, e.getMessage()));
                    log.warn("import.error line={} sourceId='{}' error={}", lineNumber, sourceId, e.getMessage());
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Processed " + totalRecords + " records");
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(totalRecords, imported, duplicates, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed result={}", result);
        return result;
    }

    RawCandidateRecord toRecord(JsonNode node) {
        String domain = text(node, "source_domain");
        if (domain == null || domain.isBlank()) {
            throw new IllegalArgumentException("source_domain is required");
        }
        return RawCandidateRecord.builder()
                .sourceId(text(node, "source_id"))
                .sourceDomain(domain)
                .sourceUrl(text(node, "source_url"))
                .brandRaw(text(node, "brand_raw"))
                .productNameRaw(text(node, "product_name_raw"))
                .formRaw(text(node, "form_raw"))
                .lifeStageRaw(text(node, "life_stage_raw"))
                .ingredientsRaw(text(node, "ingredients_raw"))
                .kcalPer100g(number(node, "kcal_per_100g"))
                .proteinPercent(number(node, "protein_percent"))
                .fatPercent(number(node, "fat_percent"))
                .fiberPercent(number(node, "fiber_percent"))
                .ashPercent(number(node, "ash_percent"))
                .moisturePercent(number(node, "moisture_percent"))
                .price(decimal(node, "price"))
                .packSizes(textList(node, "pack_sizes"))
                .availableCountries(new LinkedHashSet<>(textList(node, "available_countries")))
                .imageUrl(text(node, "image_url"))
                .firstSeenAt(instant(node, "first_seen_at"))
                .lastSeenAt(instant(node, "last_seen_at"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return value.asText();
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual() && !value.asText().isBlank()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(field + " is not numeric: '" + value.asText() + "'", e);
            }
        }
        if (value.isTextual()) {
            return null;
        }
        throw new IllegalArgumentException(field + " is not numeric");
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual() && !value.asText().isBlank()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(field + " is not a decimal: '" + value.asText() + "'", e);
            }
        }
        if (value.isTextual()) {
            return null;
        }
        throw new IllegalArgumentException(field + " is not a decimal");
    }

    private static List<String> textList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isTextual()) {
            return List.of(value.asText());
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException(field + " must be an array of strings");
        }
        List<String> items = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isNull()) {
                items.add(item.asText());
            }
        }
        return items;
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        return value == null || value.isBlank() ? null : Instant.parse(value.trim());
    }
}
