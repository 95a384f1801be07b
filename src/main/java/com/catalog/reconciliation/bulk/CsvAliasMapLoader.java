package com.catalog.reconciliation.bulk;

import com.catalog.reconciliation.rules.BrandAliasEntry;
import com.catalog.reconciliation.rules.BrandAliasMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads a curated alias table from CSV.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * alias_phrase,brand_slug,brand_line,is_denylisted,brand_display
 * "Royal Canin",royal_canin,,false,Royal Canin
 * "Hill's Science Plan",hills,science_plan,false,
 * "Royal Canine",,,true,
 * </pre>
 *
 * <p>The header row is required; {@code brand_display} is optional. A malformed row
 * fails the whole load.</p>
 */
public class CsvAliasMapLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvAliasMapLoader.class);

    static final List<String> REQUIRED_COLUMNS = List.of("alias_phrase", "brand_slug", "brand_line", "is_denylisted");

    public BrandAliasMap load(InputStream input, String version) {
        return load(new InputStreamReader(input, StandardCharsets.UTF_8), version);
    }

    /**
     * @throws IllegalArgumentException if the header or a row is malformed
     * @throws UncheckedIOException     if the reader fails
     */
    public BrandAliasMap load(Reader reader, String version) {
        BrandAliasMap.Builder builder = BrandAliasMap.builder().version(version);
        int rows = 0;
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = br.readLine();
            if (header == null) {
                throw new IllegalArgumentException("Alias table is empty; expected a header row");
            }
            Map<String, Integer> columns = columns(header);

            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                builder.add(toEntry(splitCsvLine(line), columns, lineNumber));
                rows++;
            }
        } catch (IOException e) {
            log.error("aliasmap.load_failed version={} error={}", version, e.getMessage());
            throw new UncheckedIOException("Failed to read alias table " + version, e);
        }
        BrandAliasMap map = builder.build();
        log.info("aliasmap.loaded version={} entries={}", version, rows);
        return map;
    }

    private static Map<String, Integer> columns(String header) {
        List<String> names = splitCsvLine(header.startsWith("\uFEFF") ? header.substring(1) : header);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            columns.put(names.get(i).trim().toLowerCase(Locale.ROOT), i);
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new IllegalArgumentException("Alias table header is missing column '" + required + "'");
            }
        }
        return columns;
    }

    private static BrandAliasEntry toEntry(List<String> fields, Map<String, Integer> columns, long lineNumber) {
        try {
            boolean denylisted = parseBoolean(field(fields, columns, "is_denylisted"));
            return new BrandAliasEntry(
                    field(fields, columns, "alias_phrase"),
                    emptyToNull(field(fields, columns, "brand_slug")),
                    field(fields, columns, "brand_line"),
                    field(fields, columns, "brand_display"),
                    denylisted);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Alias table line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    private static String field(List<String> fields, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= fields.size()) {
            return null;
        }
        return fields.get(index).trim();
    }

    private static boolean parseBoolean(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "t", "yes", "y", "1" -> true;
            case "false", "f", "no", "n", "0" -> false;
            default -> throw new IllegalArgumentException("is_denylisted is not a boolean: '" + value + "'");
        };
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Splits one CSV line, honouring double-quoted fields and {@code ""} escapes.
     */
    static List<String> splitCsvLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated quoted field in: " + line);
        }
        fields.add(current.toString());
        return fields;
    }
}
