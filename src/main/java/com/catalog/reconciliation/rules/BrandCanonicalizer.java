package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.core.model.BrandConfidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves raw brand and product-name text to a canonical brand slug.
 *
 * <p>Matching runs on {@code brand + " " + name} and only accepts an alias that starts
 * at the beginning of that text and ends on a word boundary, longest alias first.
 * Three outcomes follow from where the match ends:</p>
 * <ul>
 *   <li>exactly at the end of the raw brand: a direct hit; a repeated brand prefix
 *       in the name is removed,</li>
 *   <li>inside the product name: a split-brand repair; the leaked fragment is removed
 *       from the name,</li>
 *   <li>inside the raw brand: the rest of the raw brand moves to the front of the name.</li>
 * </ul>
 * <p>A raw brand that already is a canonical slug passes through untouched. Its line is
 * the one supplied by the caller, else a line phrase opening the name, so feeding a
 * resolution back in returns it unchanged. When nothing matches the raw brand is
 * slugged as-is and flagged {@link BrandConfidence#LOW}.</p>
 */
public class BrandCanonicalizer {
    private static final Logger log = LoggerFactory.getLogger(BrandCanonicalizer.class);

    static final String UNKNOWN_BRAND = "unknown";

    private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s\\-\\u2013\\u2014:|,/+&]+");

    public BrandResolution canonicalize(String brandRaw, String productNameRaw, BrandAliasMap aliasMap) {
        return canonicalize(brandRaw, null, productNameRaw, aliasMap);
    }

    /**
     * @param brandLine line already known for this record, or null
     */
    public BrandResolution canonicalize(String brandRaw, String brandLine, String productNameRaw,
                                        BrandAliasMap aliasMap) {
        Objects.requireNonNull(aliasMap, "aliasMap is required");
        String brand = BrandText.normalizeWhitespace(BrandText.normalizeApostrophes(brandRaw));
        String name = BrandText.normalizeWhitespace(BrandText.normalizeApostrophes(productNameRaw));
        String knownLine = brandLine == null || brandLine.isBlank() ? null : brandLine.trim();

        if (aliasMap.isCanonicalSlug(brand)) {
            return fromSlug(brand, knownLine, name, aliasMap);
        }

        String combined = brand.isEmpty() ? name : name.isEmpty() ? brand : brand + " " + name;
        Optional<BrandAliasMap.AliasMatch> match = aliasMap.matchAtStart(combined);
        if (match.isEmpty()) {
            return unresolved(brand, name);
        }

        BrandAliasEntry entry = match.get().entry();
        int end = match.get().end();
        String slug = entry.brandSlug();
        String line = entry.brandLine();
        String cleaned;

        if (brand.isEmpty() || end > brand.length()) {
            cleaned = trimSeparators(combined.substring(end));
            if (!brand.isEmpty()) {
                log.debug("canonicalize.split_repaired brandRaw='{}' alias='{}' slug={}",
                        brand, entry.aliasPhrase(), slug);
            }
        } else if (end == brand.length()) {
            Optional<BrandAliasMap.AliasMatch> repeated = aliasMap.matchAtStart(name, slug);
            if (repeated.isPresent() && repeated.get().end() < name.length()) {
                cleaned = trimSeparators(name.substring(repeated.get().end()));
                if (line == null) {
                    line = repeated.get().entry().brandLine();
                }
            } else {
                cleaned = name;
            }
        } else {
            String remainder = trimSeparators(brand.substring(end));
            cleaned = name.isEmpty() ? remainder : remainder.isEmpty() ? name : remainder + " " + name;
        }

        if (line == null) {
            line = knownLine;
        }
        String display = entry.brandDisplay() != null ? entry.brandDisplay() : aliasMap.displayFor(slug);
        return new BrandResolution(slug, line, display, cleaned, BrandConfidence.HIGH, entry.aliasPhrase());
    }

    private BrandResolution fromSlug(String slug, String knownLine, String name, BrandAliasMap aliasMap) {
        String line = knownLine;
        String cleaned = name;
        if (line == null) {
            Optional<BrandAliasMap.AliasMatch> lineMatch = aliasMap.matchLineAtStart(name, slug);
            if (lineMatch.isPresent() && lineMatch.get().end() < name.length()) {
                line = lineMatch.get().entry().brandLine();
                cleaned = trimSeparators(name.substring(lineMatch.get().end()));
            }
        }
        return new BrandResolution(slug, line, aliasMap.displayFor(slug), cleaned, BrandConfidence.HIGH, slug);
    }

    private BrandResolution unresolved(String brand, String name) {
        String slug = BrandText.slugify(brand);
        if (slug.isEmpty()) {
            slug = UNKNOWN_BRAND;
        }
        String display = brand.isEmpty() ? BrandText.titleCase(UNKNOWN_BRAND) : BrandText.titleCase(brand);
        log.debug("canonicalize.unresolved brandRaw='{}' slug={}", brand, slug);
        return new BrandResolution(slug, null, display, name, BrandConfidence.LOW, null);
    }

    private static String trimSeparators(String text) {
        return LEADING_SEPARATORS.matcher(text).replaceAll("").trim();
    }
}
