package com.catalog.reconciliation.rules;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text helpers shared by brand matching, slugging and the guards.
 */
public final class BrandText {

    /**
     * Lookahead that ends a whole-word match: the next character is not a letter or digit.
     */
    public static final String WORD_END = "(?![\\p{L}\\p{N}])";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern APOSTROPHES = Pattern.compile("[\\u2018\\u2019\\u02BC`´]");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private BrandText() {
    }

    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Replaces typographic apostrophes with {@code '}.
     */
    public static String normalizeApostrophes(String text) {
        if (text == null) {
            return null;
        }
        return APOSTROPHES.matcher(text).replaceAll("'");
    }

    /**
     * Machine slug: lower case, accents and apostrophes dropped, any other
     * non-alphanumeric run collapsed to a single underscore.
     * {@code "Hill's Science Plan"} becomes {@code hills_science_plan}.
     */
    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        String folded = DIACRITICS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        String lower = normalizeApostrophes(folded).toLowerCase(Locale.ROOT).replace("'", "");
        return EDGE_UNDERSCORES.matcher(NON_SLUG.matcher(lower).replaceAll("_")).replaceAll("");
    }

    public static String titleCase(String text) {
        String normalized = normalizeWhitespace(text);
        if (normalized.isEmpty()) {
            return normalized;
        }
        StringBuilder sb = new StringBuilder(normalized.length());
        for (String word : normalized.split(" ")) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /**
     * Regex for a phrase matched word by word with flexible whitespace.
     * Apostrophes inside the phrase are optional so {@code Lily's} also matches {@code Lilys}.
     */
    public static String phraseRegex(String phrase) {
        String[] words = normalizeWhitespace(phrase).split(" ");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                sb.append("\\s+");
            }
            String[] parts = words[i].split("'", -1);
            for (int j = 0; j < parts.length; j++) {
                if (j > 0) {
                    sb.append("'?");
                }
                if (!parts[j].isEmpty()) {
                    sb.append(Pattern.quote(parts[j]));
                }
            }
        }
        return sb.toString();
    }
}
