package com.catalog.reconciliation.derive;

import com.catalog.reconciliation.rules.BrandText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered keyword families mapping free text to a normalized value.
 * Keywords match whole words only; the first family with a hit wins.
 */
final class KeywordFamilies {

    private final Map<String, Pattern> families;

    private KeywordFamilies(Map<String, Pattern> families) {
        this.families = families;
    }

    static Builder builder() {
        return new Builder();
    }

    Optional<String> classify(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Map.Entry<String, Pattern> family : families.entrySet()) {
            if (family.getValue().matcher(text).find()) {
                return Optional.of(family.getKey());
            }
        }
        return Optional.empty();
    }

    static final class Builder {
        private final Map<String, List<String>> keywords = new LinkedHashMap<>();

        Builder family(String value, String... words) {
            keywords.computeIfAbsent(value, k -> new ArrayList<>()).addAll(List.of(words));
            return this;
        }

        KeywordFamilies build() {
            Map<String, Pattern> compiled = new LinkedHashMap<>();
            keywords.forEach((value, words) -> {
                String alternation = words.stream()
                        .map(BrandText::phraseRegex)
                        .collect(Collectors.joining("|"));
                compiled.put(value, Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation + ")" + BrandText.WORD_END,
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            });
            return new KeywordFamilies(compiled);
        }
    }
}
