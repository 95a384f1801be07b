package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.rules.BrandAliasEntry;
import com.catalog.reconciliation.rules.BrandAliasMap;
import com.catalog.reconciliation.rules.BrandText;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * What the guards know about brands, derived from one alias map version.
 *
 * <ul>
 *   <li>split patterns: every multi-word brand alias cut after its first word
 *       (stem "Royal", fragment "Canin")</li>
 *   <li>incomplete stems: slugs of those stems that are not canonical themselves,
 *       plus any configured extras</li>
 *   <li>composite slugs: brand slug joined with a line slug ({@code purina_pro_plan})</li>
 * </ul>
 */
public final class BrandKnowledge {

    private final BrandAliasMap aliasMap;
    private final List<SplitPattern> splitPatterns;
    private final Set<String> incompleteStems;
    private final Set<String> compositeSlugs;
    private final Map<SplitPattern, Pattern> fragmentPatterns;

    private BrandKnowledge(BrandAliasMap aliasMap, Collection<String> extraStems) {
        this.aliasMap = aliasMap;
        List<SplitPattern> patterns = new ArrayList<>();
        Set<String> stems = new TreeSet<>(extraStems);
        Set<String> composites = new TreeSet<>();
        for (BrandAliasEntry entry : aliasMap.getEntries()) {
            if (entry.denylisted()) {
                continue;
            }
            if (entry.brandLine() != null) {
                composites.add(entry.brandSlug() + "_" + entry.brandLine());
                continue;
            }
            if (entry.wordCount() < 2) {
                continue;
            }
            String phrase = entry.aliasPhrase();
            int cut = phrase.indexOf(' ');
            String stem = phrase.substring(0, cut);
            String fragment = phrase.substring(cut + 1);
            patterns.add(new SplitPattern(stem, fragment, entry.brandSlug()));
            String stemSlug = BrandText.slugify(stem);
            if (!stemSlug.isEmpty() && !aliasMap.isCanonicalSlug(stemSlug)) {
                stems.add(stemSlug);
            }
        }
        patterns.sort(Comparator.comparing(SplitPattern::stem).thenComparing(SplitPattern::fragment));
        this.splitPatterns = List.copyOf(patterns);
        this.incompleteStems = Set.copyOf(stems);
        this.compositeSlugs = Set.copyOf(composites);
        Map<SplitPattern, Pattern> compiled = new HashMap<>();
        for (SplitPattern pattern : splitPatterns) {
            compiled.put(pattern, Pattern.compile("^" + BrandText.phraseRegex(pattern.fragment()) + BrandText.WORD_END,
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        this.fragmentPatterns = Map.copyOf(compiled);
    }

    public static BrandKnowledge from(BrandAliasMap aliasMap) {
        return new BrandKnowledge(aliasMap, List.of());
    }

    public static BrandKnowledge from(BrandAliasMap aliasMap, Collection<String> extraIncompleteStems) {
        return new BrandKnowledge(aliasMap, extraIncompleteStems);
    }

    public BrandAliasMap getAliasMap() {
        return aliasMap;
    }

    public List<SplitPattern> getSplitPatterns() {
        return splitPatterns;
    }

    public Set<String> getIncompleteStems() {
        return incompleteStems;
    }

    public Set<String> getCompositeSlugs() {
        return compositeSlugs;
    }

    /**
     * Whether {@code productName} starts with the pattern's fragment as whole words.
     */
    public boolean nameStartsWithFragment(SplitPattern pattern, String productName) {
        return productName != null && fragmentPatterns.get(pattern).matcher(productName).find();
    }

    /**
     * A multi-word brand cut after its first word.
     *
     * @param stem      first word, the part feeds tend to put in the brand column
     * @param fragment  remaining words, the part that leaks into the product name
     * @param brandSlug canonical slug of the full brand
     */
    public record SplitPattern(String stem, String fragment, String brandSlug) {

        public boolean brandIsStem(String brand) {
            return brand != null && BrandText.normalizeApostrophes(BrandText.normalizeWhitespace(brand))
                    .equalsIgnoreCase(stem);
        }
    }
}
