package com.catalog.reconciliation.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Versioned, read-only alias table used by the {@link BrandCanonicalizer}.
 *
 * <p>Match patterns are compiled once per map and tried longest alias first, so a
 * run against a given version is reproducible. Curators publish a new version
 * instead of mutating an existing map.</p>
 */
public final class BrandAliasMap {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final String version;
    private final List<BrandAliasEntry> entries;
    private final List<CompiledAlias> aliases;
    private final List<Pattern> denylist;
    private final Map<String, String> displayBySlug;
    private final Map<String, List<CompiledAlias>> linesBySlug;

    private BrandAliasMap(String version, List<BrandAliasEntry> entries) {
        this.version = version;
        this.entries = List.copyOf(entries);

        List<CompiledAlias> compiled = new ArrayList<>();
        List<Pattern> denied = new ArrayList<>();
        for (BrandAliasEntry entry : entries) {
            Pattern pattern = Pattern.compile("^" + BrandText.phraseRegex(entry.aliasPhrase()) + BrandText.WORD_END, FLAGS);
            if (entry.denylisted()) {
                denied.add(pattern);
            } else {
                compiled.add(new CompiledAlias(entry, pattern));
            }
        }
        compiled.sort(Comparator
                .comparingInt((CompiledAlias a) -> a.entry().aliasPhrase().length()).reversed()
                .thenComparing(a -> a.entry().aliasPhrase()));
        this.aliases = List.copyOf(compiled);
        this.denylist = List.copyOf(denied);

        Map<String, String> displays = new LinkedHashMap<>();
        for (BrandAliasEntry entry : entries) {
            if (!entry.denylisted() && entry.brandDisplay() != null) {
                displays.putIfAbsent(entry.brandSlug(), entry.brandDisplay());
            }
        }
        for (BrandAliasEntry entry : entries) {
            if (!entry.denylisted() && entry.brandLine() == null
                    && BrandText.slugify(entry.aliasPhrase()).equals(entry.brandSlug())) {
                displays.putIfAbsent(entry.brandSlug(), entry.aliasPhrase());
            }
        }
        this.displayBySlug = Map.copyOf(displays);

        // "science_plan" is matched as the phrase "science plan"
        Map<String, Map<String, CompiledAlias>> lines = new LinkedHashMap<>();
        for (BrandAliasEntry entry : entries) {
            if (!entry.denylisted() && entry.brandLine() != null) {
                lines.computeIfAbsent(entry.brandSlug(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(entry.brandLine(), line -> new CompiledAlias(entry, Pattern.compile(
                                "^" + BrandText.phraseRegex(line.replace('_', ' ')) + BrandText.WORD_END, FLAGS)));
            }
        }
        Map<String, List<CompiledAlias>> sortedLines = new LinkedHashMap<>();
        lines.forEach((slug, bySlug) -> sortedLines.put(slug, bySlug.values().stream()
                .sorted(Comparator.comparingInt((CompiledAlias a) -> a.entry().brandLine().length()).reversed()
                        .thenComparing(a -> a.entry().brandLine()))
                .toList()));
        this.linesBySlug = Map.copyOf(sortedLines);
    }

    public String getVersion() {
        return version;
    }

    public List<BrandAliasEntry> getEntries() {
        return entries;
    }

    /**
     * Non-denylisted entries in match order: longest phrase first, then alphabetical.
     */
    public List<BrandAliasEntry> getAliasesInMatchOrder() {
        return aliases.stream().map(CompiledAlias::entry).toList();
    }

    public List<BrandAliasEntry> getDenylistedEntries() {
        return entries.stream().filter(BrandAliasEntry::denylisted).toList();
    }

    public Set<String> getCanonicalSlugs() {
        return entries.stream()
                .filter(e -> !e.denylisted())
                .map(BrandAliasEntry::brandSlug)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isCanonicalSlug(String slug) {
        return slug != null && aliases.stream().anyMatch(a -> a.entry().brandSlug().equals(slug));
    }

    /**
     * Display name for a canonical slug; falls back to the title-cased slug.
     */
    public String displayFor(String slug) {
        String display = displayBySlug.get(slug);
        return display != null ? display : BrandText.titleCase(slug.replace('_', ' '));
    }

    /**
     * Longest alias that matches at the start of {@code text} on a word boundary
     * and is not shadowed by a denylisted phrase at the same position.
     */
    public Optional<AliasMatch> matchAtStart(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (CompiledAlias alias : aliases) {
            Matcher matcher = alias.pattern().matcher(text);
            if (matcher.find() && !isDenied(text, matcher.end())) {
                return Optional.of(new AliasMatch(alias.entry(), matcher.end()));
            }
        }
        return Optional.empty();
    }

    /**
     * Longest alias of {@code slug} that matches at the start of {@code text}.
     */
    public Optional<AliasMatch> matchAtStart(String text, String slug) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (CompiledAlias alias : aliases) {
            if (!alias.entry().brandSlug().equals(slug)) {
                continue;
            }
            Matcher matcher = alias.pattern().matcher(text);
            if (matcher.find() && !isDenied(text, matcher.end())) {
                return Optional.of(new AliasMatch(alias.entry(), matcher.end()));
            }
        }
        return Optional.empty();
    }

    /**
     * Longest product line of {@code slug} whose words open {@code text}, for names
     * that follow an already canonical brand slug.
     */
    public Optional<AliasMatch> matchLineAtStart(String text, String slug) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (CompiledAlias line : linesBySlug.getOrDefault(slug, List.of())) {
            Matcher matcher = line.pattern().matcher(text);
            if (matcher.find()) {
                return Optional.of(new AliasMatch(line.entry(), matcher.end()));
            }
        }
        return Optional.empty();
    }

    /**
     * Whether a denylisted phrase matches at the start of {@code text}.
     */
    public boolean startsWithDenylisted(String text) {
        return isDenied(text, 0);
    }

    private boolean isDenied(String text, int matchEnd) {
        for (Pattern denied : denylist) {
            Matcher matcher = denied.matcher(text);
            if (matcher.find() && matcher.end() >= matchEnd) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "BrandAliasMap{version='" + version + "', entries=" + entries.size() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A successful alias match.
     *
     * @param entry matched alias row
     * @param end   index just past the matched text
     */
    public record AliasMatch(BrandAliasEntry entry, int end) {
    }

    private record CompiledAlias(BrandAliasEntry entry, Pattern pattern) {
    }

    public static class Builder {
        private String version;
        private final List<BrandAliasEntry> entries = new ArrayList<>();

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder add(BrandAliasEntry entry) {
            entries.add(Objects.requireNonNull(entry, "entry is required"));
            return this;
        }

        public Builder addAll(Collection<BrandAliasEntry> newEntries) {
            newEntries.forEach(this::add);
            return this;
        }

        public Builder alias(String phrase, String brandSlug) {
            return add(BrandAliasEntry.alias(phrase, brandSlug));
        }

        public Builder alias(String phrase, String brandSlug, String brandLine) {
            return add(BrandAliasEntry.alias(phrase, brandSlug, brandLine));
        }

        public Builder canonical(String displayName, String brandSlug) {
            return add(BrandAliasEntry.canonical(displayName, brandSlug));
        }

        public Builder deny(String phrase) {
            return add(BrandAliasEntry.deny(phrase));
        }

        public BrandAliasMap build() {
            Objects.requireNonNull(version, "version is required");
            return new BrandAliasMap(version, entries);
        }
    }
}
