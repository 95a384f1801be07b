package com.catalog.reconciliation.config;

import com.catalog.reconciliation.api.ReconciliationOptions;
import com.catalog.reconciliation.cache.CacheConfig;
import com.catalog.reconciliation.derive.PriceBuckets;
import com.catalog.reconciliation.publish.PublishMode;
import com.catalog.reconciliation.rules.PackSizeStripping;
import com.catalog.reconciliation.scoring.ScoringWeights;
import com.catalog.reconciliation.scoring.SourceTrustTable;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link ReconciliationOptions} from MicroProfile Config properties.
 *
 * <p>Defaults ship in {@code META-INF/microprofile-config.properties}; system properties
 * and environment variables override them as usual. A property that is absent keeps the
 * {@link ReconciliationOptions.Builder} default.</p>
 *
 * <pre>
 * catalog-reconciliation.parallelism=4
 * catalog-reconciliation.run-timeout-seconds=600
 * catalog-reconciliation.lease.target=catalog
 * catalog-reconciliation.lease.timeout-millis=0
 * catalog-reconciliation.publish-mode=STRICT
 * catalog-reconciliation.collision.threshold=0.75
 * catalog-reconciliation.scoring.trust=allaboutdogfood.co.uk:5,petfoodexpert.com:3
 * catalog-reconciliation.key.pack-size-stripping=MULTIPACK_ONLY
 * </pre>
 */
public final class ReconciliationConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationConfigLoader.class);

    public static final String PREFIX = "catalog-reconciliation.";

    private ReconciliationConfigLoader() {
    }

    /**
     * Reads the default config sources: system properties, environment and
     * {@code META-INF/microprofile-config.properties} on the classpath.
     */
    public static ReconciliationOptions load() {
        return load(new SmallRyeConfigBuilder().addDefaultSources().build());
    }

    /**
     * Reads only the given properties; used for inline configuration and tests.
     */
    public static ReconciliationOptions fromProperties(Map<String, String> properties) {
        return load(new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "inline", 500))
                .build());
    }

    /**
     * @throws IllegalArgumentException if a property has an invalid value
     */
    public static ReconciliationOptions load(Config config) {
        ReconciliationOptions.Builder builder = ReconciliationOptions.builder();

        config.getOptionalValue(PREFIX + "parallelism", Integer.class).ifPresent(builder::parallelism);
        config.getOptionalValue(PREFIX + "run-timeout-seconds", Long.class)
                .ifPresent(s -> builder.runTimeout(Duration.ofSeconds(s)));
        config.getOptionalValue(PREFIX + "lease.target", String.class).ifPresent(builder::leaseTarget);
        config.getOptionalValue(PREFIX + "lease.timeout-millis", Long.class)
                .ifPresent(ms -> builder.leaseTimeout(Duration.ofMillis(ms)));
        config.getOptionalValue(PREFIX + "publish-mode", String.class)
                .ifPresent(mode -> builder.publishMode(enumValue(PublishMode.class, mode, "publish-mode")));
        config.getOptionalValue(PREFIX + "collision.threshold", Double.class).ifPresent(builder::collisionThreshold);
        config.getOptionalValue(PREFIX + "guard.sample-size", Integer.class).ifPresent(builder::guardSampleSize);

        builder.scoringWeights(scoringWeights(config));
        config.getOptionalValues(PREFIX + "scoring.trust", String.class)
                .ifPresent(entries -> builder.trustTable(trustTable(entries)));

        PriceBuckets defaults = PriceBuckets.defaults();
        BigDecimal lowBelow = config.getOptionalValue(PREFIX + "price-bucket.low-below", BigDecimal.class)
                .orElse(defaults.lowBelow());
        BigDecimal highAbove = config.getOptionalValue(PREFIX + "price-bucket.high-above", BigDecimal.class)
                .orElse(defaults.highAbove());
        builder.priceBuckets(new PriceBuckets(lowBelow, highAbove));

        config.getOptionalValue(PREFIX + "key.pack-size-stripping", String.class)
                .ifPresent(s -> builder.packSizeStripping(enumValue(PackSizeStripping.class, s, "key.pack-size-stripping")));
        config.getOptionalValues(PREFIX + "key.stop-list", String.class).ifPresent(builder::stopList);

        builder.cacheConfig(cacheConfig(config));

        ReconciliationOptions options = builder.build();
        log.info("config.loaded options={}", options);
        return options;
    }

    private static ScoringWeights scoringWeights(Config config) {
        ScoringWeights defaults = ScoringWeights.defaults();
        return new ScoringWeights(
                config.getOptionalValue(PREFIX + "scoring.energy", Integer.class).orElse(defaults.energy()),
                config.getOptionalValue(PREFIX + "scoring.protein", Integer.class).orElse(defaults.protein()),
                config.getOptionalValue(PREFIX + "scoring.fat", Integer.class).orElse(defaults.fat()),
                config.getOptionalValue(PREFIX + "scoring.ingredients", Integer.class).orElse(defaults.ingredients()),
                config.getOptionalValue(PREFIX + "scoring.image", Integer.class).orElse(defaults.image()));
    }

    /**
     * Parses {@code domain:bonus} pairs.
     */
    static SourceTrustTable trustTable(List<String> entries) {
        Map<String, Integer> bonuses = new LinkedHashMap<>();
        for (String entry : entries) {
            int colon = entry.lastIndexOf(':');
            if (colon <= 0 || colon == entry.length() - 1) {
                throw new IllegalArgumentException("scoring.trust entry must be domain:bonus, got '" + entry + "'");
            }
            try {
                bonuses.put(entry.substring(0, colon).trim(), Integer.parseInt(entry.substring(colon + 1).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("scoring.trust bonus is not an integer in '" + entry + "'", e);
            }
        }
        return new SourceTrustTable(bonuses);
    }

    private static CacheConfig cacheConfig(Config config) {
        boolean enabled = config.getOptionalValue(PREFIX + "cache.enabled", Boolean.class).orElse(false);
        if (!enabled) {
            return CacheConfig.disabled();
        }
        CacheConfig defaults = CacheConfig.defaults();
        long maxSize = config.getOptionalValue(PREFIX + "cache.max-size", Long.class).orElse(defaults.maxEntries());
        long ttlSeconds = config.getOptionalValue(PREFIX + "cache.ttl-seconds", Long.class)
                .orElse(defaults.ttl().toSeconds());
        return new CacheConfig(maxSize, Duration.ofSeconds(ttlSeconds), true);
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value, String property) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(PREFIX + property + " has unknown value '" + value + "'", e);
        }
    }
}
