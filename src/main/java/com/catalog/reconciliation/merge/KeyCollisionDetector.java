package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.audit.KeyDecision;
import com.catalog.reconciliation.audit.KeyDecisionLog;
import com.catalog.reconciliation.audit.KeyDecisionType;
import com.catalog.reconciliation.core.model.CanonicalKey;
import com.catalog.reconciliation.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Splits a key group into clusters of records that name the same product.
 *
 * <p>Members are visited in rank order and join the first cluster whose representative
 * name is at least {@code threshold} similar and whose product line does not differ;
 * otherwise they open a new cluster. Clusters are then numbered by their smallest source
 * id, so a cluster keeps its suffix when scores change between runs. A group with an
 * approved MERGE decision is never split.</p>
 */
public class KeyCollisionDetector {
    private static final Logger log = LoggerFactory.getLogger(KeyCollisionDetector.class);

    public static final double DEFAULT_THRESHOLD = 0.75;

    private final SimilarityAlgorithm similarity;
    private final double threshold;
    private final KeyDecisionLog decisions;

    public KeyCollisionDetector(SimilarityAlgorithm similarity, double threshold, KeyDecisionLog decisions) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1]");
        }
        this.similarity = similarity;
        this.threshold = threshold;
        this.decisions = decisions;
    }

    public List<KeyCluster> cluster(CanonicalKey key, Collection<PreparedCandidate> group) {
        String productKey = key.productKey();
        List<PreparedCandidate> ranked = RecordRanking.rank(MergeEngine.latestPerSource(group));
        Optional<KeyDecision> decision = decisions.latestFor(productKey);
        if (ranked.size() == 1 || decision.map(d -> d.type() == KeyDecisionType.MERGE).orElse(false)) {
            return List.of(new KeyCluster(key, productKey, ranked));
        }

        List<List<PreparedCandidate>> clusters = new ArrayList<>();
        for (PreparedCandidate candidate : ranked) {
            List<PreparedCandidate> home = null;
            for (List<PreparedCandidate> cluster : clusters) {
                PreparedCandidate representative = cluster.get(0);
                if (sameLine(representative, candidate)
                        && similarity.compute(representative.cleanedName(), candidate.cleanedName()) >= threshold) {
                    home = cluster;
                    break;
                }
            }
            if (home == null) {
                home = new ArrayList<>();
                clusters.add(home);
            }
            home.add(candidate);
        }
        clusters.sort(Comparator.comparing(KeyCollisionDetector::smallestSourceId));

        List<KeyCluster> result = new ArrayList<>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            result.add(new KeyCluster(key, KeyCluster.suffixed(productKey, i + 1), clusters.get(i)));
        }
        if (result.size() > 1) {
            log.debug("collision.clustered productKey={} clusters={}", productKey, result.size());
        }
        return result;
    }

    /**
     * Describes the collision between clusters of one key, or empty for a single cluster.
     */
    public Optional<KeyCollision> describe(List<KeyCluster> clusters) {
        if (clusters.size() < 2) {
            return Optional.empty();
        }
        String productKey = clusters.get(0).productKey();
        List<String> keys = new ArrayList<>();
        List<String> sourceIds = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (KeyCluster cluster : clusters) {
            keys.add(cluster.productKey());
            sourceIds.add(cluster.representative().sourceId());
            names.add(cluster.representative().cleanedName());
        }
        double score = similarity.compute(names.get(0), names.get(1));
        boolean split = decisions.isApproved(productKey, KeyDecisionType.SPLIT);
        return Optional.of(new KeyCollision(productKey, keys, sourceIds, names, score, split));
    }

    /**
     * An unknown line is compatible with any line.
     */
    static boolean sameLine(PreparedCandidate a, PreparedCandidate b) {
        String lineA = a.brand().brandLine();
        String lineB = b.brand().brandLine();
        return lineA == null || lineB == null || lineA.equals(lineB);
    }

    private static String smallestSourceId(List<PreparedCandidate> cluster) {
        return cluster.stream().map(PreparedCandidate::sourceId).min(Comparator.naturalOrder()).orElseThrow();
    }

    public double getThreshold() {
        return threshold;
    }
}
