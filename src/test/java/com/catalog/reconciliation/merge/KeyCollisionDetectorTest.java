package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.audit.KeyDecisionLog;
import com.catalog.reconciliation.audit.KeyDecisionType;
import com.catalog.reconciliation.core.model.RawCandidateRecord;
import com.catalog.reconciliation.key.ProductKeyBuilder;
import com.catalog.reconciliation.rules.BrandAliasMap;
import com.catalog.reconciliation.rules.DefaultBrandAliases;
import com.catalog.reconciliation.scoring.QualityScorer;
import com.catalog.reconciliation.similarity.ProductNameSimilarity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.catalog.reconciliation.CandidateRecords.record;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyCollisionDetector Tests")
class KeyCollisionDetectorTest {

    private final CandidatePreparer preparer = new CandidatePreparer(new ProductKeyBuilder(), new QualityScorer());
    private final BrandAliasMap aliases = DefaultBrandAliases.create();
    private KeyDecisionLog decisions;
    private KeyCollisionDetector detector;

    private PreparedCandidate plain;
    private PreparedCandidate relaunch;

    @BeforeEach
    void setUp() {
        decisions = new KeyDecisionLog();
        detector = new KeyCollisionDetector(new ProductNameSimilarity(), KeyCollisionDetector.DEFAULT_THRESHOLD, decisions);
        plain = prepare(record("shop-a.example", "/p/1", "Royal Canin", "Adult").build());
        relaunch = prepare(record("shop-b.example", "/p/2", "Royal Canin", "New Improved Formula Adult").build());
    }

    private PreparedCandidate prepare(RawCandidateRecord record) {
        return preparer.prepare(record, aliases);
    }

    @Test
    @DisplayName("Stop-list words make both names share one key")
    void sharedKey() {
        assertEquals("royal_canin::adult::any", plain.key().productKey());
        assertEquals(plain.key(), relaunch.key());
    }

    @Test
    @DisplayName("Dissimilar names are split under suffixed keys")
    void splitsDissimilarNames() {
        List<KeyCluster> clusters = detector.cluster(plain.key(), List.of(relaunch, plain));

        assertEquals(2, clusters.size());
        assertEquals("royal_canin::adult::any", clusters.get(0).productKey());
        assertEquals("royal_canin::adult::any~2", clusters.get(1).productKey());
        assertEquals("shop-a.example|/p/1", clusters.get(0).representative().sourceId());
    }

    @Test
    @DisplayName("Collision description carries keys and similarity")
    void describesCollision() {
        KeyCollision collision = detector.describe(detector.cluster(plain.key(), List.of(plain, relaunch)))
                .orElseThrow();

        assertEquals("royal_canin::adult::any", collision.productKey());
        assertEquals(List.of("royal_canin::adult::any", "royal_canin::adult::any~2"), collision.productKeys());
        assertTrue(collision.similarity() < KeyCollisionDetector.DEFAULT_THRESHOLD);
        assertFalse(collision.splitConfirmed());
    }

    @Test
    @DisplayName("Similar names stay in one cluster")
    void similarNamesMerge() {
        PreparedCandidate sameName = prepare(record("shop-c.example", "/p/3", "Royal Canin", "Adult").build());

        List<KeyCluster> clusters = detector.cluster(plain.key(), List.of(plain, sameName));

        assertEquals(1, clusters.size());
        assertTrue(detector.describe(clusters).isEmpty());
    }

    @Test
    @DisplayName("Approved merge keeps the group together")
    void approvedMerge() {
        decisions.record("royal_canin::adult::any", KeyDecisionType.MERGE, "reviewer", "same product");

        List<KeyCluster> clusters = detector.cluster(plain.key(), List.of(plain, relaunch));

        assertEquals(1, clusters.size());
        assertEquals(2, clusters.get(0).members().size());
    }

    @Test
    @DisplayName("Confirmed split is flagged on the collision")
    void confirmedSplit() {
        decisions.record("royal_canin::adult::any", KeyDecisionType.SPLIT, "reviewer", "different recipes");

        KeyCollision collision = detector.describe(detector.cluster(plain.key(), List.of(plain, relaunch)))
                .orElseThrow();

        assertTrue(collision.splitConfirmed());
    }

    @Test
    @DisplayName("Different product lines of one brand are never clustered together")
    void splitsProductLines() {
        PreparedCandidate one = prepare(record("shop-a.example", "/p/11", "Purina ONE", "Adult Chicken")
                .formRaw("dry").build());
        PreparedCandidate proPlan = prepare(record("shop-b.example", "/p/12", "Purina Pro Plan", "Adult Chicken")
                .formRaw("dry").build());
        assertEquals(one.key(), proPlan.key());

        List<KeyCluster> clusters = detector.cluster(one.key(), List.of(one, proPlan));

        assertEquals(2, clusters.size());
        assertEquals("one", clusters.get(0).representative().brand().brandLine());
        assertEquals("pro_plan", clusters.get(1).representative().brand().brandLine());
        assertEquals("purina::adult-chicken::dry~2", clusters.get(1).productKey());
    }

    @Test
    @DisplayName("A record without a line still joins a lined cluster with the same name")
    void unknownLineJoins() {
        PreparedCandidate proPlan = prepare(record("shop-a.example", "/p/12", "Purina Pro Plan", "Adult Chicken")
                .formRaw("dry").build());
        PreparedCandidate plain = prepare(record("shop-b.example", "/p/13", "Purina", "Adult Chicken")
                .formRaw("dry").build());

        assertEquals(1, detector.cluster(proPlan.key(), List.of(proPlan, plain)).size());
    }

    @Test
    @DisplayName("Suffixes follow the smallest source id, not the score")
    void suffixesSurviveScoreChanges() {
        PreparedCandidate relaunchRich = prepare(record("shop-b.example", "/p/2", "Royal Canin",
                "New Improved Formula Adult").kcalPer100g(370.0).proteinPercent(25.0).build());
        PreparedCandidate plainRich = prepare(record("shop-a.example", "/p/1", "Royal Canin", "Adult")
                .kcalPer100g(370.0).proteinPercent(25.0).build());

        List<KeyCluster> before = detector.cluster(plain.key(), List.of(plain, relaunchRich));
        List<KeyCluster> after = detector.cluster(plain.key(), List.of(plainRich, relaunch));

        assertTrue(relaunchRich.score() > plain.score());
        assertTrue(plainRich.score() > relaunch.score());
        assertEquals("royal_canin::adult::any~2", before.get(1).productKey());
        assertEquals("shop-b.example|/p/2", before.get(1).representative().sourceId());
        assertEquals("royal_canin::adult::any~2", after.get(1).productKey());
        assertEquals("shop-b.example|/p/2", after.get(1).representative().sourceId());
    }

    @Test
    @DisplayName("Threshold outside [0, 1] is rejected")
    void invalidThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> new KeyCollisionDetector(new ProductNameSimilarity(), 1.5, decisions));
    }

    @Test
    @DisplayName("Suffix helpers")
    void suffixes() {
        assertEquals("a::b::c", KeyCluster.suffixed("a::b::c", 1));
        assertEquals("a::b::c~3", KeyCluster.suffixed("a::b::c", 3));
        assertEquals("a::b::c", KeyCluster.baseKeyOf("a::b::c~3"));
    }
}
