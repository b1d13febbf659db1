package pl.marcinmilkowski.sense_reducer.cluster;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.Mode;
import pl.marcinmilkowski.sense_reducer.model.SenseBucket;
import pl.marcinmilkowski.sense_reducer.model.Source;
import pl.marcinmilkowski.sense_reducer.model.WitnessKey;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;
import pl.marcinmilkowski.sense_reducer.normalize.GlossNormalizer;
import pl.marcinmilkowski.sense_reducer.similarity.NormalizedWitness;
import pl.marcinmilkowski.sense_reducer.similarity.SimilarityGraph;
import pl.marcinmilkowski.sense_reducer.similarity.SimilarityGraphBuilder;
import pl.marcinmilkowski.sense_reducer.similarity.SimilarityScorer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SenseBucketerTest {

    private static GlossNormalizer normalizer;
    private static SimilarityGraphBuilder builder;
    private final SenseBucketer bucketer = new SenseBucketer();

    @BeforeAll
    static void setUp() {
        normalizer = new GlossNormalizer();
        builder = new SimilarityGraphBuilder(new SimilarityScorer(normalizer));
    }

    private List<SenseBucket> cluster(Language language, Mode mode, List<WitnessSenseUnit> witnesses) {
        List<NormalizedWitness> normalized = new ArrayList<>();
        for (WitnessSenseUnit w : witnesses) {
            normalized.add(NormalizedWitness.of(w, language, normalizer));
        }
        SimilarityGraph graph = builder.build(normalized, mode);
        return bucketer.cluster(normalized, graph, mode);
    }

    private static List<WitnessSenseUnit> shivaWitnesses() {
        return List.of(
            new WitnessSenseUnit(Source.MW, "217497", "auspicious; benign; favorable"),
            new WitnessSenseUnit(Source.MW, "217501", "Śiva, the deity"),
            new WitnessSenseUnit(Source.AP90, "27998:1", "auspicious; lucky"));
    }

    @Test
    @DisplayName("OPEN mode merges the two 'auspicious' witnesses and keeps the deity apart")
    void testOpenMode() {
        List<SenseBucket> buckets = cluster(Language.SANSKRIT, Mode.OPEN, shivaWitnesses());

        assertEquals(2, buckets.size());
        SenseBucket b1 = buckets.get(0);
        assertEquals("B1", b1.senseId());
        assertEquals(List.of(new WitnessKey(Source.MW, "217497"), new WitnessKey(Source.AP90, "27998:1")), b1.witnessKeys());
        assertEquals("auspicious; benign; favorable", b1.displayGloss(), "centroid is the highest-priority witness");
        assertEquals(0.645, b1.confidence(), 1e-9);
        assertTrue(b1.primaryWitness());
        assertNull(b1.semanticConstant());

        SenseBucket b2 = buckets.get(1);
        assertEquals("B2", b2.senseId());
        assertEquals(List.of(new WitnessKey(Source.MW, "217501")), b2.witnessKeys());
        assertEquals(1.0, b2.confidence(), 1e-9);
    }

    @Test
    @DisplayName("SKEPTIC mode keeps every witness apart, ordered by source priority")
    void testSkepticMode() {
        List<SenseBucket> buckets = cluster(Language.SANSKRIT, Mode.SKEPTIC, shivaWitnesses());

        assertEquals(3, buckets.size());
        assertEquals("mw:217497", buckets.get(0).centroid().key().toString());
        assertEquals("mw:217501", buckets.get(1).centroid().key().toString());
        assertEquals("ap90:27998:1", buckets.get(2).centroid().key().toString());
        assertEquals("B3", buckets.get(2).senseId());
    }

    @Test
    @DisplayName("Membership is the transitive closure of the seed, not a single pass")
    void testTransitiveClosure() {
        // 1 and 3 restate each other; 2 only matches 3 (shared name tag), and 2 sorts before 3
        List<WitnessSenseUnit> witnesses = List.of(
            new WitnessSenseUnit(Source.MW, "1", "bright light"),
            new WitnessSenseUnit(Source.MW, "2", "bright Light lamp"),
            new WitnessSenseUnit(Source.MW, "3", "bright Light"));
        List<SenseBucket> buckets = cluster(Language.SANSKRIT, Mode.OPEN, witnesses);

        assertEquals(1, buckets.size());
        assertEquals(List.of("1", "2", "3"),
            buckets.get(0).witnesses().stream().map(WitnessSenseUnit::senseRef).toList());
        // pairs: 1-2 = 0.34 * 2/3 + 0.28, 1-3 = 1.0, 2-3 = 0.34 * 2/3 + 0.28 + 0.28
        double expected = ((0.34 * 2 / 3 + 0.28) + 1.0 + (0.34 * 2 / 3 + 0.56)) / 3;
        assertEquals(expected, buckets.get(0).confidence(), 1e-9);
    }

    @Test
    @DisplayName("Equal-sized buckets rank those with a primary witness first")
    void testPrimaryTieBreak() {
        // For Greek, MW sorts first but only LSJ is primary
        List<WitnessSenseUnit> witnesses = List.of(
            new WitnessSenseUnit(Source.MW, "1", "alpha"),
            new WitnessSenseUnit(Source.LSJ, "2", "beta"));
        List<SenseBucket> buckets = cluster(Language.GREEK, Mode.OPEN, witnesses);

        assertEquals(2, buckets.size());
        assertEquals(Source.LSJ, buckets.get(0).centroid().source());
        assertTrue(buckets.get(0).primaryWitness());
        assertEquals(Source.MW, buckets.get(1).centroid().source());
        assertFalse(buckets.get(1).primaryWitness());
    }

    @Test
    @DisplayName("Larger buckets rank first and domains are merged")
    void testSizeRanking() {
        List<WitnessSenseUnit> witnesses = List.of(
            new WitnessSenseUnit(Source.MW, "a", "cow"),
            new WitnessSenseUnit(Source.HERITAGE, "b", "auspicious, lucky", Set.of("astrology"), Set.of()),
            new WitnessSenseUnit(Source.CDSL, "c", "lucky; auspicious", Set.of("ritual"), Set.of("vedic")));
        List<SenseBucket> buckets = cluster(Language.SANSKRIT, Mode.OPEN, witnesses);

        assertEquals(2, buckets.size());
        assertEquals(2, buckets.get(0).size());
        assertEquals("auspicious, lucky", buckets.get(0).displayGloss());
        assertEquals(Set.of("astrology", "ritual"), buckets.get(0).domains());
        assertEquals(Set.of("vedic"), buckets.get(0).register());
        assertEquals("cow", buckets.get(1).displayGloss());
    }

    @Test
    @DisplayName("Input order does not change the result")
    void testOrderIndependence() {
        List<WitnessSenseUnit> shuffled = new ArrayList<>(shivaWitnesses());
        Collections.reverse(shuffled);
        List<SenseBucket> forward = cluster(Language.SANSKRIT, Mode.OPEN, shivaWitnesses());
        List<SenseBucket> backward = cluster(Language.SANSKRIT, Mode.OPEN, shuffled);
        assertEquals(forward, backward);
    }

    @Test
    @DisplayName("Buckets partition the input")
    void testPartition() {
        List<WitnessSenseUnit> witnesses = new ArrayList<>(shivaWitnesses());
        witnesses.add(new WitnessSenseUnit(Source.CDSL, "x1", "auspicious; benign; favorable"));
        witnesses.add(new WitnessSenseUnit(Source.HERITAGE, "x2", "not auspicious"));
        for (Mode mode : Mode.values()) {
            List<SenseBucket> buckets = cluster(Language.SANSKRIT, mode, witnesses);
            Set<WitnessKey> seen = new HashSet<>();
            int total = 0;
            for (SenseBucket bucket : buckets) {
                assertFalse(bucket.witnesses().isEmpty());
                for (WitnessKey key : bucket.witnessKeys()) {
                    assertTrue(seen.add(key), "witness in two buckets: " + key);
                    total++;
                }
            }
            assertEquals(witnesses.size(), total);
        }
    }

    @Test
    @DisplayName("No witnesses, no buckets; unknown witnesses are rejected")
    void testEdgeCases() {
        assertTrue(cluster(Language.LATIN, Mode.OPEN, List.of()).isEmpty());

        List<NormalizedWitness> inGraph = List.of(NormalizedWitness.of(
            new WitnessSenseUnit(Source.LEWIS_SHORT, "1", "war"), Language.LATIN, normalizer));
        SimilarityGraph graph = builder.build(inGraph, Mode.OPEN);
        List<NormalizedWitness> outside = List.of(NormalizedWitness.of(
            new WitnessSenseUnit(Source.LEWIS_SHORT, "2", "peace"), Language.LATIN, normalizer));
        assertThrows(IllegalArgumentException.class, () -> bucketer.cluster(outside, graph, Mode.OPEN));
        assertEquals(1, bucketer.cluster(graph).size());
    }
}
