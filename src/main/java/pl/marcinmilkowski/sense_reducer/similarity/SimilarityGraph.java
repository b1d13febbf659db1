package pl.marcinmilkowski.sense_reducer.similarity;

import pl.marcinmilkowski.sense_reducer.model.Mode;
import pl.marcinmilkowski.sense_reducer.model.WitnessKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Symmetric score lookup over all unordered witness pairs of one run.
 *
 * <p>Only the upper triangle is stored: pair {@code (i, j)} with {@code i < j} lives at
 * {@code i * (2n - i - 1) / 2 + (j - i - 1)}. The score of a witness with itself is 1.0.</p>
 */
public class SimilarityGraph {

    private static final Comparator<SimilarityEdge> BY_SCORE_DESC =
        Comparator.comparingDouble(SimilarityEdge::score).reversed()
            .thenComparingInt(SimilarityEdge::left)
            .thenComparingInt(SimilarityEdge::right);

    private final List<NormalizedWitness> witnesses;
    private final Map<WitnessKey, Integer> indexByKey;
    private final SimilarityResult[] upper;
    private final Mode mode;
    private final int prunedPairs;

    SimilarityGraph(List<NormalizedWitness> witnesses, SimilarityResult[] upper, Mode mode, int prunedPairs) {
        int n = witnesses.size();
        if (upper.length != pairCount(n)) {
            throw new IllegalArgumentException("Expected " + pairCount(n) + " pair scores, got " + upper.length);
        }
        this.witnesses = List.copyOf(witnesses);
        this.upper = upper;
        this.mode = mode;
        this.prunedPairs = prunedPairs;
        Map<WitnessKey, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(witnesses.get(i).key(), i);
        }
        this.indexByKey = Collections.unmodifiableMap(index);
    }

    static int pairCount(int n) {
        return n * (n - 1) / 2;
    }

    public int size() {
        return witnesses.size();
    }

    public Mode getMode() {
        return mode;
    }

    public List<NormalizedWitness> getWitnesses() {
        return witnesses;
    }

    /**
     * @return graph index of the witness, or -1 if it is not part of the graph
     */
    public int indexOf(WitnessKey key) {
        Integer index = indexByKey.get(key);
        return index != null ? index : -1;
    }

    /**
     * Pairs scored 0.0 by pruning instead of by the scorer.
     */
    public int getPrunedPairs() {
        return prunedPairs;
    }

    public double score(int i, int j) {
        if (i == j) {
            checkIndex(i);
            return 1.0;
        }
        return result(i, j).value();
    }

    public double score(WitnessKey a, WitnessKey b) {
        return score(requireIndex(a), requireIndex(b));
    }

    public SimilarityResult result(int i, int j) {
        checkIndex(i);
        checkIndex(j);
        if (i == j) {
            throw new IllegalArgumentException("No edge between a witness and itself: " + i);
        }
        int lo = Math.min(i, j);
        int hi = Math.max(i, j);
        return upper[offset(lo, hi)];
    }

    public SimilarityEdge edge(int i, int j) {
        SimilarityResult result = result(i, j);
        int lo = Math.min(i, j);
        int hi = Math.max(i, j);
        return new SimilarityEdge(lo, hi, witnesses.get(lo).key(), witnesses.get(hi).key(), result);
    }

    /**
     * Edges from {@code i} scoring at least {@code threshold}, best first, ties by index.
     */
    public List<SimilarityEdge> neighbors(int i, double threshold) {
        checkIndex(i);
        List<SimilarityEdge> edges = new ArrayList<>();
        for (int j = 0; j < witnesses.size(); j++) {
            if (j != i && score(i, j) >= threshold) {
                edges.add(edge(i, j));
            }
        }
        edges.sort(BY_SCORE_DESC);
        return edges;
    }

    /**
     * All pairs scoring at least {@code threshold}, best first, ties by indices.
     */
    public List<SimilarityEdge> similarPairs(double threshold) {
        List<SimilarityEdge> edges = new ArrayList<>();
        int n = witnesses.size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (upper[offset(i, j)].value() >= threshold) {
                    edges.add(edge(i, j));
                }
            }
        }
        edges.sort(BY_SCORE_DESC);
        return edges;
    }

    private int offset(int lo, int hi) {
        int n = witnesses.size();
        return lo * (2 * n - lo - 1) / 2 + (hi - lo - 1);
    }

    private int requireIndex(WitnessKey key) {
        int index = indexOf(key);
        if (index < 0) {
            throw new IllegalArgumentException("Witness not in graph: " + key);
        }
        return index;
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= witnesses.size()) {
            throw new IndexOutOfBoundsException("Witness index " + i + " out of range for " + witnesses.size());
        }
    }
}
