package pl.marcinmilkowski.sense_reducer.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_reducer.model.Mode;

import java.util.List;

/**
 * Builds the {@link SimilarityGraph} for one run.
 *
 * <p>Up to {@code fullMatrixCutoff} witnesses every pair is scored. Above the cutoff a pair
 * whose token sets are disjoint and whose domain and register tags share nothing is pruned:
 * it gets 0.0 without calling the scorer. A pruned pair can still carry entity and
 * primary-source agreement, so pruning may drop an edge that a weight table giving those
 * signals more than the threshold would have kept. The number of pruned pairs is reported
 * on the graph.</p>
 */
public class SimilarityGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityGraphBuilder.class);

    public static final int DEFAULT_FULL_MATRIX_CUTOFF = 100;

    private final SimilarityScorer scorer;
    private final int fullMatrixCutoff;

    public SimilarityGraphBuilder(SimilarityScorer scorer, int fullMatrixCutoff) {
        if (fullMatrixCutoff < 1) {
            throw new IllegalArgumentException("full_matrix_cutoff must be positive: " + fullMatrixCutoff);
        }
        this.scorer = scorer;
        this.fullMatrixCutoff = fullMatrixCutoff;
    }

    public SimilarityGraphBuilder(SimilarityScorer scorer) {
        this(scorer, DEFAULT_FULL_MATRIX_CUTOFF);
    }

    public SimilarityGraph build(List<NormalizedWitness> witnesses, Mode mode) {
        int n = witnesses.size();
        boolean prune = n > fullMatrixCutoff;
        SimilarityResult[] upper = new SimilarityResult[SimilarityGraph.pairCount(n)];
        int pruned = 0;
        int k = 0;
        for (int i = 0; i < n; i++) {
            NormalizedWitness a = witnesses.get(i);
            for (int j = i + 1; j < n; j++) {
                NormalizedWitness b = witnesses.get(j);
                if (prune && canPrune(a, b)) {
                    upper[k++] = SimilarityResult.pruned();
                    pruned++;
                } else {
                    upper[k++] = scorer.score(a, b, mode);
                }
            }
        }

        if (prune) {
            logger.info("Similarity graph over {} witnesses ({} mode): pruned {} of {} pairs",
                n, mode.getCode(), pruned, upper.length);
        } else {
            logger.debug("Similarity graph over {} witnesses ({} mode): {} pairs scored",
                n, mode.getCode(), upper.length);
        }
        return new SimilarityGraph(witnesses, upper, mode, pruned);
    }

    static boolean canPrune(NormalizedWitness a, NormalizedWitness b) {
        return TokenSimilarity.isDisjoint(a.gloss().getTokenSet(), b.gloss().getTokenSet())
            && TokenSimilarity.isDisjoint(a.witness().domains(), b.witness().domains())
            && TokenSimilarity.isDisjoint(a.witness().register(), b.witness().register());
    }
}
