package pl.marcinmilkowski.sense_reducer.similarity;

import pl.marcinmilkowski.sense_reducer.model.WitnessKey;

/**
 * One unordered pair of the similarity graph. {@code left} is always the lower graph index.
 */
public record SimilarityEdge(
    int left,
    int right,
    WitnessKey leftKey,
    WitnessKey rightKey,
    SimilarityResult result
) {

    public double score() {
        return result.value();
    }

    @Override
    public String toString() {
        return String.format("%s <-> %s = %.4f", leftKey, rightKey, result.value());
    }
}
