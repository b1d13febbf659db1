package pl.marcinmilkowski.sense_reducer.similarity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combined similarity in [0, 1] and the per-signal breakdown that produced it.
 *
 * <p>Component values are the raw, unweighted signals (e.g. metadata in [0, 0.4]) except
 * {@link #NEGATION}, which holds the mode penalty actually applied.</p>
 */
public record SimilarityResult(double value, Map<String, Double> components) {

    public static final String TOKEN_OVERLAP = "token_overlap";
    public static final String METADATA_OVERLAP = "metadata_overlap";
    public static final String ENTITY_AGREEMENT = "entity_agreement";
    public static final String PRIMARY_SOURCE = "primary_source";
    public static final String NEGATION = "negation";
    public static final String VERBATIM = "verbatim";
    public static final String PRUNED = "pruned";

    private static final SimilarityResult PRUNED_RESULT =
        new SimilarityResult(0.0, Map.of(PRUNED, 1.0));

    public SimilarityResult {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Similarity out of range: " + value);
        }
        components = components != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(components))
            : Map.of();
    }

    /**
     * Placeholder for a pair skipped by graph pruning.
     */
    public static SimilarityResult pruned() {
        return PRUNED_RESULT;
    }

    public boolean isPruned() {
        return components.containsKey(PRUNED);
    }

    public double component(String name) {
        return components.getOrDefault(name, 0.0);
    }
}
