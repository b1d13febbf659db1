package pl.marcinmilkowski.sense_reducer.registry;

import pl.marcinmilkowski.sense_reducer.model.SemanticConstant;
import pl.marcinmilkowski.sense_reducer.normalize.GlossNormalizer;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * Registry held only in memory. Used in tests and by callers that embed the reducer
 * without a persistent store.
 */
public class InMemorySemanticConstantRegistry extends AbstractSemanticConstantRegistry {

    public InMemorySemanticConstantRegistry(GlossNormalizer normalizer, double matchThreshold, Clock clock) {
        super(normalizer, matchThreshold, clock);
    }

    public InMemorySemanticConstantRegistry(GlossNormalizer normalizer) {
        this(normalizer, DEFAULT_MATCH_THRESHOLD, Clock.systemUTC());
    }

    /**
     * Registry pre-filled with existing constants, e.g. a curated seed set.
     */
    public static InMemorySemanticConstantRegistry seeded(GlossNormalizer normalizer, Clock clock,
                                                          Collection<SemanticConstant> seed) {
        InMemorySemanticConstantRegistry registry =
            new InMemorySemanticConstantRegistry(normalizer, DEFAULT_MATCH_THRESHOLD, clock);
        registry.preload(List.copyOf(seed));
        return registry;
    }

    @Override
    protected void persist(SemanticConstant constant) {
        // cache is the store
    }
}
