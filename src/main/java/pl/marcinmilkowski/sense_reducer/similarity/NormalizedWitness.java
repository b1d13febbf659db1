package pl.marcinmilkowski.sense_reducer.similarity;

import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.WitnessKey;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;
import pl.marcinmilkowski.sense_reducer.normalize.GlossNormalizer;
import pl.marcinmilkowski.sense_reducer.normalize.NormalizedGloss;

/**
 * A witness paired with its normalized gloss and its primary-source flag for the run
 * language. Built once per witness and reused by the scorer, graph builder and bucketer.
 */
public record NormalizedWitness(
    WitnessSenseUnit witness,
    NormalizedGloss gloss,
    boolean primary
) {

    public static NormalizedWitness of(WitnessSenseUnit witness, Language language, GlossNormalizer normalizer) {
        return new NormalizedWitness(witness,
            normalizer.normalize(witness.glossRaw(), language),
            witness.source().isPrimaryFor(language));
    }

    public WitnessKey key() {
        return witness.key();
    }
}
