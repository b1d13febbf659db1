package pl.marcinmilkowski.sense_reducer.pipeline;

import pl.marcinmilkowski.sense_reducer.model.ReductionException;
import pl.marcinmilkowski.sense_reducer.model.WitnessKey;

/**
 * A second witness with an already seen {@code (source, sense_ref)}. The later one is
 * dropped with a warning; the first is kept.
 */
public class DuplicateWitnessException extends ReductionException {

    public DuplicateWitnessException(WitnessKey key) {
        super("duplicate witness " + key + " dropped");
    }
}
