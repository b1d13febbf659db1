package pl.marcinmilkowski.sense_reducer.model;

/**
 * A witness sense unit is missing a required field (source, sense_ref or gloss_raw).
 * The orchestrator drops the witness and records a warning.
 */
public class MalformedWitnessException extends ReductionException {

    private final String missingField;

    public MalformedWitnessException(String missingField) {
        super("missing " + missingField);
        this.missingField = missingField;
    }

    public String getMissingField() {
        return missingField;
    }
}
