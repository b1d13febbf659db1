package pl.marcinmilkowski.sense_reducer.model;

/**
 * Raised when a mode value cannot be parsed. Surfaced to the caller, never retried.
 */
public class InvalidModeException extends ReductionException {

    private final String value;

    public InvalidModeException(String value) {
        super("Unknown reduction mode: " + value + " (expected open or skeptic)");
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
