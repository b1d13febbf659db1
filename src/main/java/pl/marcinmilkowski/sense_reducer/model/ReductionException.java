package pl.marcinmilkowski.sense_reducer.model;

/**
 * Base class for all errors raised by the semantic reduction pipeline.
 */
public class ReductionException extends RuntimeException {

    public ReductionException(String message) {
        super(message);
    }

    public ReductionException(String message, Throwable cause) {
        super(message, cause);
    }
}
