package pl.marcinmilkowski.sense_reducer.registry;

import pl.marcinmilkowski.sense_reducer.model.ReductionException;

/**
 * The constant store cannot be opened, read or written. Reduction runs recover from it by
 * leaving semantic constants unassigned.
 */
public class RegistryUnavailableException extends ReductionException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
