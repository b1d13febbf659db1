package pl.marcinmilkowski.sense_reducer.registry;

import pl.marcinmilkowski.sense_reducer.model.ReductionException;

public class ConstantNotFoundException extends ReductionException {

    private final String constantId;

    public ConstantNotFoundException(String constantId) {
        super("Unknown semantic constant: " + constantId);
        this.constantId = constantId;
    }

    public String getConstantId() {
        return constantId;
    }
}
