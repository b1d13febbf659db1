package pl.marcinmilkowski.sense_reducer.registry;

/**
 * Outcome of {@link SemanticConstantRegistry#matchOrCreate}: the constant id and whether a
 * new provisional constant had to be written.
 */
public record ConstantAssignment(String constantId, boolean created) {

    public static ConstantAssignment matched(String constantId) {
        return new ConstantAssignment(constantId, false);
    }

    public static ConstantAssignment created(String constantId) {
        return new ConstantAssignment(constantId, true);
    }
}
