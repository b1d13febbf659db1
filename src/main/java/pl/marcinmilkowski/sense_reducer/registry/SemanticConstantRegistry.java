package pl.marcinmilkowski.sense_reducer.registry;

import pl.marcinmilkowski.sense_reducer.model.SemanticConstant;
import pl.marcinmilkowski.sense_reducer.model.SenseBucket;

import java.util.List;
import java.util.Optional;

/**
 * Store of semantic constants shared by all reduction runs.
 *
 * <p>Implementations must make {@link #matchOrCreate} an atomic check-then-insert so that
 * concurrent runs reducing the same concept converge on one constant. Any operation may
 * throw {@link RegistryUnavailableException} when the backing store fails.</p>
 */
public interface SemanticConstantRegistry extends AutoCloseable {

    /** Default Jaccard threshold for matching a bucket to an existing constant. */
    double DEFAULT_MATCH_THRESHOLD = 0.85;

    /**
     * Best constant whose label or description matches the bucket's display gloss at or
     * above the match threshold. Ties go to the earliest {@code created_at}, then the
     * smaller id.
     *
     * @return the constant id, or null when nothing matches
     */
    String findMatch(SenseBucket bucket);

    /**
     * Write a new provisional constant derived from the bucket's centroid gloss.
     *
     * @return the new constant id
     */
    String createProvisional(SenseBucket bucket);

    /**
     * {@link #findMatch} and, when it finds nothing, {@link #createProvisional}, as one
     * atomic step.
     */
    ConstantAssignment matchOrCreate(SenseBucket bucket);

    /**
     * Move a constant from provisional to curated. Promoting a curated constant does
     * nothing.
     *
     * @throws ConstantNotFoundException if no constant has this id
     */
    void promote(String constantId);

    Optional<SemanticConstant> get(String constantId);

    /**
     * All constants, ordered by id.
     */
    List<SemanticConstant> constants();

    @Override
    default void close() {
    }
}
