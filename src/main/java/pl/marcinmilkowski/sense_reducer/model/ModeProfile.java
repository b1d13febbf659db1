package pl.marcinmilkowski.sense_reducer.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Strategy table for {@link Mode}: clustering threshold, per-signal weights and the
 * negation penalty.
 *
 * <p>Signal weights apply to signals scaled into [-1, 1] by their maximum magnitude and sum
 * to 1.0, so the best achievable score before the negation penalty is exactly 1.0. The
 * penalty is added after weighting.</p>
 *
 * <p>Weights are chosen so that any pair reaching the SKEPTIC threshold also reaches the
 * OPEN threshold. A new mode must keep that ordering relative to its neighbours.</p>
 */
public record ModeProfile(
    double threshold,
    double tokenWeight,
    double metadataWeight,
    double entityWeight,
    double primaryWeight,
    double negationPenalty
) {

    private static final Map<Mode, ModeProfile> TABLE;

    static {
        EnumMap<Mode, ModeProfile> table = new EnumMap<>(Mode.class);
        table.put(Mode.OPEN, new ModeProfile(0.62, 0.34, 0.10, 0.28, 0.28, -0.40));
        table.put(Mode.SKEPTIC, new ModeProfile(0.78, 0.22, 0.20, 0.29, 0.29, -0.60));
        TABLE = Collections.unmodifiableMap(table);
    }

    public static ModeProfile of(Mode mode) {
        ModeProfile profile = TABLE.get(mode);
        if (profile == null) {
            throw new IllegalStateException("No profile configured for mode " + mode);
        }
        return profile;
    }

    public double weightSum() {
        return tokenWeight + metadataWeight + entityWeight + primaryWeight;
    }
}
