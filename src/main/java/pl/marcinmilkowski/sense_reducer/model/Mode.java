package pl.marcinmilkowski.sense_reducer.model;

import java.util.Locale;

/**
 * Clustering strictness. All mode-specific constants live in {@link ModeProfile}.
 */
public enum Mode {
    /** Learner-friendly: favors consolidation of witnesses. */
    OPEN,
    /** Evidence-first: favors finer splitting. */
    SKEPTIC;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public ModeProfile profile() {
        return ModeProfile.of(this);
    }

    /**
     * Parse "open" or "skeptic", case-insensitively.
     *
     * @throws InvalidModeException for any other value
     */
    public static Mode parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Mode mode : values()) {
                if (mode.getCode().equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new InvalidModeException(value);
    }
}
