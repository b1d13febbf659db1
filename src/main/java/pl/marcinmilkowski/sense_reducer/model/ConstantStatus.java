package pl.marcinmilkowski.sense_reducer.model;

import java.util.Locale;

/**
 * Lifecycle of a semantic constant. The only transition is {@code PROVISIONAL -> CURATED}.
 */
public enum ConstantStatus {
    /** Minted automatically by the registry when no existing constant matched. */
    PROVISIONAL,
    /** Confirmed by an out-of-band curation process. */
    CURATED;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConstantStatus fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Missing constant status");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
