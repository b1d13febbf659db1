package pl.marcinmilkowski.sense_reducer.normalize;

import java.util.Locale;

/**
 * Coarse entity class detected in a gloss by rule-based matching.
 */
public enum EntityType {
    PERSON_OR_DEITY,
    PLACE,
    ABSTRACT,
    OBJECT;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the matching type, or null if the key is unknown
     */
    public static EntityType fromKey(String key) {
        if (key == null) return null;
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
