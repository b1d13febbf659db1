package pl.marcinmilkowski.sense_reducer.model;

import java.util.Locale;

/**
 * Classical languages whose lexicon evidence can be reduced.
 */
public enum Language {
    LATIN("lat"),
    GREEK("grc"),
    SANSKRIT("san");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    /**
     * ISO 639-style code, also used to locate the bundled lexicon resource.
     */
    public String getCode() {
        return code;
    }

    /**
     * Parse a language code or common alias ("la", "latin", "greek", "sanskrit").
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static Language fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing language code");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "lat", "la", "latin" -> LATIN;
            case "grc", "greek" -> GREEK;
            case "san", "sanskrit" -> SANSKRIT;
            default -> throw new IllegalArgumentException("Unknown language: " + value);
        };
    }
}
