package pl.marcinmilkowski.sense_reducer.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lexicographic and morphological sources that contribute witness sense units.
 *
 * <p>Priority rank orders sources for every tie-break in the pipeline (lower rank wins).
 * A source is "primary" only relative to the language of the reduction run.</p>
 */
public enum Source {
    /** Monier-Williams Sanskrit-English Dictionary */
    MW("mw", 1, EnumSet.of(Language.SANSKRIT)),
    /** Apte Practical Sanskrit-English Dictionary (1890) */
    AP90("ap90", 2, EnumSet.of(Language.SANSKRIT)),
    /** Sanskrit Heritage morphology engine */
    HERITAGE("heritage", 3, EnumSet.noneOf(Language.class)),
    /** Liddell-Scott-Jones Greek-English Lexicon */
    LSJ("lsj", 4, EnumSet.of(Language.GREEK)),
    /** Lewis and Short Latin Dictionary */
    LEWIS_SHORT("lewis_short", 5, EnumSet.of(Language.LATIN)),
    /** Whitaker's Words Latin analyzer */
    WHITAKERS("whitakers", 6, EnumSet.noneOf(Language.class)),
    /** Diogenes lookup front end */
    DIOGENES("diogenes", 7, EnumSet.noneOf(Language.class)),
    /** Classical Language Toolkit analyzers */
    CLTK("cltk", 8, EnumSet.noneOf(Language.class)),
    /** Cologne Digital Sanskrit Lexicon, generic dictionaries */
    CDSL("cdsl", 9, EnumSet.noneOf(Language.class));

    private final String code;
    private final int priority;
    private final Set<Language> primaryFor;

    Source(String code, int priority, Set<Language> primaryFor) {
        this.code = code;
        this.priority = priority;
        this.primaryFor = primaryFor;
    }

    public String getCode() {
        return code;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isPrimaryFor(Language language) {
        return language != null && primaryFor.contains(language);
    }

    /**
     * Look up a source by code, case-insensitively.
     *
     * @return the source, or null if the code is unknown
     */
    public static Source fromCode(String code) {
        if (code == null) return null;
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Source source : values()) {
            if (source.code.equals(normalized)) {
                return source;
            }
        }
        return null;
    }
}
