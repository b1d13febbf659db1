package pl.marcinmilkowski.sense_reducer.registry;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * UPPER_SNAKE_CASE id derivation for new constants.
 */
public final class ConstantIds {

    static final String FALLBACK = "CONCEPT";
    static final int MAX_WORDS = 2;

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ID = Pattern.compile("[^A-Z0-9]+");

    private ConstantIds() {
    }

    /**
     * Join up to two leading content tokens: diacritics removed, uppercased, anything outside
     * {@code [A-Z0-9]} collapsed to an underscore. Tokens with nothing left (e.g. Greek
     * script) are skipped. Returns {@code CONCEPT} when no token survives.
     */
    public static String baseId(List<String> contentTokens) {
        StringBuilder id = new StringBuilder();
        int words = 0;
        for (String token : contentTokens) {
            if (words == MAX_WORDS) break;
            String part = asIdPart(token);
            if (part.isEmpty()) continue;
            if (id.length() > 0) id.append('_');
            id.append(part);
            words++;
        }
        return id.length() > 0 ? id.toString() : FALLBACK;
    }

    /**
     * {@code base}, or the first of {@code base_2}, {@code base_3}, ... not yet taken.
     */
    public static String unique(String base, Predicate<String> taken) {
        if (!taken.test(base)) {
            return base;
        }
        int suffix = 2;
        while (taken.test(base + "_" + suffix)) {
            suffix++;
        }
        return base + "_" + suffix;
    }

    static String asIdPart(String token) {
        String decomposed = Normalizer.normalize(token, Normalizer.Form.NFD);
        String stripped = MARKS.matcher(decomposed).replaceAll("").toUpperCase(Locale.ROOT);
        String collapsed = NON_ID.matcher(stripped).replaceAll("_");
        int start = 0;
        int end = collapsed.length();
        while (start < end && collapsed.charAt(start) == '_') start++;
        while (end > start && collapsed.charAt(end - 1) == '_') end--;
        return collapsed.substring(start, end);
    }
}
