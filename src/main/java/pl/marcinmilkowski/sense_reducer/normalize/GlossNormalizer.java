package pl.marcinmilkowski.sense_reducer.normalize;

import pl.marcinmilkowski.sense_reducer.model.Language;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic gloss canonicalization for comparison.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Unicode NFC</li>
 *   <li>lowercase ({@link Locale#ROOT})</li>
 *   <li>collapse whitespace</li>
 *   <li>expand the language's abbreviations, longest key first</li>
 *   <li>tokenize on anything that is not a letter, digit or combining mark</li>
 *   <li>optionally drop stop-words (negation markers are always kept)</li>
 * </ol>
 *
 * <p>No paraphrase, translation, synonym substitution or stemming happens here. The same
 * raw gloss and language always give the same tokens and entity tag.</p>
 *
 * <h2>Entity detection</h2>
 * <p>Rules fire in this order, first hit wins:</p>
 * <ul>
 *   <li>PLACE marker phrase ("place where", "river", ...) or known place name</li>
 *   <li>PERSON_OR_DEITY marker phrase ("god of", "deity", ...) or known deity name</li>
 *   <li>PERSON_OR_DEITY for a capitalized word after the first one, unless it is a short
 *       citation abbreviation such as "Cic."</li>
 *   <li>ABSTRACT marker phrase ("quality of", ...) or a content word with an abstract
 *       suffix ("-ness", "-ous", ...)</li>
 *   <li>OBJECT marker phrase ("kind of", "vessel", ...)</li>
 * </ul>
 */
public class GlossNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}\\p{M}]+");
    private static final int CITATION_MAX_LENGTH = 5;
    private static final int MIN_STEM_LENGTH = 3;

    private final LanguageLexicon common;
    private final Map<Language, LanguageLexicon> lexicons;
    private final boolean stripStopwords;

    /**
     * Normalizer over the bundled lexicons.
     */
    public GlossNormalizer(boolean stripStopwords) {
        this(LexiconLoader.loadCommon(), LexiconLoader.loadAllBundled(), stripStopwords);
    }

    public GlossNormalizer() {
        this(true);
    }

    /**
     * @param common   lexicon for language-agnostic text
     * @param lexicons per-language lexicons; languages without an entry fall back to common
     */
    public GlossNormalizer(LanguageLexicon common, Map<Language, LanguageLexicon> lexicons,
                           boolean stripStopwords) {
        this.common = common;
        EnumMap<Language, LanguageLexicon> copy = new EnumMap<>(Language.class);
        copy.putAll(lexicons);
        this.lexicons = Collections.unmodifiableMap(copy);
        this.stripStopwords = stripStopwords;
    }

    public NormalizedGloss normalize(String glossRaw, Language language) {
        return normalize(glossRaw, lexiconFor(language));
    }

    /**
     * Normalize language-agnostic text (constant labels, descriptions) with the common
     * lexicon only.
     */
    public NormalizedGloss normalize(String text) {
        return normalize(text, common);
    }

    public LanguageLexicon lexiconFor(Language language) {
        if (language == null) {
            return common;
        }
        return lexicons.getOrDefault(language, common);
    }

    public boolean isStripStopwords() {
        return stripStopwords;
    }

    private NormalizedGloss normalize(String glossRaw, LanguageLexicon lexicon) {
        String raw = glossRaw != null ? glossRaw : "";
        String nfc = Normalizer.normalize(raw, Normalizer.Form.NFC);
        String lower = nfc.toLowerCase(Locale.ROOT);
        String collapsed = WHITESPACE.matcher(lower).replaceAll(" ").trim();
        String expanded = lexicon.expandAbbreviations(collapsed);

        List<String> allTokens = tokenize(expanded);
        boolean negated = detectNegation(expanded, allTokens, lexicon);
        EntityType entity = detectEntity(nfc, allTokens, lexicon);

        LinkedHashSet<String> kept = new LinkedHashSet<>();
        for (String token : allTokens) {
            if (stripStopwords && lexicon.isStopword(token) && !lexicon.isNegationToken(token)) {
                continue;
            }
            kept.add(token);
        }
        return new NormalizedGloss(expanded, new ArrayList<>(kept), entity, negated);
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(text)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static boolean detectNegation(String expanded, List<String> tokens, LanguageLexicon lexicon) {
        for (String token : tokens) {
            if (lexicon.isNegationWord(token)) {
                return true;
            }
        }
        for (String word : WHITESPACE.split(expanded)) {
            if (lexicon.isNegationPrefixed(stripLeadingPunctuation(word))) {
                return true;
            }
        }
        return containsPhrase(tokens, multiWordMarkers(lexicon));
    }

    private static List<String> multiWordMarkers(LanguageLexicon lexicon) {
        List<String> phrases = new ArrayList<>();
        for (String marker : lexicon.getNegationMarkers()) {
            if (marker.indexOf(' ') > 0) {
                phrases.add(marker);
            }
        }
        return phrases;
    }

    private static EntityType detectEntity(String nfc, List<String> tokens, LanguageLexicon lexicon) {
        if (containsPhrase(tokens, lexicon.getMarkers(EntityType.PLACE))) {
            return EntityType.PLACE;
        }
        for (String token : tokens) {
            if (lexicon.isPlaceName(token)) return EntityType.PLACE;
        }
        if (containsPhrase(tokens, lexicon.getMarkers(EntityType.PERSON_OR_DEITY))) {
            return EntityType.PERSON_OR_DEITY;
        }
        for (String token : tokens) {
            if (lexicon.isDeityName(token)) return EntityType.PERSON_OR_DEITY;
        }
        if (hasProperName(nfc)) {
            return EntityType.PERSON_OR_DEITY;
        }
        if (containsPhrase(tokens, lexicon.getMarkers(EntityType.ABSTRACT))) {
            return EntityType.ABSTRACT;
        }
        for (String token : tokens) {
            if (lexicon.isStopword(token)) continue;
            for (String suffix : lexicon.getAbstractSuffixes()) {
                if (token.endsWith(suffix) && token.length() >= suffix.length() + MIN_STEM_LENGTH) {
                    return EntityType.ABSTRACT;
                }
            }
        }
        if (containsPhrase(tokens, lexicon.getMarkers(EntityType.OBJECT))) {
            return EntityType.OBJECT;
        }
        return null;
    }

    /**
     * A capitalized word anywhere but the start of the gloss. Short capitalized words
     * directly followed by a period ("Cic.", "Hom.") are citation abbreviations, and single
     * letters are ignored.
     */
    static boolean hasProperName(String nfc) {
        String[] words = WHITESPACE.split(nfc.trim());
        for (int i = 1; i < words.length; i++) {
            String word = stripLeadingPunctuation(words[i]);
            int end = 0;
            while (end < word.length()) {
                int cp = word.codePointAt(end);
                if (!Character.isLetter(cp) && Character.getType(cp) != Character.NON_SPACING_MARK) break;
                end += Character.charCount(cp);
            }
            if (end == 0) continue;
            String core = word.substring(0, end);
            if (!Character.isUpperCase(core.codePointAt(0)) || core.codePointCount(0, core.length()) < 2) {
                continue;
            }
            boolean citation = end < word.length() && word.charAt(end) == '.'
                && core.codePointCount(0, core.length()) <= CITATION_MAX_LENGTH;
            if (!citation) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsPhrase(List<String> tokens, List<String> phrases) {
        if (phrases.isEmpty() || tokens.isEmpty()) {
            return false;
        }
        String joined = " " + String.join(" ", tokens) + " ";
        for (String phrase : phrases) {
            if (joined.contains(" " + phrase + " ")) {
                return true;
            }
        }
        return false;
    }

    private static String stripLeadingPunctuation(String word) {
        int start = 0;
        while (start < word.length()) {
            int cp = word.codePointAt(start);
            if (Character.isLetterOrDigit(cp)) break;
            start += Character.charCount(cp);
        }
        return word.substring(start);
    }
}
