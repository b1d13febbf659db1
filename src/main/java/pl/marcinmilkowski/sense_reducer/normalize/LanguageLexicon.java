package pl.marcinmilkowski.sense_reducer.normalize;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word lists that drive gloss normalization for one language: abbreviations, stop-words,
 * negation markers, name lists and entity marker phrases.
 *
 * <p>All entries are stored lowercased and NFC-normalized by {@link LexiconLoader}. Lists
 * that are scanned in order (markers, suffixes) are kept sorted so that the result never
 * depends on file order.</p>
 */
public final class LanguageLexicon {

    private final String name;
    private final Map<String, String> abbreviations;
    private final Set<String> stopwords;
    private final Set<String> negationMarkers;
    private final Set<String> deityNames;
    private final Set<String> placeNames;
    private final Map<EntityType, List<String>> entityMarkers;
    private final List<String> abstractSuffixes;
    private final Pattern abbreviationPattern;

    public LanguageLexicon(String name,
                           Map<String, String> abbreviations,
                           Set<String> stopwords,
                           Set<String> negationMarkers,
                           Set<String> deityNames,
                           Set<String> placeNames,
                           Map<EntityType, ? extends Iterable<String>> entityMarkers,
                           Iterable<String> abstractSuffixes) {
        this.name = name;
        this.abbreviations = Collections.unmodifiableMap(new TreeMap<>(abbreviations));
        this.stopwords = Collections.unmodifiableSet(new TreeSet<>(stopwords));
        this.negationMarkers = Collections.unmodifiableSet(new TreeSet<>(negationMarkers));
        this.deityNames = Collections.unmodifiableSet(new TreeSet<>(deityNames));
        this.placeNames = Collections.unmodifiableSet(new TreeSet<>(placeNames));

        EnumMap<EntityType, List<String>> markers = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            TreeSet<String> phrases = new TreeSet<>();
            Iterable<String> source = entityMarkers.get(type);
            if (source != null) {
                source.forEach(phrases::add);
            }
            markers.put(type, List.copyOf(phrases));
        }
        this.entityMarkers = Collections.unmodifiableMap(markers);

        TreeSet<String> suffixes = new TreeSet<>();
        abstractSuffixes.forEach(suffixes::add);
        this.abstractSuffixes = List.copyOf(suffixes);

        this.abbreviationPattern = compileAbbreviations(this.abbreviations.keySet());
    }

    /**
     * Build a lexicon holding the entries of both lexicons. Abbreviations defined in
     * {@code other} win over ours.
     */
    public LanguageLexicon mergedWith(LanguageLexicon other) {
        Map<String, String> mergedAbbreviations = new TreeMap<>(abbreviations);
        mergedAbbreviations.putAll(other.abbreviations);

        EnumMap<EntityType, List<String>> mergedMarkers = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            List<String> phrases = new ArrayList<>(entityMarkers.get(type));
            phrases.addAll(other.entityMarkers.get(type));
            mergedMarkers.put(type, phrases);
        }

        List<String> mergedSuffixes = new ArrayList<>(abstractSuffixes);
        mergedSuffixes.addAll(other.abstractSuffixes);

        return new LanguageLexicon(
            other.name,
            mergedAbbreviations,
            union(stopwords, other.stopwords),
            union(negationMarkers, other.negationMarkers),
            union(deityNames, other.deityNames),
            union(placeNames, other.placeNames),
            mergedMarkers,
            mergedSuffixes);
    }

    /**
     * Replace abbreviations at word boundaries. A key ending in a period ("lit.") only
     * matches with the period; other keys ("esp") match with or without one. Longer keys
     * are tried first.
     */
    public String expandAbbreviations(String text) {
        if (abbreviationPattern == null || text.isEmpty()) {
            return text;
        }
        Matcher m = abbreviationPattern.matcher(text);
        StringBuilder sb = new StringBuilder(text.length() + 16);
        while (m.find()) {
            String matched = m.group(1);
            String expansion = abbreviations.get(matched);
            if (expansion == null && matched.endsWith(".")) {
                expansion = abbreviations.get(matched.substring(0, matched.length() - 1));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(expansion != null ? expansion : matched));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public boolean isStopword(String token) {
        return stopwords.contains(token);
    }

    /**
     * Whole-word negation marker ("not", "without"). Prefix markers such as "non-" are
     * reported by {@link #isNegationPrefixed(String)}.
     */
    public boolean isNegationWord(String token) {
        return negationMarkers.contains(token);
    }

    /**
     * Word starts with a prefix marker that ends in a hyphen ("non-existent").
     */
    public boolean isNegationPrefixed(String word) {
        for (String marker : negationMarkers) {
            if (marker.endsWith("-") && word.startsWith(marker) && word.length() > marker.length()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Token is a negation marker or the stem of a hyphenated prefix marker ("non" for
     * "non-"). Such tokens survive stop-word stripping.
     */
    public boolean isNegationToken(String token) {
        return negationMarkers.contains(token) || negationMarkers.contains(token + "-");
    }

    public boolean isDeityName(String token) {
        return deityNames.contains(token);
    }

    public boolean isPlaceName(String token) {
        return placeNames.contains(token);
    }

    public List<String> getMarkers(EntityType type) {
        return entityMarkers.get(type);
    }

    public List<String> getAbstractSuffixes() {
        return abstractSuffixes;
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getAbbreviations() {
        return abbreviations;
    }

    public Set<String> getStopwords() {
        return stopwords;
    }

    public Set<String> getNegationMarkers() {
        return negationMarkers;
    }

    /**
     * Export for diagnostics, using the same keys as the JSON resources.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("language", name);
        root.put("abbreviations", new JSONObject(new TreeMap<String, Object>(abbreviations)));
        root.put("stopwords", new JSONArray(stopwords));
        root.put("negation_markers", new JSONArray(negationMarkers));
        root.put("deity_names", new JSONArray(deityNames));
        root.put("place_names", new JSONArray(placeNames));
        JSONObject markers = new JSONObject();
        for (Map.Entry<EntityType, List<String>> e : entityMarkers.entrySet()) {
            markers.put(e.getKey().getCode(), new JSONArray(e.getValue()));
        }
        root.put("entity_markers", markers);
        root.put("abstract_suffixes", new JSONArray(abstractSuffixes));
        return root;
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> result = new LinkedHashSet<>(a);
        result.addAll(b);
        return result;
    }

    private static Pattern compileAbbreviations(Set<String> keys) {
        if (keys.isEmpty()) {
            return null;
        }
        List<String> ordered = new ArrayList<>(keys);
        ordered.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        StringBuilder alternation = new StringBuilder();
        for (String key : ordered) {
            if (alternation.length() > 0) alternation.append('|');
            alternation.append(Pattern.quote(key));
            if (!key.endsWith(".")) {
                alternation.append("\\.?");
            }
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}])(" + alternation + ")(?![\\p{L}\\p{N}])");
    }
}
