package pl.marcinmilkowski.sense_reducer.normalize;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_reducer.model.Language;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads {@link LanguageLexicon}s from JSON.
 *
 * Expected JSON structure (every key except "version" is optional):
 * {
 *   "version": "1.0",
 *   "language": "san",
 *   "abbreviations": {"esp": "especially", ...},
 *   "stopwords": ["a", "the", ...],
 *   "negation_markers": ["not", "non-", ...],
 *   "deity_names": ["śiva", ...],
 *   "place_names": ["kāśī", ...],
 *   "entity_markers": {"person_or_deity": ["god of", ...], "place": [...], ...},
 *   "abstract_suffixes": ["ness", ...]
 * }
 *
 * Bundled lexicons live on the classpath under {@code lexicons/}; the language file is
 * merged over {@code lexicons/common.json}.
 */
public final class LexiconLoader {
    private static final Logger logger = LoggerFactory.getLogger(LexiconLoader.class);

    static final String RESOURCE_DIR = "lexicons/";
    static final String COMMON = "common";

    private LexiconLoader() {
    }

    /**
     * Load a lexicon file from disk.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the content is invalid
     */
    public static LanguageLexicon load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Lexicon file not found: " + path);
        }
        return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    /**
     * The language-agnostic lexicon bundled with the library.
     */
    public static LanguageLexicon loadCommon() {
        return loadResource(COMMON);
    }

    /**
     * Common lexicon merged with the bundled lexicon of {@code language}.
     */
    public static LanguageLexicon loadBundled(Language language) {
        return loadCommon().mergedWith(loadResource(language.getCode()));
    }

    /**
     * Bundled lexicons for every supported language.
     */
    public static Map<Language, LanguageLexicon> loadAllBundled() {
        LanguageLexicon common = loadCommon();
        Map<Language, LanguageLexicon> lexicons = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            lexicons.put(language, common.mergedWith(loadResource(language.getCode())));
        }
        return lexicons;
    }

    private static LanguageLexicon loadResource(String name) {
        String resource = RESOURCE_DIR + name + ".json";
        try (InputStream in = LexiconLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Bundled lexicon missing from classpath: " + resource);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled lexicon: " + resource, e);
        }
    }

    /**
     * Parse lexicon JSON.
     *
     * @param content JSON text
     * @param origin  file or resource name, used in messages
     * @throws IllegalArgumentException if the content is invalid
     */
    public static LanguageLexicon parse(String content, String origin) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid lexicon JSON in " + origin + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty lexicon: " + origin);
        }

        String version = root.getString("version");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in lexicon " + origin);
        }
        String name = root.getString("language");
        if (name == null || name.isBlank()) {
            name = COMMON;
        }

        Map<String, String> abbreviations = new LinkedHashMap<>();
        JSONObject abbrObj = root.getJSONObject("abbreviations");
        if (abbrObj != null) {
            for (String key : abbrObj.keySet()) {
                String expansion = abbrObj.getString(key);
                String normalizedKey = canonical(key);
                if (normalizedKey.isEmpty() || expansion == null || expansion.isBlank()) {
                    throw new IllegalArgumentException("Invalid abbreviation '" + key + "' in " + origin);
                }
                abbreviations.put(normalizedKey, canonical(expansion));
            }
        }

        Map<EntityType, List<String>> markers = new EnumMap<>(EntityType.class);
        JSONObject markersObj = root.getJSONObject("entity_markers");
        if (markersObj != null) {
            for (String key : markersObj.keySet()) {
                EntityType type = EntityType.fromKey(key);
                if (type == null) {
                    throw new IllegalArgumentException("Unknown entity type '" + key + "' in " + origin);
                }
                markers.put(type, new ArrayList<>(readList(markersObj.getJSONArray(key))));
            }
        }

        LanguageLexicon lexicon = new LanguageLexicon(
            name,
            abbreviations,
            readList(root.getJSONArray("stopwords")),
            readList(root.getJSONArray("negation_markers")),
            readList(root.getJSONArray("deity_names")),
            readList(root.getJSONArray("place_names")),
            markers,
            readList(root.getJSONArray("abstract_suffixes")));

        logger.debug("Loaded lexicon '{}' version {} from {}: {} abbreviations, {} stopwords",
            name, version, origin, abbreviations.size(), lexicon.getStopwords().size());
        return lexicon;
    }

    private static Set<String> readList(JSONArray array) {
        Set<String> values = new LinkedHashSet<>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.size(); i++) {
            String value = array.getString(i);
            if (value != null && !value.isBlank()) {
                values.add(canonical(value));
            }
        }
        return values;
    }

    /**
     * Same canonical form the normalizer produces: NFC, lowercase, single spaces.
     */
    static String canonical(String value) {
        String nfc = Normalizer.normalize(value, Normalizer.Form.NFC);
        return nfc.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }
}
