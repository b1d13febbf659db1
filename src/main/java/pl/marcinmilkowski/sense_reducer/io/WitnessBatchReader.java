package pl.marcinmilkowski.sense_reducer.io;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.Source;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a {@link WitnessBatch} from JSON.
 *
 * Expected JSON structure:
 * {
 *   "lemma": "śiva",
 *   "language": "san",
 *   "adapter_reported_results": false,
 *   "witnesses": [
 *     {"source": "mw", "sense_ref": "217497", "gloss": "auspicious; benign",
 *      "domains": ["religion"], "register": [], "ordering": 0},
 *     ...
 *   ]
 * }
 *
 * Witness fields are read leniently: an unknown source or a missing gloss is kept as null
 * so the reducer can drop the witness with a warning, and an entry that is not an object is
 * passed on as a null witness. A non-numeric ordering is ignored. {@code gloss_raw} is accepted as an
 * alias of {@code gloss}.
 */
public final class WitnessBatchReader {
    private static final Logger logger = LoggerFactory.getLogger(WitnessBatchReader.class);

    private WitnessBatchReader() {
    }

    /**
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the content is not a valid batch
     */
    public static WitnessBatch read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Witness file not found: " + path);
        }
        WitnessBatch batch = parse(Files.readString(path));
        logger.debug("Read {} witnesses for '{}' from {}", batch.witnesses().size(), batch.lemma(), path);
        return batch;
    }

    /**
     * @throws IllegalArgumentException if the content is not a valid batch
     */
    public static WitnessBatch parse(String content) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid witness JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty witness file");
        }

        String lemma = root.getString("lemma");
        if (lemma == null || lemma.isBlank()) {
            throw new IllegalArgumentException("Missing 'lemma' field in witness file");
        }
        String languageCode = root.getString("language");
        if (languageCode == null) {
            throw new IllegalArgumentException("Missing 'language' field in witness file");
        }
        Language language = Language.fromCode(languageCode);

        JSONArray array = root.getJSONArray("witnesses");
        if (array == null) {
            throw new IllegalArgumentException("Missing 'witnesses' array in witness file");
        }
        List<WitnessSenseUnit> witnesses = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object entry = array.get(i);
            if (entry instanceof JSONObject) {
                witnesses.add(toWitness((JSONObject) entry, i));
            } else {
                if (entry != null) {
                    logger.warn("Witness at index {} is not an object: {}", i, entry);
                }
                witnesses.add(null);
            }
        }

        Boolean reported = root.getBoolean("adapter_reported_results");
        return new WitnessBatch(lemma, language, witnesses, reported != null && reported);
    }

    private static WitnessSenseUnit toWitness(JSONObject obj, int index) {
        String sourceCode = obj.getString("source");
        Source source = Source.fromCode(sourceCode);
        if (source == null && sourceCode != null) {
            logger.warn("Unknown source '{}' for witness at index {}", sourceCode, index);
        }
        String gloss = obj.containsKey("gloss") ? obj.getString("gloss") : obj.getString("gloss_raw");
        return new WitnessSenseUnit(
            source,
            obj.getString("sense_ref"),
            gloss,
            readTags(obj.getJSONArray("domains")),
            readTags(obj.getJSONArray("register")),
            readOrdering(obj.get("ordering"), index));
    }

    private static Integer readOrdering(Object value, int index) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        logger.warn("Ignoring non-numeric ordering '{}' for witness at index {}", value, index);
        return null;
    }

    private static Set<String> readTags(JSONArray array) {
        Set<String> tags = new LinkedHashSet<>();
        if (array == null) {
            return tags;
        }
        for (int i = 0; i < array.size(); i++) {
            String tag = array.getString(i);
            if (tag != null) {
                tags.add(tag);
            }
        }
        return tags;
    }
}
