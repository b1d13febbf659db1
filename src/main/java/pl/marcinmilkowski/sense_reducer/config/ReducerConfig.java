package pl.marcinmilkowski.sense_reducer.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_reducer.registry.SemanticConstantRegistry;
import pl.marcinmilkowski.sense_reducer.similarity.SimilarityGraphBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reducer settings loaded from JSON.
 *
 * Expected JSON structure (all keys except "version" are optional):
 * {
 *   "version": "1.0",
 *   "match_threshold": 0.85,
 *   "full_matrix_cutoff": 100,
 *   "strip_stopwords": true
 * }
 *
 * Mode thresholds and signal weights are not configurable here; they live in
 * {@link pl.marcinmilkowski.sense_reducer.model.ModeProfile}.
 */
public record ReducerConfig(
    String version,
    double matchThreshold,     // Registry match threshold, mode independent
    int fullMatrixCutoff,      // Largest witness count scored without pruning
    boolean stripStopwords
) {
    private static final Logger logger = LoggerFactory.getLogger(ReducerConfig.class);

    public static final String CURRENT_VERSION = "1.0";

    public ReducerConfig {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' in reducer config");
        }
        if (matchThreshold <= 0.0 || matchThreshold > 1.0) {
            throw new IllegalArgumentException("'match_threshold' must be in (0, 1]: " + matchThreshold);
        }
        if (fullMatrixCutoff < 1) {
            throw new IllegalArgumentException("'full_matrix_cutoff' must be positive: " + fullMatrixCutoff);
        }
    }

    public static ReducerConfig defaults() {
        return new ReducerConfig(CURRENT_VERSION, SemanticConstantRegistry.DEFAULT_MATCH_THRESHOLD,
            SimilarityGraphBuilder.DEFAULT_FULL_MATRIX_CUTOFF, true);
    }

    /**
     * Load configuration from the specified path.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public static ReducerConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Reducer config file not found: " + configPath);
        }
        ReducerConfig config = parse(Files.readString(configPath));
        logger.info("Loaded reducer config from {}: {}", configPath, config);
        return config;
    }

    /**
     * @throws IllegalArgumentException if the content is not a valid config
     */
    public static ReducerConfig parse(String content) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid reducer config JSON: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty reducer config");
        }
        ReducerConfig defaults = defaults();
        Double threshold = root.getDouble("match_threshold");
        Integer cutoff = root.getInteger("full_matrix_cutoff");
        Boolean strip = root.getBoolean("strip_stopwords");
        return new ReducerConfig(
            root.getString("version"),
            threshold != null ? threshold : defaults.matchThreshold(),
            cutoff != null ? cutoff : defaults.fullMatrixCutoff(),
            strip != null ? strip : defaults.stripStopwords());
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("version", version);
        obj.put("match_threshold", matchThreshold);
        obj.put("full_matrix_cutoff", fullMatrixCutoff);
        obj.put("strip_stopwords", stripStopwords);
        return obj;
    }
}
