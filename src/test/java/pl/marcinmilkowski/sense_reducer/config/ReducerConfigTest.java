package pl.marcinmilkowski.sense_reducer.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReducerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Defaults use the registry threshold and the full-matrix cutoff")
    void testDefaults() {
        ReducerConfig config = ReducerConfig.defaults();
        assertEquals(ReducerConfig.CURRENT_VERSION, config.version());
        assertEquals(0.85, config.matchThreshold(), 1e-9);
        assertEquals(100, config.fullMatrixCutoff());
        assertTrue(config.stripStopwords());
    }

    @Test
    @DisplayName("Missing optional keys fall back to defaults")
    void testPartialConfig() {
        ReducerConfig config = ReducerConfig.parse("{\"version\": \"1.0\", \"full_matrix_cutoff\": 250}");
        assertEquals(250, config.fullMatrixCutoff());
        assertEquals(0.85, config.matchThreshold(), 1e-9);
        assertTrue(config.stripStopwords());
    }

    @Test
    @DisplayName("Written config loads back unchanged")
    void testLoad() throws IOException {
        ReducerConfig config = new ReducerConfig("1.0", 0.9, 40, false);
        Path file = Files.writeString(tempDir.resolve("reducer.json"), config.toJson().toJSONString());

        assertEquals(config, ReducerConfig.load(file));
    }

    @Test
    @DisplayName("Invalid configs are rejected")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> ReducerConfig.parse("{\"match_threshold\": 0.9}"),
            "version is required");
        assertThrows(IllegalArgumentException.class,
            () -> ReducerConfig.parse("{\"version\": \"1.0\", \"match_threshold\": 1.5}"));
        assertThrows(IllegalArgumentException.class,
            () -> ReducerConfig.parse("{\"version\": \"1.0\", \"full_matrix_cutoff\": 0}"));
        assertThrows(IOException.class, () -> ReducerConfig.load(tempDir.resolve("missing.json")));
    }
}
