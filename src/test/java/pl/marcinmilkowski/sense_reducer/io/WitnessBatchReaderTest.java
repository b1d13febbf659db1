package pl.marcinmilkowski.sense_reducer.io;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.Mode;
import pl.marcinmilkowski.sense_reducer.model.ReducedSenseSet;
import pl.marcinmilkowski.sense_reducer.model.Source;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;
import pl.marcinmilkowski.sense_reducer.pipeline.ReductionRequest;
import pl.marcinmilkowski.sense_reducer.pipeline.SenseReducer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WitnessBatchReaderTest {

    private static final String SHIVA = """
        {
          "lemma": "śiva",
          "language": "sanskrit",
          "witnesses": [
            {"source": "mw", "sense_ref": "217497", "gloss": "auspicious; benign; favorable",
             "domains": ["Religion"], "ordering": 0},
            {"source": "AP90", "sense_ref": "27998:1", "gloss_raw": "auspicious; lucky", "register": ["poetic"]},
            {"source": "webster", "sense_ref": "1", "gloss": "nice"},
            null
          ]
        }
        """;

    @Test
    @DisplayName("Witness fields are read, with aliases and lowercased tags")
    void testParse() {
        WitnessBatch batch = WitnessBatchReader.parse(SHIVA);

        assertEquals("śiva", batch.lemma());
        assertEquals(Language.SANSKRIT, batch.language());
        assertFalse(batch.adapterReportedResults());
        assertEquals(4, batch.witnesses().size());

        WitnessSenseUnit mw = batch.witnesses().get(0);
        assertEquals(Source.MW, mw.source());
        assertEquals("217497", mw.senseRef());
        assertEquals(Set.of("religion"), mw.domains());
        assertEquals(Integer.valueOf(0), mw.ordering());

        WitnessSenseUnit ap90 = batch.witnesses().get(1);
        assertEquals(Source.AP90, ap90.source());
        assertEquals("auspicious; lucky", ap90.glossRaw());
        assertEquals(Set.of("poetic"), ap90.register());
        assertNull(ap90.ordering());
    }

    @Test
    @DisplayName("Unknown sources and null entries are kept for the reducer to drop")
    void testLenientWitnesses() {
        WitnessBatch batch = WitnessBatchReader.parse(SHIVA);

        assertNull(batch.witnesses().get(2).source());
        assertNull(batch.witnesses().get(3));
    }

    @Test
    @DisplayName("Non-object entries and bad orderings do not abort the batch")
    void testMalformedEntries() {
        WitnessBatch batch = WitnessBatchReader.parse("""
            {
              "lemma": "śiva",
              "language": "san",
              "witnesses": [
                "oops",
                42,
                {"source": "mw", "sense_ref": "217497", "gloss": "auspicious", "ordering": "first"}
              ]
            }
            """);

        assertEquals(3, batch.witnesses().size());
        assertNull(batch.witnesses().get(0));
        assertNull(batch.witnesses().get(1));
        WitnessSenseUnit mw = batch.witnesses().get(2);
        assertEquals("auspicious", mw.glossRaw());
        assertNull(mw.ordering());

        ReducedSenseSet result = new SenseReducer().reduce(batch.toRequest(Mode.OPEN));
        assertEquals(1, result.buckets().size());
        assertEquals(List.of(
            "malformed witness at index 0 dropped: missing witness",
            "malformed witness at index 1 dropped: missing witness"), result.warnings());
    }

    @Test
    @DisplayName("The batch becomes a request for the chosen mode")
    void testToRequest() {
        WitnessBatch batch = WitnessBatchReader.parse(
            "{\"lemma\": \"lux\", \"language\": \"la\", \"adapter_reported_results\": true, \"witnesses\": []}");
        ReductionRequest request = batch.toRequest(Mode.SKEPTIC);

        assertEquals("lux", request.lemma());
        assertEquals(Language.LATIN, request.language());
        assertEquals(Mode.SKEPTIC, request.mode());
        assertTrue(request.adapterReportedResults());
        assertTrue(request.witnesses().isEmpty());
    }

    @Test
    @DisplayName("Files are read from disk")
    void testRead(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("shiva.json"), SHIVA);
        assertEquals(4, WitnessBatchReader.read(file).witnesses().size());
        assertThrows(IOException.class, () -> WitnessBatchReader.read(tempDir.resolve("missing.json")));
    }

    @Test
    @DisplayName("Batches without lemma, language or witness array are rejected")
    void testInvalid() {
        assertThrows(IllegalArgumentException.class,
            () -> WitnessBatchReader.parse("{\"language\": \"san\", \"witnesses\": []}"));
        assertThrows(IllegalArgumentException.class,
            () -> WitnessBatchReader.parse("{\"lemma\": \"x\", \"witnesses\": []}"));
        assertThrows(IllegalArgumentException.class,
            () -> WitnessBatchReader.parse("{\"lemma\": \"x\", \"language\": \"klingon\", \"witnesses\": []}"));
        assertThrows(IllegalArgumentException.class,
            () -> WitnessBatchReader.parse("{\"lemma\": \"x\", \"language\": \"san\"}"));
    }
}
