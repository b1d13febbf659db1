package pl.marcinmilkowski.sense_reducer.model;

import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SemanticConstantTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Ids must be UPPER_SNAKE_CASE")
    void testIdPattern() {
        assertTrue(SemanticConstant.isValidId("AUSPICIOUS_BENIGN_2"));
        assertFalse(SemanticConstant.isValidId("auspicious"));
        assertFalse(SemanticConstant.isValidId("A__B"));
        assertFalse(SemanticConstant.isValidId("_A"));
        assertThrows(IllegalArgumentException.class, () -> new SemanticConstant("bad id", "", "", Set.of(),
            ConstantStatus.PROVISIONAL, List.of(), CREATED, null));
    }

    @Test
    @DisplayName("curate() moves a provisional constant to curated")
    void testCurate() {
        SemanticConstant provisional = new SemanticConstant("LUCKY", "lucky", "lucky", Set.of("astrology"),
            ConstantStatus.PROVISIONAL, List.of(new WitnessKey(Source.AP90, "1")), CREATED, null);
        Instant later = CREATED.plusSeconds(60);
        SemanticConstant curated = provisional.curate(later);

        assertFalse(provisional.isCurated());
        assertTrue(curated.isCurated());
        assertEquals(later, curated.curatedAt());
        assertEquals(CREATED, curated.createdAt());
        assertEquals("curated", curated.toJson().getString("status"));
        assertEquals(List.of("ap90:1"), curated.toJson().getJSONArray("created_from").toJavaList(String.class));
    }

    @Test
    @DisplayName("A curated constant needs curated_at")
    void testCuratedNeedsTimestamp() {
        assertThrows(IllegalArgumentException.class, () -> new SemanticConstant("LUCKY", "", "", Set.of(),
            ConstantStatus.CURATED, List.of(), CREATED, null));
    }
}
