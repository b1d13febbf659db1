package pl.marcinmilkowski.sense_reducer.normalize;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.sense_reducer.model.Language;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GlossNormalizerTest {

    private static GlossNormalizer normalizer;

    @BeforeAll
    static void setUp() {
        normalizer = new GlossNormalizer();
    }

    @Test
    @DisplayName("Punctuation splits tokens and case is folded")
    void testTokenization() {
        NormalizedGloss gloss = normalizer.normalize("Auspicious;  benign,\tfavorable", Language.SANSKRIT);
        assertEquals(List.of("auspicious", "benign", "favorable"), gloss.getTokens());
        assertEquals("auspicious; benign, favorable", gloss.getText());
        assertFalse(gloss.isNegated());
    }

    @Test
    @DisplayName("Stop-words are stripped unless disabled")
    void testStopwords() {
        assertEquals(List.of("śiva", "deity"), normalizer.normalize("Śiva, the deity", Language.SANSKRIT).getTokens());

        GlossNormalizer keeping = new GlossNormalizer(false);
        assertEquals(List.of("śiva", "the", "deity"), keeping.normalize("Śiva, the deity", Language.SANSKRIT).getTokens());
        assertFalse(keeping.isStripStopwords());
    }

    @Test
    @DisplayName("Decomposed and precomposed input give the same tokens")
    void testUnicodeNormalization() {
        NormalizedGloss composed = normalizer.normalize("Śiva", Language.SANSKRIT);
        NormalizedGloss decomposed = normalizer.normalize("S\u0301iva", Language.SANSKRIT);
        assertEquals(composed.getTokens(), decomposed.getTokens());
        assertEquals(composed, decomposed);
    }

    @Test
    @DisplayName("Abbreviations expand with an optional or a required period")
    void testAbbreviations() {
        NormalizedGloss esp = normalizer.normalize("esp. of a horse", Language.SANSKRIT);
        assertEquals("especially of a horse", esp.getText());
        assertEquals(List.of("especially", "horse"), esp.getTokens());

        assertEquals(List.of("sweet", "example", "honey"),
            normalizer.normalize("sweet, e.g. honey", Language.SANSKRIT).getTokens());

        // "lit." needs its period; the verb "lit" stays
        assertEquals(List.of("lit", "fire"), normalizer.normalize("lit the fire", Language.SANSKRIT).getTokens());
        assertEquals(List.of("literally", "fire"), normalizer.normalize("lit. fire", Language.SANSKRIT).getTokens());
    }

    @Test
    @DisplayName("Longer abbreviation keys win over shorter ones")
    void testLongestMatchFirst() {
        LanguageLexicon lexicon = new LanguageLexicon("test",
            Map.of("n.", "noun", "n. of", "name of"),
            Set.of(), Set.of(), Set.of(), Set.of(), Map.of(), List.of());
        assertEquals("name of siva", lexicon.expandAbbreviations("n. of siva"));
        assertEquals("noun pl", lexicon.expandAbbreviations("n. pl"));
        assertEquals("nation", lexicon.expandAbbreviations("nation"));
    }

    @Test
    @DisplayName("Negation words, prefixes and phrases mark a gloss as negated")
    void testNegation() {
        NormalizedGloss not = normalizer.normalize("not accompanied", Language.SANSKRIT);
        assertTrue(not.isNegated());
        assertEquals(List.of("not", "accompanied"), not.getTokens(), "negation markers survive stop-word stripping");

        assertTrue(normalizer.normalize("non-existent", Language.SANSKRIT).isNegated());
        assertTrue(normalizer.normalize("devoid of fear", Language.GREEK).isNegated());
        assertTrue(normalizer.normalize("without a master", Language.LATIN).isNegated());
        assertFalse(normalizer.normalize("nonetheless", Language.LATIN).isNegated());
        assertFalse(normalizer.normalize("accompanied", Language.SANSKRIT).isNegated());
    }

    @Test
    @DisplayName("Entity markers and name lists drive the entity tag")
    void testEntityMarkers() {
        assertEquals(EntityType.PERSON_OR_DEITY, normalizer.normalize("Śiva, the deity", Language.SANSKRIT).getEntityType());
        assertEquals(EntityType.PERSON_OR_DEITY, normalizer.normalize("beloved of indra", Language.SANSKRIT).getEntityType());
        assertEquals(EntityType.PERSON_OR_DEITY, normalizer.normalize("son of zeus", Language.GREEK).getEntityType());
        assertEquals(EntityType.PLACE, normalizer.normalize("a river in the north", Language.SANSKRIT).getEntityType());
        assertEquals(EntityType.PLACE, normalizer.normalize("sacred to kāśī", Language.SANSKRIT).getEntityType());
        assertEquals(EntityType.ABSTRACT, normalizer.normalize("quality of being pure", Language.LATIN).getEntityType());
        assertEquals(EntityType.ABSTRACT, normalizer.normalize("auspicious; benign", Language.SANSKRIT).getEntityType());
        assertEquals(EntityType.OBJECT, normalizer.normalize("kind of vessel", Language.GREEK).getEntityType());
        assertNull(normalizer.normalize("accompanied", Language.SANSKRIT).getEntityType());
    }

    @Test
    @DisplayName("Name lists are per language")
    void testLanguageSpecificNames() {
        assertEquals(EntityType.PERSON_OR_DEITY, normalizer.normalize("sacred to jupiter", Language.LATIN).getEntityType());
        assertNull(normalizer.normalize("sacred to jupiter", Language.SANSKRIT).getEntityType());
    }

    @Test
    @DisplayName("Capitalized words count as names, citation abbreviations do not")
    void testProperNames() {
        assertTrue(GlossNormalizer.hasProperName("beloved of Rāma"));
        assertFalse(GlossNormalizer.hasProperName("Brave and bold"), "first word is ignored");
        assertFalse(GlossNormalizer.hasProperName("brave, Cic. Off. 1, 2"));
        assertFalse(GlossNormalizer.hasProperName("a letter A"));
        assertNull(normalizer.normalize("brave, Cic. Off. 1, 2", Language.LATIN).getEntityType());
    }

    @Test
    @DisplayName("Normalization is a pure function")
    void testDeterminism() {
        String raw = "Name of a god, esp. of Śiva; not the same as Agni";
        NormalizedGloss first = normalizer.normalize(raw, Language.SANSKRIT);
        NormalizedGloss second = normalizer.normalize(raw, Language.SANSKRIT);
        assertEquals(first, second);
        assertEquals(first.getTokens(), second.getTokens());
        assertEquals(first.getEntityType(), second.getEntityType());
        assertEquals(first.hashCode(), new GlossNormalizer().normalize(raw, Language.SANSKRIT).hashCode());
    }

    @Test
    @DisplayName("Empty and null glosses normalize to no tokens")
    void testEmpty() {
        assertTrue(normalizer.normalize("", Language.LATIN).isEmpty());
        assertTrue(normalizer.normalize(null, Language.LATIN).isEmpty());
        assertTrue(normalizer.normalize(" ;, ", Language.LATIN).isEmpty());
        assertTrue(normalizer.normalize("the of a", Language.LATIN).isEmpty());
    }

    @Test
    @DisplayName("Text without a language uses the common lexicon")
    void testCommonLexicon() {
        NormalizedGloss gloss = normalizer.normalize("The Deity Śiva");
        assertEquals(List.of("deity", "śiva"), gloss.getTokens());
        assertSame(normalizer.lexiconFor(null), normalizer.lexiconFor(null));
    }
}
