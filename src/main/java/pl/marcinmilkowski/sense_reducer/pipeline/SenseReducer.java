package pl.marcinmilkowski.sense_reducer.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_reducer.cluster.SenseBucketer;
import pl.marcinmilkowski.sense_reducer.config.ReducerConfig;
import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.MalformedWitnessException;
import pl.marcinmilkowski.sense_reducer.model.Mode;
import pl.marcinmilkowski.sense_reducer.model.ReducedSenseSet;
import pl.marcinmilkowski.sense_reducer.model.SenseBucket;
import pl.marcinmilkowski.sense_reducer.model.WitnessKey;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;
import pl.marcinmilkowski.sense_reducer.normalize.GlossNormalizer;
import pl.marcinmilkowski.sense_reducer.normalize.NormalizedGloss;
import pl.marcinmilkowski.sense_reducer.registry.ConstantAssignment;
import pl.marcinmilkowski.sense_reducer.registry.RegistryUnavailableException;
import pl.marcinmilkowski.sense_reducer.registry.SemanticConstantRegistry;
import pl.marcinmilkowski.sense_reducer.similarity.NormalizedWitness;
import pl.marcinmilkowski.sense_reducer.similarity.SimilarityGraph;
import pl.marcinmilkowski.sense_reducer.similarity.SimilarityGraphBuilder;
import pl.marcinmilkowski.sense_reducer.similarity.SimilarityScorer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the semantic reduction pipeline for one lemma: validate, normalize, build the
 * similarity graph, cluster, assign semantic constants.
 *
 * <p>Only structurally invalid input fails the run (unknown mode, no witness list, or an
 * empty list the adapters claimed was non-empty). Malformed and duplicate witnesses are
 * dropped, and an unreachable registry leaves every bucket without a constant; each of
 * these adds a warning to the result.</p>
 *
 * <p>A reducer holds no per-run state, so one instance can serve concurrent runs. The
 * registry is the only shared mutable resource and guards itself.</p>
 */
public class SenseReducer {

    private static final Logger logger = LoggerFactory.getLogger(SenseReducer.class);

    private final GlossNormalizer normalizer;
    private final SimilarityGraphBuilder graphBuilder;
    private final SenseBucketer bucketer;
    private final SemanticConstantRegistry registry;

    /**
     * @param registry constant store, or null to leave semantic constants unassigned
     */
    public SenseReducer(GlossNormalizer normalizer, SemanticConstantRegistry registry, ReducerConfig config) {
        this.normalizer = normalizer;
        this.graphBuilder = new SimilarityGraphBuilder(new SimilarityScorer(normalizer), config.fullMatrixCutoff());
        this.bucketer = new SenseBucketer();
        this.registry = registry;
    }

    public SenseReducer(SemanticConstantRegistry registry, ReducerConfig config) {
        this(new GlossNormalizer(config.stripStopwords()), registry, config);
    }

    public SenseReducer() {
        this(null, ReducerConfig.defaults());
    }

    public ReducedSenseSet reduce(String lemma, Language language, List<WitnessSenseUnit> wsus, Mode mode) {
        return reduce(ReductionRequest.of(lemma, language, wsus, mode));
    }

    /**
     * @throws pl.marcinmilkowski.sense_reducer.model.InvalidModeException if {@code mode} is unknown
     */
    public ReducedSenseSet reduce(String lemma, Language language, List<WitnessSenseUnit> wsus, String mode) {
        return reduce(lemma, language, wsus, Mode.parse(mode));
    }

    /**
     * @throws MissingWitnessesException if the request has no witness list, or an empty one
     *                                    although the adapters reported results
     */
    public ReducedSenseSet reduce(ReductionRequest request) {
        String lemma = request.lemma();
        Language language = request.language();
        Mode mode = request.mode();

        if (request.witnesses() == null) {
            throw new MissingWitnessesException(lemma, language, "no witness list supplied");
        }
        if (request.witnesses().isEmpty() && request.adapterReportedResults()) {
            throw new MissingWitnessesException(lemma, language, "adapters reported results but none arrived");
        }

        List<String> warnings = new ArrayList<>();
        List<WitnessSenseUnit> admitted = admit(request.witnesses(), warnings);
        if (admitted.isEmpty()) {
            logger.debug("No usable witnesses for '{}' ({})", lemma, language.getCode());
            return ReducedSenseSet.empty(lemma, language, mode, warnings);
        }

        List<NormalizedWitness> normalized = normalize(admitted, language);
        SimilarityGraph graph = graphBuilder.build(normalized, mode);
        List<SenseBucket> buckets = bucketer.cluster(normalized, graph, mode);
        if (registry != null) {
            buckets = assignConstants(buckets, warnings);
        }

        logger.info("Reduced '{}' ({}, {} mode): {} witnesses -> {} buckets, {} warnings",
            lemma, language.getCode(), mode.getCode(), admitted.size(), buckets.size(), warnings.size());
        return new ReducedSenseSet(lemma, language, mode, buckets, warnings);
    }

    private List<WitnessSenseUnit> admit(List<WitnessSenseUnit> witnesses, List<String> warnings) {
        List<WitnessSenseUnit> admitted = new ArrayList<>(witnesses.size());
        Set<WitnessKey> seen = new HashSet<>();
        for (int i = 0; i < witnesses.size(); i++) {
            WitnessSenseUnit witness = witnesses.get(i);
            try {
                checkWitness(witness, seen);
                admitted.add(witness);
            } catch (MalformedWitnessException e) {
                warn(warnings, String.format("malformed witness at index %d dropped: %s", i, e.getMessage()));
            } catch (DuplicateWitnessException e) {
                warn(warnings, e.getMessage());
            }
        }
        return admitted;
    }

    private static void checkWitness(WitnessSenseUnit witness, Set<WitnessKey> seen) {
        if (witness == null) {
            throw new MalformedWitnessException("witness");
        }
        witness.validate();
        if (!seen.add(witness.key())) {
            throw new DuplicateWitnessException(witness.key());
        }
    }

    private List<NormalizedWitness> normalize(List<WitnessSenseUnit> witnesses, Language language) {
        Map<WitnessKey, NormalizedGloss> cache = new LinkedHashMap<>();
        List<NormalizedWitness> normalized = new ArrayList<>(witnesses.size());
        for (WitnessSenseUnit witness : witnesses) {
            NormalizedGloss gloss = cache.computeIfAbsent(witness.key(),
                key -> normalizer.normalize(witness.glossRaw(), language));
            normalized.add(new NormalizedWitness(witness, gloss, witness.source().isPrimaryFor(language)));
        }
        return normalized;
    }

    private List<SenseBucket> assignConstants(List<SenseBucket> buckets, List<String> warnings) {
        List<SenseBucket> assigned = new ArrayList<>(buckets.size());
        int created = 0;
        try {
            for (SenseBucket bucket : buckets) {
                ConstantAssignment assignment = registry.matchOrCreate(bucket);
                if (assignment.created()) {
                    created++;
                }
                assigned.add(bucket.withSemanticConstant(assignment.constantId()));
            }
        } catch (RegistryUnavailableException e) {
            logger.debug("Registry failure", e);
            warn(warnings, "semantic constant registry unavailable: " + e.getMessage());
            return buckets;
        }
        logger.debug("Assigned constants to {} buckets ({} new provisional)", assigned.size(), created);
        return assigned;
    }

    private static void warn(List<String> warnings, String message) {
        logger.warn(message);
        warnings.add(message);
    }
}
