package pl.marcinmilkowski.sense_reducer.similarity;

import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.Mode;
import pl.marcinmilkowski.sense_reducer.model.ModeProfile;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;
import pl.marcinmilkowski.sense_reducer.normalize.EntityType;
import pl.marcinmilkowski.sense_reducer.normalize.GlossNormalizer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Pairwise similarity between two witnesses under a {@link Mode}.
 *
 * <p>Five signals are computed independently:</p>
 * <ul>
 *   <li>token overlap: Jaccard of normalized token sets, in [0, 1]</li>
 *   <li>metadata overlap: +0.20 per shared domain (at most 0.40), +0.15 per shared register
 *       (at most 0.30), total at most 0.40</li>
 *   <li>entity agreement: +0.30 for matching entity tags, -0.10 for conflicting ones, 0 if
 *       either is missing</li>
 *   <li>primary source: +0.25 if both witnesses come from a primary source of the run
 *       language, +0.10 if one does</li>
 *   <li>negation: the mode penalty when exactly one gloss is negated</li>
 * </ul>
 *
 * <p>The first four are scaled by their maximum magnitude, weighted by the mode profile and
 * summed; the negation penalty is added afterwards and the result clamped to [0, 1]. Two
 * glosses with identical non-empty token sets and the same polarity are restatements and
 * score 1.0 in every mode.</p>
 *
 * <p>Every signal is symmetric and the sum is evaluated in a fixed order, so
 * {@code score(a, b) == score(b, a)} holds exactly.</p>
 */
public class SimilarityScorer {

    static final double DOMAIN_STEP = 0.20;
    static final double DOMAIN_CAP = 0.40;
    static final double REGISTER_STEP = 0.15;
    static final double REGISTER_CAP = 0.30;
    static final double METADATA_CAP = 0.40;
    static final double ENTITY_MATCH = 0.30;
    static final double ENTITY_CONFLICT = -0.10;
    static final double BOTH_PRIMARY = 0.25;
    static final double ONE_PRIMARY = 0.10;

    private final GlossNormalizer normalizer;

    public SimilarityScorer(GlossNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public SimilarityScorer() {
        this(new GlossNormalizer());
    }

    /**
     * Score two raw witnesses, normalizing both glosses first.
     */
    public SimilarityResult score(WitnessSenseUnit a, WitnessSenseUnit b, Language language, Mode mode) {
        return score(NormalizedWitness.of(a, language, normalizer),
            NormalizedWitness.of(b, language, normalizer), mode);
    }

    public SimilarityResult score(NormalizedWitness a, NormalizedWitness b, Mode mode) {
        ModeProfile profile = mode.profile();

        Set<String> tokensA = a.gloss().getTokenSet();
        Set<String> tokensB = b.gloss().getTokenSet();
        double token = TokenSimilarity.jaccard(tokensA, tokensB);
        double metadata = metadataOverlap(a.witness(), b.witness());
        double entity = entityAgreement(a.gloss().getEntityType(), b.gloss().getEntityType());
        double primary = primaryAgreement(a.primary(), b.primary());
        boolean polarityMismatch = a.gloss().isNegated() != b.gloss().isNegated();
        double negation = polarityMismatch ? profile.negationPenalty() : 0.0;

        Map<String, Double> components = new LinkedHashMap<>();
        components.put(SimilarityResult.TOKEN_OVERLAP, token);
        components.put(SimilarityResult.METADATA_OVERLAP, metadata);
        components.put(SimilarityResult.ENTITY_AGREEMENT, entity);
        components.put(SimilarityResult.PRIMARY_SOURCE, primary);
        components.put(SimilarityResult.NEGATION, negation);

        if (!polarityMismatch && !tokensA.isEmpty() && tokensA.equals(tokensB)) {
            components.put(SimilarityResult.VERBATIM, 1.0);
            return new SimilarityResult(1.0, components);
        }

        double weighted = profile.tokenWeight() * token
            + profile.metadataWeight() * (metadata / METADATA_CAP)
            + profile.entityWeight() * (entity / ENTITY_MATCH)
            + profile.primaryWeight() * (primary / BOTH_PRIMARY);
        return new SimilarityResult(clamp(weighted + negation), components);
    }

    static double metadataOverlap(WitnessSenseUnit a, WitnessSenseUnit b) {
        int sharedDomains = TokenSimilarity.countShared(a.domains(), b.domains());
        int sharedRegisters = TokenSimilarity.countShared(a.register(), b.register());
        double domainPart = Math.min(sharedDomains * DOMAIN_STEP, DOMAIN_CAP);
        double registerPart = Math.min(sharedRegisters * REGISTER_STEP, REGISTER_CAP);
        return Math.min(domainPart + registerPart, METADATA_CAP);
    }

    static double entityAgreement(EntityType a, EntityType b) {
        if (a == null || b == null) {
            return 0.0;
        }
        return a == b ? ENTITY_MATCH : ENTITY_CONFLICT;
    }

    static double primaryAgreement(boolean a, boolean b) {
        if (a && b) {
            return BOTH_PRIMARY;
        }
        return a || b ? ONE_PRIMARY : 0.0;
    }

    private static double clamp(double value) {
        if (value < 0.0) return 0.0;
        if (value > 1.0) return 1.0;
        return value;
    }
}
