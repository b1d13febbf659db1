package pl.marcinmilkowski.sense_reducer.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_reducer.model.ConstantStatus;
import pl.marcinmilkowski.sense_reducer.model.SemanticConstant;
import pl.marcinmilkowski.sense_reducer.model.SenseBucket;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;
import pl.marcinmilkowski.sense_reducer.normalize.GlossNormalizer;
import pl.marcinmilkowski.sense_reducer.normalize.LanguageLexicon;
import pl.marcinmilkowski.sense_reducer.similarity.TokenSimilarity;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Matching, id allocation and lifecycle shared by all registry stores.
 *
 * <p>Constants are cached in memory, keyed by id. Lookups hold the read lock; anything that
 * may write holds the write lock for the whole check-then-insert, so concurrent callers
 * never allocate the same id or create two constants for one concept. Subclasses persist
 * each new or changed constant in {@link #persist(SemanticConstant)} before it becomes
 * visible in the cache.</p>
 */
public abstract class AbstractSemanticConstantRegistry implements SemanticConstantRegistry {

    private static final Logger logger = LoggerFactory.getLogger(AbstractSemanticConstantRegistry.class);

    private static final String DESCRIPTION_SEPARATOR = "; ";

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, SemanticConstant> constants = new TreeMap<>();
    private final Map<String, ComparisonTokens> comparisonTokens = new HashMap<>();

    protected final GlossNormalizer normalizer;
    protected final double matchThreshold;
    protected final Clock clock;

    protected AbstractSemanticConstantRegistry(GlossNormalizer normalizer, double matchThreshold, Clock clock) {
        if (matchThreshold <= 0.0 || matchThreshold > 1.0) {
            throw new IllegalArgumentException("match threshold must be in (0, 1]: " + matchThreshold);
        }
        this.normalizer = normalizer;
        this.matchThreshold = matchThreshold;
        this.clock = clock;
    }

    /**
     * Write a new or updated constant to the backing store.
     *
     * @throws RegistryUnavailableException if the store cannot be written
     */
    protected abstract void persist(SemanticConstant constant);

    /**
     * Fill the cache from the backing store. Called by subclasses while opening.
     */
    protected void preload(Collection<SemanticConstant> stored) {
        lock.writeLock().lock();
        try {
            for (SemanticConstant constant : stored) {
                cache(constant);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String findMatch(SenseBucket bucket) {
        lock.readLock().lock();
        try {
            return bestMatch(bucket);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String createProvisional(SenseBucket bucket) {
        lock.writeLock().lock();
        try {
            return create(bucket);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public ConstantAssignment matchOrCreate(SenseBucket bucket) {
        lock.writeLock().lock();
        try {
            String match = bestMatch(bucket);
            if (match != null) {
                return ConstantAssignment.matched(match);
            }
            return ConstantAssignment.created(create(bucket));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void promote(String constantId) {
        lock.writeLock().lock();
        try {
            SemanticConstant constant = constants.get(constantId);
            if (constant == null) {
                throw new ConstantNotFoundException(constantId);
            }
            if (constant.isCurated()) {
                logger.debug("Constant {} already curated at {}", constantId, constant.curatedAt());
                return;
            }
            SemanticConstant curated = constant.curate(clock.instant());
            persist(curated);
            cache(curated);
            logger.info("Promoted constant {} to curated", constantId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<SemanticConstant> get(String constantId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(constants.get(constantId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SemanticConstant> constants() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(constants.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Score of the bucket against one constant: the better of label and description
     * overlap.
     */
    public double matchScore(SenseBucket bucket, SemanticConstant constant) {
        Set<String> bucketTokens = normalizer.normalize(bucket.displayGloss()).getTokenSet();
        return matchScore(bucketTokens, tokensOf(constant));
    }

    // Caller holds a lock.
    private String bestMatch(SenseBucket bucket) {
        Set<String> bucketTokens = normalizer.normalize(bucket.displayGloss()).getTokenSet();
        if (bucketTokens.isEmpty()) {
            return null;
        }
        SemanticConstant best = null;
        double bestScore = -1.0;
        for (SemanticConstant candidate : constants.values()) {
            double score = matchScore(bucketTokens, comparisonTokens.get(candidate.constantId()));
            if (score < matchThreshold) continue;
            if (best == null || score > bestScore
                || (score == bestScore && candidate.createdAt().isBefore(best.createdAt()))) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best != null) {
            logger.debug("Bucket '{}' matched constant {} (score {})", bucket.displayGloss(),
                best.constantId(), bestScore);
            return best.constantId();
        }
        return null;
    }

    // Caller holds the write lock.
    private String create(SenseBucket bucket) {
        String id = ConstantIds.unique(ConstantIds.baseId(contentTokens(bucket.centroid())),
            constants::containsKey);
        SemanticConstant constant = new SemanticConstant(
            id,
            bucket.displayGloss(),
            describe(bucket),
            bucket.domains(),
            ConstantStatus.PROVISIONAL,
            bucket.witnessKeys(),
            clock.instant(),
            null);
        persist(constant);
        cache(constant);
        logger.info("Created provisional constant {} from {} witnesses", id, bucket.size());
        return id;
    }

    private List<String> contentTokens(WitnessSenseUnit centroid) {
        LanguageLexicon common = normalizer.lexiconFor(null);
        List<String> content = new ArrayList<>();
        for (String token : normalizer.normalize(centroid.glossRaw()).getTokens()) {
            if (!common.isStopword(token)) {
                content.add(token);
            }
        }
        return content;
    }

    private static String describe(SenseBucket bucket) {
        Set<String> glosses = new LinkedHashSet<>();
        for (WitnessSenseUnit w : bucket.witnesses()) {
            String gloss = w.glossRaw().trim();
            if (!gloss.isEmpty()) {
                glosses.add(gloss);
            }
        }
        return String.join(DESCRIPTION_SEPARATOR, glosses);
    }

    private void cache(SemanticConstant constant) {
        constants.put(constant.constantId(), constant);
        comparisonTokens.put(constant.constantId(), tokensOf(constant));
    }

    private ComparisonTokens tokensOf(SemanticConstant constant) {
        return new ComparisonTokens(
            normalizer.normalize(constant.canonicalLabel()).getTokenSet(),
            normalizer.normalize(constant.description()).getTokenSet());
    }

    private static double matchScore(Set<String> bucketTokens, ComparisonTokens tokens) {
        return Math.max(
            TokenSimilarity.jaccard(bucketTokens, tokens.label()),
            TokenSimilarity.jaccard(bucketTokens, tokens.description()));
    }

    private record ComparisonTokens(Set<String> label, Set<String> description) {
    }
}
