package pl.marcinmilkowski.sense_reducer.normalize;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Comparison-only view of a gloss. Never displayed and never persisted; regenerate it from
 * the raw gloss when needed.
 */
public final class NormalizedGloss {

    private final String text;
    private final List<String> tokens;
    private final Set<String> tokenSet;
    private final EntityType entityType;
    private final boolean negated;

    public NormalizedGloss(String text, List<String> tokens, EntityType entityType, boolean negated) {
        this.text = text;
        this.tokens = List.copyOf(tokens);
        this.tokenSet = Collections.unmodifiableSet(new LinkedHashSet<>(this.tokens));
        this.entityType = entityType;
        this.negated = negated;
    }

    /**
     * Lowercased, whitespace-collapsed text with abbreviations expanded.
     */
    public String getText() {
        return text;
    }

    /**
     * Distinct comparison tokens in order of first appearance.
     */
    public List<String> getTokens() {
        return tokens;
    }

    public Set<String> getTokenSet() {
        return tokenSet;
    }

    /**
     * @return detected entity type, or null when no rule fired
     */
    public EntityType getEntityType() {
        return entityType;
    }

    /** Gloss carries a negation marker. */
    public boolean isNegated() {
        return negated;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizedGloss other = (NormalizedGloss) o;
        return negated == other.negated
            && text.equals(other.text)
            && tokens.equals(other.tokens)
            && entityType == other.entityType;
    }

    @Override
    public int hashCode() {
        int result = text.hashCode();
        result = 31 * result + tokens.hashCode();
        result = 31 * result + (entityType != null ? entityType.hashCode() : 0);
        return 31 * result + (negated ? 1 : 0);
    }

    @Override
    public String toString() {
        return String.format("NormalizedGloss[%s entity=%s negated=%s]", tokens, entityType, negated);
    }
}
