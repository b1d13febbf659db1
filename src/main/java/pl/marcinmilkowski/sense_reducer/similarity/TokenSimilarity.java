package pl.marcinmilkowski.sense_reducer.similarity;

import java.util.Set;

/**
 * Set overlap measures over normalized tokens.
 */
public final class TokenSimilarity {

    private TokenSimilarity() {
    }

    /**
     * Jaccard similarity {@code |A∩B| / |A∪B|}; 0.0 if either set is empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int shared = countShared(a, b);
        return (double) shared / (a.size() + b.size() - shared);
    }

    /**
     * Number of elements present in both sets.
     */
    public static int countShared(Set<String> a, Set<String> b) {
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int shared = 0;
        for (String value : smaller) {
            if (larger.contains(value)) {
                shared++;
            }
        }
        return shared;
    }

    public static boolean isDisjoint(Set<String> a, Set<String> b) {
        return countShared(a, b) == 0;
    }
}
