package pl.marcinmilkowski.sense_reducer.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.sense_reducer.model.Mode;
import pl.marcinmilkowski.sense_reducer.model.SenseBucket;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;
import pl.marcinmilkowski.sense_reducer.similarity.NormalizedWitness;
import pl.marcinmilkowski.sense_reducer.similarity.SimilarityGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Deterministic greedy clustering of witnesses into sense buckets.
 *
 * <ol>
 *   <li>Witnesses are sorted by (source priority, sense_ref). This order breaks every tie.</li>
 *   <li>The first unassigned witness seeds a bucket. Remaining unassigned witnesses are
 *       scanned in sorted order and join if they score at least the mode threshold against
 *       any member. Scans repeat until a pass adds nobody, so a bucket is the transitive
 *       closure of its seed.</li>
 *   <li>Buckets are ranked by witness count (descending), then by holding a primary-source
 *       witness, then by the sorted position of their first member, and labelled B1, B2, ...</li>
 * </ol>
 *
 * <p>A witness never leaves a bucket once it has joined. The result is not a globally
 * optimal clustering, but it depends only on the sort order and the graph scores.</p>
 */
public class SenseBucketer {

    private static final Logger logger = LoggerFactory.getLogger(SenseBucketer.class);

    static final Comparator<NormalizedWitness> WITNESS_ORDER =
        Comparator.comparing(NormalizedWitness::key);

    /**
     * Cluster with the threshold of the graph's mode.
     */
    public List<SenseBucket> cluster(SimilarityGraph graph) {
        return cluster(graph.getWitnesses(), graph, graph.getMode());
    }

    /**
     * @param witnesses witnesses to cluster; each must be part of {@code graph}
     * @throws IllegalArgumentException if a witness is missing from the graph
     */
    public List<SenseBucket> cluster(List<NormalizedWitness> witnesses, SimilarityGraph graph, Mode mode) {
        if (witnesses.isEmpty()) {
            return List.of();
        }
        double threshold = mode.profile().threshold();

        List<NormalizedWitness> sorted = new ArrayList<>(witnesses);
        sorted.sort(WITNESS_ORDER);
        int[] graphIndex = new int[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            graphIndex[i] = graph.indexOf(sorted.get(i).key());
            if (graphIndex[i] < 0) {
                throw new IllegalArgumentException("Witness not in similarity graph: " + sorted.get(i).key());
            }
        }

        boolean[] assigned = new boolean[sorted.size()];
        List<List<Integer>> groups = new ArrayList<>();
        for (int seed = 0; seed < sorted.size(); seed++) {
            if (assigned[seed]) continue;
            assigned[seed] = true;
            List<Integer> members = new ArrayList<>();
            members.add(seed);

            boolean grew = true;
            while (grew) {
                grew = false;
                for (int candidate = seed + 1; candidate < sorted.size(); candidate++) {
                    if (assigned[candidate]) continue;
                    if (joinsAny(candidate, members, graphIndex, graph, threshold)) {
                        assigned[candidate] = true;
                        members.add(candidate);
                        grew = true;
                    }
                }
            }
            members.sort(Comparator.naturalOrder());
            groups.add(members);
        }

        groups.sort(Comparator
            .comparingInt((List<Integer> g) -> g.size()).reversed()
            .thenComparing((List<Integer> g) -> !hasPrimary(g, sorted))
            .thenComparingInt((List<Integer> g) -> g.get(0)));

        List<SenseBucket> buckets = new ArrayList<>(groups.size());
        for (int rank = 0; rank < groups.size(); rank++) {
            List<Integer> group = groups.get(rank);
            SenseBucket bucket = toBucket("B" + (rank + 1), group, sorted, graphIndex, graph);
            logger.debug("{}", bucket);
            buckets.add(bucket);
        }
        logger.debug("Clustered {} witnesses into {} buckets ({} mode, threshold {})",
            sorted.size(), buckets.size(), mode.getCode(), threshold);
        return buckets;
    }

    private static boolean joinsAny(int candidate, List<Integer> members, int[] graphIndex,
                                    SimilarityGraph graph, double threshold) {
        for (int member : members) {
            if (graph.score(graphIndex[member], graphIndex[candidate]) >= threshold) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasPrimary(List<Integer> group, List<NormalizedWitness> sorted) {
        for (int i : group) {
            if (sorted.get(i).primary()) {
                return true;
            }
        }
        return false;
    }

    private static SenseBucket toBucket(String senseId, List<Integer> group, List<NormalizedWitness> sorted,
                                        int[] graphIndex, SimilarityGraph graph) {
        List<WitnessSenseUnit> members = new ArrayList<>(group.size());
        TreeSet<String> domains = new TreeSet<>();
        TreeSet<String> register = new TreeSet<>();
        for (int i : group) {
            WitnessSenseUnit w = sorted.get(i).witness();
            members.add(w);
            domains.addAll(w.domains());
            register.addAll(w.register());
        }
        WitnessSenseUnit centroid = members.get(0);
        return new SenseBucket(senseId, members, centroid.glossRaw(),
            confidence(group, graphIndex, graph), null, domains, register, hasPrimary(group, sorted));
    }

    /**
     * Mean pairwise similarity of the members; 1.0 for a singleton.
     */
    static double confidence(List<Integer> group, int[] graphIndex, SimilarityGraph graph) {
        if (group.size() < 2) {
            return 1.0;
        }
        double sum = 0.0;
        int pairs = 0;
        for (int a = 0; a < group.size(); a++) {
            for (int b = a + 1; b < group.size(); b++) {
                sum += graph.score(graphIndex[group.get(a)], graphIndex[group.get(b)]);
                pairs++;
            }
        }
        return sum / pairs;
    }
}
