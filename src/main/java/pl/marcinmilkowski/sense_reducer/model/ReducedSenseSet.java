package pl.marcinmilkowski.sense_reducer.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Result of one reduction run.
 *
 * <p>{@code warnings} is always present so a degraded run (dropped witnesses, unreachable
 * registry) can be told apart from a clean one without reading logs.</p>
 */
public record ReducedSenseSet(
    String lemma,
    Language language,
    Mode mode,
    List<SenseBucket> buckets,
    List<String> warnings
) {

    public ReducedSenseSet {
        buckets = buckets != null ? List.copyOf(buckets) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ReducedSenseSet empty(String lemma, Language language, Mode mode, List<String> warnings) {
        return new ReducedSenseSet(lemma, language, mode, List.of(), warnings);
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    public boolean isDegraded() {
        return !warnings.isEmpty();
    }

    public int witnessCount() {
        return buckets.stream().mapToInt(SenseBucket::size).sum();
    }

    public JSONObject toJson(boolean evidence) {
        JSONObject root = new JSONObject();
        root.put("lemma", lemma);
        root.put("language", language != null ? language.getCode() : null);
        root.put("mode", mode != null ? mode.getCode() : null);
        JSONArray bucketArray = new JSONArray();
        for (SenseBucket bucket : buckets) {
            bucketArray.add(bucket.toJson(evidence));
        }
        root.put("buckets", bucketArray);
        root.put("warnings", new JSONArray(warnings));
        return root;
    }

    /**
     * Per-bucket summaries: id, truncated gloss, witness count, sources, confidence.
     */
    public List<JSONObject> bucketSummaries() {
        List<JSONObject> summaries = new ArrayList<>(buckets.size());
        for (SenseBucket bucket : buckets) {
            summaries.add(bucket.summary());
        }
        return summaries;
    }

    /**
     * Witness count with sorted distinct sources and domains.
     */
    public JSONObject witnessSummary() {
        TreeSet<String> sources = new TreeSet<>();
        TreeSet<String> domains = new TreeSet<>();
        for (SenseBucket bucket : buckets) {
            sources.addAll(bucket.sourceCodes());
            domains.addAll(bucket.domains());
        }
        JSONObject obj = new JSONObject();
        obj.put("count", witnessCount());
        obj.put("sources", new JSONArray(sources));
        obj.put("domains", new JSONArray(domains));
        return obj;
    }
}
