package pl.marcinmilkowski.sense_reducer.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A cluster of witnesses judged to express the same meaning.
 *
 * <p>Witnesses are kept in pipeline order (source priority, then sense_ref), so the first
 * witness is the centroid that supplies the display gloss. {@code senseId} is only stable
 * within one reduction run.</p>
 */
public record SenseBucket(
    String senseId,                  // "B1", "B2", ... by rank
    List<WitnessSenseUnit> witnesses,
    String displayGloss,             // Raw gloss of the centroid witness
    double confidence,               // Mean pairwise similarity, 1.0 for singletons
    String semanticConstant,         // Null until the registry assigns one
    Set<String> domains,             // Union of witness domains
    Set<String> register,            // Union of witness registers
    boolean primaryWitness           // Holds a primary-source witness for the run language
) {

    private static final int SUMMARY_GLOSS_LENGTH = 60;

    public SenseBucket {
        if (witnesses == null || witnesses.isEmpty()) {
            throw new IllegalArgumentException("Sense bucket " + senseId + " must have at least one witness");
        }
        witnesses = List.copyOf(witnesses);
        domains = domains != null ? Collections.unmodifiableSortedSet(new TreeSet<>(domains)) : Set.of();
        register = register != null ? Collections.unmodifiableSortedSet(new TreeSet<>(register)) : Set.of();
    }

    public WitnessSenseUnit centroid() {
        return witnesses.get(0);
    }

    public int size() {
        return witnesses.size();
    }

    public List<WitnessKey> witnessKeys() {
        List<WitnessKey> keys = new ArrayList<>(witnesses.size());
        for (WitnessSenseUnit w : witnesses) {
            keys.add(w.key());
        }
        return keys;
    }

    /**
     * Distinct source codes, sorted.
     */
    public List<String> sourceCodes() {
        TreeSet<String> codes = new TreeSet<>();
        for (WitnessSenseUnit w : witnesses) {
            codes.add(w.source().getCode());
        }
        return new ArrayList<>(codes);
    }

    public SenseBucket withSemanticConstant(String constantId) {
        return new SenseBucket(senseId, witnesses, displayGloss, confidence, constantId,
            domains, register, primaryWitness);
    }

    /**
     * Serialize for API responses. Without evidence only the learner-facing fields are
     * included.
     */
    public JSONObject toJson(boolean evidence) {
        JSONObject obj = new JSONObject();
        obj.put("sense_id", senseId);
        obj.put("display_gloss", displayGloss);
        obj.put("confidence", round(confidence));
        obj.put("semantic_constant", semanticConstant);
        if (evidence) {
            obj.put("domains", new JSONArray(domains));
            obj.put("register", new JSONArray(register));
            JSONArray ws = new JSONArray();
            for (WitnessSenseUnit w : witnesses) {
                ws.add(w.toJson());
            }
            obj.put("witnesses", ws);
        }
        return obj;
    }

    /**
     * Compact one-line view used by CLI summaries.
     */
    public JSONObject summary() {
        JSONObject obj = new JSONObject();
        obj.put("sense_id", senseId);
        obj.put("display_gloss", truncate(displayGloss, SUMMARY_GLOSS_LENGTH));
        obj.put("witness_count", witnesses.size());
        obj.put("sources", new JSONArray(sourceCodes()));
        obj.put("confidence", round(confidence));
        return obj;
    }

    /**
     * First {@code maxCodePoints} code points of {@code text} plus "...", or the text itself
     * when it is short enough.
     */
    static String truncate(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints)) + "...";
    }

    static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    @Override
    public String toString() {
        return String.format("%s [%d witnesses, confidence=%.3f, constant=%s] %s",
            senseId, witnesses.size(), confidence, semanticConstant, displayGloss);
    }
}
