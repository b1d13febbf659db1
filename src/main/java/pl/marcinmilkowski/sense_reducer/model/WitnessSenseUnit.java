package pl.marcinmilkowski.sense_reducer.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * One atomic sense statement from one source.
 *
 * <p>{@code glossRaw} is authoritative for display and is never rewritten. Domain and
 * register tags are lowercased and kept in sorted sets so iteration never depends on
 * insertion order. Required fields are checked by {@link #validate()}, not the constructor,
 * so adapters can hand over incomplete units and the pipeline can drop them with a warning.</p>
 */
public record WitnessSenseUnit(
    Source source,             // Enumerated origin, null only for malformed input
    String senseRef,           // Stable locator unique within source
    String glossRaw,           // Untouched source text
    Set<String> domains,
    Set<String> register,
    Integer ordering           // Original rank within the source, optional
) {

    public WitnessSenseUnit {
        domains = normalizeTags(domains);
        register = normalizeTags(register);
    }

    public WitnessSenseUnit(Source source, String senseRef, String glossRaw) {
        this(source, senseRef, glossRaw, Set.of(), Set.of(), null);
    }

    public WitnessSenseUnit(Source source, String senseRef, String glossRaw,
                            Set<String> domains, Set<String> register) {
        this(source, senseRef, glossRaw, domains, register, null);
    }

    /**
     * @throws MalformedWitnessException if source, sense_ref or gloss_raw is missing
     */
    public void validate() {
        if (source == null) {
            throw new MalformedWitnessException("source");
        }
        if (senseRef == null || senseRef.isBlank()) {
            throw new MalformedWitnessException("sense_ref");
        }
        if (glossRaw == null) {
            throw new MalformedWitnessException("gloss_raw");
        }
    }

    public WitnessKey key() {
        return new WitnessKey(source, senseRef);
    }

    public boolean hasMetadata() {
        return !domains.isEmpty() || !register.isEmpty();
    }

    /**
     * Evidence view used when the caller asks for witnesses.
     */
    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("source", source != null ? source.getCode() : null);
        obj.put("sense_ref", senseRef);
        obj.put("gloss_raw", glossRaw);
        if (!domains.isEmpty()) obj.put("domains", new JSONArray(domains));
        if (!register.isEmpty()) obj.put("register", new JSONArray(register));
        if (ordering != null) obj.put("ordering", ordering);
        return obj;
    }

    private static Set<String> normalizeTags(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Collections.emptySortedSet();
        }
        TreeSet<String> normalized = new TreeSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                normalized.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSortedSet(normalized);
    }
}
