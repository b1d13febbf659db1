package pl.marcinmilkowski.sense_reducer.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Long-lived, language-agnostic concept identifier owned by the registry.
 */
public record SemanticConstant(
    String constantId,           // UPPER_SNAKE_CASE, unique per registry
    String canonicalLabel,
    String description,
    Set<String> domains,
    ConstantStatus status,
    List<WitnessKey> createdFrom, // Witnesses that originated the constant
    Instant createdAt,
    Instant curatedAt            // Null while provisional
) {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Z0-9]+(?:_[A-Z0-9]+)*");

    public SemanticConstant {
        if (constantId == null || !ID_PATTERN.matcher(constantId).matches()) {
            throw new IllegalArgumentException("Constant id must be UPPER_SNAKE_CASE: " + constantId);
        }
        if (status == null || createdAt == null) {
            throw new IllegalArgumentException("Constant " + constantId + " needs status and created_at");
        }
        if (status == ConstantStatus.CURATED && curatedAt == null) {
            throw new IllegalArgumentException("Curated constant " + constantId + " needs curated_at");
        }
        canonicalLabel = canonicalLabel != null ? canonicalLabel : "";
        description = description != null ? description : "";
        domains = domains != null ? Collections.unmodifiableSortedSet(new TreeSet<>(domains)) : Set.of();
        createdFrom = createdFrom != null ? List.copyOf(createdFrom) : List.of();
    }

    public static boolean isValidId(String constantId) {
        return constantId != null && ID_PATTERN.matcher(constantId).matches();
    }

    public boolean isCurated() {
        return status == ConstantStatus.CURATED;
    }

    /**
     * Copy of this constant in the curated state.
     */
    public SemanticConstant curate(Instant when) {
        return new SemanticConstant(constantId, canonicalLabel, description, domains,
            ConstantStatus.CURATED, createdFrom, createdAt, when);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("constant_id", constantId);
        obj.put("canonical_label", canonicalLabel);
        obj.put("description", description);
        obj.put("domains", new JSONArray(domains));
        obj.put("status", status.getCode());
        JSONArray origins = new JSONArray();
        for (WitnessKey key : createdFrom) {
            origins.add(key.toString());
        }
        obj.put("created_from", origins);
        obj.put("created_at", createdAt.toString());
        if (curatedAt != null) obj.put("curated_at", curatedAt.toString());
        return obj;
    }
}
