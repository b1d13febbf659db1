package pl.marcinmilkowski.sense_reducer.pipeline;

import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.Mode;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input of one reduction run.
 *
 * <p>{@code witnesses} may be null (a hard failure downstream) and may hold null or
 * malformed entries (dropped with a warning). {@code adapterReportedResults} is set when
 * the adapters claimed the lemma has evidence; an empty list is then an error instead of an
 * empty result.</p>
 */
public record ReductionRequest(
    String lemma,
    Language language,
    List<WitnessSenseUnit> witnesses,
    Mode mode,
    boolean adapterReportedResults
) {

    public ReductionRequest {
        if (language == null) {
            throw new IllegalArgumentException("Reduction request for '" + lemma + "' has no language");
        }
        if (mode == null) {
            throw new IllegalArgumentException("Reduction request for '" + lemma + "' has no mode");
        }
        witnesses = witnesses != null ? Collections.unmodifiableList(new ArrayList<>(witnesses)) : null;
    }

    public static ReductionRequest of(String lemma, Language language, List<WitnessSenseUnit> witnesses, Mode mode) {
        return new ReductionRequest(lemma, language, witnesses, mode, false);
    }
}
