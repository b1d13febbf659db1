package pl.marcinmilkowski.sense_reducer.io;

import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.Mode;
import pl.marcinmilkowski.sense_reducer.model.WitnessSenseUnit;
import pl.marcinmilkowski.sense_reducer.pipeline.ReductionRequest;

import java.util.List;

/**
 * Witnesses for one lemma as read from an input file.
 */
public record WitnessBatch(
    String lemma,
    Language language,
    List<WitnessSenseUnit> witnesses,
    boolean adapterReportedResults
) {

    public ReductionRequest toRequest(Mode mode) {
        return new ReductionRequest(lemma, language, witnesses, mode, adapterReportedResults);
    }
}
