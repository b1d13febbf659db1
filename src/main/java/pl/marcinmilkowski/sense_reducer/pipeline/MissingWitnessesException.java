package pl.marcinmilkowski.sense_reducer.pipeline;

import pl.marcinmilkowski.sense_reducer.model.Language;
import pl.marcinmilkowski.sense_reducer.model.ReductionException;

/**
 * No witness list was supplied, or the list is empty although the adapters reported
 * results for the lemma. The run fails without a partial result.
 */
public class MissingWitnessesException extends ReductionException {

    private final String lemma;
    private final Language language;

    public MissingWitnessesException(String lemma, Language language, String reason) {
        super("No witnesses for lemma '" + lemma + "' (" + (language != null ? language.getCode() : "?")
            + "): " + reason);
        this.lemma = lemma;
        this.language = language;
    }

    public String getLemma() {
        return lemma;
    }

    public Language getLanguage() {
        return language;
    }
}
