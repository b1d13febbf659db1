package pl.marcinmilkowski.sense_reducer.model;

/**
 * Identity of a witness within one reduction run: {@code (source, sense_ref)}.
 */
public record WitnessKey(Source source, String senseRef) implements Comparable<WitnessKey> {

    /**
     * Orders by source priority, then sense_ref. This is the single tie-break order of the
     * pipeline.
     */
    @Override
    public int compareTo(WitnessKey other) {
        int cmp = Integer.compare(source.getPriority(), other.source.getPriority());
        return cmp != 0 ? cmp : senseRef.compareTo(other.senseRef);
    }

    /**
     * Parse the {@code source:sense_ref} form produced by {@link #toString()}.
     *
     * @throws IllegalArgumentException if the value has no separator or an unknown source
     */
    public static WitnessKey parse(String value) {
        int sep = value == null ? -1 : value.indexOf(':');
        if (sep <= 0) {
            throw new IllegalArgumentException("Invalid witness key: " + value);
        }
        Source source = Source.fromCode(value.substring(0, sep));
        if (source == null) {
            throw new IllegalArgumentException("Unknown source in witness key: " + value);
        }
        return new WitnessKey(source, value.substring(sep + 1));
    }

    @Override
    public String toString() {
        return source.getCode() + ":" + senseRef;
    }
}
