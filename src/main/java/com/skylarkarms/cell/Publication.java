package com.skylarkarms.cell;

/**
 * An {@code int}-phase / {@link T} value pair swapped atomically by a {@link PublishedCell}.
 * <p> Phases only move forward:
 * <pre>
 *     UNPUBLISHED(-1) -> CONSTRUCTING(0) -> PUBLISHED(1) -> TORN_DOWN(2)
 *                        CONSTRUCTING(0) -> FAILED(3)
 * </pre>
 * Only a {@link #PUBLISHED_PHASE} instance carries a live value.
 * {@link #CONSTRUCTING_PHASE} and {@link #FAILED_PHASE} are both logically unpublished.
 * */
record Publication<T>(
        int phase,
        T value,
        Throwable cause)
{
    static final int
            UNPUBLISHED_PHASE = -1,
            CONSTRUCTING_PHASE = 0,
    /**
     * Once the cell reaches this phase, the value is assumed fully constructed.
     * */
            PUBLISHED_PHASE = 1,
            TORN_DOWN_PHASE = 2,
            FAILED_PHASE = 3;

    static final Publication<?>
            UNPUBLISHED = new Publication<>(UNPUBLISHED_PHASE, null, null),
            CONSTRUCTING = new Publication<>(CONSTRUCTING_PHASE, null, null),
            TORN_DOWN = new Publication<>(TORN_DOWN_PHASE, null, null);

    @SuppressWarnings("unchecked")
    static <T> Publication<T> unpublished() { return (Publication<T>) UNPUBLISHED; }

    static <T> Publication<T> published(T value) {
        assert value != null : "A published value must not be null";
        return new Publication<>(PUBLISHED_PHASE, value, null);
    }

    static <T> Publication<T> failed(Throwable cause) { return new Publication<>(FAILED_PHASE, null, cause); }

    boolean isPublished() { return phase == PUBLISHED_PHASE; }

    /**
     * @return true while an access should keep waiting.
     * */
    boolean isPending() { return phase <= CONSTRUCTING_PHASE; }

    static String toPhaseString(int phase) {
        return switch (phase) {
            case UNPUBLISHED_PHASE -> "UNPUBLISHED";
            case CONSTRUCTING_PHASE -> "CONSTRUCTING";
            case PUBLISHED_PHASE -> "PUBLISHED";
            case TORN_DOWN_PHASE -> "TORN_DOWN";
            case FAILED_PHASE -> "FAILED";
            default -> throw new IllegalStateException("Unexpected value: " + phase);
        };
    }

    @Override
    public String toString() {
        return switch (phase) {
            case PUBLISHED_PHASE -> "Publication{[PUBLISHED], value=\n" + String.valueOf(value).indent(3) + "}";
            case FAILED_PHASE -> "Publication{[FAILED], cause=" + cause + "}";
            default -> "Publication{[" + toPhaseString(phase) + "]}";
        };
    }
}
