package io.github.yok.crmexport.model;

/**
 * States a phase passes through in the ingestion driver.
 *
 * <p>
 * Normal path: {@code FRESH|RESUMING → FETCHING → PERSISTING → CHECKPOINTING → FETCHING ... →
 * DRAINED → COMPLETE}. A phase that drained under a limit, or whose
 * input ids are incomplete, ends in {@link #DRAINED} without a completion marker.
 * {@link #LIMITED}, {@link #STUCK} and {@link #SKIPPED} are the other terminal states.
 * </p>
 */
public enum PhaseState {

    FRESH,
    RESUMING,
    FETCHING,
    PERSISTING,
    CHECKPOINTING,
    DRAINED,
    COMPLETE,
    LIMITED,
    STUCK,
    SKIPPED;

    /**
     * Whether the phase ended without leaving work behind for a later run.
     *
     * @return true for {@link #COMPLETE} and {@link #SKIPPED}
     */
    public boolean isSettled() {
        return this == COMPLETE || this == SKIPPED;
    }
}
