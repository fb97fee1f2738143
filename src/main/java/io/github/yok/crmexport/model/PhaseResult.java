package io.github.yok.crmexport.model;

import lombok.Value;

/**
 * Outcome of one phase run by the ingestion driver.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class PhaseResult {

    ResourceType resourceType;

    Phase phase;

    // Terminal state the phase ended in
    PhaseState state;

    // Records (data) or source objects (associations) processed during this run
    long processed;

    // Cursor or index the phase stopped at; null when the phase never fetched
    String lastPosition;

    /**
     * Creates a result for a phase that was skipped without fetching anything.
     *
     * @param type resource type
     * @param phase phase
     * @return skipped result
     */
    public static PhaseResult skipped(ResourceType type, Phase phase) {
        return new PhaseResult(type, phase, PhaseState.SKIPPED, 0, null);
    }
}
