package io.github.yok.crmexport.checkpoint;

import io.github.yok.crmexport.model.ResourceType;
import java.util.Collection;
import java.util.Optional;

/**
 * Durable resume state of the ingestion phases.
 *
 * <p>
 * A checkpoint holds the position to resume from after an interruption: an opaque cursor for the
 * data phase, the next index into the stored id list for the association phase. A completion
 * marker records that a phase drained naturally and can be skipped.
 * </p>
 */
public interface CheckpointStore {

    /**
     * Reads the checkpoint of a phase.
     *
     * @param key phase key
     * @return saved position; empty when absent or unreadable
     */
    Optional<String> load(CheckpointKey key);

    /**
     * Persists the checkpoint of a phase, replacing any previous value. The value is durable when
     * this method returns.
     *
     * @param key phase key
     * @param position cursor or index to resume from
     * @throws CheckpointException if the checkpoint cannot be written
     */
    void save(CheckpointKey key, String position);

    /**
     * Removes the checkpoint of a phase if present.
     *
     * @param key phase key
     */
    void clear(CheckpointKey key);

    /**
     * Tells whether the phase has a completion marker.
     *
     * @param key phase key
     * @return true when the phase drained in an earlier run
     */
    boolean isPhaseComplete(CheckpointKey key);

    /**
     * Writes the completion marker of a phase.
     *
     * @param key phase key
     * @throws CheckpointException if the marker cannot be written
     */
    void markComplete(CheckpointKey key);

    /**
     * Removes checkpoints and completion markers of both phases of the given types.
     *
     * @param types resource types
     */
    void reset(Collection<ResourceType> types);
}
