package io.github.yok.crmexport.core;

import io.github.yok.crmexport.model.ResourceType;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Options of one export run, as given on the command line.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class RunOptions {

    // Remove checkpoints and completion markers before starting
    boolean fresh;

    // Per-phase limit; null for a full export
    Integer limit;

    // Subset of resource types; empty for the configured list
    @Builder.Default
    List<ResourceType> resourceTypes = List.of();

    // Write the CSV snapshot after ingestion
    @Builder.Default
    boolean export = true;

    /**
     * Tells whether this run is limited.
     *
     * @return true when a positive limit is set
     */
    public boolean isLimited() {
        return limit != null && limit > 0;
    }
}
