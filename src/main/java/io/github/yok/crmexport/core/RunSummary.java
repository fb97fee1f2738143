package io.github.yok.crmexport.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.crmexport.model.PhaseResult;
import io.github.yok.crmexport.model.ResourceType;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Outcome of an export run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RunSummary {

    ImmutableList<PhaseResult> results;

    // Rows in each resource table after the run
    ImmutableMap<ResourceType, Long> recordCounts;

    // Whether all state files were removed at the end of the run
    boolean stateCleared;

    /**
     * Creates a summary.
     *
     * @param results phase results in execution order
     * @param recordCounts stored rows per type
     * @param stateCleared whether the state files were removed
     */
    public RunSummary(List<PhaseResult> results, Map<ResourceType, Long> recordCounts,
            boolean stateCleared) {
        this.results = ImmutableList.copyOf(results);
        this.recordCounts = ImmutableMap.copyOf(recordCounts);
        this.stateCleared = stateCleared;
    }

    /**
     * Tells whether every phase ended complete or skipped.
     *
     * @return true when nothing is left to resume
     */
    public boolean isFullyComplete() {
        return results.stream().allMatch(r -> r.getState().isSettled());
    }
}
