package io.github.yok.crmexport.checkpoint;

import io.github.yok.crmexport.model.Phase;
import io.github.yok.crmexport.model.ResourceType;
import lombok.Value;

/**
 * Identifies the resume state of one phase of one resource type.
 *
 * @author Yasuharu.Okawauchi
 */
@Value(staticConstructor = "of")
public class CheckpointKey {

    ResourceType resourceType;

    Phase phase;

    /**
     * Returns the file name stem shared by the checkpoint and the completion marker.
     *
     * @return {@code contacts} for the data phase, {@code contacts_associations} otherwise
     */
    public String fileStem() {
        String name = resourceType.getApiName();
        return phase == Phase.DATA ? name : name + "_associations";
    }

    @Override
    public String toString() {
        return fileStem();
    }
}
