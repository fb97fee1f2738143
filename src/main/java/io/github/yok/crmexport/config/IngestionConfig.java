package io.github.yok.crmexport.config;

import com.google.common.collect.ImmutableList;
import io.github.yok.crmexport.model.ResourceType;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds settings of the ingestion run.
 *
 * <p>
 * You can specify the following properties in {@code application.yml}.
 * </p>
 * <ul>
 * <li>{@code ingestion.resource-types}: types to export, in processing order</li>
 * <li>{@code ingestion.sample-limit}: per-phase limit used by {@code --sample}</li>
 * <li>{@code ingestion.reset-state-on-success}: remove checkpoints and completion markers after
 * a fully successful unlimited run</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
@NoArgsConstructor
public class IngestionConfig {

    /**
     * Types to export, in processing order.
     */
    private List<ResourceType> resourceTypes = ImmutableList.copyOf(ResourceType.values());

    /**
     * Limit applied per phase in sample mode.
     */
    private int sampleLimit = 50;

    /**
     * Whether resume state is removed after a fully successful unlimited run.
     */
    private boolean resetStateOnSuccess = true;
}
