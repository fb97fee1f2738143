package io.github.yok.crmexport.fetch;

import com.google.common.collect.ImmutableList;
import io.github.yok.crmexport.client.CrmApiClient;
import io.github.yok.crmexport.model.ResourceType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Remote property names per resource type, discovered once and reused for the rest of the run.
 *
 * <p>
 * The same list drives the table columns and the {@code properties} parameter of every page
 * request, so rows and columns always line up.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PropertyCatalog {

    private final CrmApiClient apiClient;

    private final Map<ResourceType, ImmutableList<String>> cache =
            new EnumMap<>(ResourceType.class);

    /**
     * Returns the property names of a type, discovering them on first use.
     *
     * @param type resource type
     * @return property names in API order
     */
    public List<String> propertiesOf(ResourceType type) {
        return cache.computeIfAbsent(type,
                t -> ImmutableList.copyOf(apiClient.listPropertyNames(t.getApiName())));
    }

    /**
     * Forgets all discovered properties so the next run sees schema changes.
     */
    public void invalidate() {
        log.debug("Property catalog cleared ({} types cached)", cache.size());
        cache.clear();
    }
}
