package io.github.yok.crmexport.fetch;

import io.github.yok.crmexport.client.CrmApiClient;
import io.github.yok.crmexport.config.ApiConfig;
import io.github.yok.crmexport.model.ResourceType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Dispatch table from {@link ResourceType} to its {@link PageFetcher}, built once at startup.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
public class PageFetcherRegistry {

    private final Map<ResourceType, PageFetcher> fetchers;

    /**
     * Registers an {@link ObjectPageFetcher} for every resource type.
     *
     * @param apiClient API client
     * @param catalog property discovery
     * @param apiConfig API settings (page size)
     */
    @Autowired
    public PageFetcherRegistry(CrmApiClient apiClient, PropertyCatalog catalog,
            ApiConfig apiConfig) {
        Map<ResourceType, PageFetcher> map = new EnumMap<>(ResourceType.class);
        for (ResourceType type : ResourceType.values()) {
            map.put(type, new ObjectPageFetcher(type, apiClient, catalog, apiConfig.getPageSize()));
        }
        this.fetchers = Collections.unmodifiableMap(map);
    }

    /**
     * Creates a registry from explicit fetchers.
     *
     * @param fetchers fetcher per type
     */
    public PageFetcherRegistry(Map<ResourceType, PageFetcher> fetchers) {
        Map<ResourceType, PageFetcher> copy = new EnumMap<>(ResourceType.class);
        copy.putAll(fetchers);
        this.fetchers = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the fetcher of a type.
     *
     * @param type resource type
     * @return fetcher
     * @throws IllegalStateException if no fetcher is registered for the type
     */
    public PageFetcher get(ResourceType type) {
        PageFetcher fetcher = fetchers.get(type);
        if (fetcher == null) {
            throw new IllegalStateException("No page fetcher registered for " + type);
        }
        return fetcher;
    }
}
