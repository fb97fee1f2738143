package io.github.yok.crmexport.fetch;

import io.github.yok.crmexport.client.CrmApiClient;
import io.github.yok.crmexport.model.RecordPage;
import io.github.yok.crmexport.model.ResourceType;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link PageFetcher} backed by the object listing endpoint of one resource type.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ObjectPageFetcher implements PageFetcher {

    private final ResourceType type;
    private final CrmApiClient apiClient;
    private final PropertyCatalog catalog;
    private final int pageSize;

    /**
     * Creates a fetcher.
     *
     * @param type resource type to list
     * @param apiClient API client
     * @param catalog property discovery
     * @param pageSize records per page
     */
    public ObjectPageFetcher(ResourceType type, CrmApiClient apiClient, PropertyCatalog catalog,
            int pageSize) {
        this.type = type;
        this.apiClient = apiClient;
        this.catalog = catalog;
        this.pageSize = pageSize;
    }

    @Override
    public RecordPage fetchPage(String cursor) {
        log.debug("[{}] Fetching page after {}", type.getApiName(), cursor);
        return new RecordPage(apiClient.listObjects(type.getApiName(), catalog.propertiesOf(type),
                pageSize, cursor));
    }
}
