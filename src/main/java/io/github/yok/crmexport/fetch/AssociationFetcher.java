package io.github.yok.crmexport.fetch;

import io.github.yok.crmexport.client.CrmApiClient;
import io.github.yok.crmexport.model.AssociationEdge;
import io.github.yok.crmexport.model.ResourceType;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Collects the association edges of one stored object.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@RequiredArgsConstructor
public class AssociationFetcher {

    private final CrmApiClient apiClient;

    /**
     * Fetches the edges from one object to every partner type of its resource type.
     *
     * @param fromType source type
     * @param fromId source object id
     * @return edges, grouped by partner type in {@link ResourceType#getAssociationTargets()} order
     */
    public List<AssociationEdge> fetchEdges(ResourceType fromType, String fromId) {
        return fromType.getAssociationTargets().stream()
                .flatMap(toType -> apiClient
                        .listAssociatedIds(fromType.getApiName(), fromId, toType.getApiName())
                        .stream()
                        .map(toId -> new AssociationEdge(fromType, fromId, toType, toId)))
                .collect(Collectors.toList());
    }
}
