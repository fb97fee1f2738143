package io.github.yok.crmexport.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.yok.crmexport.model.CrmRecord;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Typed access to the CRM endpoints used by the export.
 *
 * <ul>
 * <li>{@code GET /crm/v3/properties/{type}}: property discovery</li>
 * <li>{@code GET /crm/v3/objects/{type}}: object pages</li>
 * <li>{@code GET /crm/v4/objects/{type}/{id}/associations/{toType}}: associations</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrmApiClient {

    static final String UNKNOWN_ID = "unknown";

    private final CrmTransportClient transport;

    /**
     * Fetches all property names defined for an object type.
     *
     * @param objectType API object type
     * @return property names in API order
     */
    public List<String> listPropertyNames(String objectType) {
        log.info("Fetching properties for {}", objectType);
        JsonNode body = transport.get("/crm/v3/properties/" + objectType, Map.of());
        List<String> names = new ArrayList<>();
        for (JsonNode prop : body.path("results")) {
            String name = prop.path("name").asText("");
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        log.info("Fetched {} properties for {}", names.size(), objectType);
        return names;
    }

    /**
     * Fetches one page of objects.
     *
     * @param objectType API object type
     * @param properties properties to include in each record
     * @param limit page size
     * @param after resume token; null for the start of the stream
     * @return records in API order; empty at the end of the stream
     * @throws TransportException if a result carries no {@code id}
     */
    public List<CrmRecord> listObjects(String objectType, List<String> properties, int limit,
            String after) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("properties", String.join(",", properties));
        params.put("limit", limit);
        params.put("after", after);

        String path = "/crm/v3/objects/" + objectType;
        JsonNode body = transport.get(path, params);
        List<CrmRecord> records = new ArrayList<>();
        for (JsonNode item : body.path("results")) {
            String id = textOrNull(item.path("id"));
            if (id == null) {
                throw new TransportException("GET " + path + " (after=" + after
                        + ") returned a result without id at position " + records.size(), null);
            }
            records.add(toRecord(id, item));
        }
        return records;
    }

    /**
     * Fetches the ids of all objects of {@code toObjectType} associated with one object, following
     * the association paging until it is exhausted.
     *
     * @param objectType source object type
     * @param objectId source object id
     * @param toObjectType partner object type
     * @return associated ids; {@code unknown} for results that carry no id
     */
    public List<String> listAssociatedIds(String objectType, String objectId,
            String toObjectType) {
        log.info("Fetching associations for {} {} to {}", objectType, objectId, toObjectType);
        String path = "/crm/v4/objects/" + objectType + "/" + objectId + "/associations/"
                + toObjectType;

        List<String> ids = new ArrayList<>();
        String after = null;
        do {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("after", after);
            JsonNode body = transport.get(path, params);
            for (JsonNode assoc : body.path("results")) {
                ids.add(associatedId(assoc));
            }
            after = textOrNull(body.path("paging").path("next").path("after"));
        } while (after != null);

        log.info("Fetched {} associations", ids.size());
        return ids;
    }

    private CrmRecord toRecord(String id, JsonNode item) {
        Map<String, String> props = new LinkedHashMap<>();
        JsonNode properties = item.path("properties");
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            props.put(field.getKey(), value.isNull() ? "" : value.asText());
        }
        return new CrmRecord(id, props);
    }

    private String associatedId(JsonNode assoc) {
        String id = textOrNull(assoc.path("id"));
        if (id == null) {
            id = textOrNull(assoc.path("toObjectId"));
        }
        return id == null ? UNKNOWN_ID : id;
    }

    private static String textOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isEmpty() ? null : text;
    }
}
