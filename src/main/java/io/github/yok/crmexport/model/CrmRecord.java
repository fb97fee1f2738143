package io.github.yok.crmexport.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Value;

/**
 * One CRM object as returned by the API.
 *
 * <p>
 * {@code id} is assigned by the remote system and is the natural key for upserts. Property values
 * are untyped strings; a property that is absent reads as the empty string.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class CrmRecord {

    String id;

    Map<String, String> properties;

    /**
     * Creates a record holding an insertion-ordered copy of the properties.
     *
     * @param id remote object id
     * @param properties property name to value
     */
    public CrmRecord(String id, Map<String, String> properties) {
        this.id = id;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Returns the value of a property, or the empty string when it is absent.
     *
     * @param name property name
     * @return property value, never null
     */
    public String getProperty(String name) {
        String value = properties.get(name);
        return value == null ? "" : value;
    }
}
