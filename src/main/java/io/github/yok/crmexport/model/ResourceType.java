package io.github.yok.crmexport.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * CRM object types handled by the export.
 *
 * <p>
 * The API name doubles as the local table name. Each type carries the fixed set of partner types
 * whose associations are fetched during the association phase:
 * </p>
 * <ul>
 * <li>{@code companies} → {@code contacts}</li>
 * <li>{@code notes}, {@code tasks}, {@code calls} → {@code companies}, {@code contacts}</li>
 * <li>{@code contacts} → none</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ResourceType {

    COMPANIES("companies"),
    CONTACTS("contacts"),
    NOTES("notes"),
    TASKS("tasks"),
    CALLS("calls");

    private final String apiName;

    ResourceType(String apiName) {
        this.apiName = apiName;
    }

    /**
     * Returns the object type name used in API paths.
     *
     * @return API name (e.g. {@code contacts})
     */
    public String getApiName() {
        return apiName;
    }

    /**
     * Returns the local table name for this type.
     *
     * @return table name
     */
    public String getTableName() {
        return apiName;
    }

    /**
     * Returns the partner types whose associations are collected for this type.
     *
     * @return partner types in fetch order; empty when the type has no association phase
     */
    public List<ResourceType> getAssociationTargets() {
        switch (this) {
            case COMPANIES:
                return List.of(CONTACTS);
            case NOTES:
            case TASKS:
            case CALLS:
                return List.of(COMPANIES, CONTACTS);
            default:
                return List.of();
        }
    }

    /**
     * Resolves a type from its API name or constant name, ignoring case.
     *
     * @param value API name or enum constant name
     * @return matching type
     * @throws IllegalArgumentException if nothing matches
     */
    public static ResourceType fromName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.apiName.equals(normalized)
                        || t.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown resource type: " + value));
    }
}
