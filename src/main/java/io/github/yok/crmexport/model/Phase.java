package io.github.yok.crmexport.model;

/**
 * Ingestion phase of a resource type.
 */
public enum Phase {

    /** Object records fetched page by page from the API. */
    DATA,

    /** Association edges collected for records already in the store. */
    ASSOCIATIONS
}
