package io.github.yok.crmexport.db;

import io.github.yok.crmexport.model.AssociationEdge;
import io.github.yok.crmexport.model.CrmRecord;
import io.github.yok.crmexport.model.ResourceType;
import java.sql.SQLException;
import java.util.List;

/**
 * Destination of fetched records and association edges.
 */
public interface RecordSink {

    /**
     * Inserts or replaces a batch of records in one transaction. Applying the same batch twice
     * leaves the store as applying it once.
     *
     * @param type resource type of the batch
     * @param batch records to store
     * @throws SQLException on store error; the batch is rolled back
     */
    void upsertRecords(ResourceType type, List<CrmRecord> batch) throws SQLException;

    /**
     * Inserts association edges in one transaction.
     *
     * @param edges edges to store
     * @throws SQLException on store error; the edges are rolled back
     */
    void insertAssociations(List<AssociationEdge> edges) throws SQLException;

    /**
     * Lists stored ids of a type in ascending order.
     *
     * @param type resource type
     * @return ids ordered by {@code id}
     * @throws SQLException on store error
     */
    List<String> listIds(ResourceType type) throws SQLException;

    /**
     * Counts stored records of a type.
     *
     * @param type resource type
     * @return row count
     * @throws SQLException on store error
     */
    long countRecords(ResourceType type) throws SQLException;
}
