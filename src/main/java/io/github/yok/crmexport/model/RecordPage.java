package io.github.yok.crmexport.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * One page of records returned for a cursor.
 *
 * <p>
 * An empty page is the only end-of-stream signal. The resume token for the next page is the id of
 * the last record; callers treat it as opaque.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RecordPage {

    ImmutableList<CrmRecord> records;

    /**
     * Creates a page.
     *
     * @param records records in API order
     */
    public RecordPage(List<CrmRecord> records) {
        this.records = ImmutableList.copyOf(records);
    }

    /**
     * Returns an empty page.
     *
     * @return page with no records
     */
    public static RecordPage empty() {
        return new RecordPage(ImmutableList.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    /**
     * Returns the cursor to resume after this page.
     *
     * @return id of the last record
     * @throws IllegalStateException if the page is empty
     */
    public String nextCursor() {
        if (records.isEmpty()) {
            throw new IllegalStateException("An empty page has no next cursor");
        }
        return records.get(records.size() - 1).getId();
    }
}
