package io.github.yok.crmexport.fetch;

import io.github.yok.crmexport.model.RecordPage;

/**
 * Retrieves pages of records of one resource type.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * Fetches the page that follows {@code cursor}.
     *
     * @param cursor resume token from the previous page; null for the start of the stream
     * @return next page; empty at the end of the stream
     */
    RecordPage fetchPage(String cursor);
}
