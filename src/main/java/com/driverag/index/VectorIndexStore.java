package com.driverag.index;

import java.util.List;

/**
 * Searchable home of all index entries. The entries of one document are always replaced as a whole:
 * a search sees either every entry of the old version or every entry of the new one.
 */
public interface VectorIndexStore extends IndexView {

    /**
     * Replaces every entry of {@code documentId} with {@code entries}, all of which must carry
     * {@code version}.
     *
     * @return false if the store already holds a newer version of the document; the write is discarded
     */
    boolean upsert(String documentId, long version, List<IndexEntry> entries);

    void delete(String documentId);

    IndexView view();

    List<IndexEntry> entries(String documentId);

    /**
     * @return the stored version of the document, or 0 if it was never indexed or has been deleted
     */
    long documentVersion(String documentId);

    int size();

    int dimension();
}
