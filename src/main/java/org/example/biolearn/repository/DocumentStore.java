package org.example.biolearn.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schema-less access to named collections in the document database.
 * <p>
 * Documents are plain string-keyed maps; the store-assigned identifier lives under {@link #ID_FIELD}.
 * Every call is a single round trip. Connectivity and data-access failures surface as
 * {@link StoreUnavailableException}.
 */
public interface DocumentStore {

    String ID_FIELD = "_id";

    /**
     * Stores the document and returns the identifier assigned to it.
     *
     * @throws DuplicateDocumentException if a unique index rejects the document
     */
    String insert(String collection, Map<String, Object> document);

    List<Map<String, Object>> findAll(String collection);

    /**
     * Returns the first document whose fields equal every entry of {@code filter}.
     * An empty filter matches any document.
     */
    Optional<Map<String, Object>> findOne(String collection, Map<String, Object> filter);

    /**
     * Returns at most {@code limit} matching documents; a limit of zero means no limit.
     */
    List<Map<String, Object>> findMany(String collection, Map<String, Object> filter, int limit);

    List<String> collectionNames();

    String databaseName();

    void ensureUniqueIndex(String collection, String field);
}
