package org.example.biolearn.repository;

public class DuplicateDocumentException extends RuntimeException {

    private final String collection;

    public DuplicateDocumentException(String collection, Throwable cause) {
        super("Duplicate key in collection " + collection, cause);
        this.collection = collection;
    }

    public String getCollection() {
        return collection;
    }
}
