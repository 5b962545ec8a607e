package org.example.biolearn.service;

public class DuplicateSlugException extends RuntimeException {

    private final String slug;

    public DuplicateSlugException(String slug) {
        super("Slug already exists");
        this.slug = slug;
    }

    public DuplicateSlugException(String slug, Throwable cause) {
        super("Slug already exists", cause);
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
