package org.example.biolearn.service;

public class ChapterNotFoundException extends RuntimeException {

    private final String slug;

    public ChapterNotFoundException(String slug) {
        super("Chapter not found");
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
