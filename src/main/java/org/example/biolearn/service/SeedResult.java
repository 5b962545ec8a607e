package org.example.biolearn.service;

public enum SeedResult {
    SEEDED("Seeded"),
    ALREADY_SEEDED("Already seeded");

    private final String message;

    SeedResult(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
