package org.example.biolearn.service;

/**
 * Thrown when a payload passes JSON binding but breaks a content rule, such as a
 * {@code correct_index} outside the option list.
 */
public class InvalidContentException extends RuntimeException {

    public InvalidContentException(String message) {
        super(message);
    }
}
