package org.example.biolearn.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Acknowledgement returned by write operations, e.g. {@code {"status":"ok"}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationStatus(String status, String message) {

    public static final String OK = "ok";

    public static OperationStatus ok() {
        return new OperationStatus(OK, null);
    }

    public static OperationStatus ok(String message) {
        return new OperationStatus(OK, message);
    }
}
