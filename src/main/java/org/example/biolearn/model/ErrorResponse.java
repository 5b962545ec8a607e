package org.example.biolearn.model;

import java.time.Instant;

public record ErrorResponse(
        String error,
        String detail,
        int status,
        String path,
        String requestId,
        Instant timestamp
) {
}
