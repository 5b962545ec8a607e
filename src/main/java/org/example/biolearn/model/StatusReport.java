package org.example.biolearn.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Diagnostic snapshot of the backend and its document store. Store problems are described
 * in {@code database} rather than raised.
 */
public record StatusReport(
        String backend,
        String database,
        @JsonProperty("database_url") String databaseUrl,
        @JsonProperty("database_name") String databaseName,
        @JsonProperty("connection_status") String connectionStatus,
        List<String> collections
) {
}
