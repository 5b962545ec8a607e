package org.example.biolearn.service;

import org.example.biolearn.config.ContentApiProperties;
import org.example.biolearn.model.StatusReport;
import org.example.biolearn.repository.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the diagnostic {@link StatusReport}. Store failures become text in the report
 * instead of exceptions, so the status endpoint answers even when the store is down.
 */
@Service
public class StoreStatusService {

    private static final Logger log = LoggerFactory.getLogger(StoreStatusService.class);

    static final String BACKEND_RUNNING = "✅ Running";
    static final String DATABASE_WORKING = "✅ Connected & Working";
    static final String DATABASE_ERROR_PREFIX = "❌ Error: ";
    static final String DATABASE_DEGRADED_PREFIX = "⚠️  Connected but Error: ";
    static final String URL_SET = "✅ Set";
    static final String URL_NOT_SET = "❌ Not Set";
    static final String CONNECTED = "Connected";
    static final String NOT_CONNECTED = "Not Connected";
    static final int MAX_ERROR_LENGTH = 50;

    private final DocumentStore documentStore;
    private final ContentApiProperties properties;
    private final String databaseUrl;

    public StoreStatusService(DocumentStore documentStore,
                              ContentApiProperties properties,
                              @Value("${DATABASE_URL:}") String databaseUrl) {
        this.documentStore = documentStore;
        this.properties = properties;
        this.databaseUrl = databaseUrl;
    }

    /**
     * A store whose database handle cannot be resolved is reported as not connected. One that
     * resolves its database but fails to list collections is connected but degraded.
     */
    public StatusReport report() {
        String urlStatus = databaseUrl == null || databaseUrl.isBlank() ? URL_NOT_SET : URL_SET;
        String databaseName;
        try {
            databaseName = documentStore.databaseName();
        } catch (RuntimeException e) {
            log.warn("Document store unavailable: {}", e.getMessage());
            return new StatusReport(BACKEND_RUNNING, DATABASE_ERROR_PREFIX + abbreviate(e.getMessage()),
                    urlStatus, null, NOT_CONNECTED, List.of());
        }

        try {
            List<String> collections = documentStore.collectionNames().stream()
                    .limit(Math.max(0, properties.getHealth().getMaxCollections()))
                    .toList();
            return new StatusReport(BACKEND_RUNNING, DATABASE_WORKING, urlStatus, databaseName, CONNECTED, collections);
        } catch (RuntimeException e) {
            log.warn("Listing collections of {} failed: {}", databaseName, e.getMessage());
            return new StatusReport(BACKEND_RUNNING, DATABASE_DEGRADED_PREFIX + abbreviate(e.getMessage()),
                    urlStatus, databaseName, CONNECTED, List.of());
        }
    }

    private static String abbreviate(String message) {
        if (message == null) {
            return "unknown error";
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
