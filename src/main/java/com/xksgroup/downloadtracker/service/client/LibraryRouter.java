package com.xksgroup.downloadtracker.service.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.downloadtracker.config.TrackerProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static category to library instance map, built once from configuration.
 */
@Slf4j
@Component
public class LibraryRouter {

    private final Map<String, LibraryClient> clientsByCategory;

    @Autowired
    public LibraryRouter(OkHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties,
                         @Value("${tracker.enrichment.max-retries:3}") int maxRetries,
                         @Value("${tracker.enrichment.retry-backoff-ms:1000}") long backoffMillis) {
        Map<String, LibraryClient> clients = new LinkedHashMap<>();
        for (TrackerProperties.Library library : properties.getLibraries()) {
            if (library.getCategory() == null || library.getCategory().isBlank()) {
                log.warn("Library instance '{}' has no category and will never be used", library.getName());
                continue;
            }
            register(clients, library.getCategory(),
                    new ArrLibraryClient(httpClient, objectMapper, library, maxRetries, backoffMillis));
            log.info("Loaded {} instance '{}' for category '{}'", library.getType(), library.getName(), library.getCategory());
        }
        this.clientsByCategory = Collections.unmodifiableMap(clients);
    }

    public LibraryRouter(Map<String, LibraryClient> clientsByCategory) {
        Map<String, LibraryClient> clients = new LinkedHashMap<>();
        clientsByCategory.forEach((category, client) -> register(clients, category, client));
        this.clientsByCategory = Collections.unmodifiableMap(clients);
    }

    public Optional<LibraryClient> route(String category) {
        if (category == null || category.isBlank()) {
            return Optional.empty();
        }
        LibraryClient client = clientsByCategory.get(category.trim());
        if (client == null) {
            log.debug("No library instance for category '{}'", category);
        }
        return Optional.ofNullable(client);
    }

    public Map<String, LibraryClient> getRoutes() {
        return clientsByCategory;
    }

    private static void register(Map<String, LibraryClient> clients, String category, LibraryClient client) {
        LibraryClient previous = clients.putIfAbsent(category.trim(), client);
        if (previous != null) {
            throw new IllegalStateException("Category '" + category + "' is routed to both '"
                    + previous.getName() + "' and '" + client.getName() + "'");
        }
    }
}
