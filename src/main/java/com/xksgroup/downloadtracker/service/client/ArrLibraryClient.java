package com.xksgroup.downloadtracker.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.downloadtracker.config.TrackerProperties;
import com.xksgroup.downloadtracker.exception.LibraryLookupException;
import com.xksgroup.downloadtracker.model.library.LibraryCandidate;
import com.xksgroup.downloadtracker.model.library.LibraryType;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Radarr/Sonarr v3 API client. The whole library is fetched and candidates are
 * scored locally, which keeps the lookup independent of the instance's own search.
 */
@Slf4j
public class ArrLibraryClient implements LibraryClient {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String name;
    private final String baseUrl;
    private final String apiKey;
    private final LibraryType type;
    private final int maxAttempts;
    private final long backoffMillis;

    public ArrLibraryClient(OkHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties.Library config,
                            int maxAttempts, long backoffMillis) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.name = config.getName();
        this.baseUrl = config.normalizedUrl();
        this.apiKey = config.getApiKey();
        this.type = config.getType();
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = Math.max(0, backoffMillis);
    }

    @Override
    public String getName() {
        return name;
    }

    public LibraryType getType() {
        return type;
    }

    /**
     * The year is not sent upstream; it only takes part in local scoring.
     */
    @Override
    public List<LibraryCandidate> searchByTitle(String title, Integer year) {
        JsonNode items = fetchWithRetry(type.getEndpoint());
        List<LibraryCandidate> candidates = new ArrayList<>();
        for (JsonNode item : items) {
            String itemTitle = item.path("title").asText("");
            if (itemTitle.isBlank()) {
                continue;
            }
            int itemYear = item.path("year").asInt(0);
            candidates.add(LibraryCandidate.builder()
                    .title(itemTitle)
                    .year(itemYear > 0 ? itemYear : null)
                    .type(type.getMediaType())
                    .posterUrl(posterUrl(item))
                    .build());
        }
        log.debug("{} returned {} candidates for '{}'", name, candidates.size(), title);
        return candidates;
    }

    private JsonNode fetchWithRetry(String endpoint) {
        Request request = new Request.Builder()
                .url(baseUrl + "/api/v3/" + endpoint)
                .header("X-Api-Key", apiKey)
                .get()
                .build();

        String lastError = "no attempt made";
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (response.isSuccessful() && body != null) {
                    JsonNode root = objectMapper.readTree(body.string());
                    if (!root.isArray()) {
                        throw new LibraryLookupException(name + " returned a non-array payload for /" + endpoint);
                    }
                    return root;
                }
                lastError = "HTTP " + response.code();
            } catch (IOException e) {
                lastError = e.getMessage();
            }

            if (attempt < maxAttempts - 1) {
                sleepBackoff(attempt);
            }
        }
        throw new LibraryLookupException("Error connecting to " + name + " after " + maxAttempts + " attempts: " + lastError);
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(backoffMillis * (1L << attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LibraryLookupException("Lookup on " + name + " interrupted", e);
        }
    }

    private String posterUrl(JsonNode item) {
        for (JsonNode image : item.path("images")) {
            if (!"poster".equals(image.path("coverType").asText())) {
                continue;
            }
            String remoteUrl = image.path("remoteUrl").asText("");
            if (!remoteUrl.isBlank()) {
                return remoteUrl;
            }
            String url = image.path("url").asText("");
            if (!url.isBlank()) {
                return url.startsWith("/") ? baseUrl + url : url;
            }
        }
        return null;
    }
}
