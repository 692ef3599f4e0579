package com.xksgroup.downloadtracker.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.downloadtracker.config.TrackerProperties;
import com.xksgroup.downloadtracker.exception.DownloadClientException;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.snapshot.HistoryItem;
import com.xksgroup.downloadtracker.model.snapshot.QueueItem;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SABnzbd JSON API client.
 */
@Slf4j
@Service
public class SabnzbdClient implements DownloadQueueSource {

    private static final Pattern SPEED_PATTERN =
            Pattern.compile("([\\d.]+)\\s*(KB/s|MB/s|GB/s|B/s|K|M|G)?", Pattern.CASE_INSENSITIVE);
    private static final double BYTES_PER_MB = 1024d * 1024d;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final int historyLimit;

    public SabnzbdClient(OkHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getSabnzbd().normalizedUrl();
        this.apiKey = properties.getSabnzbd().getApiKey();
        this.historyLimit = properties.getSabnzbd().getHistoryLimit();
    }

    @Override
    public List<QueueItem> fetchQueue() {
        return parseQueue(request("queue", Map.of()));
    }

    @Override
    public List<HistoryItem> fetchHistory() {
        return parseHistory(request("history", Map.of("limit", String.valueOf(historyLimit))));
    }

    @Override
    public void setPriority(String externalId, int code) {
        JsonNode answer = request("queue", Map.of(
                "name", "priority",
                "value", externalId,
                "value2", String.valueOf(code)));

        if (answer.has("status") && !answer.path("status").asBoolean(true)) {
            throw new DownloadClientException("SABnzbd refused priority change for " + externalId + ": "
                    + answer.path("error").asText("unknown error"));
        }
        log.debug("SABnzbd accepted priority {} for {}: {}", code, externalId, answer);
    }

    private JsonNode request(String mode, Map<String, String> extraParams) {
        HttpUrl parsed = HttpUrl.parse(baseUrl + "/api");
        if (parsed == null) {
            throw new DownloadClientException("Invalid SABnzbd url: " + baseUrl);
        }
        HttpUrl.Builder url = parsed.newBuilder()
                .addQueryParameter("apikey", apiKey)
                .addQueryParameter("output", "json")
                .addQueryParameter("mode", mode);
        extraParams.forEach(url::addQueryParameter);

        Request request = new Request.Builder().url(url.build()).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new DownloadClientException("SABnzbd API error: HTTP " + response.code() + " for mode " + mode);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new DownloadClientException("SABnzbd returned an empty body for mode " + mode);
            }
            return objectMapper.readTree(body.string());
        } catch (IOException e) {
            throw new DownloadClientException("Cannot reach SABnzbd at " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    List<QueueItem> parseQueue(JsonNode root) {
        List<QueueItem> items = new ArrayList<>();
        JsonNode queue = root.path("queue");
        if (queue.isMissingNode()) {
            throw new DownloadClientException("SABnzbd queue response has no 'queue' object");
        }

        boolean queuePaused = queue.path("paused").asBoolean(false);
        double globalSpeed = parseSpeedToMb(queue.path("speed").asText("0"));

        int position = 0;
        for (JsonNode slot : queue.path("slots")) {
            position++;
            String slotStatus = slot.path("status").asText("");
            double percentage = parseDouble(slot.path("percentage"));

            DownloadStatus status;
            if ("Downloading".equalsIgnoreCase(slotStatus)) {
                status = DownloadStatus.DOWNLOADING;
            } else if (position == 1 && !queuePaused && !"Paused".equalsIgnoreCase(slotStatus)) {
                // The head of a running queue is the active download
                status = DownloadStatus.DOWNLOADING;
            } else {
                status = DownloadStatus.QUEUED;
            }

            double speed = status == DownloadStatus.DOWNLOADING && percentage > 0 ? globalSpeed : 0.0;

            items.add(QueueItem.builder()
                    .externalId(slot.path("nzo_id").asText())
                    .name(slot.path("filename").asText(""))
                    .status(status)
                    .detailedStatus(slotStatus)
                    .progress(percentage)
                    .speed(speed)
                    .sizeTotal(parseDouble(slot.path("mb")))
                    .sizeLeft(parseDouble(slot.path("mbleft")))
                    .timeLeft(slot.path("timeleft").asText("0:00:00"))
                    .category(textOrNull(slot.path("cat")))
                    .priority(textOrNull(slot.path("priority")))
                    .queuePosition(position)
                    .build());
        }
        return items;
    }

    List<HistoryItem> parseHistory(JsonNode root) {
        List<HistoryItem> items = new ArrayList<>();
        JsonNode history = root.path("history");
        if (history.isMissingNode()) {
            throw new DownloadClientException("SABnzbd history response has no 'history' object");
        }

        for (JsonNode slot : history.path("slots")) {
            String statusRaw = slot.path("status").asText("");
            String failMessage = slot.path("fail_message").asText("");

            DownloadStatus status;
            if (!failMessage.isBlank() || "Failed".equalsIgnoreCase(statusRaw)) {
                status = DownloadStatus.FAILED;
            } else if ("Completed".equalsIgnoreCase(statusRaw)) {
                status = DownloadStatus.COMPLETED;
            } else {
                // Extracting, Verifying, Repairing, Moving, Running...
                status = DownloadStatus.DOWNLOADING;
            }

            Instant completedAt = null;
            long completed = slot.path("completed").asLong(0);
            if (completed > 0 && status.isTerminal()) {
                completedAt = Instant.ofEpochSecond(completed);
            }

            items.add(HistoryItem.builder()
                    .externalId(slot.path("nzo_id").asText())
                    .name(slot.path("name").asText(""))
                    .status(status)
                    .detailedStatus(statusRaw)
                    .sizeTotal(slot.path("bytes").asDouble(0) / BYTES_PER_MB)
                    .category(textOrNull(slot.path("category")))
                    .completedAt(completedAt)
                    .failureReason(failMessage.isBlank() ? null : failMessage)
                    .build());
        }
        return items;
    }

    /**
     * Converts a SABnzbd speed string to MB/s: "12.3 M" or "12.3 MB/s" to 12.3,
     * "500 K" to 0.488, "1.2 G" to 1228.8. A bare number is KB/s.
     */
    static double parseSpeedToMb(String speed) {
        if (speed == null) {
            return 0.0;
        }
        Matcher matcher = SPEED_PATTERN.matcher(speed.trim());
        if (!matcher.find()) {
            return 0.0;
        }
        double value;
        try {
            value = Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            return 0.0;
        }
        String unit = matcher.group(2) == null ? "K" : matcher.group(2).toUpperCase(Locale.ROOT);
        return switch (unit) {
            case "B/S" -> value / BYTES_PER_MB;
            case "KB/S", "K" -> value / 1024;
            case "MB/S", "M" -> value;
            case "GB/S", "G" -> value * 1024;
            default -> 0.0;
        };
    }

    private static double parseDouble(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText("0").trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
