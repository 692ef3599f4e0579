package com.xksgroup.downloadtracker.service.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.downloadtracker.config.TrackerProperties;
import com.xksgroup.downloadtracker.exception.DownloadClientException;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.snapshot.HistoryItem;
import com.xksgroup.downloadtracker.model.snapshot.QueueItem;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SabnzbdClient Tests")
class SabnzbdClientTest {

    private MockWebServer server;
    private SabnzbdClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        TrackerProperties properties = new TrackerProperties();
        properties.getSabnzbd().setUrl(server.url("/").toString());
        properties.getSabnzbd().setApiKey("secret");
        properties.getSabnzbd().setHistoryLimit(50);
        client = new SabnzbdClient(new OkHttpClient(), new ObjectMapper(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should map queue slots, treating the head of a running queue as downloading")
    void testFetchQueue() throws InterruptedException {
        server.enqueue(json("""
                {"queue": {"paused": false, "speed": "1.2 M", "slots": [
                  {"nzo_id": "SABnzbd_nzo_1", "filename": "Show.Name.S01E01.1080p", "status": "Queued",
                   "percentage": "10", "mb": "1000.5", "mbleft": "900.45", "timeleft": "0:10:00",
                   "cat": "tv", "priority": "High"},
                  {"nzo_id": "SABnzbd_nzo_2", "filename": "Movie.2020.1080p", "status": "Queued",
                   "percentage": "0", "mb": "2000", "mbleft": "2000", "timeleft": "0:00:00",
                   "cat": "movies", "priority": "Normal"}
                ]}}
                """));

        List<QueueItem> items = client.fetchQueue();

        assertEquals(2, items.size());
        QueueItem head = items.get(0);
        assertEquals("SABnzbd_nzo_1", head.getExternalId());
        assertEquals(DownloadStatus.DOWNLOADING, head.getStatus());
        assertEquals(1.2, head.getSpeed(), 1e-9);
        assertEquals(10.0, head.getProgress());
        assertEquals(1000.5, head.getSizeTotal());
        assertEquals("High", head.getPriority());
        assertEquals(1, head.getQueuePosition());

        QueueItem second = items.get(1);
        assertEquals(DownloadStatus.QUEUED, second.getStatus());
        assertEquals(0.0, second.getSpeed());
        assertEquals(2, second.getQueuePosition());

        RecordedRequest request = server.takeRequest();
        assertEquals("/api", request.getRequestUrl().encodedPath());
        assertEquals("queue", request.getRequestUrl().queryParameter("mode"));
        assertEquals("secret", request.getRequestUrl().queryParameter("apikey"));
        assertEquals("json", request.getRequestUrl().queryParameter("output"));
    }

    @Test
    @DisplayName("Should keep every slot queued when the queue is paused")
    void testFetchQueue_Paused() {
        server.enqueue(json("""
                {"queue": {"paused": true, "speed": "0", "slots": [
                  {"nzo_id": "SABnzbd_nzo_1", "filename": "A", "status": "Queued", "percentage": "50"}
                ]}}
                """));

        assertEquals(DownloadStatus.QUEUED, client.fetchQueue().get(0).getStatus());
    }

    @Test
    @DisplayName("Should map completed, failed and post-processing history entries")
    void testFetchHistory() throws InterruptedException {
        server.enqueue(json("""
                {"history": {"slots": [
                  {"nzo_id": "nzo_done", "name": "Movie.2020", "status": "Completed", "bytes": 104857600,
                   "category": "movies", "completed": 1714564800, "fail_message": ""},
                  {"nzo_id": "nzo_failed", "name": "Broken", "status": "Failed", "bytes": 0,
                   "category": "tv", "completed": 1714564800, "fail_message": "Unpacking failed"},
                  {"nzo_id": "nzo_unpack", "name": "Show.S01E01", "status": "Extracting", "bytes": 0,
                   "category": "tv", "completed": 0, "fail_message": ""}
                ]}}
                """));

        List<HistoryItem> items = client.fetchHistory();

        assertEquals(3, items.size());
        assertEquals(DownloadStatus.COMPLETED, items.get(0).getStatus());
        assertEquals(100.0, items.get(0).getSizeTotal(), 1e-9);
        assertEquals(Instant.ofEpochSecond(1714564800L), items.get(0).getCompletedAt());
        assertNull(items.get(0).getFailureReason());

        assertTrue(items.get(1).isFailed());
        assertEquals("Unpacking failed", items.get(1).getFailureReason());

        assertEquals(DownloadStatus.DOWNLOADING, items.get(2).getStatus());
        assertNull(items.get(2).getCompletedAt());

        RecordedRequest request = server.takeRequest();
        assertEquals("history", request.getRequestUrl().queryParameter("mode"));
        assertEquals("50", request.getRequestUrl().queryParameter("limit"));
    }

    @Test
    @DisplayName("Should fail on HTTP errors")
    void testFetchQueue_HttpError() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThrows(DownloadClientException.class, () -> client.fetchQueue());
    }

    @Test
    @DisplayName("Should fail when the payload has no queue object")
    void testFetchQueue_MalformedPayload() {
        server.enqueue(json("{\"error\": \"API Key Incorrect\"}"));

        assertThrows(DownloadClientException.class, () -> client.fetchQueue());
    }

    @Test
    @DisplayName("Should send the priority code to the controller")
    void testSetPriority() throws InterruptedException {
        server.enqueue(json("{\"position\": 0}"));

        client.setPriority("SABnzbd_nzo_1", 1);

        RecordedRequest request = server.takeRequest();
        assertEquals("queue", request.getRequestUrl().queryParameter("mode"));
        assertEquals("priority", request.getRequestUrl().queryParameter("name"));
        assertEquals("SABnzbd_nzo_1", request.getRequestUrl().queryParameter("value"));
        assertEquals("1", request.getRequestUrl().queryParameter("value2"));
    }

    @Test
    @DisplayName("Should fail when the controller refuses the priority change")
    void testSetPriority_Refused() {
        server.enqueue(json("{\"status\": false, \"error\": \"not found\"}"));

        DownloadClientException ex = assertThrows(DownloadClientException.class,
                () -> client.setPriority("SABnzbd_nzo_9", 2));
        assertTrue(ex.getMessage().contains("not found"));
    }

    @Test
    @DisplayName("Should convert speed strings to MB/s")
    void testParseSpeedToMb() {
        assertEquals(12.3, SabnzbdClient.parseSpeedToMb("12.3 M"), 1e-9);
        assertEquals(12.3, SabnzbdClient.parseSpeedToMb("12.3 MB/s"), 1e-9);
        assertEquals(0.5, SabnzbdClient.parseSpeedToMb("512 K"), 1e-9);
        assertEquals(1228.8, SabnzbdClient.parseSpeedToMb("1.2 G"), 1e-9);
        assertEquals(1.0, SabnzbdClient.parseSpeedToMb("1024"), 1e-9);
        assertEquals(0.0, SabnzbdClient.parseSpeedToMb(""), 1e-9);
        assertEquals(0.0, SabnzbdClient.parseSpeedToMb(null), 1e-9);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
