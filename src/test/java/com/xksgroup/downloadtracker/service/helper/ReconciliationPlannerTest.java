package com.xksgroup.downloadtracker.service.helper;

import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.download.Priority;
import com.xksgroup.downloadtracker.model.snapshot.HistoryItem;
import com.xksgroup.downloadtracker.model.snapshot.QueueItem;
import com.xksgroup.downloadtracker.model.snapshot.QueueSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReconciliationPlanner Tests")
class ReconciliationPlannerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ReconciliationPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new ReconciliationPlanner(3);
    }

    // ============================================================================
    // Inserts
    // ============================================================================

    @Test
    @DisplayName("Should insert unknown queue and history items")
    void testPlan_InsertsNewItems() {
        QueueSnapshot snapshot = new QueueSnapshot(
                List.of(queueItem("nzo_1", DownloadStatus.DOWNLOADING, 1), queueItem("nzo_2", DownloadStatus.QUEUED, 2)),
                List.of(historyItem("nzo_3", DownloadStatus.COMPLETED, Instant.parse("2024-05-01T10:00:00Z"))));

        ReconciliationPlan plan = planner.plan(List.of(), snapshot, NOW);

        assertEquals(3, plan.getInserts().size());
        assertTrue(plan.getUpdates().isEmpty());
        assertEquals(1, plan.getCompletedTransitions());

        DownloadRecord downloading = find(plan.getInserts(), "nzo_1");
        assertTrue(downloading.getId().startsWith("dl-"));
        assertEquals(DownloadStatus.DOWNLOADING, downloading.getStatus());
        assertEquals(Priority.NORMAL, downloading.getPriority());
        assertEquals(NOW, downloading.getCreatedAt());
        assertFalse(downloading.isPosterAttempted());

        DownloadRecord completed = find(plan.getInserts(), "nzo_3");
        assertEquals(DownloadStatus.COMPLETED, completed.getStatus());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), completed.getCompletedAt());
        assertEquals(100.0, completed.getProgress());
    }

    @Test
    @DisplayName("Should prefer the history entry when an item is in both lists")
    void testPlan_HistoryWins() {
        QueueSnapshot snapshot = new QueueSnapshot(
                List.of(queueItem("nzo_1", DownloadStatus.DOWNLOADING, 1)),
                List.of(historyItem("nzo_1", DownloadStatus.COMPLETED, null)));

        ReconciliationPlan plan = planner.plan(List.of(), snapshot, NOW);

        assertEquals(1, plan.getInserts().size());
        assertEquals(DownloadStatus.COMPLETED, plan.getInserts().get(0).getStatus());
        assertEquals(NOW, plan.getInserts().get(0).getCompletedAt());
    }

    // ============================================================================
    // Idempotence
    // ============================================================================

    @Test
    @DisplayName("Should produce an empty plan when the same snapshot is applied twice")
    void testPlan_Idempotent() {
        QueueSnapshot snapshot = new QueueSnapshot(
                List.of(queueItem("nzo_1", DownloadStatus.DOWNLOADING, 1), queueItem("nzo_2", DownloadStatus.QUEUED, 2)),
                List.of(historyItem("nzo_3", DownloadStatus.FAILED, null),
                        historyItem("nzo_4", DownloadStatus.DOWNLOADING, null)));

        List<DownloadRecord> store = apply(new ArrayList<>(), planner.plan(List.of(), snapshot, NOW));
        ReconciliationPlan second = planner.plan(store, snapshot, NOW.plusSeconds(5));

        assertTrue(second.isEmpty(), "second plan should be empty but had " + second.mutationCount() + " mutations");
    }

    // ============================================================================
    // Status transitions
    // ============================================================================

    @Test
    @DisplayName("Should not move a downloading record back to queued")
    void testPlan_NoRegression() {
        DownloadRecord record = persisted("nzo_1", DownloadStatus.DOWNLOADING);
        QueueSnapshot snapshot = new QueueSnapshot(List.of(queueItem("nzo_1", DownloadStatus.QUEUED, 2)), List.of());

        ReconciliationPlan plan = planner.plan(List.of(record), snapshot, NOW);

        assertEquals(1, plan.getUpdates().size());
        assertEquals(DownloadStatus.DOWNLOADING, plan.getUpdates().get(0).fields().getStatus());
        assertEquals(2, plan.getUpdates().get(0).fields().getQueuePosition());
    }

    @Test
    @DisplayName("Should complete a downloading record found in history")
    void testPlan_CompletesFromHistory() {
        Instant finishedAt = Instant.parse("2024-05-01T11:30:00Z");
        DownloadRecord record = persisted("nzo_1", DownloadStatus.DOWNLOADING);
        record.setProgress(80.0);
        record.setSpeed(10.0);
        QueueSnapshot snapshot = new QueueSnapshot(List.of(), List.of(historyItem("nzo_1", DownloadStatus.COMPLETED, finishedAt)));

        ReconciliationPlan plan = planner.plan(List.of(record), snapshot, NOW);

        assertEquals(1, plan.getCompletedTransitions());
        ReconciliationPlan.RecordUpdate update = plan.getUpdates().get(0);
        assertEquals(record.getId(), update.id());
        assertEquals(DownloadStatus.COMPLETED, update.fields().getStatus());
        assertEquals(finishedAt, update.fields().getCompletedAt());
        assertEquals(100.0, update.fields().getProgress());
        assertEquals(0.0, update.fields().getSpeed());
        assertNull(update.fields().getQueuePosition());
    }

    @Test
    @DisplayName("Should fail a record reported failed in history")
    void testPlan_FailsFromHistory() {
        DownloadRecord record = persisted("nzo_1", DownloadStatus.DOWNLOADING);
        QueueSnapshot snapshot = new QueueSnapshot(List.of(), List.of(historyItem("nzo_1", DownloadStatus.FAILED, null)));

        ReconciliationPlan plan = planner.plan(List.of(record), snapshot, NOW);

        assertEquals(1, plan.getFailedTransitions());
        assertEquals(DownloadStatus.FAILED, plan.getUpdates().get(0).fields().getStatus());
        assertEquals("Unpacking failed", plan.getUpdates().get(0).fields().getFailureReason());
        assertEquals(NOW, plan.getUpdates().get(0).fields().getCompletedAt());
    }

    @Test
    @DisplayName("Should leave terminal records untouched")
    void testPlan_TerminalFrozen() {
        DownloadRecord completed = persisted("nzo_1", DownloadStatus.COMPLETED);
        DownloadRecord failed = persisted("nzo_2", DownloadStatus.FAILED);
        QueueSnapshot snapshot = new QueueSnapshot(List.of(queueItem("nzo_1", DownloadStatus.DOWNLOADING, 1)), List.of());

        ReconciliationPlan plan = planner.plan(List.of(completed, failed), snapshot, NOW);

        assertTrue(plan.isEmpty());
    }

    // ============================================================================
    // Missing records
    // ============================================================================

    @Test
    @DisplayName("Should only count misses below the threshold")
    void testPlan_GracePeriod() {
        DownloadRecord record = persisted("nzo_1", DownloadStatus.DOWNLOADING);
        QueueSnapshot empty = new QueueSnapshot(List.of(), List.of());

        ReconciliationPlan plan = planner.plan(List.of(record), empty, NOW);

        assertTrue(plan.getDeletions().isEmpty());
        assertEquals(1, plan.getUpdates().size());
        assertEquals(DownloadStatus.DOWNLOADING, plan.getUpdates().get(0).fields().getStatus());
        assertEquals(1, plan.getUpdates().get(0).fields().getConsecutiveMisses());
    }

    @Test
    @DisplayName("Should fail a downloading record missing for threshold cycles")
    void testPlan_OrphanedDownloadFails() {
        List<DownloadRecord> store = new ArrayList<>(List.of(persisted("nzo_1", DownloadStatus.DOWNLOADING)));
        QueueSnapshot empty = new QueueSnapshot(List.of(), List.of());

        apply(store, planner.plan(store, empty, NOW));
        apply(store, planner.plan(store, empty, NOW));
        ReconciliationPlan third = planner.plan(store, empty, NOW);

        assertEquals(1, third.getFailedTransitions());
        assertEquals(DownloadStatus.FAILED, third.getUpdates().get(0).fields().getStatus());
        assertEquals(ReconciliationPlanner.REMOVED_REASON, third.getUpdates().get(0).fields().getFailureReason());
        assertEquals(NOW, third.getUpdates().get(0).fields().getCompletedAt());
    }

    @Test
    @DisplayName("Should delete a queued record missing for threshold cycles")
    void testPlan_CancelledQueuedDeleted() {
        DownloadRecord record = persisted("nzo_1", DownloadStatus.QUEUED);
        record.setConsecutiveMisses(2);

        ReconciliationPlan plan = planner.plan(List.of(record), new QueueSnapshot(List.of(), List.of()), NOW);

        assertEquals(List.of(record.getId()), plan.getDeletions());
        assertTrue(plan.getUpdates().isEmpty());
    }

    @Test
    @DisplayName("Should reset the miss counter when a record reappears")
    void testPlan_ReappearResetsMisses() {
        DownloadRecord record = persisted("nzo_1", DownloadStatus.QUEUED);
        record.setConsecutiveMisses(2);
        QueueSnapshot snapshot = new QueueSnapshot(List.of(queueItem("nzo_1", DownloadStatus.QUEUED, 1)), List.of());

        ReconciliationPlan plan = planner.plan(List.of(record), snapshot, NOW);

        assertTrue(plan.getDeletions().isEmpty());
        assertEquals(0, plan.getUpdates().get(0).fields().getConsecutiveMisses());
    }

    @Test
    @DisplayName("Should reject a miss threshold below 1")
    void testConstructor_InvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new ReconciliationPlanner(0));
    }

    // ============================================================================
    // Helpers
    // ============================================================================

    private static QueueItem queueItem(String externalId, DownloadStatus status, int position) {
        return QueueItem.builder()
                .externalId(externalId)
                .name("Show.Name.S01E0" + position + ".1080p")
                .status(status)
                .detailedStatus(status == DownloadStatus.DOWNLOADING ? "Downloading" : "Queued")
                .progress(status == DownloadStatus.DOWNLOADING ? 25.0 : 0.0)
                .speed(status == DownloadStatus.DOWNLOADING ? 5.5 : 0.0)
                .sizeTotal(1000.0)
                .sizeLeft(750.0)
                .timeLeft("0:02:00")
                .category("tv")
                .priority("Normal")
                .queuePosition(position)
                .build();
    }

    private static HistoryItem historyItem(String externalId, DownloadStatus status, Instant completedAt) {
        return HistoryItem.builder()
                .externalId(externalId)
                .name("Movie.2020.1080p")
                .status(status)
                .detailedStatus(status == DownloadStatus.DOWNLOADING ? "Extracting" : status.name())
                .sizeTotal(2048.0)
                .category("movies")
                .completedAt(completedAt)
                .failureReason(status == DownloadStatus.FAILED ? "Unpacking failed" : null)
                .build();
    }

    private static DownloadRecord persisted(String externalId, DownloadStatus status) {
        return DownloadRecord.builder()
                .id("dl-" + externalId)
                .externalId(externalId)
                .name("Show.Name.S01E01.1080p")
                .status(status)
                .category("tv")
                .priority(Priority.NORMAL)
                .createdAt(NOW.minusSeconds(3600))
                .completedAt(status.isTerminal() ? NOW.minusSeconds(60) : null)
                .build();
    }

    private static DownloadRecord find(List<DownloadRecord> records, String externalId) {
        return records.stream()
                .filter(record -> externalId.equals(record.getExternalId()))
                .findFirst()
                .orElseThrow();
    }

    private static List<DownloadRecord> apply(List<DownloadRecord> store, ReconciliationPlan plan) {
        store.addAll(plan.getInserts());
        for (ReconciliationPlan.RecordUpdate update : plan.getUpdates()) {
            store.stream()
                    .filter(record -> record.getId().equals(update.id()))
                    .forEach(record -> update.fields().applyTo(record));
        }
        store.removeIf(record -> plan.getDeletions().contains(record.getId()));
        return store;
    }
}
