package com.xksgroup.downloadtracker.controller;

import com.xksgroup.downloadtracker.repo.DownloadRecordRepository;
import com.xksgroup.downloadtracker.service.MediaMatcherService;
import com.xksgroup.downloadtracker.service.SyncScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("tracker/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Santé", description = "Vérifications de santé du service de suivi")
public class HealthController {

    private final DownloadRecordRepository downloadRecordRepository;
    private final SyncScheduler syncScheduler;
    private final MediaMatcherService mediaMatcherService;

    @GetMapping
    @Operation(
        summary = "Vérification de santé du système",
        description = "Vérifie la connectivité à la base de données et l'état des cycles de synchronisation et de nettoyage."
    )
    public ResponseEntity<Object> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", LocalDateTime.now());
        health.put("service", "download-tracker");

        long uptime = ManagementFactory.getRuntimeMXBean().getUptime();
        long hours = uptime / (1000 * 60 * 60);
        long minutes = (uptime % (1000 * 60 * 60)) / (1000 * 60);
        health.put("uptime", String.format("%d hours %d minutes", hours, minutes));

        try {
            health.put("totalDownloads", downloadRecordRepository.count());
            health.put("database", "connected");
        } catch (DataAccessException e) {
            log.warn("Health check could not reach the store: {}", e.getMessage());
            health.put("database", "disconnected");
            health.put("status", "unhealthy");
        }

        Map<String, Object> sync = new HashMap<>();
        sync.put("lastSyncAt", syncScheduler.getLastSyncAt());
        sync.put("completedCycles", syncScheduler.getSyncTask().getCompletedRuns());
        sync.put("failedCycles", syncScheduler.getSyncTask().getFailedRuns());
        sync.put("skippedTicks", syncScheduler.getSyncTask().getSkippedTicks());
        sync.put("lookupsInFlight", mediaMatcherService.getInFlightCount());
        health.put("sync", sync);

        Map<String, Object> cleanup = new HashMap<>();
        cleanup.put("lastCleanupAt", syncScheduler.getLastCleanupAt());
        cleanup.put("completedCycles", syncScheduler.getRetentionTask().getCompletedRuns());
        health.put("cleanup", cleanup);

        HttpStatus status = "healthy".equals(health.get("status")) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }
}
