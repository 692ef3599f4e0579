package com.xksgroup.downloadtracker.service;

import com.xksgroup.downloadtracker.exception.LibraryLookupException;
import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.download.MediaMatch;
import com.xksgroup.downloadtracker.model.library.LibraryCandidate;
import com.xksgroup.downloadtracker.model.library.ParsedRelease;
import com.xksgroup.downloadtracker.repo.DownloadRecordRepository;
import com.xksgroup.downloadtracker.service.client.LibraryClient;
import com.xksgroup.downloadtracker.service.client.LibraryRouter;
import com.xksgroup.downloadtracker.service.helper.ReleaseNameParser;
import com.xksgroup.downloadtracker.service.helper.TitleMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Enriches downloads with library metadata in the background.
 * <p>
 * Every record gets at most one automatic lookup: {@code posterAttempted} is
 * flipped in the store before the lookup starts, whatever its outcome. Lookups run
 * on a fixed-size executor and never block reconciliation.
 */
@Slf4j
@Service
public class MediaMatcherService {

    // Dispatch order: active first, then recent results, then the backlog
    private static final Map<DownloadStatus, Integer> DISPATCH_ORDER = Map.of(
            DownloadStatus.DOWNLOADING, 0,
            DownloadStatus.COMPLETED, 1,
            DownloadStatus.QUEUED, 2,
            DownloadStatus.FAILED, 3);

    private final DownloadRecordRepository downloadRecordRepository;
    private final LibraryRouter libraryRouter;
    private final TaskExecutor enrichmentExecutor;
    private final int minScore;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public MediaMatcherService(DownloadRecordRepository downloadRecordRepository,
                               LibraryRouter libraryRouter,
                               @Qualifier("enrichmentExecutor") TaskExecutor enrichmentExecutor,
                               @Value("${tracker.enrichment.min-score:60}") int minScore) {
        this.downloadRecordRepository = downloadRecordRepository;
        this.libraryRouter = libraryRouter;
        this.enrichmentExecutor = enrichmentExecutor;
        this.minScore = minScore;
    }

    /**
     * Hands every record that has not been attempted yet to the enrichment executor.
     *
     * @return number of lookups dispatched
     */
    public int dispatchPending() {
        List<DownloadRecord> pending = new ArrayList<>(downloadRecordRepository.findByPosterAttemptedFalse());
        if (pending.isEmpty()) {
            return 0;
        }
        pending.sort(Comparator.comparingInt(record -> DISPATCH_ORDER.getOrDefault(record.getStatus(), 4)));

        int dispatched = 0;
        for (DownloadRecord record : pending) {
            if (!inFlight.add(record.getId())) {
                continue;
            }
            try {
                enrichmentExecutor.execute(() -> enrich(record));
                dispatched++;
            } catch (TaskRejectedException e) {
                inFlight.remove(record.getId());
                log.debug("Enrichment queue full, {} pending records wait for the next cycle", pending.size() - dispatched);
                break;
            }
        }
        if (dispatched > 0) {
            log.debug("Dispatched {} enrichment lookups", dispatched);
        }
        return dispatched;
    }

    /**
     * Claims the record, performs the lookup and stores any match. A lost claim means
     * another worker already owns this record.
     */
    void enrich(DownloadRecord record) {
        try {
            if (!downloadRecordRepository.claimForEnrichment(record.getId())) {
                return;
            }
            Optional<MediaMatch> match = lookup(record);
            if (match.isPresent()) {
                downloadRecordRepository.saveMediaMatch(record.getId(), match.get());
                log.info("Poster found for '{}': {} ({})", record.getName(), match.get().getMediaTitle(),
                        match.get().getSourceInstance());
            }
        } finally {
            inFlight.remove(record.getId());
        }
    }

    /**
     * Lookup failures end up as "no match"; store failures propagate.
     */
    Optional<MediaMatch> lookup(DownloadRecord record) {
        Optional<LibraryClient> client = libraryRouter.route(record.getCategory());
        if (client.isEmpty()) {
            log.debug("No library instance for category '{}' of '{}'", record.getCategory(), record.getName());
            return Optional.empty();
        }

        ParsedRelease release = ReleaseNameParser.parse(record.getName());
        if (release.title().isBlank()) {
            return Optional.empty();
        }

        List<LibraryCandidate> candidates;
        try {
            candidates = client.get().searchByTitle(release.title(), release.year());
        } catch (LibraryLookupException e) {
            log.warn("Lookup for '{}' on {} failed: {}", release.title(), client.get().getName(), e.getMessage());
            return Optional.empty();
        }

        Optional<TitleMatcher.ScoredCandidate> best = TitleMatcher.selectBest(release, candidates, minScore);
        if (best.isEmpty()) {
            log.debug("No confident match for '{}' in {}", release.title(), client.get().getName());
            return Optional.empty();
        }

        LibraryCandidate candidate = best.get().candidate();
        log.debug("Best match for '{}': '{}' (score: {})", release.title(), candidate.getTitle(), best.get().score());
        return Optional.of(MediaMatch.builder()
                .mediaTitle(candidate.getTitle())
                .mediaType(candidate.getType())
                .year(candidate.getYear())
                .season(release.season())
                .episode(release.episode())
                .posterUrl(candidate.getPosterUrl())
                .sourceInstance(client.get().getName())
                .matchScore(best.get().score())
                .build());
    }

    public int getInFlightCount() {
        return inFlight.size();
    }
}
