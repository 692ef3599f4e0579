package com.xksgroup.downloadtracker.controller;

import com.xksgroup.downloadtracker.model.download.DownloadRecord;
import com.xksgroup.downloadtracker.model.download.DownloadStatus;
import com.xksgroup.downloadtracker.model.dto.DownloadDto;
import com.xksgroup.downloadtracker.model.dto.PriorityUpdateRequest;
import com.xksgroup.downloadtracker.service.DownloadQueryService;
import com.xksgroup.downloadtracker.service.PriorityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("tracker/api/v1/downloads")
@RequiredArgsConstructor
@Tag(name = "Téléchargements", description = "Consulter les téléchargements suivis et modifier leur priorité")
public class DownloadController {

    private final DownloadQueryService downloadQueryService;
    private final PriorityService priorityService;

    @GetMapping
    @Operation(
        summary = "Lister les téléchargements",
        description = "Récupère tous les téléchargements suivis, avec filtrage optionnel par statut (queued, downloading, completed, failed)."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Téléchargements récupérés avec succès",
            content = @Content(
                mediaType = "application/json",
                array = @ArraySchema(schema = @Schema(implementation = DownloadDto.class)),
                examples = @ExampleObject(
                    name = "Liste des téléchargements",
                    value = """
                    [
                        {
                            "id": "dl-4f1c2a9e-6b55-4a43-9d0e-2f8a3b1c7d10",
                            "externalId": "SABnzbd_nzo_abc123",
                            "name": "Show.Name.S06E18.1080p.WEB-DL.x264-GROUP",
                            "category": "tv",
                            "status": "downloading",
                            "progress": 42.5,
                            "speed": 12.3,
                            "sizeTotal": 2048.0,
                            "sizeLeft": 1177.6,
                            "timeLeft": "0:01:35",
                            "queuePosition": 1,
                            "priority": "Normal",
                            "mediaTitle": "Show Name",
                            "mediaType": "tv",
                            "season": 6,
                            "episode": 18,
                            "posterUrl": "https://image.tmdb.org/t/p/original/poster.jpg",
                            "sourceInstance": "sonarr-main",
                            "failed": false
                        }
                    ]
                    """
                )
            )
        ),
        @ApiResponse(responseCode = "400", description = "Statut inconnu")
    })
    public ResponseEntity<List<DownloadDto>> listDownloads(
            @Parameter(description = "Filtrer par statut", example = "queued")
            @RequestParam(required = false) String status) {

        List<DownloadRecord> records = status == null || status.isBlank()
                ? downloadQueryService.listAll()
                : downloadQueryService.listByStatus(parseStatus(status));

        return ResponseEntity.ok(records.stream().map(DownloadDto::fromRecord).toList());
    }

    @PostMapping("/{id}/priority")
    @Operation(
        summary = "Modifier la priorité d'un téléchargement",
        description = "Envoie la nouvelle priorité au client de téléchargement. Seuls les téléchargements en file d'attente sont acceptés."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Priorité mise à jour"),
        @ApiResponse(responseCode = "400", description = "Libellé de priorité invalide"),
        @ApiResponse(responseCode = "404", description = "Téléchargement introuvable"),
        @ApiResponse(responseCode = "409", description = "Le téléchargement n'est plus en file d'attente"),
        @ApiResponse(responseCode = "502", description = "Le client de téléchargement a refusé le changement")
    })
    public ResponseEntity<DownloadDto> updatePriority(
            @Parameter(description = "Identifiant interne du téléchargement")
            @PathVariable String id,
            @Valid @RequestBody PriorityUpdateRequest request) {

        DownloadRecord updated = priorityService.updatePriority(id, request.getPriority());
        return ResponseEntity.ok(DownloadDto.fromRecord(updated));
    }

    @PostMapping("/admin/reset-poster-flags")
    @Operation(
        summary = "Réinitialiser les recherches d'affiches",
        description = "Remet posterAttempted à false sur tous les téléchargements afin qu'ils soient recherchés à nouveau (ex: après une amélioration de l'algorithme de correspondance)."
    )
    public ResponseEntity<Map<String, Object>> resetPosterFlags() {
        long count = downloadQueryService.resetPosterFlags();
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "reset", count,
                "message", "Reset poster_attempted for " + count + " items"));
    }

    private static DownloadStatus parseStatus(String status) {
        try {
            return DownloadStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown status: " + status, e);
        }
    }
}
