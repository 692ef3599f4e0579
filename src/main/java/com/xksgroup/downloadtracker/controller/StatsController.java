package com.xksgroup.downloadtracker.controller;

import com.xksgroup.downloadtracker.model.dto.StatsDto;
import com.xksgroup.downloadtracker.service.DownloadQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("tracker/api/v1/stats")
@RequiredArgsConstructor
@Tag(name = "Statistiques", description = "Compteurs par statut et débit total")
public class StatsController {

    private final DownloadQueryService downloadQueryService;

    @GetMapping
    @Operation(summary = "Statistiques des téléchargements", description = "Nombre de téléchargements par statut et vitesse totale en MB/s")
    public ResponseEntity<StatsDto> getStats() {
        return ResponseEntity.ok(downloadQueryService.stats());
    }
}
