package com.xksgroup.downloadtracker.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Requête de changement de priorité")
public class PriorityUpdateRequest {
    @NotBlank(message = "priority is required")
    @Schema(
        description = "Niveau de priorité. Insensible à la casse.",
        example = "high",
        allowableValues = {"force", "high", "normal", "low"}
    )
    private String priority;
}
