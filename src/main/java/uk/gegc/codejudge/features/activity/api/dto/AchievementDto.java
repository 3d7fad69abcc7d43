package uk.gegc.codejudge.features.activity.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.activity.domain.model.AchievementType;

import java.time.Instant;

@Schema(name = "AchievementDto", description = "Achievement earned by the user")
public record AchievementDto(
        @Schema(description = "Achievement type", example = "FIRST_SOLVE")
        AchievementType type,

        @Schema(description = "Display title", example = "First Solve")
        String title,

        @Schema(description = "What it takes to earn it", example = "Solve your first problem")
        String description,

        @Schema(description = "When it was earned", example = "2024-05-01T10:15:30Z")
        Instant earnedAt
) {
}
