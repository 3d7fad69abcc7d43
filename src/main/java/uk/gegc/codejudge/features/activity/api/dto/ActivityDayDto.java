package uk.gegc.codejudge.features.activity.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;

@Schema(name = "ActivityDayDto", description = "Per-day submission activity")
public record ActivityDayDto(
        @Schema(description = "Calendar day", example = "2024-05-01")
        LocalDate date,

        @Schema(description = "Judged submissions that day", example = "4")
        int submissionsCount,

        @Schema(description = "Problems solved for the first time that day", example = "2")
        int problemsSolved
) {
}
