package uk.gegc.codejudge.features.activity.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "StreakDto", description = "Current solving streak and a day-by-day activity calendar")
public record StreakDto(
        @Schema(description = "Consecutive days with at least one solve, ending today", example = "5")
        int currentStreak,

        @Schema(description = "Days with activity inside the requested window, oldest first")
        List<ActivityDayDto> calendar
) {
}
