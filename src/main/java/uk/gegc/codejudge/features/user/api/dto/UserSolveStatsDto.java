package uk.gegc.codejudge.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "UserSolveStatsDto", description = "Solve counters of the current user")
public record UserSolveStatsDto(
        @Schema(description = "Username", example = "alice")
        String username,

        @Schema(description = "Distinct problems solved", example = "42")
        int totalSolved,

        @Schema(description = "Easy problems solved", example = "20")
        int easySolved,

        @Schema(description = "Medium problems solved", example = "15")
        int mediumSolved,

        @Schema(description = "Hard problems solved", example = "7")
        int hardSolved,

        @Schema(description = "Problems attempted but not solved yet", example = "3")
        long attemptedUnsolved
) {
}
