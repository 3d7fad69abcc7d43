package uk.gegc.codejudge.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "UserLeaderboardEntryDto", description = "Global leaderboard row ordered by problems solved")
public record UserLeaderboardEntryDto(
        @Schema(description = "1-based position on the board", example = "1")
        int rank,

        @Schema(description = "Username", example = "alice")
        String username,

        @Schema(description = "Distinct problems solved", example = "42")
        int totalSolved,

        @Schema(description = "Easy problems solved", example = "20")
        int easySolved,

        @Schema(description = "Medium problems solved", example = "15")
        int mediumSolved,

        @Schema(description = "Hard problems solved", example = "7")
        int hardSolved
) {
}
