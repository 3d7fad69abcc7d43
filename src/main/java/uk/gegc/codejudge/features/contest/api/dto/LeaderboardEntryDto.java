package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "LeaderboardEntryDto", description = "One participant's standing in a contest")
public record LeaderboardEntryDto(
        @Schema(description = "Rank, null before the first ranking pass", example = "1")
        Integer rank,

        @Schema(description = "Username", example = "alice")
        String username,

        @Schema(description = "Total score", example = "300")
        int totalScore,

        @Schema(description = "Problems solved", example = "3")
        int problemsSolved,

        @Schema(description = "Minutes from contest start to the latest submission", example = "42")
        int totalTime,

        @Schema(description = "Penalty minutes for wrong attempts on solved problems", example = "20")
        int penaltyTime,

        @Schema(description = "Time of the latest submission")
        Instant lastSubmissionAt
) {
}
