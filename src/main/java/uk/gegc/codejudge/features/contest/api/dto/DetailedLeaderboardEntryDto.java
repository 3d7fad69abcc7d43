package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "DetailedLeaderboardEntryDto", description = "Leaderboard entry with per-problem progress")
public record DetailedLeaderboardEntryDto(
        @Schema(description = "Overall standing")
        LeaderboardEntryDto standing,

        @Schema(description = "Progress on every contest problem, in problem order")
        List<ProblemStatusDto> problems
) {
}
