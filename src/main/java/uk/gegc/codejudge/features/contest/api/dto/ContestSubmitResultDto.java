package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ContestSubmitResultDto", description = "Judged contest submission and the author's standing after re-ranking")
public record ContestSubmitResultDto(
        ContestSubmissionDetailDto submission,
        LeaderboardEntryDto standing
) {
}
