package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.problem.domain.model.SolveStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ProblemStatusDto", description = "A participant's progress on one contest problem")
public record ProblemStatusDto(
        @Schema(description = "Contest problem UUID")
        UUID problemId,

        @Schema(description = "Problem title", example = "Balanced Brackets")
        String problemTitle,

        @Schema(description = "Display order", example = "1")
        int problemOrder,

        @Schema(description = "Points awarded for solving", example = "100")
        int points,

        @Schema(description = "Progress, null when never attempted", example = "SOLVED")
        SolveStatus status,

        @Schema(description = "Points earned", example = "100")
        int score,

        @Schema(description = "All submissions", example = "3")
        int attempts,

        @Schema(description = "Non-accepted submissions before the first acceptance", example = "2")
        int wrongAttempts,

        @Schema(description = "Minutes from contest start to the first acceptance", example = "17")
        Integer solveTime,

        @Schema(description = "Time of the first acceptance")
        Instant firstSolvedAt
) {
}
