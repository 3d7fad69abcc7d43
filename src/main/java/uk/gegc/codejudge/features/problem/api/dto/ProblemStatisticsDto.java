package uk.gegc.codejudge.features.problem.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.problem.domain.model.Difficulty;

import java.util.UUID;

@Schema(name = "ProblemStatisticsDto", description = "Submission counters for a problem")
public record ProblemStatisticsDto(
        @Schema(description = "Problem UUID", example = "3fa85f64-5717-4562-b3fc-2c963f66afa6")
        UUID problemId,

        @Schema(description = "Problem slug", example = "two-sum")
        String slug,

        @Schema(description = "Problem title", example = "Two Sum")
        String title,

        @Schema(description = "Difficulty", example = "EASY")
        Difficulty difficulty,

        @Schema(description = "Number of judged submissions", example = "120")
        long totalSubmissions,

        @Schema(description = "Number of accepted submissions", example = "45")
        long acceptedSubmissions,

        @Schema(description = "Number of distinct users who solved the problem", example = "30")
        long totalSolved,

        @Schema(description = "Accepted / total submissions as a percentage", example = "37.5")
        double acceptanceRate
) {
}
