package uk.gegc.codejudge.features.submission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.util.Map;

@Schema(name = "SubmissionStatsDto", description = "Practice submission counts of the current user")
public record SubmissionStatsDto(
        @Schema(description = "All practice submissions", example = "42")
        long totalSubmissions,

        @Schema(description = "Accepted submissions", example = "20")
        long acceptedSubmissions,

        @Schema(description = "Accepted / total as a percentage", example = "47.62")
        double acceptanceRate,

        @Schema(description = "Submission count per verdict")
        Map<Verdict, Long> byVerdict
) {
}
