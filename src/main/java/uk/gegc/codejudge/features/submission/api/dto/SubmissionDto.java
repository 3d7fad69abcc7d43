package uk.gegc.codejudge.features.submission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "SubmissionDto", description = "Summary of a judged practice submission")
public record SubmissionDto(
        @Schema(description = "Submission UUID", example = "3fa85f64-5717-4562-b3fc-2c963f66afa6")
        UUID id,

        @Schema(description = "Problem slug", example = "two-sum")
        String problemSlug,

        @Schema(description = "Problem title", example = "Two Sum")
        String problemTitle,

        @Schema(description = "Language", example = "PYTHON")
        Language language,

        @Schema(description = "Final verdict", example = "ACCEPTED")
        Verdict verdict,

        @Schema(description = "Test cases passed", example = "10")
        int testCasesPassed,

        @Schema(description = "Test cases considered", example = "10")
        int totalTestCases,

        @Schema(description = "Maximum execution time over executed cases in ms", example = "48")
        Integer executionTimeMs,

        @Schema(description = "Maximum memory over executed cases in KB", example = "9216")
        Integer memoryUsedKb,

        @Schema(description = "When the submission was made", example = "2025-01-27T10:30:00Z")
        Instant submittedAt
) {
}
