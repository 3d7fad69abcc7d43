package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ContestSubmissionDetailDto", description = "Full contest submission, visible to its author only")
public record ContestSubmissionDetailDto(
        @Schema(description = "Submission UUID")
        UUID id,

        @Schema(description = "Contest slug", example = "weekly-42")
        String contestSlug,

        @Schema(description = "Author username", example = "alice")
        String username,

        @Schema(description = "Contest problem UUID")
        UUID problemId,

        @Schema(description = "Contest problem title", example = "Balanced Brackets")
        String problemTitle,

        @Schema(description = "Language", example = "JAVA")
        Language language,

        @Schema(description = "Final verdict", example = "WRONG_ANSWER")
        Verdict verdict,

        @Schema(description = "Test cases passed", example = "3")
        int testCasesPassed,

        @Schema(description = "Test cases considered", example = "5")
        int totalTestCases,

        @Schema(description = "Maximum execution time in ms")
        Integer executionTimeMs,

        @Schema(description = "Maximum memory in KB")
        Integer memoryUsedKb,

        @Schema(description = "Error text of the first failing case")
        String errorMessage,

        @Schema(description = "Compiler output when compilation failed")
        String compilationOutput,

        @Schema(description = "Source code")
        String code,

        @Schema(description = "When the submission was made")
        Instant submittedAt
) {
}
