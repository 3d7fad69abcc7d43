package uk.gegc.codejudge.features.submission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "SubmissionDetailDto", description = "Full submission view. Code and per-case results are only included for the owner.")
public record SubmissionDetailDto(
        @Schema(description = "Submission UUID")
        UUID id,

        @Schema(description = "Author username", example = "alice")
        String username,

        @Schema(description = "Problem slug", example = "two-sum")
        String problemSlug,

        @Schema(description = "Problem title", example = "Two Sum")
        String problemTitle,

        @Schema(description = "Language", example = "CPP")
        Language language,

        @Schema(description = "Final verdict", example = "COMPILATION_ERROR")
        Verdict verdict,

        @Schema(description = "Test cases passed", example = "0")
        int testCasesPassed,

        @Schema(description = "Test cases considered", example = "4")
        int totalTestCases,

        @Schema(description = "Maximum execution time in ms")
        Integer executionTimeMs,

        @Schema(description = "Maximum memory in KB")
        Integer memoryUsedKb,

        @Schema(description = "Error text of the first failing case")
        String errorMessage,

        @Schema(description = "Compiler output when compilation failed")
        String compilationOutput,

        @Schema(description = "Source code, owner only")
        String code,

        @Schema(description = "Per-case results in execution order, owner only")
        List<TestCaseResultDto> testCaseResults,

        @Schema(description = "When the submission was made")
        Instant submittedAt
) {
}
