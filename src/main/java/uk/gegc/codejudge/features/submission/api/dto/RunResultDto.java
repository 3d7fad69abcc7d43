package uk.gegc.codejudge.features.submission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.util.List;

@Schema(name = "RunResultDto", description = "Result of a sample-only run. Nothing is stored.")
public record RunResultDto(
        @Schema(description = "Verdict over the sample cases", example = "WRONG_ANSWER")
        Verdict verdict,

        @Schema(description = "Sample cases passed", example = "1")
        int passedCases,

        @Schema(description = "Sample cases considered", example = "2")
        int totalCases,

        @Schema(description = "Compiler output when compilation failed")
        String compileOutput,

        @Schema(description = "Per-case details")
        List<RunCaseResultDto> results
) {

    @Schema(name = "RunCaseResultDto", description = "One executed sample case")
    public record RunCaseResultDto(
            String input,
            String expectedOutput,
            String actualOutput,
            Verdict status,
            Integer executionTimeMs,
            Integer memoryUsedKb,
            String errorMessage
    ) {
    }
}
