package uk.gegc.codejudge.features.submission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;
import uk.gegc.codejudge.features.submission.domain.model.TestCaseStatus;

import java.util.UUID;

@Schema(name = "TestCaseResultDto", description = "Outcome of one test case. Input and outputs are only shown for sample cases.")
public record TestCaseResultDto(
        @Schema(description = "Test case UUID")
        UUID testCaseId,

        @Schema(description = "Test case type", example = "SAMPLE")
        TestCaseType type,

        @Schema(description = "Per-case status", example = "WRONG_ANSWER")
        TestCaseStatus status,

        @Schema(description = "Input, sample cases only")
        String input,

        @Schema(description = "Expected output, sample cases only")
        String expectedOutput,

        @Schema(description = "Program output, sample cases only")
        String actualOutput,

        @Schema(description = "Execution time in ms", example = "12")
        Integer executionTimeMs,

        @Schema(description = "Memory used in KB", example = "8704")
        Integer memoryUsedKb,

        @Schema(description = "Error text reported for this case")
        String errorMessage
) {
}
