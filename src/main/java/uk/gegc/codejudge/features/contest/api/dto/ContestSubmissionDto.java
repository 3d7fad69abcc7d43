package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ContestSubmissionDto", description = "Summary of a contest submission")
public record ContestSubmissionDto(
        UUID id,
        UUID problemId,
        String problemTitle,
        Language language,
        Verdict verdict,
        int testCasesPassed,
        int totalTestCases,
        Integer executionTimeMs,
        Integer memoryUsedKb,
        Instant submittedAt
) {
}
