package uk.gegc.codejudge.features.submission.domain.judging;

import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

/**
 * Result of executing one test case. Time and memory are zero when the sandbox
 * reported nothing.
 */
public record CaseOutcome(
        JudgeCase testCase,
        Verdict status,
        String actualOutput,
        int executionTimeMs,
        int memoryUsedKb,
        String errorMessage
) {

    public boolean passed() {
        return status == Verdict.ACCEPTED;
    }
}
