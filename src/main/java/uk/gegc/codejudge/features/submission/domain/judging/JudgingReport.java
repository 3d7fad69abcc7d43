package uk.gegc.codejudge.features.submission.domain.judging;

import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.util.List;

/**
 * Aggregate result of one judging pass.
 *
 * @param totalCases     number of cases considered, executed or not
 * @param maxTimeMs      largest execution time over executed cases, null when none was measured
 * @param maxMemoryKb    largest memory usage over executed cases, null when none was measured
 * @param errorMessage   error text of the first failing case, if any
 * @param caseOutcomes   one entry per executed case, in execution order
 */
public record JudgingReport(
        Verdict verdict,
        int passedCases,
        int totalCases,
        Integer maxTimeMs,
        Integer maxMemoryKb,
        String compileOutput,
        String errorMessage,
        List<CaseOutcome> caseOutcomes
) {

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }
}
