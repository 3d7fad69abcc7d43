package uk.gegc.codejudge.features.submission.application;

import uk.gegc.codejudge.features.submission.domain.judging.JudgingMode;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingReport;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingRequest;

/**
 * Runs a program against its test cases, one case at a time, and derives the verdict.
 * Performs no persistence; callers decide what to store.
 */
public interface JudgingEngine {

    JudgingReport judge(JudgingRequest request, JudgingMode mode);
}
