package uk.gegc.codejudge.features.submission.application;

import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingMode;

import java.time.Duration;

public interface JudgingMetricsService {

    void recordJudgingPass(JudgingMode mode, Verdict verdict, Duration duration);

    void incrementSandboxFailure();
}
