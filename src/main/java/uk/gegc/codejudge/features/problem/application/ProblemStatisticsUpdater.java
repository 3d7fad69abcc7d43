package uk.gegc.codejudge.features.problem.application;

import uk.gegc.codejudge.features.problem.domain.model.Problem;

import java.time.Instant;
import java.util.UUID;

/**
 * Applies the counters touched by one completed practice judging pass.
 * Must run inside the transaction that stores the submission's verdict.
 */
public interface ProblemStatisticsUpdater {

    /**
     * @return true when this pass was the user's first acceptance of the problem
     */
    boolean recordJudgingPass(UUID userId, Problem problem, boolean accepted, Instant at);
}
