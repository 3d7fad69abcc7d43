package uk.gegc.codejudge.features.problem.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.codejudge.features.problem.application.ProblemStatisticsUpdater;
import uk.gegc.codejudge.features.problem.domain.model.Problem;
import uk.gegc.codejudge.features.problem.domain.model.ProblemSolveStatus;
import uk.gegc.codejudge.features.problem.domain.repository.ProblemRepository;
import uk.gegc.codejudge.features.problem.domain.repository.ProblemSolveStatusRepository;
import uk.gegc.codejudge.features.user.domain.model.User;
import uk.gegc.codejudge.features.user.domain.repository.UserRepository;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;

import java.time.Instant;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProblemStatisticsUpdaterImpl implements ProblemStatisticsUpdater {

    private final UserRepository userRepository;
    private final ProblemRepository problemRepository;
    private final ProblemSolveStatusRepository solveStatusRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean recordJudgingPass(UUID userId, Problem problem, boolean accepted, Instant at) {
        // User row lock first, then problem rows: one lock order for every judging pass
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));

        problemRepository.incrementTotalSubmissions(problem.getId());
        if (accepted) {
            problemRepository.incrementAcceptedSubmissions(problem.getId());
        }

        ProblemSolveStatus status = solveStatusRepository.findByUser_IdAndProblem_Id(userId, problem.getId())
                .orElseGet(() -> newStatus(user, problem));
        status.setAttempts(status.getAttempts() + 1);
        status.setLastAttemptedAt(at);

        boolean firstSolve = accepted && status.markSolved(at);
        solveStatusRepository.save(status);

        if (firstSolve) {
            problemRepository.incrementTotalSolved(problem.getId());
            user.recordFirstSolve(problem.getDifficulty());
            userRepository.save(user);
            log.info("User {} solved problem {} for the first time", user.getUsername(), problem.getSlug());
        }
        return firstSolve;
    }

    private static ProblemSolveStatus newStatus(User user, Problem problem) {
        ProblemSolveStatus status = new ProblemSolveStatus();
        status.setUser(user);
        status.setProblem(problem);
        return status;
    }
}
