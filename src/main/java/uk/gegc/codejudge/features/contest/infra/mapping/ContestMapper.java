package uk.gegc.codejudge.features.contest.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.codejudge.features.contest.api.dto.*;
import uk.gegc.codejudge.features.contest.domain.model.*;
import uk.gegc.codejudge.features.submission.domain.judging.JudgeCase;

import java.time.Duration;
import java.time.Instant;

@Component
public class ContestMapper {

    public LeaderboardEntryDto toLeaderboardEntry(ContestParticipant participant) {
        return new LeaderboardEntryDto(
                participant.getRank(),
                participant.getUser().getUsername(),
                participant.getTotalScore(),
                participant.getProblemsSolved(),
                participant.getTotalTime(),
                participant.getPenaltyTime(),
                participant.getLastSubmissionAt()
        );
    }

    public ProblemStatusDto toProblemStatus(ContestProblem problem, ContestProblemStatus status) {
        if (status == null) {
            return new ProblemStatusDto(problem.getId(), problem.getTitle(), problem.getSortOrder(), problem.getPoints(),
                    null, 0, 0, 0, null, null);
        }
        return new ProblemStatusDto(
                problem.getId(),
                problem.getTitle(),
                problem.getSortOrder(),
                problem.getPoints(),
                status.getStatus(),
                status.getScore(),
                status.getAttempts(),
                status.getWrongAttempts(),
                status.getSolveTime(),
                status.getFirstSolvedAt()
        );
    }

    public ContestSubmissionDto toSubmissionDto(ContestSubmission submission) {
        return new ContestSubmissionDto(
                submission.getId(),
                submission.getProblem().getId(),
                submission.getProblem().getTitle(),
                submission.getLanguage(),
                submission.getVerdict(),
                submission.getTestCasesPassed(),
                submission.getTotalTestCases(),
                submission.getExecutionTimeMs(),
                submission.getMemoryUsedKb(),
                submission.getSubmittedAt()
        );
    }

    public ContestSubmissionDetailDto toSubmissionDetailDto(ContestSubmission submission) {
        return new ContestSubmissionDetailDto(
                submission.getId(),
                submission.getContest().getSlug(),
                submission.getUser().getUsername(),
                submission.getProblem().getId(),
                submission.getProblem().getTitle(),
                submission.getLanguage(),
                submission.getVerdict(),
                submission.getTestCasesPassed(),
                submission.getTotalTestCases(),
                submission.getExecutionTimeMs(),
                submission.getMemoryUsedKb(),
                submission.getErrorMessage(),
                submission.getCompilationOutput(),
                submission.getCode(),
                submission.getSubmittedAt()
        );
    }

    public ContestRegistrationDto toRegistrationDto(ContestRegistration registration) {
        return new ContestRegistrationDto(
                registration.getContest().getSlug(),
                registration.getUser().getUsername(),
                registration.getRegisteredAt()
        );
    }

    public TimeInfoDto toTimeInfo(Contest contest, Instant now) {
        ContestStatus status = contest.statusAt(now);
        return switch (status) {
            case NOT_STARTED -> new TimeInfoDto(status, contest.getStartTime(), contest.getEndTime(),
                    Duration.between(now, contest.getStartTime()).toSeconds(), null, null, null);
            case ACTIVE -> new TimeInfoDto(status, contest.getStartTime(), contest.getEndTime(),
                    null,
                    Duration.between(now, contest.getEndTime()).toSeconds(),
                    Duration.between(contest.getStartTime(), now).toSeconds(),
                    null);
            case ENDED -> new TimeInfoDto(status, contest.getStartTime(), contest.getEndTime(),
                    null, null, null,
                    Duration.between(contest.getStartTime(), contest.getEndTime()).toSeconds());
        };
    }

    public JudgeCase toJudgeCase(ContestTestCase testCase) {
        return new JudgeCase(
                testCase.getId(),
                testCase.getSortOrder(),
                testCase.getType(),
                testCase.getInputData(),
                testCase.getExpectedOutput()
        );
    }
}
