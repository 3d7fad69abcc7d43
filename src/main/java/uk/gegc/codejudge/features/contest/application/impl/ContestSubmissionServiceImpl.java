package uk.gegc.codejudge.features.contest.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.codejudge.features.contest.api.dto.ContestSubmissionDetailDto;
import uk.gegc.codejudge.features.contest.api.dto.ContestSubmissionDto;
import uk.gegc.codejudge.features.contest.api.dto.ContestSubmitRequest;
import uk.gegc.codejudge.features.contest.api.dto.ContestSubmitResultDto;
import uk.gegc.codejudge.features.contest.application.ContestRankingService;
import uk.gegc.codejudge.features.contest.application.ContestSubmissionService;
import uk.gegc.codejudge.features.contest.config.ContestProperties;
import uk.gegc.codejudge.features.contest.domain.model.*;
import uk.gegc.codejudge.features.contest.domain.repository.*;
import uk.gegc.codejudge.features.contest.infra.mapping.ContestMapper;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.application.JudgingEngine;
import uk.gegc.codejudge.features.submission.application.SourceCodeValidator;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingMode;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingReport;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingRequest;
import uk.gegc.codejudge.features.user.domain.model.User;
import uk.gegc.codejudge.features.user.domain.repository.UserRepository;
import uk.gegc.codejudge.shared.exception.ContestNotRunningException;
import uk.gegc.codejudge.shared.exception.ForbiddenException;
import uk.gegc.codejudge.shared.exception.NotRegisteredException;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Contest judging in two short transactions around the sandbox calls. Both hold the contest
 * row lock, so scoring and re-ranking of one contest never interleave.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContestSubmissionServiceImpl implements ContestSubmissionService {

    private final UserRepository userRepository;
    private final ContestRepository contestRepository;
    private final ContestRegistrationRepository registrationRepository;
    private final ContestProblemRepository contestProblemRepository;
    private final ContestTestCaseRepository testCaseRepository;
    private final ContestSubmissionRepository submissionRepository;
    private final ContestParticipantRepository participantRepository;
    private final ContestProblemStatusRepository problemStatusRepository;
    private final ContestRankingService rankingService;
    private final JudgingEngine judgingEngine;
    private final SourceCodeValidator codeValidator;
    private final ContestMapper contestMapper;
    private final ContestProperties contestProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public ContestSubmitResultDto submit(String username, String contestSlug, ContestSubmitRequest request) {
        codeValidator.validate(request.code());
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new ResourceNotFoundException("User " + username + " not found"));
        if (user.isBanned()) {
            throw new ForbiddenException("User " + username + " is banned from submitting");
        }
        Contest contest = contestRepository.findBySlugAndActiveTrue(contestSlug)
                .orElseThrow(() -> new ResourceNotFoundException("Contest " + contestSlug + " not found"));
        if (!contest.isRunningAt(Instant.now(clock))) {
            throw new ContestNotRunningException(contestSlug);
        }
        ContestRegistration registration = registrationRepository.findByContest_IdAndUser_Id(contest.getId(), user.getId())
                .orElseThrow(() -> new NotRegisteredException(username, contestSlug));
        ContestProblem problem = contestProblemRepository
                .findByIdAndContest_IdAndActiveTrue(request.problemId(), contest.getId())
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Problem " + request.problemId() + " not found in contest " + contestSlug));
        List<ContestTestCase> testCases = testCaseRepository.findByContestProblem_IdAndActiveTrueOrderBySortOrderAsc(problem.getId());

        UUID submissionId = transactionTemplate.execute(status ->
                openSubmission(contest.getId(), user, problem, registration, request, testCases.size()));

        JudgingRequest judgingRequest = new JudgingRequest(
                request.code(),
                request.language(),
                problem.getTimeLimitMs(),
                problem.getMemoryLimitMb(),
                testCases.stream().map(contestMapper::toJudgeCase).toList()
        );
        JudgingReport report = judgingEngine.judge(judgingRequest, JudgingMode.FULL);

        ContestSubmitResultDto result = transactionTemplate.execute(status ->
                scoreSubmission(contest.getId(), submissionId, user.getId(), problem.getId(), report));
        log.info("Contest submission {} by {} in {} judged {}", submissionId, username, contestSlug, report.verdict());
        return result;
    }

    private UUID openSubmission(UUID contestId, User user, ContestProblem problem, ContestRegistration registration,
                                ContestSubmitRequest request, int totalTestCases) {
        Contest contest = lockContest(contestId);

        ContestSubmission submission = new ContestSubmission();
        submission.setContest(contest);
        submission.setUser(user);
        submission.setProblem(problem);
        submission.setCode(request.code());
        submission.setLanguage(request.language());
        submission.setVerdict(Verdict.RUNNING);
        submission.setTotalTestCases(totalTestCases);
        submission.setSubmittedAt(Instant.now(clock));
        submissionRepository.save(submission);

        ContestParticipant participant = participantRepository.findByContest_IdAndUser_Id(contestId, user.getId())
                .orElseGet(() -> {
                    ContestParticipant created = new ContestParticipant();
                    created.setContest(contest);
                    created.setUser(user);
                    created.setRegisteredAt(registration.getRegisteredAt());
                    return participantRepository.save(created);
                });

        ContestProblemStatus problemStatus = problemStatusRepository
                .findByParticipant_IdAndContestProblem_Id(participant.getId(), problem.getId())
                .orElseGet(() -> {
                    ContestProblemStatus created = new ContestProblemStatus();
                    created.setParticipant(participant);
                    created.setContestProblem(problem);
                    return created;
                });
        problemStatus.setAttempts(problemStatus.getAttempts() + 1);
        problemStatusRepository.save(problemStatus);

        return submission.getId();
    }

    private ContestSubmitResultDto scoreSubmission(UUID contestId, UUID submissionId, UUID userId, UUID problemId,
                                                   JudgingReport report) {
        Contest contest = lockContest(contestId);
        Instant now = Instant.now(clock);

        ContestSubmission submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> new ResourceNotFoundException("Contest submission " + submissionId + " not found"));
        submission.applyReport(report, now);
        submissionRepository.save(submission);

        contestProblemRepository.incrementTotalSubmissions(problemId);
        if (submission.isAccepted()) {
            contestProblemRepository.incrementAcceptedSubmissions(problemId);
        }

        ContestParticipant participant = participantRepository.findByContest_IdAndUser_Id(contestId, userId)
                .orElseThrow(() -> new IllegalStateException("Participant missing for contest submission " + submissionId));
        ContestProblemStatus problemStatus = problemStatusRepository
                .findByParticipant_IdAndContestProblem_Id(participant.getId(), problemId)
                .orElseThrow(() -> new IllegalStateException("Problem status missing for contest submission " + submissionId));
        ContestProblem problem = submission.getProblem();

        if (submission.isAccepted()) {
            if (problemStatus.markSolved(problem.getPoints(), contest.minutesSinceStart(now), now)) {
                contestProblemRepository.incrementTotalSolved(problemId);
                participant.recordSolve(problem.getPoints(),
                        problemStatus.getWrongAttempts() * contestProperties.getPenaltyMinutes());
            }
        } else {
            problemStatus.recordWrongAttempt();
        }
        problemStatusRepository.save(problemStatus);

        // time of the latest submission of any verdict, not of the latest acceptance
        participant.setTotalTime(contest.minutesSinceStart(now));
        participant.setLastSubmissionAt(now);
        participantRepository.save(participant);

        rankingService.rerank(contest);

        return new ContestSubmitResultDto(
                contestMapper.toSubmissionDetailDto(submission),
                contestMapper.toLeaderboardEntry(participant)
        );
    }

    private Contest lockContest(UUID contestId) {
        return contestRepository.findByIdForUpdate(contestId)
                .orElseThrow(() -> new ResourceNotFoundException("Contest " + contestId + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public ContestSubmissionDetailDto getSubmission(String username, UUID submissionId) {
        ContestSubmission submission = submissionRepository.findByIdWithDetails(submissionId)
                .orElseThrow(() -> new ResourceNotFoundException("Contest submission " + submissionId + " not found"));
        if (!submission.getUser().getUsername().equals(username)) {
            throw new ForbiddenException("You can only view your own contest submissions");
        }
        return contestMapper.toSubmissionDetailDto(submission);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ContestSubmissionDto> getMySubmissions(String username, String contestSlug, Pageable pageable) {
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new ResourceNotFoundException("User " + username + " not found"));
        Contest contest = contestRepository.findBySlugAndActiveTrue(contestSlug)
                .orElseThrow(() -> new ResourceNotFoundException("Contest " + contestSlug + " not found"));
        return submissionRepository.findByContest_IdAndUser_Id(contest.getId(), user.getId(), pageable)
                .map(contestMapper::toSubmissionDto);
    }
}
