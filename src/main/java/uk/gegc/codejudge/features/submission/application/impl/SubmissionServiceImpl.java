package uk.gegc.codejudge.features.submission.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.codejudge.features.problem.application.ProblemStatisticsUpdater;
import uk.gegc.codejudge.features.problem.domain.model.Problem;
import uk.gegc.codejudge.features.problem.domain.model.TestCase;
import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;
import uk.gegc.codejudge.features.problem.domain.repository.ProblemRepository;
import uk.gegc.codejudge.features.problem.domain.repository.TestCaseRepository;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.api.dto.RunCodeRequest;
import uk.gegc.codejudge.features.submission.api.dto.RunResultDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionDetailDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionStatsDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmitSolutionRequest;
import uk.gegc.codejudge.features.submission.application.JudgingEngine;
import uk.gegc.codejudge.features.submission.application.SourceCodeValidator;
import uk.gegc.codejudge.features.submission.application.SubmissionService;
import uk.gegc.codejudge.features.submission.domain.event.SubmissionJudgedEvent;
import uk.gegc.codejudge.features.submission.domain.judging.CaseOutcome;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingMode;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingReport;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingRequest;
import uk.gegc.codejudge.features.submission.domain.model.Submission;
import uk.gegc.codejudge.features.submission.domain.model.TestCaseResult;
import uk.gegc.codejudge.features.submission.domain.model.TestCaseStatus;
import uk.gegc.codejudge.features.submission.domain.repository.SubmissionRepository;
import uk.gegc.codejudge.features.submission.domain.repository.VerdictCountProjection;
import uk.gegc.codejudge.features.submission.infra.mapping.SubmissionMapper;
import uk.gegc.codejudge.features.user.domain.model.User;
import uk.gegc.codejudge.features.user.domain.repository.UserRepository;
import uk.gegc.codejudge.shared.exception.ForbiddenException;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionServiceImpl implements SubmissionService {

    private final UserRepository userRepository;
    private final ProblemRepository problemRepository;
    private final TestCaseRepository testCaseRepository;
    private final SubmissionRepository submissionRepository;
    private final JudgingEngine judgingEngine;
    private final ProblemStatisticsUpdater statisticsUpdater;
    private final SourceCodeValidator codeValidator;
    private final SubmissionMapper submissionMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public SubmissionDetailDto submit(String username, SubmitSolutionRequest request) {
        codeValidator.validate(request.code());
        User user = loadSubmittingUser(username);
        Problem problem = loadActiveProblem(request.problemSlug());
        List<TestCase> testCases = testCaseRepository.findByProblem_IdAndActiveTrueOrderBySortOrderAsc(problem.getId());

        UUID submissionId = transactionTemplate.execute(status -> {
            Submission submission = new Submission();
            submission.setUser(user);
            submission.setProblem(problem);
            submission.setCode(request.code());
            submission.setLanguage(request.language());
            submission.setVerdict(Verdict.RUNNING);
            submission.setTotalTestCases(testCases.size());
            submission.setSubmittedAt(Instant.now(clock));
            return submissionRepository.save(submission).getId();
        });

        JudgingRequest judgingRequest = new JudgingRequest(
                request.code(),
                request.language(),
                problem.getTimeLimitMs(),
                problem.getMemoryLimitMb(),
                testCases.stream().map(submissionMapper::toJudgeCase).toList()
        );
        JudgingReport report = judgingEngine.judge(judgingRequest, JudgingMode.FULL);

        SubmissionDetailDto result = transactionTemplate.execute(status -> storeResult(submissionId, user.getId(), report));
        log.info("Submission {} by {} on {} judged {} ({}/{} passed)",
                submissionId, username, problem.getSlug(), report.verdict(), report.passedCases(), report.totalCases());
        return result;
    }

    private SubmissionDetailDto storeResult(UUID submissionId, UUID userId, JudgingReport report) {
        Submission submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> new ResourceNotFoundException("Submission " + submissionId + " not found"));
        Instant now = Instant.now(clock);
        submission.applyReport(report, now);

        List<CaseOutcome> outcomes = report.caseOutcomes();
        for (int i = 0; i < outcomes.size(); i++) {
            CaseOutcome outcome = outcomes.get(i);
            TestCaseResult result = TestCaseResult.pending(testCaseRepository.getReferenceById(outcome.testCase().id()), i);
            submission.addTestCaseResult(result);
            result.complete(
                    TestCaseStatus.fromVerdict(outcome.status()),
                    outcome.actualOutput(),
                    positiveOrNull(outcome.executionTimeMs()),
                    positiveOrNull(outcome.memoryUsedKb()),
                    outcome.errorMessage()
            );
        }
        submissionRepository.save(submission);

        statisticsUpdater.recordJudgingPass(userId, submission.getProblem(), submission.isAccepted(), now);

        eventPublisher.publishEvent(new SubmissionJudgedEvent(
                this,
                submission.getId(),
                userId,
                submission.getProblem().getId(),
                submission.getVerdict(),
                submission.getSubmittedAt()
        ));
        return submissionMapper.toDetailDto(submission, true);
    }

    @Override
    public RunResultDto run(String username, RunCodeRequest request) {
        codeValidator.validate(request.code());
        loadSubmittingUser(username);
        Problem problem = loadActiveProblem(request.problemSlug());
        List<TestCase> samples = testCaseRepository.findByProblem_IdAndTypeAndActiveTrueOrderBySortOrderAsc(
                problem.getId(), TestCaseType.SAMPLE);

        JudgingRequest judgingRequest = new JudgingRequest(
                request.code(),
                request.language(),
                problem.getTimeLimitMs(),
                problem.getMemoryLimitMb(),
                samples.stream().map(submissionMapper::toJudgeCase).toList()
        );
        JudgingReport report = judgingEngine.judge(judgingRequest, JudgingMode.PREVIEW);
        log.debug("Preview run by {} on {}: {}", username, problem.getSlug(), report.verdict());
        return submissionMapper.toRunResultDto(report);
    }

    @Override
    @Transactional(readOnly = true)
    public SubmissionDetailDto getSubmission(String username, UUID submissionId) {
        Submission submission = submissionRepository.findByIdWithUserAndProblem(submissionId)
                .orElseThrow(() -> new ResourceNotFoundException("Submission " + submissionId + " not found"));
        boolean owner = submission.getUser().getUsername().equals(username);
        return submissionMapper.toDetailDto(submission, owner);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<SubmissionDto> getMySubmissions(String username, Pageable pageable) {
        User user = loadUser(username);
        return submissionRepository.findByUser_Id(user.getId(), pageable).map(submissionMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public SubmissionStatsDto getMyStats(String username) {
        User user = loadUser(username);
        Map<Verdict, Long> byVerdict = new EnumMap<>(Verdict.class);
        for (VerdictCountProjection row : submissionRepository.countByVerdictForUser(user.getId())) {
            byVerdict.put(row.getVerdict(), row.getTotal());
        }
        long total = byVerdict.values().stream().mapToLong(Long::longValue).sum();
        long accepted = byVerdict.getOrDefault(Verdict.ACCEPTED, 0L);
        double rate = total == 0 ? 0.0 : Math.round((double) accepted / total * 10000.0) / 100.0;
        return new SubmissionStatsDto(total, accepted, rate, byVerdict);
    }

    private User loadUser(String username) {
        return userRepository.findByUsername(username)
                .orElseThrow(() -> new ResourceNotFoundException("User " + username + " not found"));
    }

    private User loadSubmittingUser(String username) {
        User user = loadUser(username);
        if (user.isBanned()) {
            throw new ForbiddenException("User " + username + " is banned from submitting");
        }
        return user;
    }

    private Problem loadActiveProblem(String slug) {
        return problemRepository.findBySlugAndActiveTrue(slug)
                .orElseThrow(() -> new ResourceNotFoundException("Problem " + slug + " not found"));
    }

    private static Integer positiveOrNull(int value) {
        return value > 0 ? value : null;
    }
}
