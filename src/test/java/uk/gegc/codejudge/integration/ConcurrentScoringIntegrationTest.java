package uk.gegc.codejudge.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.codejudge.features.contest.api.dto.ContestSubmitRequest;
import uk.gegc.codejudge.features.contest.application.ContestService;
import uk.gegc.codejudge.features.contest.application.ContestSubmissionService;
import uk.gegc.codejudge.features.contest.domain.model.Contest;
import uk.gegc.codejudge.features.contest.domain.model.ContestParticipant;
import uk.gegc.codejudge.features.contest.domain.model.ContestProblem;
import uk.gegc.codejudge.features.contest.domain.model.ContestRegistration;
import uk.gegc.codejudge.features.contest.domain.model.ContestTestCase;
import uk.gegc.codejudge.features.contest.domain.repository.ContestParticipantRepository;
import uk.gegc.codejudge.features.contest.domain.repository.ContestProblemRepository;
import uk.gegc.codejudge.features.contest.domain.repository.ContestRegistrationRepository;
import uk.gegc.codejudge.features.contest.domain.repository.ContestRepository;
import uk.gegc.codejudge.features.contest.domain.repository.ContestTestCaseRepository;
import uk.gegc.codejudge.features.problem.domain.model.Difficulty;
import uk.gegc.codejudge.features.problem.domain.model.Problem;
import uk.gegc.codejudge.features.problem.domain.model.TestCase;
import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;
import uk.gegc.codejudge.features.problem.domain.repository.ProblemRepository;
import uk.gegc.codejudge.features.problem.domain.repository.TestCaseRepository;
import uk.gegc.codejudge.features.sandbox.application.SandboxClient;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionOutcome;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionRequest;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.SandboxResult;
import uk.gegc.codejudge.features.submission.api.dto.SubmitSolutionRequest;
import uk.gegc.codejudge.features.submission.application.SubmissionService;
import uk.gegc.codejudge.features.user.domain.model.User;
import uk.gegc.codejudge.features.user.domain.repository.UserRepository;
import uk.gegc.codejudge.shared.exception.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Runs registrations and submissions from several threads against the H2 schema with
 * committed data, so the row locks and in-database increments are what keeps the
 * counters and ranks consistent.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Concurrent scoring")
class ConcurrentScoringIntegrationTest {

    private static final int THREADS = 6;

    @Autowired
    private SubmissionService submissionService;

    @Autowired
    private ContestService contestService;

    @Autowired
    private ContestSubmissionService contestSubmissionService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ProblemRepository problemRepository;

    @Autowired
    private TestCaseRepository testCaseRepository;

    @Autowired
    private ContestRepository contestRepository;

    @Autowired
    private ContestProblemRepository contestProblemRepository;

    @Autowired
    private ContestTestCaseRepository contestTestCaseRepository;

    @Autowired
    private ContestRegistrationRepository registrationRepository;

    @Autowired
    private ContestParticipantRepository participantRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @MockitoBean
    private SandboxClient sandboxClient;

    private String runId;

    @BeforeEach
    void setUp() {
        runId = UUID.randomUUID().toString().substring(0, 8);
        when(sandboxClient.execute(any(ExecutionRequest.class))).thenAnswer(inv -> ExecutionOutcome.completed(
                new SandboxResult(3, "Accepted", "0.010", "1024", "ok", null, null, null)));
    }

    @Test
    @DisplayName("registration cap holds when users register at the same time")
    void register_concurrently_respectsCap() throws Exception {
        Contest contest = saveContest(Instant.now().plus(Duration.ofDays(1)), 2);
        List<User> users = saveUsers(6);

        List<Callable<Object>> tasks = new ArrayList<>();
        for (User user : users) {
            tasks.add(() -> contestService.register(user.getUsername(), contest.getSlug()));
        }
        Outcome<Object> outcome = runConcurrently(tasks);

        assertThat(outcome.successes()).hasSize(2);
        assertThat(outcome.errors()).hasSize(4).allMatch(ValidationException.class::isInstance);
        assertThat(registrationCount(contest.getId())).isEqualTo(2);
        assertThat(contestRepository.findById(contest.getId()).orElseThrow().getTotalParticipants()).isEqualTo(2);
    }

    @Test
    @DisplayName("participant counter matches registration rows without a cap")
    void register_concurrently_countsEveryone() throws Exception {
        Contest contest = saveContest(Instant.now().plus(Duration.ofDays(1)), null);
        List<User> users = saveUsers(8);

        List<Callable<Object>> tasks = new ArrayList<>();
        for (User user : users) {
            tasks.add(() -> contestService.register(user.getUsername(), contest.getSlug()));
        }
        Outcome<Object> outcome = runConcurrently(tasks);

        assertThat(outcome.errors()).isEmpty();
        assertThat(registrationCount(contest.getId())).isEqualTo(8);
        assertThat(contestRepository.findById(contest.getId()).orElseThrow().getTotalParticipants()).isEqualTo(8);
    }

    @Test
    @DisplayName("practice counters lose nothing and first solves count once")
    void practiceSubmissions_concurrently_keepCounters() throws Exception {
        Problem problem = saveProblem();
        List<User> users = saveUsers(4);

        List<Callable<Object>> tasks = new ArrayList<>();
        for (User user : users) {
            for (int i = 0; i < 4; i++) {
                tasks.add(() -> submissionService.submit(user.getUsername(),
                        new SubmitSolutionRequest(problem.getSlug(), "print('ok')", Language.PYTHON)));
            }
        }
        Outcome<Object> outcome = runConcurrently(tasks);

        assertThat(outcome.errors()).isEmpty();
        Problem reloaded = problemRepository.findById(problem.getId()).orElseThrow();
        assertThat(reloaded.getTotalSubmissions()).isEqualTo(16);
        assertThat(reloaded.getAcceptedSubmissions()).isEqualTo(16);
        assertThat(reloaded.getTotalSolved()).isEqualTo(4);
        for (User user : users) {
            User after = userRepository.findById(user.getId()).orElseThrow();
            assertThat(after.getTotalSolved()).isEqualTo(1);
            assertThat(after.getEasySolved()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("contest scoring stays exact and ranks stay a permutation")
    void contestSubmissions_concurrently_scoreAndRank() throws Exception {
        Contest contest = saveContest(Instant.now().minus(Duration.ofMinutes(10)), null);
        List<ContestProblem> problems = new ArrayList<>();
        for (int order = 1; order <= 4; order++) {
            problems.add(saveContestProblem(contest, order));
        }
        List<User> users = saveUsers(4);
        for (User user : users) {
            ContestRegistration registration = new ContestRegistration();
            registration.setContest(contest);
            registration.setUser(user);
            registration.setRegisteredAt(contest.getStartTime().minus(Duration.ofHours(1)));
            registrationRepository.save(registration);
        }

        List<Callable<Object>> tasks = new ArrayList<>();
        for (User user : users) {
            for (ContestProblem problem : problems) {
                for (int i = 0; i < 2; i++) {
                    tasks.add(() -> contestSubmissionService.submit(user.getUsername(), contest.getSlug(),
                            new ContestSubmitRequest(problem.getId(), "print('ok')", Language.PYTHON)));
                }
            }
        }
        Outcome<Object> outcome = runConcurrently(tasks);

        assertThat(outcome.errors()).isEmpty();
        List<ContestParticipant> participants = participantRepository.findByContest_Id(contest.getId());
        assertThat(participants).hasSize(4);
        assertThat(participants).allSatisfy(participant -> {
            assertThat(participant.getTotalScore()).isEqualTo(400);
            assertThat(participant.getProblemsSolved()).isEqualTo(4);
        });
        assertThat(participants).extracting(ContestParticipant::getRank).containsExactlyInAnyOrder(1, 2, 3, 4);
        for (ContestProblem problem : problems) {
            ContestProblem after = contestProblemRepository.findById(problem.getId()).orElseThrow();
            assertThat(after.getTotalSubmissions()).isEqualTo(8);
            assertThat(after.getAcceptedSubmissions()).isEqualTo(8);
            assertThat(after.getTotalSolved()).isEqualTo(4);
        }
    }

    private <T> Outcome<T> runConcurrently(List<Callable<T>> tasks) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch ready = new CountDownLatch(Math.min(THREADS, tasks.size()));
        CountDownLatch start = new CountDownLatch(1);
        List<T> successes = Collections.synchronizedList(new ArrayList<>());
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
        try {
            for (Callable<T> task : tasks) {
                executor.submit(() -> {
                    ready.countDown();
                    try {
                        start.await();
                        successes.add(task.call());
                    } catch (Throwable t) {
                        errors.add(t);
                    }
                });
            }
            ready.await(5, TimeUnit.SECONDS);
            start.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(60, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
        return new Outcome<>(successes, errors);
    }

    private long registrationCount(UUID contestId) {
        Long count = transactionTemplate.execute(status -> registrationRepository.findAll().stream()
                .filter(registration -> registration.getContest().getId().equals(contestId))
                .count());
        return count == null ? 0 : count;
    }

    private List<User> saveUsers(int count) {
        List<User> users = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            User user = new User();
            user.setUsername("racer-" + runId + "-" + i);
            user.setEmail("racer-" + runId + "-" + i + "@example.com");
            user.setHashedPassword("{noop}secret");
            users.add(userRepository.save(user));
        }
        return users;
    }

    private Problem saveProblem() {
        Problem problem = new Problem();
        problem.setTitle("Echo " + runId);
        problem.setSlug("echo-" + runId);
        problem.setDifficulty(Difficulty.EASY);
        problem = problemRepository.save(problem);

        TestCase testCase = new TestCase();
        testCase.setProblem(problem);
        testCase.setType(TestCaseType.HIDDEN);
        testCase.setInputData("");
        testCase.setExpectedOutput("ok");
        testCase.setSortOrder(1);
        testCaseRepository.save(testCase);
        return problem;
    }

    private Contest saveContest(Instant start, Integer maxParticipants) {
        Contest contest = new Contest();
        contest.setTitle("Race " + runId);
        contest.setSlug("race-" + runId);
        contest.setStartTime(start);
        contest.setEndTime(start.plus(Duration.ofHours(2)));
        contest.setMaxParticipants(maxParticipants);
        return contestRepository.save(contest);
    }

    private ContestProblem saveContestProblem(Contest contest, int order) {
        ContestProblem problem = new ContestProblem();
        problem.setContest(contest);
        problem.setTitle("Task " + order);
        problem.setSortOrder(order);
        problem = contestProblemRepository.save(problem);

        ContestTestCase testCase = new ContestTestCase();
        testCase.setContestProblem(problem);
        testCase.setInputData("");
        testCase.setExpectedOutput("ok");
        testCase.setSortOrder(1);
        contestTestCaseRepository.save(testCase);
        return problem;
    }

    private record Outcome<T>(List<T> successes, List<Throwable> errors) {
    }
}
