package uk.gegc.codejudge.features.submission.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.codejudge.features.problem.domain.model.Difficulty;
import uk.gegc.codejudge.features.problem.domain.model.Problem;
import uk.gegc.codejudge.features.problem.domain.model.SolveStatus;
import uk.gegc.codejudge.features.problem.domain.model.TestCase;
import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;
import uk.gegc.codejudge.features.problem.domain.repository.ProblemRepository;
import uk.gegc.codejudge.features.problem.domain.repository.ProblemSolveStatusRepository;
import uk.gegc.codejudge.features.problem.domain.repository.TestCaseRepository;
import uk.gegc.codejudge.features.sandbox.application.SandboxClient;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionOutcome;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionRequest;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.SandboxResult;
import uk.gegc.codejudge.features.submission.api.dto.SubmitSolutionRequest;
import uk.gegc.codejudge.features.user.domain.model.User;
import uk.gegc.codejudge.features.user.domain.repository.UserRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives a practice submission end to end against the H2 schema with the sandbox mocked out.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
@DisplayName("Submission flow integration")
class SubmissionFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ProblemRepository problemRepository;

    @Autowired
    private TestCaseRepository testCaseRepository;

    @Autowired
    private ProblemSolveStatusRepository problemSolveStatusRepository;

    @Autowired
    private EntityManager entityManager;

    @MockitoBean
    private SandboxClient sandboxClient;

    private User alice;
    private Problem problem;

    @BeforeEach
    void setUp() {
        alice = new User();
        alice.setUsername("alice");
        alice.setEmail("alice@example.com");
        alice.setHashedPassword("{noop}secret");
        alice = userRepository.save(alice);

        problem = new Problem();
        problem.setTitle("Sum Two");
        problem.setSlug("sum-two");
        problem.setDifficulty(Difficulty.EASY);
        problem = problemRepository.save(problem);

        testCaseRepository.save(testCase(TestCaseType.SAMPLE, "1 2", "3", 1));
        testCaseRepository.save(testCase(TestCaseType.HIDDEN, "5 5", "10", 2));
        entityManager.flush();
    }

    private TestCase testCase(TestCaseType type, String input, String expected, int order) {
        TestCase testCase = new TestCase();
        testCase.setProblem(problem);
        testCase.setType(type);
        testCase.setInputData(input);
        testCase.setExpectedOutput(expected);
        testCase.setSortOrder(order);
        return testCase;
    }

    private static ExecutionOutcome accepted(String stdout) {
        return ExecutionOutcome.completed(new SandboxResult(3, "Accepted", "0.012", "2048", stdout, null, null, null));
    }

    @Test
    @WithMockUser(username = "alice")
    @DisplayName("accepted submission is stored and counted as a solve")
    void acceptedSubmission_updatesCounters() throws Exception {
        when(sandboxClient.execute(any(ExecutionRequest.class))).thenReturn(accepted("3"), accepted("10"));

        mockMvc.perform(post("/api/v1/submissions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SubmitSolutionRequest("sum-two", "print(sum(map(int, input().split())))", Language.PYTHON))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.verdict").value("ACCEPTED"))
                .andExpect(jsonPath("$.testCasesPassed").value(2))
                .andExpect(jsonPath("$.totalTestCases").value(2))
                .andExpect(jsonPath("$.executionTimeMs").value(12))
                .andExpect(jsonPath("$.testCaseResults.length()").value(2));

        entityManager.flush();
        entityManager.clear();

        User reloaded = userRepository.findById(alice.getId()).orElseThrow();
        assertThat(reloaded.getTotalSolved()).isEqualTo(1);
        assertThat(reloaded.getEasySolved()).isEqualTo(1);
        assertThat(problemSolveStatusRepository.findByUser_IdAndProblem_Id(alice.getId(), problem.getId()))
                .get()
                .extracting("status")
                .isEqualTo(SolveStatus.SOLVED);

        mockMvc.perform(get("/api/v1/problems/{slug}/statistics", "sum-two"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSubmissions").value(1))
                .andExpect(jsonPath("$.acceptedSubmissions").value(1))
                .andExpect(jsonPath("$.totalSolved").value(1));
    }

    @Test
    @WithMockUser(username = "alice")
    @DisplayName("wrong answer leaves the problem attempted")
    void wrongAnswer_marksAttempted() throws Exception {
        when(sandboxClient.execute(any(ExecutionRequest.class))).thenReturn(
                ExecutionOutcome.completed(new SandboxResult(4, "Wrong Answer", "0.010", "2048", "4", null, null, null)));

        mockMvc.perform(post("/api/v1/submissions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SubmitSolutionRequest("sum-two", "print(4)", Language.PYTHON))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.verdict").value("WRONG_ANSWER"))
                .andExpect(jsonPath("$.testCasesPassed").value(0));

        entityManager.flush();
        entityManager.clear();

        assertThat(userRepository.findById(alice.getId()).orElseThrow().getTotalSolved()).isZero();
        assertThat(problemSolveStatusRepository.findByUser_IdAndProblem_Id(alice.getId(), problem.getId()))
                .get()
                .extracting("status")
                .isEqualTo(SolveStatus.ATTEMPTED);
    }

    @Test
    @DisplayName("OpenAPI document lists the judging endpoints")
    void apiDocs_available() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paths['/api/v1/submissions']").exists())
                .andExpect(jsonPath("$.paths['/api/v1/contests/{slug}/leaderboard']").exists());
    }
}
