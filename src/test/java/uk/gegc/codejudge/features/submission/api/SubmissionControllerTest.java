package uk.gegc.codejudge.features.submission.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.api.dto.RunCodeRequest;
import uk.gegc.codejudge.features.submission.api.dto.RunResultDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionDetailDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionStatsDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmitSolutionRequest;
import uk.gegc.codejudge.features.submission.application.SubmissionService;
import uk.gegc.codejudge.shared.exception.ForbiddenException;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;
import uk.gegc.codejudge.testsupport.WebMvcSecurityTestConfig;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SubmissionController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("SubmissionController")
class SubmissionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private SubmissionService submissionService;

    private static SubmissionDetailDto acceptedDetail(UUID id) {
        return new SubmissionDetailDto(
                id, "alice", "two-sum", "Two Sum", Language.PYTHON, Verdict.ACCEPTED,
                3, 3, 120, 2048, null, null, "print(1)", List.of(), Instant.parse("2024-05-10T10:00:00Z"));
    }

    @Nested
    @DisplayName("POST /api/v1/submissions")
    class Submit {

        @Test
        @WithMockUser(username = "alice")
        @DisplayName("returns 201 with the judged submission")
        void submit_valid_returnsCreated() throws Exception {
            UUID id = UUID.randomUUID();
            when(submissionService.submit(eq("alice"), any(SubmitSolutionRequest.class))).thenReturn(acceptedDetail(id));

            mockMvc.perform(post("/api/v1/submissions")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(
                                    new SubmitSolutionRequest("two-sum", "print(1)", Language.PYTHON))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value(id.toString()))
                    .andExpect(jsonPath("$.verdict").value("ACCEPTED"))
                    .andExpect(jsonPath("$.testCasesPassed").value(3))
                    .andExpect(jsonPath("$.totalTestCases").value(3));
        }

        @Test
        @WithMockUser(username = "alice")
        @DisplayName("rejects blank code with 400 before reaching the service")
        void submit_blankCode_returnsBadRequest() throws Exception {
            mockMvc.perform(post("/api/v1/submissions")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(
                                    Map.of("problemSlug", "two-sum", "code", "  ", "language", "PYTHON"))))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(submissionService);
        }

        @Test
        @WithMockUser(username = "alice")
        @DisplayName("returns 404 when the problem does not exist")
        void submit_unknownProblem_returnsNotFound() throws Exception {
            when(submissionService.submit(eq("alice"), any(SubmitSolutionRequest.class)))
                    .thenThrow(new ResourceNotFoundException("Problem nope not found"));

            mockMvc.perform(post("/api/v1/submissions")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(
                                    new SubmitSolutionRequest("nope", "print(1)", Language.PYTHON))))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("requires authentication")
        void submit_anonymous_returnsUnauthorized() throws Exception {
            mockMvc.perform(post("/api/v1/submissions")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(
                                    new SubmitSolutionRequest("two-sum", "print(1)", Language.PYTHON))))
                    .andExpect(status().isUnauthorized());

            verify(submissionService, never()).submit(any(), any());
        }
    }

    @Test
    @WithMockUser(username = "alice")
    @DisplayName("POST /run returns 200 with sample results")
    void run_returnsOk() throws Exception {
        RunResultDto result = new RunResultDto(Verdict.WRONG_ANSWER, 1, 2, null, List.of(
                new RunResultDto.RunCaseResultDto("1 2", "3", "3", Verdict.ACCEPTED, 10, 1024, null),
                new RunResultDto.RunCaseResultDto("2 2", "4", "5", Verdict.WRONG_ANSWER, 11, 1024, null)));
        when(submissionService.run(eq("alice"), any(RunCodeRequest.class))).thenReturn(result);

        mockMvc.perform(post("/api/v1/submissions/run")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new RunCodeRequest("two-sum", "print(3)", Language.PYTHON))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdict").value("WRONG_ANSWER"))
                .andExpect(jsonPath("$.passedCases").value(1))
                .andExpect(jsonPath("$.results.length()").value(2))
                .andExpect(jsonPath("$.results[1].actualOutput").value("5"));
    }

    @Test
    @WithMockUser(username = "bob")
    @DisplayName("GET /{id} maps ForbiddenException to 403")
    void getSubmission_foreign_returnsForbidden() throws Exception {
        UUID id = UUID.randomUUID();
        when(submissionService.getSubmission("bob", id)).thenThrow(new ForbiddenException("Not your submission"));

        mockMvc.perform(get("/api/v1/submissions/{id}", id))
                .andExpect(status().isForbidden());
    }

    @Test
    @WithMockUser(username = "alice")
    @DisplayName("GET /{id} with a malformed id returns 400")
    void getSubmission_badId_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/submissions/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(submissionService);
    }

    @Test
    @WithMockUser(username = "alice")
    @DisplayName("GET /me returns the caller's page")
    void getMySubmissions_returnsPage() throws Exception {
        SubmissionDto dto = new SubmissionDto(UUID.randomUUID(), "two-sum", "Two Sum", Language.JAVA,
                Verdict.TIME_LIMIT_EXCEEDED, 1, 3, 2000, 4096, Instant.parse("2024-05-10T10:00:00Z"));
        when(submissionService.getMySubmissions(eq("alice"), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(dto), PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/v1/submissions/me").param("page", "0").param("size", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].verdict").value("TIME_LIMIT_EXCEEDED"))
                .andExpect(jsonPath("$.content[0].problemSlug").value("two-sum"));
    }

    @Test
    @WithMockUser(username = "alice")
    @DisplayName("GET /me/stats returns counters")
    void getMyStats_returnsOk() throws Exception {
        when(submissionService.getMyStats("alice")).thenReturn(new SubmissionStatsDto(
                3, 1, 33.33, Map.of(Verdict.ACCEPTED, 1L, Verdict.WRONG_ANSWER, 2L)));

        mockMvc.perform(get("/api/v1/submissions/me/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSubmissions").value(3))
                .andExpect(jsonPath("$.acceptanceRate").value(33.33))
                .andExpect(jsonPath("$.byVerdict.WRONG_ANSWER").value(2));
    }
}
