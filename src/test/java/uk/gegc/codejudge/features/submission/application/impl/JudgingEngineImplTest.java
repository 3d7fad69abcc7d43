package uk.gegc.codejudge.features.submission.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;
import uk.gegc.codejudge.features.sandbox.application.SandboxClient;
import uk.gegc.codejudge.features.sandbox.application.impl.VerdictResolverImpl;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionOutcome;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionRequest;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.SandboxResult;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.application.JudgingMetricsService;
import uk.gegc.codejudge.features.submission.domain.judging.CaseOutcome;
import uk.gegc.codejudge.features.submission.domain.judging.JudgeCase;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingMode;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingReport;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingRequest;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JudgingEngineImpl")
class JudgingEngineImplTest {

    @Mock
    private SandboxClient sandboxClient;

    @Mock
    private JudgingMetricsService metricsService;

    private JudgingEngineImpl engine;

    @BeforeEach
    void setUp() {
        engine = new JudgingEngineImpl(sandboxClient, new VerdictResolverImpl(), metricsService);
    }

    @Nested
    @DisplayName("Full judging")
    class FullJudging {

        @Test
        @DisplayName("all cases accepted yields ACCEPTED with maxima over cases")
        void allAccepted() {
            when(sandboxClient.execute(any())).thenReturn(
                    completed(3, "0.010", "1000", "1\n"),
                    completed(3, "0.050", "3000", "2\n"),
                    completed(3, "0.020", "2000", "3\n"));

            JudgingReport report = engine.judge(request(hidden(1), hidden(2), hidden(3)), JudgingMode.FULL);

            assertThat(report.verdict()).isEqualTo(Verdict.ACCEPTED);
            assertThat(report.passedCases()).isEqualTo(3);
            assertThat(report.totalCases()).isEqualTo(3);
            assertThat(report.maxTimeMs()).isEqualTo(50);
            assertThat(report.maxMemoryKb()).isEqualTo(3000);
            assertThat(report.errorMessage()).isNull();
            verify(metricsService).recordJudgingPass(eq(JudgingMode.FULL), eq(Verdict.ACCEPTED), any(Duration.class));
        }

        @Test
        @DisplayName("first non-accepted case in order decides the verdict")
        void firstFailureDecidesVerdict() {
            when(sandboxClient.execute(any())).thenReturn(
                    completed(3, "0.01", "100", "ok"),
                    completed(4, "0.01", "100", "wrong"),
                    completed(5, "2.5", "100", ""));

            JudgingReport report = engine.judge(request(hidden(1), hidden(2), hidden(3)), JudgingMode.FULL);

            assertThat(report.verdict()).isEqualTo(Verdict.WRONG_ANSWER);
            assertThat(report.passedCases()).isEqualTo(1);
            assertThat(report.caseOutcomes()).extracting(CaseOutcome::status)
                    .containsExactly(Verdict.ACCEPTED, Verdict.WRONG_ANSWER, Verdict.TIME_LIMIT_EXCEEDED);
        }

        @Test
        @DisplayName("compilation error on case 2 of 4 stops execution")
        void compilationErrorShortCircuits() {
            when(sandboxClient.execute(any())).thenReturn(
                    completed(3, "0.01", "100", "ok"),
                    ExecutionOutcome.completed(
                            new SandboxResult(6, "Compilation Error", null, null, null, null, "main.cpp:1: error", null)));

            JudgingReport report = engine.judge(request(hidden(1), hidden(2), hidden(3), hidden(4)), JudgingMode.FULL);

            assertThat(report.verdict()).isEqualTo(Verdict.COMPILATION_ERROR);
            assertThat(report.compileOutput()).isEqualTo("main.cpp:1: error");
            assertThat(report.passedCases()).isEqualTo(1);
            assertThat(report.totalCases()).isEqualTo(4);
            assertThat(report.caseOutcomes()).hasSize(2);
            assertThat(report.caseOutcomes().get(1).status()).isEqualTo(Verdict.RUNTIME_ERROR);
            assertThat(report.caseOutcomes().get(1).errorMessage()).isEqualTo(JudgingEngineImpl.COMPILATION_ERROR_MESSAGE);
            verify(sandboxClient, times(2)).execute(any());
        }

        @Test
        @DisplayName("sandbox failure is recorded as RUNTIME_ERROR and judging continues")
        void sandboxFailureDegrades() {
            when(sandboxClient.execute(any())).thenReturn(
                    completed(3, "0.01", "100", "ok"),
                    ExecutionOutcome.failure("connection refused"),
                    completed(3, "0.01", "100", "ok"));

            JudgingReport report = engine.judge(request(hidden(1), hidden(2), hidden(3)), JudgingMode.FULL);

            assertThat(report.verdict()).isEqualTo(Verdict.RUNTIME_ERROR);
            assertThat(report.passedCases()).isEqualTo(2);
            assertThat(report.caseOutcomes()).hasSize(3);
            assertThat(report.caseOutcomes().get(1).errorMessage()).isEqualTo(JudgingEngineImpl.EXECUTION_FAILED_MESSAGE);
            assertThat(report.errorMessage()).isEqualTo(JudgingEngineImpl.EXECUTION_FAILED_MESSAGE);
            verify(sandboxClient, times(3)).execute(any());
            verify(metricsService).incrementSandboxFailure();
        }

        @Test
        @DisplayName("internal sandbox status on a finished run counts as a runtime error")
        void internalErrorStatusBecomesRuntimeError() {
            when(sandboxClient.execute(any())).thenReturn(
                    ExecutionOutcome.completed(new SandboxResult(13, "Internal Error", null, null, null, null, null, "boom")));

            JudgingReport report = engine.judge(request(hidden(1)), JudgingMode.FULL);

            assertThat(report.verdict()).isEqualTo(Verdict.RUNTIME_ERROR);
            assertThat(report.errorMessage()).isEqualTo("boom");
        }

        @Test
        @DisplayName("stderr is preferred over the sandbox message for failing cases")
        void stderrPreferredForErrorMessage() {
            when(sandboxClient.execute(any())).thenReturn(
                    ExecutionOutcome.completed(new SandboxResult(11, "Runtime Error (NZEC)", "0.01", "10", "",
                            "Traceback: ZeroDivisionError", null, "Exited with error status 1")));

            JudgingReport report = engine.judge(request(hidden(1)), JudgingMode.FULL);

            assertThat(report.verdict()).isEqualTo(Verdict.RUNTIME_ERROR);
            assertThat(report.errorMessage()).isEqualTo("Traceback: ZeroDivisionError");
        }

        @Test
        @DisplayName("cases run by sort order regardless of input order")
        void casesRunInSortOrder() {
            when(sandboxClient.execute(any())).thenReturn(completed(3, "0.01", "10", "x"));
            JudgeCase third = hidden(3);
            JudgeCase first = hidden(1);
            JudgeCase second = hidden(2);

            JudgingReport report = engine.judge(request(third, first, second), JudgingMode.FULL);

            assertThat(report.caseOutcomes()).extracting(CaseOutcome::testCase).containsExactly(first, second, third);
        }

        @Test
        @DisplayName("limits are passed to the sandbox in seconds and kilobytes")
        void limitsConverted() {
            when(sandboxClient.execute(any())).thenReturn(completed(3, "0.01", "10", "x"));
            ArgumentCaptor<ExecutionRequest> captor = ArgumentCaptor.forClass(ExecutionRequest.class);

            engine.judge(new JudgingRequest("print(1)", Language.PYTHON, 1500, 128, List.of(hidden(1))), JudgingMode.FULL);

            verify(sandboxClient).execute(captor.capture());
            ExecutionRequest sent = captor.getValue();
            assertThat(sent.cpuTimeLimitSeconds()).isEqualTo(1.5);
            assertThat(sent.memoryLimitKb()).isEqualTo(128 * 1024);
            assertThat(sent.stdin()).isEqualTo("in-1");
            assertThat(sent.expectedOutput()).isEqualTo("out-1");
        }

        @Test
        @DisplayName("no active cases yields INTERNAL_ERROR without calling the sandbox")
        void noCases_internalError() {
            JudgingReport report = engine.judge(request(), JudgingMode.FULL);

            assertThat(report.verdict()).isEqualTo(Verdict.INTERNAL_ERROR);
            assertThat(report.totalCases()).isZero();
            assertThat(report.maxTimeMs()).isNull();
            assertThat(report.maxMemoryKb()).isNull();
            verify(sandboxClient, never()).execute(any());
        }
    }

    @Nested
    @DisplayName("Preview judging")
    class PreviewJudging {

        @Test
        @DisplayName("only sample cases are executed")
        void onlySampleCases() {
            when(sandboxClient.execute(any())).thenReturn(completed(3, "0.01", "10", "x"));
            JudgeCase sample = new JudgeCase(UUID.randomUUID(), 2, TestCaseType.SAMPLE, "s", "x");

            JudgingReport report = engine.judge(request(hidden(1), sample, hidden(3)), JudgingMode.PREVIEW);

            assertThat(report.totalCases()).isEqualTo(1);
            assertThat(report.caseOutcomes()).extracting(CaseOutcome::testCase).containsExactly(sample);
            verify(sandboxClient, times(1)).execute(any());
            verify(metricsService).recordJudgingPass(eq(JudgingMode.PREVIEW), eq(Verdict.ACCEPTED), any(Duration.class));
        }
    }

    private static JudgingRequest request(JudgeCase... cases) {
        return new JudgingRequest("code", Language.CPP, 2000, 256, List.of(cases));
    }

    private static JudgeCase hidden(int order) {
        return new JudgeCase(UUID.randomUUID(), order, TestCaseType.HIDDEN, "in-" + order, "out-" + order);
    }

    private static ExecutionOutcome completed(int statusId, String time, String memory, String stdout) {
        return ExecutionOutcome.completed(new SandboxResult(statusId, "status", time, memory, stdout, null, null, null));
    }
}
