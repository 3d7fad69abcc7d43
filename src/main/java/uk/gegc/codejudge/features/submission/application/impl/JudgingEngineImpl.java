package uk.gegc.codejudge.features.submission.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;
import uk.gegc.codejudge.features.sandbox.application.SandboxClient;
import uk.gegc.codejudge.features.sandbox.application.VerdictResolver;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionOutcome;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionRequest;
import uk.gegc.codejudge.features.sandbox.domain.model.ResolvedExecution;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.application.JudgingEngine;
import uk.gegc.codejudge.features.submission.application.JudgingMetricsService;
import uk.gegc.codejudge.features.submission.domain.judging.CaseOutcome;
import uk.gegc.codejudge.features.submission.domain.judging.JudgeCase;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingMode;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingReport;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingRequest;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingRun;

import java.time.Duration;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class JudgingEngineImpl implements JudgingEngine {

    static final String EXECUTION_FAILED_MESSAGE = "Failed to execute code";
    static final String COMPILATION_ERROR_MESSAGE = "Compilation error";

    private final SandboxClient sandboxClient;
    private final VerdictResolver verdictResolver;
    private final JudgingMetricsService metricsService;

    @Override
    public JudgingReport judge(JudgingRequest request, JudgingMode mode) {
        long startedAt = System.nanoTime();
        List<JudgeCase> cases = casesFor(request, mode);
        JudgingRun run = new JudgingRun(cases.size());

        for (JudgeCase testCase : cases) {
            ExecutionOutcome outcome = sandboxClient.execute(toExecutionRequest(request, testCase));

            if (outcome.isFailure()) {
                metricsService.incrementSandboxFailure();
                log.warn("Sandbox failed on case {} (order {}): {}", testCase.id(), testCase.sortOrder(), outcome.getFailureReason());
                run.record(new CaseOutcome(testCase, Verdict.RUNTIME_ERROR, "", 0, 0, EXECUTION_FAILED_MESSAGE));
                continue;
            }

            ResolvedExecution resolved = verdictResolver.resolve(outcome.getResult());
            if (resolved.verdict() == Verdict.COMPILATION_ERROR) {
                run.abortOnCompilation(
                        new CaseOutcome(testCase, Verdict.RUNTIME_ERROR, "", 0, 0, COMPILATION_ERROR_MESSAGE),
                        resolved.compileOutput());
                log.debug("Compilation failed on case {}, skipping remaining cases", testCase.id());
                break;
            }

            run.record(toCaseOutcome(testCase, resolved));
        }

        if (run.isRunning()) {
            run.complete();
        }
        JudgingReport report = run.toReport();
        metricsService.recordJudgingPass(mode, report.verdict(), Duration.ofNanos(System.nanoTime() - startedAt));
        log.debug("Judged {} code in {} mode: {} ({}/{} passed)",
                request.language(), mode, report.verdict(), report.passedCases(), report.totalCases());
        return report;
    }

    private List<JudgeCase> casesFor(JudgingRequest request, JudgingMode mode) {
        return request.cases().stream()
                .filter(testCase -> mode == JudgingMode.FULL || testCase.type() == TestCaseType.SAMPLE)
                .sorted(JudgeCase.EXECUTION_ORDER)
                .toList();
    }

    private ExecutionRequest toExecutionRequest(JudgingRequest request, JudgeCase testCase) {
        return new ExecutionRequest(
                request.code(),
                request.language(),
                testCase.input(),
                testCase.expectedOutput(),
                request.timeLimitSeconds(),
                request.memoryLimitKb()
        );
    }

    private CaseOutcome toCaseOutcome(JudgeCase testCase, ResolvedExecution resolved) {
        Verdict status = caseStatus(resolved.verdict());
        String error = status == Verdict.ACCEPTED ? null : firstNonBlank(resolved.stderr(), resolved.message());
        return new CaseOutcome(
                testCase,
                status,
                resolved.stdout(),
                resolved.executionTimeMs(),
                resolved.memoryUsedKb(),
                error
        );
    }

    /**
     * Per-case results only carry outcomes a test case can end in. A sandbox that reports a
     * non-terminal or internal state for a finished run is treated as a runtime failure.
     */
    private static Verdict caseStatus(Verdict verdict) {
        return switch (verdict) {
            case ACCEPTED, WRONG_ANSWER, TIME_LIMIT_EXCEEDED, MEMORY_LIMIT_EXCEEDED, RUNTIME_ERROR -> verdict;
            case PENDING, RUNNING, INTERNAL_ERROR, COMPILATION_ERROR -> Verdict.RUNTIME_ERROR;
        };
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
