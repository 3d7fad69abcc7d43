package uk.gegc.codejudge.features.submission.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.codejudge.features.problem.domain.model.TestCase;
import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;
import uk.gegc.codejudge.features.submission.api.dto.RunResultDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionDetailDto;
import uk.gegc.codejudge.features.submission.api.dto.SubmissionDto;
import uk.gegc.codejudge.features.submission.api.dto.TestCaseResultDto;
import uk.gegc.codejudge.features.submission.domain.judging.CaseOutcome;
import uk.gegc.codejudge.features.submission.domain.judging.JudgeCase;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingReport;
import uk.gegc.codejudge.features.submission.domain.model.Submission;
import uk.gegc.codejudge.features.submission.domain.model.TestCaseResult;

import java.util.List;

@Component
public class SubmissionMapper {

    public SubmissionDto toDto(Submission submission) {
        return new SubmissionDto(
                submission.getId(),
                submission.getProblem().getSlug(),
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

    /**
     * @param owner whether the caller wrote the submission; non-owners get no code and no per-case results
     */
    public SubmissionDetailDto toDetailDto(Submission submission, boolean owner) {
        List<TestCaseResultDto> results = owner
                ? submission.getTestCaseResults().stream().map(this::toResultDto).toList()
                : List.of();
        return new SubmissionDetailDto(
                submission.getId(),
                submission.getUser().getUsername(),
                submission.getProblem().getSlug(),
                submission.getProblem().getTitle(),
                submission.getLanguage(),
                submission.getVerdict(),
                submission.getTestCasesPassed(),
                submission.getTotalTestCases(),
                submission.getExecutionTimeMs(),
                submission.getMemoryUsedKb(),
                submission.getErrorMessage(),
                submission.getCompilationOutput(),
                owner ? submission.getCode() : null,
                results,
                submission.getSubmittedAt()
        );
    }

    public TestCaseResultDto toResultDto(TestCaseResult result) {
        TestCase testCase = result.getTestCase();
        boolean sample = testCase.getType() == TestCaseType.SAMPLE;
        return new TestCaseResultDto(
                testCase.getId(),
                testCase.getType(),
                result.getStatus(),
                sample ? testCase.getInputData() : null,
                sample ? testCase.getExpectedOutput() : null,
                sample ? result.getActualOutput() : null,
                result.getExecutionTimeMs(),
                result.getMemoryUsedKb(),
                result.getErrorMessage()
        );
    }

    public RunResultDto toRunResultDto(JudgingReport report) {
        List<RunResultDto.RunCaseResultDto> cases = report.caseOutcomes().stream()
                .map(SubmissionMapper::toRunCase)
                .toList();
        return new RunResultDto(report.verdict(), report.passedCases(), report.totalCases(), report.compileOutput(), cases);
    }

    public JudgeCase toJudgeCase(TestCase testCase) {
        return new JudgeCase(
                testCase.getId(),
                testCase.getSortOrder(),
                testCase.getType(),
                testCase.getInputData(),
                testCase.getExpectedOutput()
        );
    }

    private static RunResultDto.RunCaseResultDto toRunCase(CaseOutcome outcome) {
        return new RunResultDto.RunCaseResultDto(
                outcome.testCase().input(),
                outcome.testCase().expectedOutput(),
                outcome.actualOutput(),
                outcome.status(),
                outcome.executionTimeMs(),
                outcome.memoryUsedKb(),
                outcome.errorMessage()
        );
    }
}
