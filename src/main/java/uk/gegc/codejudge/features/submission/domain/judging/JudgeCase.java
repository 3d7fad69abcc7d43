package uk.gegc.codejudge.features.submission.domain.judging;

import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;

import java.util.Comparator;
import java.util.UUID;

public record JudgeCase(
        UUID id,
        int sortOrder,
        TestCaseType type,
        String input,
        String expectedOutput
) {

    public static final Comparator<JudgeCase> EXECUTION_ORDER = Comparator
            .comparingInt(JudgeCase::sortOrder)
            .thenComparing(JudgeCase::id, Comparator.nullsLast(Comparator.naturalOrder()));
}
