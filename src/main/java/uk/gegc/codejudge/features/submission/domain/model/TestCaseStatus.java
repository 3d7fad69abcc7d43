package uk.gegc.codejudge.features.submission.domain.model;

import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

public enum TestCaseStatus {
    PENDING,
    ACCEPTED,
    WRONG_ANSWER,
    TIME_LIMIT_EXCEEDED,
    MEMORY_LIMIT_EXCEEDED,
    RUNTIME_ERROR;

    public static TestCaseStatus fromVerdict(Verdict verdict) {
        return switch (verdict) {
            case ACCEPTED -> ACCEPTED;
            case WRONG_ANSWER -> WRONG_ANSWER;
            case TIME_LIMIT_EXCEEDED -> TIME_LIMIT_EXCEEDED;
            case MEMORY_LIMIT_EXCEEDED -> MEMORY_LIMIT_EXCEEDED;
            default -> RUNTIME_ERROR;
        };
    }
}
