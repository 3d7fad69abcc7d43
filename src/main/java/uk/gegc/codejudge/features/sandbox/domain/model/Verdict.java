package uk.gegc.codejudge.features.sandbox.domain.model;

public enum Verdict {
    PENDING,
    RUNNING,
    ACCEPTED,
    WRONG_ANSWER,
    TIME_LIMIT_EXCEEDED,
    MEMORY_LIMIT_EXCEEDED,
    RUNTIME_ERROR,
    COMPILATION_ERROR,
    INTERNAL_ERROR;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
