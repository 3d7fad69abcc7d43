package uk.gegc.codejudge.features.sandbox.domain.model;

/**
 * Normalized view of one sandbox run. Text fields are never null.
 */
public record ResolvedExecution(
        Verdict verdict,
        int executionTimeMs,
        int memoryUsedKb,
        String stdout,
        String stderr,
        String compileOutput,
        String message,
        String statusDescription
) {
}
