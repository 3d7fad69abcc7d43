package uk.gegc.codejudge.features.sandbox.domain.model;

/**
 * One unit of work for the sandbox: a program run against a single input.
 *
 * @param cpuTimeLimitSeconds CPU limit in seconds, as the sandbox expects it
 * @param memoryLimitKb       memory limit in kilobytes
 */
public record ExecutionRequest(
        String sourceCode,
        Language language,
        String stdin,
        String expectedOutput,
        double cpuTimeLimitSeconds,
        int memoryLimitKb
) {
}
