package uk.gegc.codejudge.features.submission.domain.judging;

import uk.gegc.codejudge.features.sandbox.domain.model.Language;

import java.util.List;

/**
 * Everything the engine needs to judge one program.
 *
 * @param timeLimitMs   per-case CPU limit in milliseconds
 * @param memoryLimitMb per-case memory limit in megabytes
 */
public record JudgingRequest(
        String code,
        Language language,
        int timeLimitMs,
        int memoryLimitMb,
        List<JudgeCase> cases
) {

    public JudgingRequest {
        cases = cases == null ? List.of() : List.copyOf(cases);
    }

    public double timeLimitSeconds() {
        return timeLimitMs / 1000.0;
    }

    public int memoryLimitKb() {
        return memoryLimitMb * 1024;
    }
}
