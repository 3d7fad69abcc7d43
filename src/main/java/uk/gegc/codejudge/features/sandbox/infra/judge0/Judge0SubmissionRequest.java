package uk.gegc.codejudge.features.sandbox.infra.judge0;

import com.fasterxml.jackson.annotation.JsonProperty;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionRequest;

record Judge0SubmissionRequest(
        @JsonProperty("source_code") String sourceCode,
        @JsonProperty("language_id") int languageId,
        @JsonProperty("stdin") String stdin,
        @JsonProperty("expected_output") String expectedOutput,
        @JsonProperty("cpu_time_limit") double cpuTimeLimit,
        @JsonProperty("memory_limit") int memoryLimit
) {

    static Judge0SubmissionRequest from(ExecutionRequest request) {
        return new Judge0SubmissionRequest(
                request.sourceCode(),
                request.language().getJudge0Id(),
                request.stdin(),
                request.expectedOutput(),
                request.cpuTimeLimitSeconds(),
                request.memoryLimitKb()
        );
    }
}
