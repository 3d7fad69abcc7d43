package uk.gegc.codejudge.features.sandbox.infra.judge0;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.codejudge.features.sandbox.domain.model.SandboxResult;

@JsonIgnoreProperties(ignoreUnknown = true)
record Judge0SubmissionResponse(
        @JsonProperty("token") String token,
        @JsonProperty("status") Status status,
        @JsonProperty("time") JsonNode time,
        @JsonProperty("memory") JsonNode memory,
        @JsonProperty("stdout") String stdout,
        @JsonProperty("stderr") String stderr,
        @JsonProperty("compile_output") String compileOutput,
        @JsonProperty("message") String message
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Status(
            @JsonProperty("id") Integer id,
            @JsonProperty("description") String description
    ) {
    }

    Integer statusId() {
        return status != null ? status.id() : null;
    }

    boolean isInProgress() {
        Integer id = statusId();
        return id != null && (id == 1 || id == 2);
    }

    SandboxResult toResult() {
        return new SandboxResult(
                statusId(),
                status != null ? status.description() : null,
                text(time),
                text(memory),
                stdout,
                stderr,
                compileOutput,
                message
        );
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }
}
