package uk.gegc.codejudge.features.sandbox.infra.judge0;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import uk.gegc.codejudge.features.sandbox.application.SandboxClient;
import uk.gegc.codejudge.features.sandbox.config.SandboxProperties;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionOutcome;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionRequest;

/**
 * {@link SandboxClient} backed by a Judge0-compatible HTTP API.
 * <p>
 * The run is created asynchronously ({@code wait=false}) and then polled on a fixed
 * interval until Judge0 leaves the "In Queue" / "Processing" states or the polling
 * budget runs out.
 * </p>
 */
@Component
@Slf4j
public class Judge0SandboxClient implements SandboxClient {

    static final String EXECUTION_UNAVAILABLE = "execution timeout/unavailable";

    private final RestClient restClient;
    private final SandboxProperties properties;

    public Judge0SandboxClient(RestClient sandboxRestClient, SandboxProperties properties) {
        this.restClient = sandboxRestClient;
        this.properties = properties;
    }

    @Override
    public ExecutionOutcome execute(ExecutionRequest request) {
        String token;
        try {
            token = createSubmission(request);
        } catch (RestClientException e) {
            log.warn("Sandbox rejected submission for language {}: {}", request.language(), e.getMessage());
            return ExecutionOutcome.failure(e.getMessage());
        }
        if (!StringUtils.hasText(token)) {
            log.warn("Sandbox accepted submission but returned no token");
            return ExecutionOutcome.failure("Sandbox returned no submission token");
        }
        return pollUntilTerminal(token);
    }

    private String createSubmission(ExecutionRequest request) {
        ResponseEntity<Judge0SubmissionResponse> response = restClient.post()
                .uri(uri -> uri.path("/submissions")
                        .queryParam("base64_encoded", "false")
                        .queryParam("wait", "false")
                        .build())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Judge0SubmissionRequest.from(request))
                .retrieve()
                .toEntity(Judge0SubmissionResponse.class);

        if (response.getStatusCode() != HttpStatus.CREATED || response.getBody() == null) {
            throw new RestClientException("Unexpected sandbox response status " + response.getStatusCode());
        }
        return response.getBody().token();
    }

    private ExecutionOutcome pollUntilTerminal(String token) {
        for (int poll = 1; poll <= properties.getMaxPolls(); poll++) {
            Judge0SubmissionResponse body;
            try {
                body = restClient.get()
                        .uri(uri -> uri.path("/submissions/{token}")
                                .queryParam("base64_encoded", "false")
                                .build(token))
                        .retrieve()
                        .body(Judge0SubmissionResponse.class);
            } catch (RestClientException e) {
                log.warn("Polling sandbox submission {} failed: {}", token, e.getMessage());
                return ExecutionOutcome.failure(e.getMessage());
            }

            if (body != null && !body.isInProgress()) {
                log.debug("Sandbox submission {} finished with status {} after {} poll(s)", token, body.statusId(), poll);
                return ExecutionOutcome.completed(body.toResult());
            }

            if (poll < properties.getMaxPolls() && !sleep()) {
                return ExecutionOutcome.failure(EXECUTION_UNAVAILABLE);
            }
        }
        log.warn("Sandbox submission {} did not finish within {} polls", token, properties.getMaxPolls());
        return ExecutionOutcome.failure(EXECUTION_UNAVAILABLE);
    }

    private boolean sleep() {
        try {
            Thread.sleep(properties.getPollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
