package uk.gegc.codejudge.features.sandbox.application;

import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionOutcome;
import uk.gegc.codejudge.features.sandbox.domain.model.ExecutionRequest;

/**
 * Adapter to the external code execution service.
 */
public interface SandboxClient {

    /**
     * Submit one program run and block until the sandbox reports a terminal state.
     * Network errors, rejected submissions and an exhausted polling budget are returned
     * as {@link ExecutionOutcome#failure(String)}; this method does not throw for them.
     */
    ExecutionOutcome execute(ExecutionRequest request);
}
