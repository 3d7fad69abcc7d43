package uk.gegc.codejudge.features.sandbox.domain.model;

import java.util.Objects;

/**
 * Either a terminal sandbox response or the reason none could be obtained.
 * Transport problems are reported through {@link #failure(String)} rather than thrown.
 */
public final class ExecutionOutcome {

    private final SandboxResult result;
    private final String failureReason;

    private ExecutionOutcome(SandboxResult result, String failureReason) {
        this.result = result;
        this.failureReason = failureReason;
    }

    public static ExecutionOutcome completed(SandboxResult result) {
        return new ExecutionOutcome(Objects.requireNonNull(result, "result"), null);
    }

    public static ExecutionOutcome failure(String reason) {
        return new ExecutionOutcome(null, reason);
    }

    public boolean isFailure() {
        return result == null;
    }

    public SandboxResult getResult() {
        if (result == null) {
            throw new IllegalStateException("Execution failed: " + failureReason);
        }
        return result;
    }

    public String getFailureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return isFailure() ? "ExecutionOutcome[failure=" + failureReason + "]" : "ExecutionOutcome[" + result + "]";
    }
}
