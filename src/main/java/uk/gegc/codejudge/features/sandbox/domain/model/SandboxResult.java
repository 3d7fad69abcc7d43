package uk.gegc.codejudge.features.sandbox.domain.model;

/**
 * Raw terminal response from the sandbox. Numeric fields are kept as text because the
 * upstream service reports them as numbers, numeric strings or not at all.
 */
public record SandboxResult(
        Integer statusId,
        String statusDescription,
        String time,
        String memory,
        String stdout,
        String stderr,
        String compileOutput,
        String message
) {
}
