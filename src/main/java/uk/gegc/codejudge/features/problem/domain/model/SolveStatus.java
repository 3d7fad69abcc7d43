package uk.gegc.codejudge.features.problem.domain.model;

/**
 * Monotonic: ATTEMPTED may become SOLVED, never the reverse.
 */
public enum SolveStatus {
    ATTEMPTED,
    SOLVED
}
