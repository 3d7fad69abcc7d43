package uk.gegc.codejudge.features.problem.domain.model;

/**
 * SAMPLE cases are visible to users and used by run previews; HIDDEN cases are judged only.
 */
public enum TestCaseType {
    SAMPLE,
    HIDDEN
}
