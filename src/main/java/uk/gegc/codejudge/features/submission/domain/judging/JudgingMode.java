package uk.gegc.codejudge.features.submission.domain.judging;

public enum JudgingMode {
    /**
     * Every active test case, sample and hidden.
     */
    FULL,
    /**
     * Sample cases only; nothing is persisted.
     */
    PREVIEW
}
