package uk.gegc.codejudge.features.contest.domain.model;

public enum ScoringType {
    /**
     * Score, then time of last submission activity.
     */
    STANDARD,
    /**
     * Score, then time plus wrong-attempt penalty.
     */
    ICPC
}
