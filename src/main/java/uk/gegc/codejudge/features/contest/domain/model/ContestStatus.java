package uk.gegc.codejudge.features.contest.domain.model;

public enum ContestStatus {
    NOT_STARTED,
    ACTIVE,
    ENDED
}
