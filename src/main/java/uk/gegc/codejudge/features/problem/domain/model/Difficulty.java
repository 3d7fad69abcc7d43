package uk.gegc.codejudge.features.problem.domain.model;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD
}
