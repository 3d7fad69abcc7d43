package uk.gegc.codejudge.features.sandbox.domain.model;

/**
 * Languages accepted for judging, with the numeric id the Judge0 sandbox uses for each.
 */
public enum Language {
    PYTHON(71),
    JAVA(62),
    CPP(54),
    C(50),
    JAVASCRIPT(63);

    private final int judge0Id;

    Language(int judge0Id) {
        this.judge0Id = judge0Id;
    }

    public int getJudge0Id() {
        return judge0Id;
    }
}
