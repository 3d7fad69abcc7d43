package uk.gegc.codejudge.features.activity.domain.model;

public enum AchievementType {
    FIRST_SOLVE(Kind.TOTAL_SOLVED, 1, "First Solve", "Solve your first problem"),
    SOLVE_10(Kind.TOTAL_SOLVED, 10, "Problem Solver", "Solve 10 problems"),
    SOLVE_50(Kind.TOTAL_SOLVED, 50, "Dedicated Solver", "Solve 50 problems"),
    SOLVE_100(Kind.TOTAL_SOLVED, 100, "Century", "Solve 100 problems"),
    SOLVE_STREAK_7(Kind.STREAK, 7, "Week Streak", "Solve at least one problem on 7 consecutive days"),
    SOLVE_STREAK_30(Kind.STREAK, 30, "Month Streak", "Solve at least one problem on 30 consecutive days");

    public enum Kind {
        TOTAL_SOLVED,
        STREAK
    }

    private final Kind kind;
    private final int threshold;
    private final String title;
    private final String description;

    AchievementType(Kind kind, int threshold, String title, String description) {
        this.kind = kind;
        this.threshold = threshold;
        this.title = title;
        this.description = description;
    }

    public Kind getKind() {
        return kind;
    }

    public int getThreshold() {
        return threshold;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public boolean isReached(int totalSolved, int streak) {
        int value = kind == Kind.TOTAL_SOLVED ? totalSolved : streak;
        return value >= threshold;
    }
}
