package uk.gegc.codejudge.features.activity.domain.model;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Counts consecutive solving days, walking back from a given day and stopping at the first
 * day without a solve. A day without a solve yields a streak of zero.
 */
public final class StreakCalculator {

    private StreakCalculator() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static int currentStreak(Collection<LocalDate> solvedDays, LocalDate today) {
        Set<LocalDate> days = new HashSet<>(solvedDays);
        int streak = 0;
        LocalDate day = today;
        while (days.contains(day)) {
            streak++;
            day = day.minusDays(1);
        }
        return streak;
    }
}
