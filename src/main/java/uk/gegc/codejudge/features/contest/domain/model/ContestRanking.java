package uk.gegc.codejudge.features.contest.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Total order used to rank the participants of a contest.
 * <p>
 * Higher score first. Ties are broken by time, lower first: {@code totalTime} under
 * {@link ScoringType#STANDARD}, {@code totalTime + penaltyTime} under {@link ScoringType#ICPC}.
 * Remaining ties go to the earlier registration, then to the smaller participant id, so
 * no two participants ever share a rank.
 * </p>
 * <p>
 * The ICPC time key differs from the plain (score, totalTime) ordering: two
 * participants with equal score and equal {@code totalTime} are separated by their wrong
 * attempts, and a participant with fewer minutes but more penalty can rank below one with
 * more minutes and no penalty.
 * </p>
 */
public final class ContestRanking {

    private ContestRanking() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static Comparator<ContestParticipant> comparator(ScoringType scoringType) {
        Comparator<ContestParticipant> byTime = scoringType == ScoringType.ICPC
                ? Comparator.comparingLong(p -> (long) p.getTotalTime() + p.getPenaltyTime())
                : Comparator.comparingInt(ContestParticipant::getTotalTime);

        return Comparator.comparingInt(ContestParticipant::getTotalScore).reversed()
                .thenComparing(byTime)
                .thenComparing(ContestParticipant::getRegisteredAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                .thenComparing(ContestParticipant::getId, Comparator.nullsLast(Comparator.<UUID>naturalOrder()));
    }

    /**
     * Sorts the participants and assigns ranks 1..N in that order.
     *
     * @return the participants in rank order
     */
    public static List<ContestParticipant> assignRanks(List<ContestParticipant> participants, ScoringType scoringType) {
        List<ContestParticipant> ordered = new ArrayList<>(participants);
        ordered.sort(comparator(scoringType));
        for (int i = 0; i < ordered.size(); i++) {
            ordered.get(i).setRank(i + 1);
        }
        return ordered;
    }
}
