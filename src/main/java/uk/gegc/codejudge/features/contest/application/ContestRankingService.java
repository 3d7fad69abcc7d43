package uk.gegc.codejudge.features.contest.application;

import uk.gegc.codejudge.features.contest.domain.model.Contest;
import uk.gegc.codejudge.features.contest.domain.model.ContestParticipant;

import java.util.List;

public interface ContestRankingService {

    /**
     * Recomputes the rank of every participant of the contest. The caller must hold the
     * contest row lock.
     *
     * @return participants in rank order
     */
    List<ContestParticipant> rerank(Contest contest);
}
