package uk.gegc.codejudge.features.contest.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.codejudge.features.contest.application.ContestRankingService;
import uk.gegc.codejudge.features.contest.domain.model.Contest;
import uk.gegc.codejudge.features.contest.domain.model.ContestParticipant;
import uk.gegc.codejudge.features.contest.domain.model.ContestRanking;
import uk.gegc.codejudge.features.contest.domain.repository.ContestParticipantRepository;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ContestRankingServiceImpl implements ContestRankingService {

    private final ContestParticipantRepository participantRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public List<ContestParticipant> rerank(Contest contest) {
        List<ContestParticipant> ranked = ContestRanking.assignRanks(
                participantRepository.findByContest_Id(contest.getId()),
                contest.getScoringType());
        participantRepository.saveAll(ranked);
        log.info("Re-ranked {} participants of contest {} ({})", ranked.size(), contest.getSlug(), contest.getScoringType());
        return ranked;
    }
}
