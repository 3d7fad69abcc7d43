package uk.gegc.codejudge.features.contest.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.codejudge.features.contest.api.dto.*;
import uk.gegc.codejudge.features.contest.application.ContestService;
import uk.gegc.codejudge.features.contest.config.ContestProperties;
import uk.gegc.codejudge.features.contest.domain.model.*;
import uk.gegc.codejudge.features.contest.domain.repository.*;
import uk.gegc.codejudge.features.contest.infra.mapping.ContestMapper;
import uk.gegc.codejudge.features.user.domain.model.User;
import uk.gegc.codejudge.features.user.domain.repository.UserRepository;
import uk.gegc.codejudge.shared.exception.NotRegisteredException;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;
import uk.gegc.codejudge.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ContestServiceImpl implements ContestService {

    private final UserRepository userRepository;
    private final ContestRepository contestRepository;
    private final ContestRegistrationRepository registrationRepository;
    private final ContestProblemRepository contestProblemRepository;
    private final ContestParticipantRepository participantRepository;
    private final ContestProblemStatusRepository problemStatusRepository;
    private final ContestSubmissionRepository submissionRepository;
    private final ContestMapper contestMapper;
    private final ContestProperties contestProperties;
    private final Clock clock;

    @Override
    @Transactional
    public ContestRegistrationDto register(String username, String contestSlug) {
        User user = loadUser(username);
        Contest contest = lockContest(contestSlug);

        if (!contest.isRegistrationOpenAt(Instant.now(clock))) {
            throw new ValidationException("Registration is closed for contest " + contestSlug);
        }
        if (registrationRepository.existsByContest_IdAndUser_Id(contest.getId(), user.getId())) {
            throw new ValidationException("Already registered for contest " + contestSlug);
        }

        ContestRegistration registration = new ContestRegistration();
        registration.setContest(contest);
        registration.setUser(user);
        registration.setRegisteredAt(Instant.now(clock));
        registrationRepository.save(registration);
        contest.setTotalParticipants(contest.getTotalParticipants() + 1);

        log.info("User {} registered for contest {}", username, contestSlug);
        return contestMapper.toRegistrationDto(registration);
    }

    @Override
    @Transactional
    public void unregister(String username, String contestSlug) {
        User user = loadUser(username);
        Contest contest = lockContest(contestSlug);

        if (contest.statusAt(Instant.now(clock)) != ContestStatus.NOT_STARTED) {
            throw new ValidationException("Cannot unregister from a contest that has started or ended");
        }
        ContestRegistration registration = registrationRepository.findByContest_IdAndUser_Id(contest.getId(), user.getId())
                .orElseThrow(() -> new NotRegisteredException(username, contestSlug));
        registrationRepository.delete(registration);
        contest.setTotalParticipants(Math.max(0, contest.getTotalParticipants() - 1));
        log.info("User {} unregistered from contest {}", username, contestSlug);
    }

    private Contest lockContest(String contestSlug) {
        return contestRepository.findActiveBySlugForUpdate(contestSlug)
                .orElseThrow(() -> new ResourceNotFoundException("Contest " + contestSlug + " not found"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LeaderboardEntryDto> getLeaderboard(String contestSlug) {
        Contest contest = loadContest(contestSlug);
        return participantRepository.findLeaderboard(contest.getId()).stream()
                .map(contestMapper::toLeaderboardEntry)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<DetailedLeaderboardEntryDto> getDetailedLeaderboard(String contestSlug) {
        Contest contest = loadContest(contestSlug);
        List<ContestProblem> problems = contestProblemRepository.findByContest_IdAndActiveTrueOrderBySortOrderAsc(contest.getId());
        Map<UUID, Map<UUID, ContestProblemStatus>> statusesByParticipant = problemStatusRepository
                .findAllForContest(contest.getId()).stream()
                .collect(Collectors.groupingBy(
                        status -> status.getParticipant().getId(),
                        Collectors.toMap(status -> status.getContestProblem().getId(), Function.identity())));

        return participantRepository.findLeaderboard(contest.getId()).stream()
                .map(participant -> {
                    Map<UUID, ContestProblemStatus> statuses = statusesByParticipant.getOrDefault(participant.getId(), Map.of());
                    List<ProblemStatusDto> problemStatuses = problems.stream()
                            .map(problem -> contestMapper.toProblemStatus(problem, statuses.get(problem.getId())))
                            .toList();
                    return new DetailedLeaderboardEntryDto(contestMapper.toLeaderboardEntry(participant), problemStatuses);
                })
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public ContestDashboardDto getDashboard(String username, String contestSlug) {
        User user = loadUser(username);
        Contest contest = loadContest(contestSlug);
        if (!registrationRepository.existsByContest_IdAndUser_Id(contest.getId(), user.getId())) {
            throw new NotRegisteredException(username, contestSlug);
        }

        ContestParticipant participant = participantRepository.findByContest_IdAndUser_Id(contest.getId(), user.getId())
                .orElse(null);
        Map<UUID, ContestProblemStatus> statuses = participant == null
                ? Map.of()
                : problemStatusRepository.findByParticipant_Id(participant.getId()).stream()
                .collect(Collectors.toMap(status -> status.getContestProblem().getId(), Function.identity()));

        List<ProblemStatusDto> problems = contestProblemRepository.findByContest_IdAndActiveTrueOrderBySortOrderAsc(contest.getId())
                .stream()
                .map(problem -> contestMapper.toProblemStatus(problem, statuses.get(problem.getId())))
                .toList();

        List<ContestSubmissionDto> recent = submissionRepository.findByContest_IdAndUser_Id(
                        contest.getId(),
                        user.getId(),
                        PageRequest.of(0, contestProperties.getDashboardRecentSubmissions(), Sort.by(Sort.Direction.DESC, "submittedAt")))
                .map(contestMapper::toSubmissionDto)
                .getContent();

        return new ContestDashboardDto(
                contest.getSlug(),
                contest.getTitle(),
                contest.getScoringType(),
                contestMapper.toTimeInfo(contest, Instant.now(clock)),
                participant != null ? contestMapper.toLeaderboardEntry(participant) : null,
                problems,
                recent
        );
    }

    private User loadUser(String username) {
        return userRepository.findByUsername(username)
                .orElseThrow(() -> new ResourceNotFoundException("User " + username + " not found"));
    }

    private Contest loadContest(String contestSlug) {
        return contestRepository.findBySlugAndActiveTrue(contestSlug)
                .orElseThrow(() -> new ResourceNotFoundException("Contest " + contestSlug + " not found"));
    }
}
