package uk.gegc.codejudge.features.user.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.codejudge.features.problem.domain.model.SolveStatus;
import uk.gegc.codejudge.features.problem.domain.repository.ProblemSolveStatusRepository;
import uk.gegc.codejudge.features.user.api.dto.UserLeaderboardEntryDto;
import uk.gegc.codejudge.features.user.api.dto.UserSolveStatsDto;
import uk.gegc.codejudge.features.user.application.UserStatsService;
import uk.gegc.codejudge.features.user.domain.model.User;
import uk.gegc.codejudge.features.user.domain.repository.UserRepository;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;
import uk.gegc.codejudge.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserStatsServiceImpl implements UserStatsService {

    static final int MAX_LEADERBOARD_SIZE = 500;

    private final UserRepository userRepository;
    private final ProblemSolveStatusRepository solveStatusRepository;

    @Override
    public List<UserLeaderboardEntryDto> getLeaderboard(int limit) {
        if (limit < 1 || limit > MAX_LEADERBOARD_SIZE) {
            throw new ValidationException("limit must be between 1 and " + MAX_LEADERBOARD_SIZE);
        }
        List<User> users = userRepository.findTopSolvers(PageRequest.of(0, limit));
        List<UserLeaderboardEntryDto> entries = new ArrayList<>(users.size());
        for (int i = 0; i < users.size(); i++) {
            User u = users.get(i);
            entries.add(new UserLeaderboardEntryDto(
                    i + 1, u.getUsername(), u.getTotalSolved(), u.getEasySolved(), u.getMediumSolved(), u.getHardSolved()));
        }
        return entries;
    }

    @Override
    public UserSolveStatsDto getMyStats(String username) {
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new ResourceNotFoundException("User " + username + " not found"));
        long attempted = solveStatusRepository.countByUser_IdAndStatus(user.getId(), SolveStatus.ATTEMPTED);
        return new UserSolveStatsDto(
                user.getUsername(),
                user.getTotalSolved(),
                user.getEasySolved(),
                user.getMediumSolved(),
                user.getHardSolved(),
                attempted
        );
    }
}
