package uk.gegc.codejudge.features.activity.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.codejudge.features.activity.api.dto.AchievementDto;
import uk.gegc.codejudge.features.activity.api.dto.ActivityDayDto;
import uk.gegc.codejudge.features.activity.api.dto.StreakDto;
import uk.gegc.codejudge.features.activity.application.ActivityService;
import uk.gegc.codejudge.features.activity.domain.model.StreakCalculator;
import uk.gegc.codejudge.features.activity.domain.repository.UserAchievementRepository;
import uk.gegc.codejudge.features.activity.domain.repository.UserActivityRepository;
import uk.gegc.codejudge.features.user.domain.model.User;
import uk.gegc.codejudge.features.user.domain.repository.UserRepository;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;
import uk.gegc.codejudge.shared.exception.ValidationException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ActivityServiceImpl implements ActivityService {

    static final int MAX_CALENDAR_DAYS = 366;

    private final UserRepository userRepository;
    private final UserActivityRepository activityRepository;
    private final UserAchievementRepository achievementRepository;
    private final Clock clock;

    @Override
    public StreakDto getMyStreak(String username, int days) {
        if (days < 1 || days > MAX_CALENDAR_DAYS) {
            throw new ValidationException("days must be between 1 and " + MAX_CALENDAR_DAYS);
        }
        User user = loadUser(username);
        LocalDate today = LocalDate.now(clock);

        int streak = StreakCalculator.currentStreak(activityRepository.findSolvedDays(user.getId(), today), today);
        List<ActivityDayDto> calendar = activityRepository
                .findByUser_IdAndActivityDateBetweenOrderByActivityDateAsc(user.getId(), today.minusDays(days - 1L), today)
                .stream()
                .map(a -> new ActivityDayDto(a.getActivityDate(), a.getSubmissionsCount(), a.getProblemsSolved()))
                .toList();
        return new StreakDto(streak, calendar);
    }

    @Override
    public List<AchievementDto> getMyAchievements(String username) {
        User user = loadUser(username);
        return achievementRepository.findByUser_IdOrderByEarnedAtAsc(user.getId()).stream()
                .map(a -> new AchievementDto(
                        a.getType(),
                        a.getType().getTitle(),
                        a.getType().getDescription(),
                        a.getEarnedAt()))
                .toList();
    }

    private User loadUser(String username) {
        return userRepository.findByUsername(username)
                .orElseThrow(() -> new ResourceNotFoundException("User " + username + " not found"));
    }
}
