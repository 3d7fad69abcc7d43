package uk.gegc.codejudge.features.activity.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.codejudge.features.activity.application.ActivityTracker;
import uk.gegc.codejudge.features.activity.domain.model.AchievementType;
import uk.gegc.codejudge.features.activity.domain.model.StreakCalculator;
import uk.gegc.codejudge.features.activity.domain.model.UserAchievement;
import uk.gegc.codejudge.features.activity.domain.model.UserActivity;
import uk.gegc.codejudge.features.activity.domain.repository.UserAchievementRepository;
import uk.gegc.codejudge.features.activity.domain.repository.UserActivityRepository;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.domain.event.SubmissionJudgedEvent;
import uk.gegc.codejudge.features.submission.domain.repository.SubmissionRepository;
import uk.gegc.codejudge.features.user.domain.model.User;
import uk.gegc.codejudge.features.user.domain.repository.UserRepository;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

@Slf4j
@Service
public class ActivityTrackerImpl implements ActivityTracker {

    private static final int MAX_ATTEMPTS = 3;

    private final UserRepository userRepository;
    private final UserActivityRepository activityRepository;
    private final UserAchievementRepository achievementRepository;
    private final SubmissionRepository submissionRepository;
    private final Clock clock;

    // Self-reference so REQUIRES_NEW applies through the proxy
    private final ActivityTracker self;

    public ActivityTrackerImpl(
            UserRepository userRepository,
            UserActivityRepository activityRepository,
            UserAchievementRepository achievementRepository,
            SubmissionRepository submissionRepository,
            Clock clock,
            @Lazy ActivityTracker self
    ) {
        this.userRepository = userRepository;
        this.activityRepository = activityRepository;
        this.achievementRepository = achievementRepository;
        this.submissionRepository = submissionRepository;
        this.clock = clock;
        this.self = self;
    }

    @Override
    @Async("activityTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleSubmissionJudged(SubmissionJudgedEvent event) {
        log.debug("Tracking activity for submission {} ({})", event.getSubmissionId(), event.getVerdict());
        try {
            runWithRetry(() -> self.recordActivity(event));
            List<AchievementType> awarded = withRetry(() -> self.awardAchievements(event.getUserId()));
            if (!awarded.isEmpty()) {
                log.info("User {} earned achievements {}", event.getUserId(), awarded);
            }
        } catch (Exception e) {
            log.error("Failed to track activity for submission {}", event.getSubmissionId(), e);
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordActivity(SubmissionJudgedEvent event) {
        User user = loadUser(event.getUserId());
        ZoneId zone = clock.getZone();
        LocalDate day = LocalDate.ofInstant(event.getSubmittedAt(), zone);

        if (!activityRepository.existsByUser_IdAndActivityDate(user.getId(), day)) {
            UserActivity activity = new UserActivity();
            activity.setUser(user);
            activity.setActivityDate(day);
            activityRepository.saveAndFlush(activity);
        }

        int solvedDelta = 0;
        if (event.isAccepted()) {
            Instant startOfDay = day.atStartOfDay(zone).toInstant();
            boolean solvedEarlierToday = submissionRepository.existsOtherWithVerdictBetween(
                    user.getId(),
                    event.getProblemId(),
                    Verdict.ACCEPTED,
                    startOfDay,
                    event.getSubmittedAt(),
                    event.getSubmissionId());
            solvedDelta = solvedEarlierToday ? 0 : 1;
        }
        activityRepository.incrementCounters(user.getId(), day, solvedDelta);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<AchievementType> awardAchievements(UUID userId) {
        User user = loadUser(userId);
        LocalDate today = LocalDate.now(clock);
        int streak = StreakCalculator.currentStreak(activityRepository.findSolvedDays(userId, today), today);

        List<AchievementType> awarded = new ArrayList<>();
        for (AchievementType type : AchievementType.values()) {
            if (type.isReached(user.getTotalSolved(), streak) && !achievementRepository.existsByUser_IdAndType(userId, type)) {
                UserAchievement achievement = new UserAchievement();
                achievement.setUser(user);
                achievement.setType(type);
                achievement.setEarnedAt(Instant.now(clock));
                achievementRepository.saveAndFlush(achievement);
                awarded.add(type);
            }
        }
        return awarded;
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));
    }

    /**
     * Retries when a concurrent handler inserted the same unique row first.
     */
    private static <T> T withRetry(Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (DataIntegrityViolationException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw e;
                }
                log.debug("Unique row already inserted concurrently, retrying (attempt {})", attempt);
            }
        }
    }

    private static void runWithRetry(Runnable action) {
        withRetry(() -> {
            action.run();
            return null;
        });
    }
}
