package uk.gegc.codejudge.features.activity.application;

import uk.gegc.codejudge.features.activity.domain.model.AchievementType;
import uk.gegc.codejudge.features.submission.domain.event.SubmissionJudgedEvent;

import java.util.List;
import java.util.UUID;

/**
 * Downstream consumer of judged practice submissions. Failures here never affect judging.
 */
public interface ActivityTracker {

    void handleSubmissionJudged(SubmissionJudgedEvent event);

    /**
     * Bumps the day's submission counter, and the solved counter when this is the first
     * acceptance of the problem by the user that day.
     */
    void recordActivity(SubmissionJudgedEvent event);

    /**
     * Awards every achievement the user has reached and does not hold yet.
     *
     * @return the newly awarded achievements
     */
    List<AchievementType> awardAchievements(UUID userId);
}
