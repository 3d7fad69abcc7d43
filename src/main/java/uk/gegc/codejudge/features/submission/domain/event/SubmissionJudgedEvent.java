package uk.gegc.codejudge.features.submission.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.time.Instant;
import java.util.UUID;

/**
 * Published inside the transaction that stores a practice submission's verdict.
 * Listeners that should only see committed data use
 * {@code @TransactionalEventListener(phase = AFTER_COMMIT)}.
 */
public class SubmissionJudgedEvent extends ApplicationEvent {

    private final UUID submissionId;
    private final UUID userId;
    private final UUID problemId;
    private final Verdict verdict;
    private final Instant submittedAt;

    public SubmissionJudgedEvent(Object source, UUID submissionId, UUID userId, UUID problemId,
                                 Verdict verdict, Instant submittedAt) {
        super(source);
        this.submissionId = submissionId;
        this.userId = userId;
        this.problemId = problemId;
        this.verdict = verdict;
        this.submittedAt = submittedAt;
    }

    public UUID getSubmissionId() {
        return submissionId;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getProblemId() {
        return problemId;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }
}
