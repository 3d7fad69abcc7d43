package uk.gegc.codejudge.features.submission.domain.judging;

import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of a single judging pass.
 * <p>
 * A run starts in {@link State#RUNNING} and ends either in {@link State#COMPLETED} once
 * every case has been considered, or in {@link State#ABORTED_COMPILATION} as soon as the
 * program fails to compile. No case can be recorded after a terminal transition.
 * </p>
 */
public class JudgingRun {

    public enum State {
        RUNNING,
        COMPLETED,
        ABORTED_COMPILATION
    }

    private final int totalCases;
    private final List<CaseOutcome> outcomes = new ArrayList<>();
    private State state = State.RUNNING;
    private int passedCases;
    private int maxTimeMs;
    private int maxMemoryKb;
    private String compileOutput;

    public JudgingRun(int totalCases) {
        this.totalCases = totalCases;
    }

    public State getState() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public List<CaseOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public void record(CaseOutcome outcome) {
        requireRunning();
        outcomes.add(outcome);
        if (outcome.passed()) {
            passedCases++;
        }
        maxTimeMs = Math.max(maxTimeMs, outcome.executionTimeMs());
        maxMemoryKb = Math.max(maxMemoryKb, outcome.memoryUsedKb());
    }

    /**
     * Records the case that failed to compile and stops the run.
     */
    public void abortOnCompilation(CaseOutcome outcome, String compileOutput) {
        requireRunning();
        outcomes.add(outcome);
        this.compileOutput = compileOutput;
        this.state = State.ABORTED_COMPILATION;
    }

    public void complete() {
        requireRunning();
        this.state = State.COMPLETED;
    }

    public JudgingReport toReport() {
        if (state == State.RUNNING) {
            throw new IllegalStateException("Judging run has not finished");
        }
        CaseOutcome firstFailure = outcomes.stream()
                .filter(outcome -> !outcome.passed())
                .findFirst()
                .orElse(null);

        return new JudgingReport(
                finalVerdict(firstFailure),
                passedCases,
                totalCases,
                maxTimeMs > 0 ? maxTimeMs : null,
                maxMemoryKb > 0 ? maxMemoryKb : null,
                compileOutput,
                firstFailure != null ? firstFailure.errorMessage() : null,
                List.copyOf(outcomes)
        );
    }

    private Verdict finalVerdict(CaseOutcome firstFailure) {
        if (state == State.ABORTED_COMPILATION) {
            return Verdict.COMPILATION_ERROR;
        }
        if (outcomes.isEmpty()) {
            return Verdict.INTERNAL_ERROR;
        }
        return firstFailure == null ? Verdict.ACCEPTED : firstFailure.status();
    }

    private void requireRunning() {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Judging run already " + state);
        }
    }
}
