package uk.gegc.codejudge.features.submission.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.application.JudgingMetricsService;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingMode;

import java.time.Duration;

/**
 * Micrometer counters and timers for judging passes.
 */
@Service
public class JudgingMetricsServiceImpl implements JudgingMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter sandboxFailureCounter;

    public JudgingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.sandboxFailureCounter = Counter.builder("judging.sandbox.failures")
                .description("Test cases that could not be executed by the sandbox")
                .register(meterRegistry);
    }

    @Override
    public void recordJudgingPass(JudgingMode mode, Verdict verdict, Duration duration) {
        Counter.builder("judging.verdicts")
                .description("Judging passes by final verdict")
                .tag("mode", mode.name())
                .tag("verdict", verdict.name())
                .register(meterRegistry)
                .increment();
        Timer.builder("judging.duration")
                .description("Wall-clock time of one judging pass")
                .tag("mode", mode.name())
                .register(meterRegistry)
                .record(duration);
    }

    @Override
    public void incrementSandboxFailure() {
        sandboxFailureCounter.increment();
    }
}
