package uk.gegc.codejudge.features.sandbox.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.codejudge.features.sandbox.application.VerdictResolver;
import uk.gegc.codejudge.features.sandbox.domain.model.ResolvedExecution;
import uk.gegc.codejudge.features.sandbox.domain.model.SandboxResult;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Service
@Slf4j
public class VerdictResolverImpl implements VerdictResolver {

    @Override
    public ResolvedExecution resolve(SandboxResult result) {
        Verdict verdict = verdictFor(result.statusId());
        return new ResolvedExecution(
                verdict,
                secondsToMillis(result.time()),
                toKilobytes(result.memory()),
                nullToEmpty(result.stdout()),
                nullToEmpty(result.stderr()),
                nullToEmpty(result.compileOutput()),
                nullToEmpty(result.message()),
                nullToEmpty(result.statusDescription())
        );
    }

    @Override
    public Verdict verdictFor(Integer statusId) {
        if (statusId == null) {
            return Verdict.INTERNAL_ERROR;
        }
        return switch (statusId) {
            case 1 -> Verdict.PENDING;
            case 2 -> Verdict.RUNNING;
            case 3 -> Verdict.ACCEPTED;
            case 4 -> Verdict.WRONG_ANSWER;
            case 5 -> Verdict.TIME_LIMIT_EXCEEDED;
            case 6 -> Verdict.COMPILATION_ERROR;
            // SIGSEGV, SIGXFSZ, SIGFPE, SIGABRT, NZEC, other, exec format error
            case 7, 8, 9, 10, 11, 12, 14 -> Verdict.RUNTIME_ERROR;
            case 13 -> Verdict.INTERNAL_ERROR;
            default -> {
                log.warn("Unrecognized sandbox status id {}", statusId);
                yield Verdict.INTERNAL_ERROR;
            }
        };
    }

    static int secondsToMillis(String seconds) {
        if (seconds == null || seconds.isBlank()) {
            return 0;
        }
        try {
            return new BigDecimal(seconds.trim())
                    .multiply(BigDecimal.valueOf(1000))
                    .setScale(0, RoundingMode.HALF_UP)
                    .intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Could not parse sandbox time '{}', using 0", seconds);
            return 0;
        }
    }

    static int toKilobytes(String memory) {
        if (memory == null || memory.isBlank()) {
            return 0;
        }
        try {
            return new BigDecimal(memory.trim())
                    .setScale(0, RoundingMode.HALF_UP)
                    .intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Could not parse sandbox memory '{}', using 0", memory);
            return 0;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
