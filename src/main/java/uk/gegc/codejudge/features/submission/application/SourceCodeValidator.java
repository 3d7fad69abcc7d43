package uk.gegc.codejudge.features.submission.application;

import org.springframework.stereotype.Component;
import uk.gegc.codejudge.shared.exception.ValidationException;

import java.nio.charset.StandardCharsets;

/**
 * Rejects code that must never reach the sandbox. Shared by practice and contest submissions.
 */
@Component
public class SourceCodeValidator {

    public static final int MAX_CODE_BYTES = 50_000;

    public void validate(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("Code must not be empty");
        }
        int size = code.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_CODE_BYTES) {
            throw new ValidationException("Code must be at most " + MAX_CODE_BYTES + " bytes, got " + size);
        }
    }
}
