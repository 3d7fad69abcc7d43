package uk.gegc.codejudge.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a contest submission arrives outside the contest window.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ContestNotRunningException extends RuntimeException {

    private final String contestSlug;

    public ContestNotRunningException(String contestSlug) {
        super("Contest " + contestSlug + " is not currently active");
        this.contestSlug = contestSlug;
    }

    public String getContestSlug() {
        return contestSlug;
    }
}
