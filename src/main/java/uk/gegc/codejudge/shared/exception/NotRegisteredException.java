package uk.gegc.codejudge.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class NotRegisteredException extends RuntimeException {

    public NotRegisteredException(String username, String contestSlug) {
        super("User " + username + " is not registered for contest " + contestSlug);
    }
}
