package se.ironpass_be.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The presented code matches no issued token. Nothing can be logged because the token
 * cannot be tied to a member. The message never carries the presented value.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class InvalidQrTokenException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    public static final String CODE = "TOKEN_INVALID";

    public InvalidQrTokenException() {
        super(CODE);
    }
}
