package se.ironpass_be.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class BusinessLogicException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BusinessLogicException(String message) {
        super(message);
    }
}
