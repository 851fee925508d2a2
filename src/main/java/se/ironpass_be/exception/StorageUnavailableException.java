package se.ironpass_be.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Storage could not be reached or timed out. Never turned into a deny verdict.
 * {@code retryable} is false for the token consume write: a blind retry could claim a token
 * another request already won.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class StorageUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final boolean retryable;

    public StorageUnavailableException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
