package assetup.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Coarse classification of ledger failures, used to pick the HTTP status.
 */
public enum ErrorKind {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    ALREADY_EXISTS(HttpStatus.CONFLICT),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    ARITHMETIC_FAULT(HttpStatus.UNPROCESSABLE_ENTITY),
    RESTRICTION_VIOLATION(HttpStatus.FORBIDDEN),
    STATE_CONFLICT(HttpStatus.CONFLICT);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
