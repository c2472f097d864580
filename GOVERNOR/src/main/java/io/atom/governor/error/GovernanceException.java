package io.atom.governor.error;

/**
 * Base class of all governance failures. Each subclass maps to one {@link ErrorCode}.
 */
public abstract class GovernanceException extends RuntimeException {

    private final ErrorCode errorCode;

    protected GovernanceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected GovernanceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return errorCode == ErrorCode.TRANSIENT;
    }

    public enum ErrorCode {
        NOT_FOUND,
        PERMISSION_DENIED,
        TRANSIENT,
        INVALID_STATE
    }
}
