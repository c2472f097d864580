package io.atom.governor.error;

/**
 * Cache or record store unavailable or too slow. Callers may retry.
 */
public class TransientGovernanceException extends GovernanceException {

    public TransientGovernanceException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT, message, cause);
    }
}
