package io.atom.governor.error;

/**
 * The requested transition is not valid from the entity's current state,
 * e.g. promoting an autonomous agent or approving an already rejected proposal.
 */
public class InvalidStateException extends GovernanceException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
