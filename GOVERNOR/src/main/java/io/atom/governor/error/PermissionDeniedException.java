package io.atom.governor.error;

/**
 * The caller is not authorised for the requested governance operation.
 */
public class PermissionDeniedException extends GovernanceException {

    public PermissionDeniedException(String userId, String action) {
        super(ErrorCode.PERMISSION_DENIED, "User " + userId + " is not permitted to " + action);
    }
}
