package io.atom.governor.error;

/**
 * A referenced agent, session, proposal or supervision session does not exist.
 */
public class EntityNotFoundException extends GovernanceException {

    private final String entityType;
    private final String entityId;

    public EntityNotFoundException(String entityType, String entityId) {
        super(ErrorCode.NOT_FOUND, entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
