package com.hmmtagger.server.ai;

/**
 * Thrown when a state or observation is looked up in an index it was never
 * assigned to.
 */
public class UnregisteredEntityException extends IllegalArgumentException {
    private final transient Object entity;

    public UnregisteredEntityException(Object entity) {
        super("The given entity was not previously registered: " + entity);
        this.entity = entity;
    }

    public Object getEntity() {
        return entity;
    }
}
