package dev.linguaroute.exception;

/**
 * Raised when an entity cannot be deleted because other rows still reference its id.
 */
public class EntityInUseException extends RuntimeException {

    public EntityInUseException(String resource, Object id, String dependents) {
        super(String.format("%s '%s' is still referenced by %s", resource, id, dependents));
    }
}
