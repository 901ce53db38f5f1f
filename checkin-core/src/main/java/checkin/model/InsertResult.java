package checkin.model;

/**
 * Outcome of an idempotent insert. A uniqueness violation is reported as
 * {@link #ALREADY_EXISTS}, never as an exception.
 */
public enum InsertResult {
    CREATED,
    ALREADY_EXISTS
}
