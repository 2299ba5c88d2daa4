package org.academic.store;

/**
 * Outcome of a store operation. Failures are reported here, never thrown.
 */
public enum OperationResult {
    OK(1),
    /** Applied in memory, but writing the backing file failed. Not rolled back. */
    OK_NOT_PERSISTED(1),
    NOT_FOUND(0),
    /** A rekey target key is already taken. */
    CONFLICT(-1),
    /** An inserted record repeats a key already present. */
    DUPLICATE(0),
    CAPACITY_EXCEEDED(0),
    INVALID(0);

    private final int code;

    OperationResult(int code) {
        this.code = code;
    }

    /**
     * Integer status: 1 applied, 0 not found or rejected, -1 rekey onto a taken key.
     */
    public int code() {
        return code;
    }

    public boolean isApplied() {
        return this == OK || this == OK_NOT_PERSISTED;
    }

    public boolean isPersisted() {
        return this == OK;
    }
}
