package io.github.drompincen.playdeck.runtime.lock;

import io.github.drompincen.playdeck.runtime.error.PMException;

/**
 * The lock key stayed taken for the whole acquisition window.
 */
public class AcquireLockException extends PMException {

    private final String lockId;

    public AcquireLockException(String lockId, String message) {
        super(message);
        this.lockId = lockId;
    }

    public String getLockId() { return lockId; }
}
