package com.memsim.memory;

/**
 * Base failure of the memory hierarchy. All failures are local to the access
 * (or construction) that raised them; nothing is retried.
 */
public class MemoryException extends RuntimeException {

    public MemoryException(String message) {
        super(message);
    }

    public MemoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
