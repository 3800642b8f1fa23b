package com.memsim.memory;

/**
 * Geometry, timing or cache parameters that cannot build a working component.
 * Raised before anything is constructed.
 */
public class InvalidConfigurationException extends MemoryException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
