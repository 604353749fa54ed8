package org.mibig.core.error;

/**
 * Base class of all exceptions raised by the MIBiG core.
 */
public class MibigException extends RuntimeException {

    public MibigException(String message) {
        super(message);
    }

    public MibigException(String message, Throwable cause) {
        super(message, cause);
    }
}
