package org.mibig.core.error;

/**
 * Raised when a document cannot be read into the legacy (v3) read model.
 */
public class LegacyFormatException extends MibigException {

    public LegacyFormatException(String message) {
        super(message);
    }

    public LegacyFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
