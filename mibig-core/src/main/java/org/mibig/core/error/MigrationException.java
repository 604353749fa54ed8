package org.mibig.core.error;

/**
 * Raised when a legacy record cannot be migrated: unknown vocabulary, unsupported shape or
 * inconsistent changelog arrays.
 */
public class MigrationException extends MibigException {

    public MigrationException(String message) {
        super(message);
    }
}
