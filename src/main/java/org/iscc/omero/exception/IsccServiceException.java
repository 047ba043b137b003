package org.iscc.omero.exception;

/**
 * Base exception for the ISCC service.
 * Carries a stable error code and the operation that failed.
 */
public class IsccServiceException extends RuntimeException {

    private final String errorCode;
    private final String operation;

    public IsccServiceException(String errorCode, String operation, String message) {
        super(String.format("[%s] %s: %s", errorCode, operation, message));
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public IsccServiceException(String errorCode, String operation, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, message), cause);
        this.errorCode = errorCode;
        this.operation = operation;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }
}
