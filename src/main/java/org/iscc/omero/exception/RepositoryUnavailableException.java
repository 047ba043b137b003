package org.iscc.omero.exception;

/**
 * The repository could not be reached or refused the session (network or auth).
 * Recoverable: the orchestrator reconnects with backoff.
 */
public class RepositoryUnavailableException extends IsccServiceException {

    public RepositoryUnavailableException(String operation, String message) {
        super("REPOSITORY_UNAVAILABLE", operation, message);
    }

    public RepositoryUnavailableException(String operation, String message, Throwable cause) {
        super("REPOSITORY_UNAVAILABLE", operation, message, cause);
    }

    public static RepositoryUnavailableException sessionClosed(String operation, String sessionId) {
        return new RepositoryUnavailableException(operation, "Session is not open: " + sessionId);
    }
}
