package org.iscc.omero.exception;

import java.util.List;

/**
 * Invalid or missing configuration. Fatal at startup.
 */
public class ConfigException extends IsccServiceException {

    private final List<String> problems;

    public ConfigException(String operation, List<String> problems) {
        super("CONFIG_ERROR", operation, String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigException(String operation, String message, Throwable cause) {
        super("CONFIG_ERROR", operation, message, cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
