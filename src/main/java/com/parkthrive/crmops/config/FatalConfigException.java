package com.parkthrive.crmops.config;

import java.util.List;

/**
 * Required configuration or credentials are absent; the run stops before any record is touched.
 */
public class FatalConfigException extends RuntimeException {

    private final List<String> problems;

    public FatalConfigException(String workflow, List<String> problems) {
        super("Workflow '" + workflow + "' cannot start: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public FatalConfigException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public FatalConfigException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
