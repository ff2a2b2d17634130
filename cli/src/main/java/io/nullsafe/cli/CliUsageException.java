package io.nullsafe.cli;

/** Thrown when the command line cannot be interpreted. */
public class CliUsageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CliUsageException(String message) {
        super(message);
    }
}
