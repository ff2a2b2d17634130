package io.nullsafe.runtime;

/**
 * Thrown by an injected boundary guard when null reaches a parameter declared non-nullable. Raised
 * before the first original statement of the guarded function runs.
 *
 * <p>
 * Carries the parameter name, the fully-qualified path of the guarded function and the source
 * location of its declaration ({@code "<unit>:<line>"}, or just the unit name when the line is
 * unknown).
 */
public final class GuardFailure extends NullPointerException {

    private static final long serialVersionUID = 1L;

    private final String parameter;
    private final String function;
    private final String location;

    public GuardFailure(String parameter, String function, String location) {
        super("Null passed to non-nullable parameter '" + parameter + "' of " + function
                + (location != null ? " (" + location + ")" : ""));
        this.parameter = parameter;
        this.function = function;
        this.location = location;
    }

    /** Name of the parameter that received null. */
    public String parameter() {
        return parameter;
    }

    /** Fully-qualified path of the guarded function, e.g. {@code app.util.job}. */
    public String function() {
        return function;
    }

    /** Declaration site of the guarded function, or {@code null} if unknown. */
    public String location() {
        return location;
    }
}
