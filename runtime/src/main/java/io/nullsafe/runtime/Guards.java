package io.nullsafe.runtime;

/**
 * Runtime entry point of the boundary guards inserted by the API guard rewrite. Every injected
 * guard is a call to {@link #checkArgument(Object, String, String, String)}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class Guards {

    /** Qualified name under which rewritten trees call {@link #checkArgument}. */
    public static final String CHECK_ARGUMENT = Guards.class.getName() + ".checkArgument";

    private Guards() {}

    /**
     * Fails if {@code value} is null.
     *
     * @param value     the runtime value bound to the parameter
     * @param parameter the parameter name
     * @param function  the fully-qualified path of the enclosing function
     * @param location  declaration site, or {@code null}
     * @throws GuardFailure if {@code value} is null
     */
    public static void checkArgument(Object value, String parameter, String function, String location) {
        if (value == null) {
            throw new GuardFailure(parameter, function, location);
        }
    }
}
