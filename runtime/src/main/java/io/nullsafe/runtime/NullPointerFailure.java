package io.nullsafe.runtime;

/**
 * Thrown by {@link Nullables#sure(Object)} when the caller asserted a value is not null and it
 * was. Never recovered internally.
 */
public final class NullPointerFailure extends NullPointerException {

    private static final long serialVersionUID = 1L;

    public NullPointerFailure(String message) {
        super(message);
    }
}
