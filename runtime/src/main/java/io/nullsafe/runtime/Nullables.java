package io.nullsafe.runtime;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Combinators for explicit handling of nullable values, usable from any code whether or not it
 * was processed by the rewrite engine.
 *
 * <p>
 * A nullable value is an ordinary reference that may be {@code null}; {@code null} is the
 * "absent" case, anything else is "present".
 *
 * <p>
 * {@link #sure(Object)} and {@link #unsafe(Object)} both narrow a nullable value to a non-null
 * one. {@code sure} checks and fails loudly. {@code unsafe} does not check at all: the caller
 * takes responsibility for whatever fails later if the value was null.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class Nullables {

    private Nullables() {}

    /**
     * Returns {@code value} if it is not null, otherwise {@code fallback}. Never fails.
     */
    public static <T> T or(T value, T fallback) {
        return value != null ? value : fallback;
    }

    /**
     * Returns {@code value} if it is not null, otherwise the result of {@code fallback}. The
     * supplier is only invoked for a null value.
     */
    public static <T> T orGet(T value, Supplier<? extends T> fallback) {
        return value != null ? value : fallback.get();
    }

    /**
     * Asserts that {@code value} is not null.
     *
     * @return {@code value}
     * @throws NullPointerFailure if {@code value} is null
     */
    public static <T> T sure(T value) {
        if (value == null) {
            throw new NullPointerFailure("sure() called on a null value");
        }
        return value;
    }

    /**
     * Returns {@code value} unchanged and unchecked. Explicit escape hatch: no runtime check is
     * performed.
     */
    public static <T> T unsafe(T value) {
        return value;
    }

    /**
     * Maps a present value through {@code callback}. Returns null without invoking the callback
     * when {@code value} is null.
     */
    public static <T, R> R let(T value, Function<? super T, ? extends R> callback) {
        return value != null ? callback.apply(value) : null;
    }

    /** Invokes {@code callback} with {@code value} if it is not null; otherwise does nothing. */
    public static <T> void run(T value, Consumer<? super T> callback) {
        if (value != null) {
            callback.accept(value);
        }
    }

    /**
     * Like {@link #run(Object, Consumer)}, but returns {@code value} afterwards so calls can be
     * chained.
     */
    public static <T> T apply(T value, Consumer<? super T> callback) {
        if (value != null) {
            callback.accept(value);
        }
        return value;
    }
}
