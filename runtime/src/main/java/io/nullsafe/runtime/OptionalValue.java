package io.nullsafe.runtime;

import java.util.Objects;

/**
 * Result of a lookup that can find nothing (absent) or find a value (present). Unlike
 * {@link java.util.Optional}, a present value may itself be {@code null}: this is what lets
 * {@link SafeSequence#get(int)} tell "no element at that index" apart from "a null stored at that
 * index".
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param <T> the payload type
 */
public final class OptionalValue<T> {

    private static final OptionalValue<?> ABSENT = new OptionalValue<>(false, null);

    private final boolean present;
    private final T value;

    private OptionalValue(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    /** A present value. {@code value} may be {@code null}. */
    public static <T> OptionalValue<T> present(T value) {
        return new OptionalValue<>(true, value);
    }

    /** The shared absent instance. */
    @SuppressWarnings("unchecked")
    public static <T> OptionalValue<T> absent() {
        return (OptionalValue<T>) ABSENT;
    }

    public boolean isPresent() {
        return present;
    }

    public boolean isAbsent() {
        return !present;
    }

    /**
     * Returns the payload.
     *
     * @throws NullPointerFailure if this value is absent
     */
    public T get() {
        if (!present) {
            throw new NullPointerFailure("get() called on an absent value");
        }
        return value;
    }

    /** Returns the payload if present (possibly {@code null}), otherwise {@code fallback}. */
    public T orElse(T fallback) {
        return present ? value : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionalValue<?> other)) return false;
        return present == other.present && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return present ? 31 + Objects.hashCode(value) : 0;
    }

    @Override
    public String toString() {
        return present ? "Present(" + value + ")" : "Absent";
    }
}
