package io.nullsafe.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Sequence whose element access never reads past its length. {@link #get(int)} answers with an
 * {@link OptionalValue}: absent for an index outside {@code [0, length)}, present otherwise, even
 * when the stored element is {@code null}.
 *
 * <p>
 * Rewritten sequence literals construct instances through {@link #copyOf(List)}.
 *
 * <p>
 * Not thread-safe: {@link #set(int, Object)} and {@link #push(Object)} mutate in place.
 *
 * @param <T> element type, nullable or not as the literal declared it
 */
public final class SafeSequence<T> implements Iterable<T> {

    /** Qualified name under which rewritten trees call {@link #copyOf(List)}. */
    public static final String FACTORY = SafeSequence.class.getName() + ".copyOf";

    private final List<T> elements;

    private SafeSequence(List<T> elements) {
        this.elements = elements;
    }

    /**
     * Wraps the elements of an already-evaluated sequence literal, in order. The list is copied;
     * it may contain nulls.
     */
    public static <T> SafeSequence<T> copyOf(List<? extends T> elements) {
        return new SafeSequence<>(new ArrayList<>(elements));
    }

    @SafeVarargs
    public static <T> SafeSequence<T> of(T... elements) {
        return new SafeSequence<>(new ArrayList<>(Arrays.asList(elements)));
    }

    public static <T> SafeSequence<T> empty() {
        return new SafeSequence<>(new ArrayList<>());
    }

    /**
     * Element at {@code index}, or absent if {@code index} is negative or not less than
     * {@link #length()}.
     */
    public OptionalValue<T> get(int index) {
        if (index < 0 || index >= elements.size()) {
            return OptionalValue.absent();
        }
        return OptionalValue.present(elements.get(index));
    }

    public OptionalValue<T> first() {
        return get(0);
    }

    public OptionalValue<T> last() {
        return get(elements.size() - 1);
    }

    /**
     * Replaces the element at {@code index}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, length)}
     */
    public void set(int index, T value) {
        if (index < 0 || index >= elements.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + elements.size());
        }
        elements.set(index, value);
    }

    /** Appends {@code value} and returns the new length. */
    public int push(T value) {
        elements.add(value);
        return elements.size();
    }

    public int length() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /** Unmodifiable live view of the elements. */
    public List<T> toList() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Iterator<T> iterator() {
        return toList().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SafeSequence<?> other)) return false;
        return elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "SafeSequence" + elements;
    }
}
