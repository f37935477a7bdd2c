/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * An immutable, array-like value. "Modifying" methods return new instances, leaving the original untouched, so
 * ArrayValues can be handed to callers of {@link ValueBearing#getValue()} without any risk of those callers silently
 * mutating a Node's state behind the back of its caching.
 *
 * Entries may be null, which represents a missing entry: a position that is unknown in an otherwise observed value.
 * Stochastics use {@link #getMissingIndices()} to find the subset of their value that remains free to be sampled.
 *
 * Equality is content-based, but note that Bayra's caching (see {@link LazyFunction}) relies on instance identity
 * instead, so two equal ArrayValues are still distinct values as far as caching is concerned.
 */
public final class ArrayValue<E> {
    private final List<E> entries;

    private ArrayValue(List<E> entries) {
        this.entries = entries;
    }

    /** Creates an ArrayValue with the given entries, any of which may be null (i.e. missing). */
    @SafeVarargs
    public static <E> ArrayValue<E> of(E... entries) {
        return new ArrayValue<>(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(entries))));
    }

    /** Creates an ArrayValue with the same entries as the given list, any of which may be null (i.e. missing). */
    public static <E> ArrayValue<E> copyOf(List<? extends E> entries) {
        return new ArrayValue<>(Collections.unmodifiableList(new ArrayList<>(entries)));
    }

    /** Creates an ArrayValue of doubles. */
    public static ArrayValue<Double> ofDoubles(double... entries) {
        return new ArrayValue<>(Arrays.stream(entries).boxed().collect(Collectors.toUnmodifiableList()));
    }

    public int size() {
        return entries.size();
    }

    /** @throws IndexOutOfBoundsException if index is out of range. */
    public E get(int index) {
        return entries.get(index);
    }

    public boolean isMissing(int index) {
        return entries.get(index) == null;
    }

    /** Returns the indices of all missing (i.e. null) entries, in increasing order. */
    public List<Integer> getMissingIndices() {
        return IntStream.range(0, entries.size())
                .filter(this::isMissing)
                .boxed()
                .collect(Collectors.toUnmodifiableList());
    }

    /** Returns a copy of this ArrayValue with the entry at index replaced by entry. */
    public ArrayValue<E> with(int index, E entry) {
        List<E> copy = new ArrayList<>(entries);
        copy.set(index, entry);
        return new ArrayValue<>(Collections.unmodifiableList(copy));
    }

    /**
     * Returns a copy of this ArrayValue where the entries at the given indices are taken from source. All other entries
     * are kept.
     *
     * @throws IllegalArgumentException if source's size differs from this ArrayValue's size.
     * @throws IndexOutOfBoundsException if any index is out of range.
     */
    public ArrayValue<E> withEntriesFrom(ArrayValue<? extends E> source, Collection<Integer> indices) {
        if (source.size() != size()) {
            String message = String.format("Expected source of size %s but found size %s: %s", size(), source.size(),
                    source);
            throw new IllegalArgumentException(message);
        }
        List<E> copy = new ArrayList<>(entries);
        indices.forEach(index -> copy.set(index, source.get(index)));
        return new ArrayValue<>(Collections.unmodifiableList(copy));
    }

    /** Applies mapper to every entry, including missing ones. */
    public <R> ArrayValue<R> map(Function<? super E, ? extends R> mapper) {
        List<R> mapped = new ArrayList<>(entries.size());
        entries.forEach(entry -> mapped.add(mapper.apply(entry)));
        return new ArrayValue<>(Collections.unmodifiableList(mapped));
    }

    /** An unmodifiable view of this ArrayValue's entries. */
    public List<E> asList() {
        return entries;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof ArrayValue)) {
            return false;
        }

        ArrayValue<?> other = (ArrayValue<?>) object;
        return Objects.equals(entries, other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
