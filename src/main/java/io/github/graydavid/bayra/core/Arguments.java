/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable snapshot of the current values of a Node's parents, keyed by parent name. This is what the functions
 * behind Nodes (log-probabilities, deterministic evaluations, random draws) receive as input. Nodes and Containers are
 * resolved to their current values when the snapshot is taken; constants are passed as-is.
 */
public final class Arguments {
    private static final Arguments EMPTY = new Arguments(Map.of());

    private final Map<String, Object> values;

    private Arguments(Map<String, Object> values) {
        this.values = values;
    }

    /** Creates Arguments from the given name-to-value mappings. Values may be null; names may not. */
    public static Arguments of(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> copy.put(Objects.requireNonNull(name), value));
        return new Arguments(Collections.unmodifiableMap(copy));
    }

    public static Arguments empty() {
        return EMPTY;
    }

    /**
     * Returns a copy of these Arguments with one more (or one replaced) name-to-value mapping.
     */
    public Arguments with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(Objects.requireNonNull(name), value);
        return new Arguments(Collections.unmodifiableMap(copy));
    }

    /** @throws IllegalArgumentException if there's no argument with the given name. */
    public Object get(String name) {
        if (!values.containsKey(name)) {
            String message = String.format("No argument named '%s'. Available arguments: %s", name, values.keySet());
            throw new IllegalArgumentException(message);
        }
        return values.get(name);
    }

    /**
     * Returns the named argument as an instance of the given class.
     *
     * @throws IllegalArgumentException if there's no argument with the given name.
     * @throws TypeConversionException if the argument is not an instance of type.
     */
    public <A> A get(String name, Class<A> type) {
        Object value = get(name);
        if (value != null && !type.isInstance(value)) {
            String message = String.format("Argument '%s' is a '%s', which can't be used as a '%s': %s", name,
                    value.getClass().getName(), type.getName(), value);
            throw new TypeConversionException(message);
        }
        return type.cast(value);
    }

    /**
     * Returns the named argument as a double.
     *
     * @throws IllegalArgumentException if there's no argument with the given name.
     * @throws TypeConversionException if the argument is null or is not a Number.
     */
    public double getDouble(String name) {
        Number number = get(name, Number.class);
        if (number == null) {
            throw new TypeConversionException(String.format("Argument '%s' is null, not a number", name));
        }
        return number.doubleValue();
    }

    /** Returns the named argument as an ArrayValue. Same exceptions as {@link #get(String, Class)}. */
    public ArrayValue<?> getArray(String name) {
        return get(name, ArrayValue.class);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof Arguments)) {
            return false;
        }

        Arguments other = (Arguments) object;
        return Objects.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
