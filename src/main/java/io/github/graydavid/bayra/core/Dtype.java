/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * The declared element type of a Node's value. When a Node has a Dtype, every value it takes on is first coerced
 * through it, so that (for example) a Stochastic declared as DOUBLE holds a Double even if the caller or a random draw
 * provided an Integer.
 *
 * Coercion is numeric: integral Dtypes truncate, BOOLEAN treats non-zero numbers as true. {@link #arrayOf(Dtype)}
 * coerces each entry of an ArrayValue while keeping missing (null) entries missing.
 */
public final class Dtype<T> {
    public static final Dtype<Double> DOUBLE = new Dtype<>("double", Dtype::toDouble);
    public static final Dtype<Long> LONG = new Dtype<>("long", Dtype::toLong);
    public static final Dtype<Integer> INTEGER = new Dtype<>("integer", Dtype::toInteger);
    public static final Dtype<Boolean> BOOLEAN = new Dtype<>("boolean", Dtype::toBoolean);

    private final String name;
    private final Function<Object, T> converter;

    private Dtype(String name, Function<Object, T> converter) {
        this.name = name;
        this.converter = converter;
    }

    /** Creates a Dtype for ArrayValues whose (non-missing) entries are coerced through elementType. */
    public static <E> Dtype<ArrayValue<E>> arrayOf(Dtype<E> elementType) {
        Objects.requireNonNull(elementType);
        return new Dtype<>("array<" + elementType.name + ">", value -> {
            if (!(value instanceof ArrayValue)) {
                throw conversionException(value, "array<" + elementType.name + ">");
            }
            ArrayValue<?> array = (ArrayValue<?>) value;
            return array.map(entry -> entry == null ? null : elementType.coerce(entry));
        });
    }

    /**
     * Coerces value to this Dtype.
     *
     * @throws TypeConversionException if value is null or can't be converted.
     */
    public T coerce(Object value) {
        if (value == null) {
            throw conversionException(null, name);
        }
        return converter.apply(value);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    private static Double toDouble(Object value) {
        return requireNumber(value, "double").doubleValue();
    }

    private static Long toLong(Object value) {
        return requireNumber(value, "long").longValue();
    }

    private static Integer toInteger(Object value) {
        return requireNumber(value, "integer").intValue();
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return requireNumber(value, "boolean").doubleValue() != 0.0;
    }

    private static Number requireNumber(Object value, String dtypeName) {
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        throw conversionException(value, dtypeName);
    }

    private static TypeConversionException conversionException(Object value, String dtypeName) {
        String type = value == null ? "null" : value.getClass().getName();
        String message = String.format("Can't coerce value '%s' of type '%s' to dtype '%s'", value, type, dtypeName);
        return new TypeConversionException(message);
    }
}
