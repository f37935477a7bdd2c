/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.nodes;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.bayra.core.Arguments;
import io.github.graydavid.bayra.core.Dtype;
import io.github.graydavid.bayra.core.ImmutableValueException;
import io.github.graydavid.bayra.core.LazyFunction;
import io.github.graydavid.bayra.core.Node;
import io.github.graydavid.bayra.core.Role;
import io.github.graydavid.bayra.core.ValueBearing;

/**
 * A variable whose value is a function of its parents' values. Deterministics have no log-probability of their own:
 * they're transparent to the density structure of the model, and Nodes that bind them as parents really depend on the
 * Stochastics behind them.
 *
 * @param <T> the type of this Deterministic's value.
 */
public class Deterministic<T> extends Node implements ValueBearing<T> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Deterministic.class);

    private final Function<? super Arguments, ? extends T> evalFunction;
    private final Dtype<? extends T> dtype;
    private final boolean trace;

    private Deterministic(Builder<T> builder, Function<? super Arguments, ? extends T> evalFunction) {
        super(Kind.DETERMINISTIC, builder);
        this.evalFunction = Objects.requireNonNull(evalFunction);
        this.dtype = builder.dtype;
        this.trace = builder.trace;

        bindParents();
        try {
            regenerateLazyFunction();
        } catch (RuntimeException | Error e) {
            abandonConstruction();
            throw e;
        }
    }

    /**
     * Starts the creation of a Deterministic. Since the value type can't be inferred from the role alone, callers will
     * usually need a type witness: {@code Deterministic.<Double>builder(Role.of("sum"))}.
     */
    public static <T> Builder<T> builder(Role role) {
        return new Builder<>(role);
    }

    @Override
    protected LazyFunction<T> createLazyFunction() {
        return new LazyFunction<T>(this::evaluate, () -> getParents().getValues(), getExtendedParents(),
                getCacheDepth());
    }

    private T evaluate(Arguments arguments) {
        T rawValue = evalFunction.apply(arguments);
        return (dtype == null) ? rawValue : dtype.coerce(rawValue);
    }

    /** Returns the result of the eval function on the parents' current values, computing it only if necessary. */
    @Override
    public T getValue() {
        // Suppress justification: createLazyFunction only ever creates LazyFunction<T>s
        @SuppressWarnings("unchecked")
        T value = (T) evaluateLazyFunction();
        LOGGER.trace("{}: returning value {}", this, value);
        return value;
    }

    /**
     * Always fails: a Deterministic's value is determined by its parents.
     *
     * @throws ImmutableValueException always.
     */
    public void setValue(T newValue) {
        String message = String.format("Deterministic '%s''s value cannot be set; it's computed by its eval function",
                getRole());
        throw new ImmutableValueException(message);
    }

    /** Whether samplers should record this Deterministic's values. */
    public boolean isTrace() {
        return trace;
    }

    public Optional<Dtype<? extends T>> getDtype() {
        return Optional.ofNullable(dtype);
    }

    /** A builder for Deterministics. Good for only one use. */
    public static final class Builder<T> extends Node.Builder<Builder<T>> {
        private Dtype<? extends T> dtype;
        private boolean trace = true;

        private Builder(Role role) {
            super(role);
        }

        @Override
        protected Builder<T> getThis() {
            return this;
        }

        /** The type that every computed value is coerced to. By default, values are used as-is. */
        public Builder<T> dtype(Dtype<? extends T> dtype) {
            requireHasNotBuilt();
            this.dtype = Objects.requireNonNull(dtype);
            return this;
        }

        /** Whether samplers should record this Deterministic's values. Defaults to true. */
        public Builder<T> trace(boolean trace) {
            requireHasNotBuilt();
            this.trace = trace;
            return this;
        }

        /**
         * Builds the Deterministic: binds its parents and computes its initial value.
         *
         * @param evalFunction computes the value from the parents' values.
         *
         * @throws io.github.graydavid.bayra.core.TypeConversionException if the initial value can't be coerced to the
         *         Dtype. Also anything that evalFunction throws.
         */
        public Deterministic<T> build(Function<? super Arguments, ? extends T> evalFunction) {
            requireHasNotBuilt();
            setHasBuilt();
            return new Deterministic<>(this, evalFunction);
        }
    }
}
