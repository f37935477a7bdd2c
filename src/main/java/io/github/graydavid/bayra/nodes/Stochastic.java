/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.nodes;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.bayra.core.Arguments;
import io.github.graydavid.bayra.core.ArrayValue;
import io.github.graydavid.bayra.core.DataIsFixedException;
import io.github.graydavid.bayra.core.Dtype;
import io.github.graydavid.bayra.core.LazyFunction;
import io.github.graydavid.bayra.core.LogProbabilities;
import io.github.graydavid.bayra.core.MarkovBlankets;
import io.github.graydavid.bayra.core.MissingInitialValueException;
import io.github.graydavid.bayra.core.NoRandomCapabilityException;
import io.github.graydavid.bayra.core.Node;
import io.github.graydavid.bayra.core.Role;
import io.github.graydavid.bayra.core.TypeConversionException;
import io.github.graydavid.bayra.core.ValueBearing;
import io.github.graydavid.bayra.core.ZeroProbabilityException;

/**
 * A variable whose value is not determined by the values of its parents. A Stochastic owns its value, and its
 * log-probability function scores that value given its parents' values. Samplers drive a model by setting Stochastics'
 * values, reading log-probabilities, and reverting values they reject.
 *
 * The log-probability function receives the parents' current values along with this Stochastic's own value, under
 * the name {@value #VALUE_ARGUMENT}. Because of that, no parent may use that name.
 *
 * A Stochastic may be data: its value is observed and can't be changed. Data may still have missing entries: if the
 * initial value is an {@link ArrayValue} with null entries, those entries are drawn from the random function at
 * creation and remain free afterwards. Setting the value of such a Stochastic only updates its missing entries.
 *
 * @param <T> the type of this Stochastic's value.
 */
public class Stochastic<T> extends Node implements ValueBearing<T> {
    /** The name under which the log-probability function receives this Stochastic's own value. */
    public static final String VALUE_ARGUMENT = "value";

    private static final Logger LOGGER = LoggerFactory.getLogger(Stochastic.class);

    private final Function<? super Arguments, ? extends Number> logpFunction;
    private final Function<? super Arguments, ? extends T> randomFunction;
    private final Dtype<? extends T> dtype;
    private final boolean isData;
    private final boolean trace;
    private T value;
    private T lastValue;
    private List<Integer> missing;

    private Stochastic(Builder<T> builder, Function<? super Arguments, ? extends Number> logpFunction) {
        super(Kind.STOCHASTIC, builder);
        this.logpFunction = Objects.requireNonNull(logpFunction);
        this.randomFunction = builder.randomFunction;
        this.dtype = builder.dtype;
        this.isData = builder.isData;
        this.trace = builder.trace;

        bindParents();
        try {
            this.value = resolveInitialValue(builder.value);
            this.lastValue = value;
            regenerateLazyFunction();
            getLogp();
        } catch (RuntimeException | Error e) {
            abandonConstruction();
            throw e;
        }
    }

    /**
     * Starts the creation of a Stochastic. Since the value type can't be inferred from the role alone, callers will
     * usually need a type witness: {@code Stochastic.<Double>builder(Role.of("mu"))}.
     */
    public static <T> Builder<T> builder(Role role) {
        return new Builder<>(role);
    }

    private T resolveInitialValue(T initialValue) {
        T resolved = initialValue;
        if (resolved == null) {
            resolved = draw(() -> String.format(
                    "Stochastic '%s''s value initialized to null; no initial value or random function provided",
                    getRole()));
        }
        resolved = coerce(resolved);

        missing = (resolved instanceof ArrayValue) ? ((ArrayValue<?>) resolved).getMissingIndices() : List.of();
        if (!missing.isEmpty()) {
            T drawn = coerce(draw(() -> String.format(
                    "Stochastic '%s''s value has missing entries at %s; no random function provided to fill them",
                    getRole(), missing)));
            resolved = withMissingEntriesFrom(resolved, drawn);
        }
        return resolved;
    }

    private T draw(Supplier<String> missingMessage) {
        if (randomFunction == null) {
            throw new MissingInitialValueException(missingMessage.get());
        }
        return randomFunction.apply(getParents().getValues());
    }

    private T coerce(T rawValue) {
        return (dtype == null) ? rawValue : dtype.coerce(rawValue);
    }

    /** Returns target with its missing entries replaced by those in source. Both must be ArrayValues. */
    private T withMissingEntriesFrom(T target, T source) {
        if (!(target instanceof ArrayValue) || !(source instanceof ArrayValue)) {
            String message = String.format(
                    "%s has missing entries %s, so its values must be ArrayValues, but found '%s'", this, missing, source);
            throw new TypeConversionException(message);
        }
        // Suppress justification: target is an ArrayValue<E> for some E, and so is the T-typed copy derived from it
        @SuppressWarnings("unchecked")
        ArrayValue<Object> targetArray = (ArrayValue<Object>) target;
        @SuppressWarnings("unchecked")
        T merged = (T) targetArray.withEntriesFrom((ArrayValue<?>) source, missing);
        return merged;
    }

    @Override
    protected LazyFunction<Number> createLazyFunction() {
        Set<Node> ultimateArguments = new LinkedHashSet<>(getExtendedParents());
        ultimateArguments.add(this);
        return new LazyFunction<>(logpFunction, () -> getParents().getValues().with(VALUE_ARGUMENT, value),
                ultimateArguments, getCacheDepth());
    }

    /** Returns this Stochastic's current value. */
    @Override
    public T getValue() {
        LOGGER.trace("{}: value accessed", this);
        return value;
    }

    /**
     * Sets this Stochastic's value, remembering the current value as the last value (by reference: see
     * {@link LazyFunction} for why that matters). If this Stochastic has a Dtype, newValue is coerced through it first.
     *
     * @throws DataIsFixedException if this Stochastic is data without missing entries.
     * @throws TypeConversionException if newValue can't be coerced to the Dtype, or if this Stochastic is data with
     *         missing entries but newValue isn't an ArrayValue.
     * @throws IllegalArgumentException if this Stochastic is data with missing entries but newValue's size differs from
     *         the current value's size.
     */
    public void setValue(T newValue) {
        Objects.requireNonNull(newValue);
        T resolved = newValue;
        if (isData) {
            if (missing.isEmpty()) {
                String message = String.format("Stochastic '%s''s value cannot be updated if isData flag is set",
                        getRole());
                throw new DataIsFixedException(message);
            }
            resolved = withMissingEntriesFrom(value, coerce(newValue));
        }
        T coerced = coerce(resolved);
        LOGGER.debug("{}: value set to {}", this, coerced);
        lastValue = value;
        value = coerced;
    }

    /**
     * Sets this Stochastic's value back to its last value. Bypasses all of the checks and coercion in
     * {@link #setValue(Object)}: the last value was already checked when it was set.
     */
    public void revert() {
        LOGGER.debug("{}: value reverted to {}", this, lastValue);
        value = lastValue;
    }

    public T getLastValue() {
        return lastValue;
    }

    /**
     * Returns the log-probability of this Stochastic's current value given its parents' values, computing it only if
     * necessary.
     *
     * @throws TypeConversionException if the computed log-probability is null.
     * @throws io.github.graydavid.bayra.core.NumericValidityException if the computed log-probability is NaN or
     *         positive infinity.
     * @throws ZeroProbabilityException if the computed log-probability is at or below {@link Node#LOG_ZERO}.
     */
    public double getLogp() {
        LOGGER.trace("{}: logp accessed", this);
        Object rawLogp = evaluateLazyFunction();
        double logp = LogProbabilities.requireValid(getRole(), rawLogp,
                () -> ZeroProbabilityException.forValue(getRole(), value, getParents().getValues()));
        LOGGER.trace("{}: returning logp {}", this, logp);
        return logp;
    }

    /**
     * Draws a new value given the parents' current values, sets it as this Stochastic's value (through
     * {@link #setValue(Object)}, with all of its checks), and returns it.
     *
     * @throws NoRandomCapabilityException if this Stochastic was built without a random function.
     */
    public T random() {
        if (randomFunction == null) {
            String message = String.format("Stochastic '%s' does not know how to draw its value", getRole());
            throw new NoRandomCapabilityException(message);
        }
        T drawn = randomFunction.apply(getParents().getValues());
        setValue(drawn);
        return drawn;
    }

    /** Shorthand for {@link #random()}. */
    public T rand() {
        return random();
    }

    public boolean isData() {
        return isData;
    }

    /** The indices of the entries that were missing from the initial value, and which remain free to be sampled. */
    public List<Integer> getMissing() {
        return missing;
    }

    /** Whether samplers should record this Stochastic's values. */
    public boolean isTrace() {
        return trace;
    }

    public Optional<Dtype<? extends T>> getDtype() {
        return Optional.ofNullable(dtype);
    }

    public boolean hasRandomFunction() {
        return randomFunction != null;
    }

    /** See {@link MarkovBlankets#coparents(Node)}. */
    public Set<Node> getCoparents() {
        return MarkovBlankets.coparents(this);
    }

    /** See {@link MarkovBlankets#moralNeighbors(Node)}. */
    public Set<Node> getMoralNeighbors() {
        return MarkovBlankets.moralNeighbors(this);
    }

    /** See {@link MarkovBlankets#markovBlanket(Node)}. */
    public Set<Node> getMarkovBlanket() {
        return MarkovBlankets.markovBlanket(this);
    }

    /** A builder for Stochastics. Good for only one use. */
    public static final class Builder<T> extends Node.Builder<Builder<T>> {
        private T value;
        private Function<? super Arguments, ? extends T> randomFunction;
        private Dtype<? extends T> dtype;
        private boolean isData = false;
        private boolean trace = true;

        private Builder(Role role) {
            super(role);
        }

        @Override
        protected Builder<T> getThis() {
            return this;
        }

        /**
         * Same as {@link Node.Builder#parent(String, Object)}, except that {@value Stochastic#VALUE_ARGUMENT} is
         * reserved.
         *
         * @throws IllegalArgumentException if name is {@value Stochastic#VALUE_ARGUMENT}.
         */
        @Override
        public Builder<T> parent(String name, Object reference) {
            if (VALUE_ARGUMENT.equals(name)) {
                throw new IllegalArgumentException(
                        "'" + VALUE_ARGUMENT + "' is reserved for the Stochastic's own value and can't name a parent");
            }
            return super.parent(name, reference);
        }

        /**
         * The initial value. If not set, the random function draws one. If the value is an ArrayValue with missing
         * entries, the random function fills those in.
         */
        public Builder<T> value(T value) {
            requireHasNotBuilt();
            this.value = Objects.requireNonNull(value);
            return this;
        }

        /** Draws a new value given the parents' current values. */
        public Builder<T> random(Function<? super Arguments, ? extends T> randomFunction) {
            requireHasNotBuilt();
            this.randomFunction = Objects.requireNonNull(randomFunction);
            return this;
        }

        /** The element type that every value is coerced to. By default, values are used as-is. */
        public Builder<T> dtype(Dtype<? extends T> dtype) {
            requireHasNotBuilt();
            this.dtype = Objects.requireNonNull(dtype);
            return this;
        }

        /** Whether the value is observed (and so fixed, apart from any missing entries). Defaults to false. */
        public Builder<T> isData(boolean isData) {
            requireHasNotBuilt();
            this.isData = isData;
            return this;
        }

        /** Whether samplers should record this Stochastic's values. Defaults to true. */
        public Builder<T> trace(boolean trace) {
            requireHasNotBuilt();
            this.trace = trace;
            return this;
        }

        /**
         * Builds the Stochastic: binds its parents, resolves its initial value, and computes and validates its initial
         * log-probability.
         *
         * @param logpFunction computes the log-probability of the {@value Stochastic#VALUE_ARGUMENT} argument given
         *        the parents' values.
         *
         * @throws MissingInitialValueException if there's no initial value (or it has missing entries) and no random
         *         function.
         * @throws ZeroProbabilityException if the initial log-probability is log(0). Also all of the other exceptions
         *         from {@link Stochastic#getLogp()}.
         */
        public Stochastic<T> build(Function<? super Arguments, ? extends Number> logpFunction) {
            requireHasNotBuilt();
            setHasBuilt();
            return new Stochastic<>(this, logpFunction);
        }
    }
}
