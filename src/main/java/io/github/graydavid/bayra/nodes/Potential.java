/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.nodes;

import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.bayra.core.Arguments;
import io.github.graydavid.bayra.core.LazyFunction;
import io.github.graydavid.bayra.core.LogProbabilities;
import io.github.graydavid.bayra.core.Node;
import io.github.graydavid.bayra.core.Role;
import io.github.graydavid.bayra.core.ZeroProbabilityException;

/**
 * An extra log-probability term that a model adds to its joint density as a function of its parents' values. A
 * Potential has no value of its own, so it can never be a parent. Its log-probability can only be read: it changes
 * only when its parents' values do.
 */
public class Potential extends Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Potential.class);

    private final Function<? super Arguments, ? extends Number> logpFunction;

    private Potential(Builder builder, Function<? super Arguments, ? extends Number> logpFunction) {
        super(Kind.POTENTIAL, builder);
        this.logpFunction = Objects.requireNonNull(logpFunction);

        bindParents();
        try {
            regenerateLazyFunction();
            getLogp();
        } catch (RuntimeException | Error e) {
            abandonConstruction();
            throw e;
        }
    }

    public static Builder builder(Role role) {
        return new Builder(role);
    }

    @Override
    protected LazyFunction<Number> createLazyFunction() {
        return new LazyFunction<>(logpFunction, () -> getParents().getValues(), getExtendedParents(), getCacheDepth());
    }

    /**
     * Returns the log-probability term given the parents' current values, computing it only if necessary.
     *
     * @throws ZeroProbabilityException if the computed term is at or below {@link Node#LOG_ZERO}. The exception carries
     *         the parent values, since a Potential has no value of its own. See {@link Stochastic#getLogp()} for the
     *         other exceptions.
     */
    public double getLogp() {
        LOGGER.trace("{}: logp accessed", this);
        Object rawLogp = evaluateLazyFunction();
        double logp = LogProbabilities.requireValid(getRole(), rawLogp,
                () -> ZeroProbabilityException.forParents(getRole(), getParents().getValues()));
        LOGGER.trace("{}: returning logp {}", this, logp);
        return logp;
    }

    /** A builder for Potentials. Good for only one use. */
    public static final class Builder extends Node.Builder<Builder> {
        private Builder(Role role) {
            super(role);
        }

        @Override
        protected Builder getThis() {
            return this;
        }

        /**
         * Builds the Potential: binds its parents and computes and validates its initial log-probability term.
         *
         * @throws ZeroProbabilityException if the initial term is log(0). Also all of the other exceptions from
         *         {@link Potential#getLogp()}.
         */
        public Potential build(Function<? super Arguments, ? extends Number> logpFunction) {
            requireHasNotBuilt();
            setHasBuilt();
            return new Potential(this, logpFunction);
        }
    }
}
