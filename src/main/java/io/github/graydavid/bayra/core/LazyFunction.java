/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Memoizes a function of a Node's parent values. The function's result is cached along with the state of its
 * "ultimate arguments": the Stochastics whose values, directly or through Deterministics, determine the function's
 * inputs. A cached result is reused as long as every ultimate argument still holds the very same value instance that
 * it held when the result was computed.
 *
 * A Stochastic that reverts to its last value puts back the same instance, which matches an older cache frame, so
 * nothing is recomputed. Values must be immutable for identity to be a valid key.
 *
 * Up to cacheDepth results are remembered, most recent first.
 *
 * @param <T> the type of the function's result.
 */
public final class LazyFunction<T> {
    private final Function<? super Arguments, ? extends T> function;
    private final Supplier<Arguments> arguments;
    private final List<Node> ultimateArguments;
    private final int cacheDepth;
    private final Deque<Frame<T>> frames;

    /**
     * @param function computes the result from the current arguments.
     * @param arguments supplies the current arguments each time the function needs to be called.
     * @param ultimateArguments the Nodes whose values decide whether a cached result is still valid.
     * @param cacheDepth the maximum number of cached results.
     *
     * @throws IllegalArgumentException if cacheDepth is not positive.
     */
    public LazyFunction(Function<? super Arguments, ? extends T> function, Supplier<Arguments> arguments,
            Collection<? extends Node> ultimateArguments, int cacheDepth) {
        if (cacheDepth < 1) {
            throw new IllegalArgumentException("cacheDepth must be positive but was " + cacheDepth);
        }
        this.function = Objects.requireNonNull(function);
        this.arguments = Objects.requireNonNull(arguments);
        this.ultimateArguments = List.copyOf(ultimateArguments);
        this.cacheDepth = cacheDepth;
        this.frames = new ArrayDeque<>(cacheDepth);
    }

    /** Returns a cached result if one matches the ultimate arguments' current values; otherwise, computes one. */
    public T get() {
        Object[] state = captureState();
        for (Frame<T> frame : frames) {
            if (frame.matches(state)) {
                return frame.result;
            }
        }
        return compute(state);
    }

    /** Computes and caches a result, regardless of whether a cached result would have matched. */
    public T forceCompute() {
        return compute(captureState());
    }

    private T compute(Object[] state) {
        T result = function.apply(arguments.get());
        frames.addFirst(new Frame<>(state, result));
        while (frames.size() > cacheDepth) {
            frames.removeLast();
        }
        return result;
    }

    private Object[] captureState() {
        Object[] state = new Object[ultimateArguments.size()];
        for (int i = 0; i < state.length; ++i) {
            Node argument = ultimateArguments.get(i);
            state[i] = (argument instanceof ValueBearing) ? ((ValueBearing<?>) argument).getValue() : argument;
        }
        return state;
    }

    public List<Node> getUltimateArguments() {
        return ultimateArguments;
    }

    public int getCacheDepth() {
        return cacheDepth;
    }

    /** The number of results currently cached. */
    public int getCachedResultCount() {
        return frames.size();
    }

    /** A cached result along with the ultimate-argument state it was computed from. */
    private static class Frame<T> {
        private final Object[] state;
        private final T result;

        private Frame(Object[] state, T result) {
            this.state = state;
            this.result = result;
        }

        private boolean matches(Object[] otherState) {
            for (int i = 0; i < state.length; ++i) {
                if (state[i] != otherState[i]) {
                    return false;
                }
            }
            return true;
        }
    }
}
