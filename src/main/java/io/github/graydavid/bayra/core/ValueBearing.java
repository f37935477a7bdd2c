/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

/**
 * A Node that exposes a value: either one it owns (Stochastic) or one computed from its parents (Deterministic). Only
 * ValueBearing Nodes can be bound as parents of other Nodes.
 */
public interface ValueBearing<T> {
    /**
     * Returns this Node's current value. The value must be treated as immutable: callers must never modify it, which
     * is why array-like values are represented by {@link ArrayValue}.
     */
    T getValue();
}
