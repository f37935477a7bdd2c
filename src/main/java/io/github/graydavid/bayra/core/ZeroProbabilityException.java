/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Indicates that a Node's log-probability is at or below {@link Node#LOG_ZERO}: the model's current state is
 * impossible. Unlike the other ModelExceptions, this one signals a normal condition rather than a bug. Samplers are
 * expected to catch it and reject the state that produced it.
 */
public class ZeroProbabilityException extends ModelException {
    private static final long serialVersionUID = 1;

    private final Role role;
    // Not serialized: values are arbitrary user payloads
    private final transient Object value;
    private final transient Arguments parentValues;

    private ZeroProbabilityException(String message, Role role, Object value, Arguments parentValues) {
        super(message);
        this.role = Objects.requireNonNull(role);
        this.value = value;
        this.parentValues = Objects.requireNonNull(parentValues);
    }

    /** Creates an exception for a value-bearing Node whose value is outside its support given its parents. */
    public static ZeroProbabilityException forValue(Role role, Object value, Arguments parentValues) {
        String message = String.format(
                "Stochastic '%s''s value is outside its support, or it forbids its parents' current values.%nValue: %s%nParents' values: %s",
                role, value, parentValues);
        return new ZeroProbabilityException(message, role, Objects.requireNonNull(value), parentValues);
    }

    /** Creates an exception for a Node without a value (i.e. a Potential) that forbids its parents' values. */
    public static ZeroProbabilityException forParents(Role role, Arguments parentValues) {
        String message = String.format("Potential '%s' forbids its parents' current values: %s", role, parentValues);
        return new ZeroProbabilityException(message, role, null, parentValues);
    }

    public Role getRole() {
        return role;
    }

    /** The offending Node's value, which is empty for Nodes that don't have one. */
    public Optional<Object> getValue() {
        return Optional.ofNullable(value);
    }

    public Arguments getParentValues() {
        return parentValues;
    }
}
