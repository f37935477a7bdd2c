/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An immutable, ordered group of members that can be bound as a single parent. Members may be Nodes, other
 * Containers, or plain constants. A Container's value is the list of its members' current values, so a parent bound
 * to a Container sees, for example, a List of Doubles where the Container held a list of Stochastics.
 *
 * Binding a Container as a parent makes the bound Node a child of every Node inside it (including Nodes inside nested
 * Containers).
 */
public final class Container {
    private final List<Object> members;
    private final Set<Node> variables; // Derived, frequently-used value

    private Container(List<Object> members) {
        this.members = members;
        this.variables = collectVariables(members);
    }

    private static Set<Node> collectVariables(List<Object> members) {
        Set<Node> variables = new LinkedHashSet<>();
        for (Object member : members) {
            if (member instanceof Node) {
                variables.add((Node) member);
            } else if (member instanceof Container) {
                variables.addAll(((Container) member).getVariables());
            }
        }
        return Collections.unmodifiableSet(variables);
    }

    /** Creates a Container with the given members. Null members are allowed and are treated as constants. */
    public static Container of(Object... members) {
        return new Container(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(members))));
    }

    public static Container copyOf(List<?> members) {
        return new Container(Collections.unmodifiableList(new ArrayList<>(members)));
    }

    public List<Object> getMembers() {
        return members;
    }

    /** Returns every Node in this Container, flattening nested Containers. */
    public Set<Node> getVariables() {
        return variables;
    }

    public Set<Node> getStochastics() {
        return variablesOfKind(Node.Kind.STOCHASTIC);
    }

    public Set<Node> getDeterministics() {
        return variablesOfKind(Node.Kind.DETERMINISTIC);
    }

    private Set<Node> variablesOfKind(Node.Kind kind) {
        return variables.stream()
                .filter(variable -> variable.getKind() == kind)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Answers whether node is in this Container, including any nested Containers. */
    public boolean contains(Node node) {
        return variables.contains(node);
    }

    /**
     * Returns the current value of each member, in order: ValueBearing Nodes yield their values, nested Containers
     * yield their lists, and constants yield themselves.
     */
    public List<Object> getValue() {
        List<Object> values = new ArrayList<>(members.size());
        members.forEach(member -> values.add(valueOf(member)));
        return Collections.unmodifiableList(values);
    }

    /**
     * Resolves a parent reference (a ValueBearing Node, a Container, or a constant) to its current value.
     *
     * @throws IllegalArgumentException if reference is a Node without a value.
     */
    static Object valueOf(Object reference) {
        if (reference instanceof ValueBearing) {
            return ((ValueBearing<?>) reference).getValue();
        }
        if (reference instanceof Container) {
            return ((Container) reference).getValue();
        }
        if (reference instanceof Node) {
            throw new IllegalArgumentException("Node has no value to use as an argument: " + reference);
        }
        return reference;
    }

    @Override
    public String toString() {
        return members.toString();
    }
}
