/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Computes "extended" relations: relations that look through Deterministic Nodes to the nearest density-bearing Nodes
 * on the other side. Deterministics are pure computations, so for the purposes of likelihood computation, a
 * Stochastic whose parent is a Deterministic really depends on whatever that Deterministic depends on.
 *
 * Both algorithms assume the graph is acyclic. Bayra guarantees that by rejecting cycles at bind time (see
 * {@link ParentBindings#rebind(String, Object)}); without that guarantee, these algorithms would never terminate.
 */
public class Closures {
    private Closures() {}

    /**
     * Returns the nearest density-bearing descendants reachable from children: every Deterministic in children is
     * replaced by its own children, repeatedly, until no Deterministics remain.
     */
    public static Set<Node> extendChildren(Collection<Node> children) {
        Set<Node> extended = new LinkedHashSet<>(children);
        boolean replacedDeterministic = true;
        while (replacedDeterministic) {
            replacedDeterministic = false;
            for (Node child : Set.copyOf(extended)) {
                if (child.getKind() == Node.Kind.DETERMINISTIC) {
                    extended.remove(child);
                    extended.addAll(child.getChildren());
                    replacedDeterministic = true;
                }
            }
        }
        return Collections.unmodifiableSet(extended);
    }

    /**
     * Returns the nearest density-bearing ancestors implied by a collection of parent references. Stochastics are kept
     * as-is; Deterministics are replaced by their extended parents; Containers contribute their Stochastics and the
     * extended parents of their Deterministics. Constants and Potentials contribute nothing: a Potential has no value,
     * so it can never be something another Node's likelihood depends on.
     *
     * Applying this method to a set of Stochastics returns that same set.
     */
    public static Set<Node> extendParents(Collection<?> parents) {
        Set<Node> extended = new LinkedHashSet<>();
        for (Object parent : parents) {
            if (parent instanceof Node) {
                addExtendedParentsOf((Node) parent, extended);
            } else if (parent instanceof Container) {
                ((Container) parent).getVariables().forEach(variable -> addExtendedParentsOf(variable, extended));
            }
        }
        return Collections.unmodifiableSet(extended);
    }

    private static void addExtendedParentsOf(Node parent, Set<Node> extended) {
        switch (parent.getKind()) {
            case STOCHASTIC:
                extended.add(parent);
                break;
            case DETERMINISTIC:
                extended.addAll(parent.getExtendedParents());
                break;
            case POTENTIAL:
                break;
            default:
                throw new IllegalStateException("Unexpected kind: " + parent.getKind());
        }
    }
}
