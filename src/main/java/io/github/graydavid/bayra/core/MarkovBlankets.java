/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Derives the neighborhoods that samplers need from a Node's extended relations. Everything is recomputed on each call
 * from the incrementally-maintained extended parents and children.
 */
public class MarkovBlankets {
    private MarkovBlankets() {}

    /** The extended parents of every one of node's extended children, plus node itself. */
    public static Set<Node> coparents(Node node) {
        Set<Node> coparents = new LinkedHashSet<>();
        node.getExtendedChildren().forEach(child -> coparents.addAll(child.getExtendedParents()));
        coparents.add(node);
        return Collections.unmodifiableSet(coparents);
    }

    /**
     * Node's neighbors in the moral graph: its coparents, extended parents, and extended children, without Potentials
     * (which contribute density but aren't variables). Note that node itself is included, as a coparent.
     */
    public static Set<Node> moralNeighbors(Node node) {
        Set<Node> neighbors = new LinkedHashSet<>(coparents(node));
        neighbors.addAll(node.getExtendedParents());
        neighbors.addAll(node.getExtendedChildren());
        neighbors.removeIf(neighbor -> neighbor.getKind() == Node.Kind.POTENTIAL);
        return Collections.unmodifiableSet(neighbors);
    }

    /** Node's moral neighbors plus node itself. */
    public static Set<Node> markovBlanket(Node node) {
        Set<Node> blanket = new LinkedHashSet<>(moralNeighbors(node));
        blanket.add(node);
        return Collections.unmodifiableSet(blanket);
    }
}
