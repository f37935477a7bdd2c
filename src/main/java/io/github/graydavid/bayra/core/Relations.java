/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The relation sets that other Nodes maintain on a Node's behalf: which Nodes depend on it (children) and which
 * density-bearing Nodes depend on it through Deterministics (extended children). Only {@link RelationRegistry} mutates
 * these; everything else sees unmodifiable views.
 *
 * Children are reference counted: a child that binds this Node under several names (or inside several Containers)
 * counts once per reference but appears in the children set once, until its last reference is gone.
 */
final class Relations {
    private final Map<Node, Integer> childReferenceCounts = new LinkedHashMap<>();
    private final Set<Node> children = Collections.unmodifiableSet(childReferenceCounts.keySet());
    private final Set<Node> mutableExtendedChildren = new LinkedHashSet<>();
    private final Set<Node> extendedChildren = Collections.unmodifiableSet(mutableExtendedChildren);

    Set<Node> getChildren() {
        return children;
    }

    Set<Node> getExtendedChildren() {
        return extendedChildren;
    }

    int getChildReferenceCount(Node child) {
        return childReferenceCounts.getOrDefault(child, 0);
    }

    void addChildReference(Node child) {
        childReferenceCounts.merge(child, 1, Integer::sum);
    }

    /** @throws IllegalStateException if child has no references left to remove. */
    void removeChildReference(Node child) {
        int count = getChildReferenceCount(child);
        if (count == 0) {
            throw new IllegalStateException("Tried to remove a child reference that doesn't exist: " + child);
        }
        if (count == 1) {
            childReferenceCounts.remove(child);
        } else {
            childReferenceCounts.put(child, count - 1);
        }
    }

    boolean addExtendedChild(Node extendedChild) {
        return mutableExtendedChildren.add(extendedChild);
    }

    boolean removeExtendedChild(Node extendedChild) {
        return mutableExtendedChildren.remove(extendedChild);
    }
}
