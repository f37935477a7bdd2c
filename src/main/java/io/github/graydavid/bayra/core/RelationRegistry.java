/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.Collection;
import java.util.List;

/**
 * The only mutator of Nodes' {@link Relations}. Every registration goes through here in pairs of bind/unbind
 * operations, each of which records its inverse in an {@link UndoJournal}, so that the parent-to-child direction of
 * the graph always mirrors the child-to-parent direction held in {@link ParentBindings}.
 */
final class RelationRegistry {
    private RelationRegistry() {}

    /** Returns the Nodes that binding reference would make an owner a child of. */
    static Collection<Node> nodesReferencedBy(Object reference) {
        if (reference instanceof Node) {
            return List.of((Node) reference);
        }
        if (reference instanceof Container) {
            return ((Container) reference).getVariables();
        }
        return List.of();
    }

    /** Adds one reference from owner to every Node in reference. Constants are ignored. */
    static void bindReference(Node owner, Object reference, UndoJournal journal) {
        nodesReferencedBy(reference).forEach(parent -> bindChild(owner, parent, journal));
    }

    /** Removes one reference from owner to every Node in reference. Constants are ignored. */
    static void unbindReference(Node owner, Object reference, UndoJournal journal) {
        nodesReferencedBy(reference).forEach(parent -> unbindChild(owner, parent, journal));
    }

    static void bindChild(Node owner, Node parent, UndoJournal journal) {
        parent.getRelations().addChildReference(owner);
        journal.record(() -> parent.getRelations().removeChildReference(owner));
    }

    static void unbindChild(Node owner, Node parent, UndoJournal journal) {
        parent.getRelations().removeChildReference(owner);
        journal.record(() -> parent.getRelations().addChildReference(owner));
    }

    /** Registers a density-bearing owner as an extended child of each of its current extended parents. */
    static void attachExtendedParents(Node owner, UndoJournal journal) {
        if (!owner.getKind().hasLogp()) {
            return;
        }
        for (Node extendedParent : owner.getExtendedParents()) {
            if (extendedParent.getRelations().addExtendedChild(owner)) {
                journal.record(() -> extendedParent.getRelations().removeExtendedChild(owner));
            }
        }
    }

    /** Deregisters a density-bearing owner from the extended children of each of its current extended parents. */
    static void detachExtendedParents(Node owner, UndoJournal journal) {
        if (!owner.getKind().hasLogp()) {
            return;
        }
        for (Node extendedParent : owner.getExtendedParents()) {
            if (extendedParent.getRelations().removeExtendedChild(owner)) {
                journal.record(() -> extendedParent.getRelations().addExtendedChild(owner));
            }
        }
    }
}
