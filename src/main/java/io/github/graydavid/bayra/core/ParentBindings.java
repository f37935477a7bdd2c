/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.onemoretry.Try;

/**
 * A Node's parents: a mapping from parent name to parent reference, owned exclusively by one Node. A reference is
 * either a ValueBearing Node, a {@link Container}, or a plain constant.
 *
 * ParentBindings keeps the rest of the graph consistent with its mappings at all times:<br>
 * 1. The owner is a child of every Node referenced (directly or inside a Container) by any name, exactly as long as at
 * least one name still references that Node.<br>
 * 2. The owner's extended parents always equal {@link Closures#extendParents(Collection)} of the current references,
 * recomputed from scratch after every change.<br>
 * 3. A density-bearing owner is an extended child of each of its extended parents.<br>
 * 4. The owner's LazyFunction is built from the current references.
 *
 * The set of names is fixed when the owner is created; only the references bound to those names can change, through
 * {@link #rebind(String, Object)}.
 */
public final class ParentBindings {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParentBindings.class);

    private final Node owner;
    private final Map<String, Object> bindings;
    private final Map<String, Object> unmodifiableBindings;
    private boolean attached;

    private ParentBindings(Node owner, Map<String, Object> bindings) {
        this.owner = owner;
        this.bindings = new LinkedHashMap<>(bindings);
        this.unmodifiableBindings = Collections.unmodifiableMap(this.bindings);
        this.attached = false;
    }

    /**
     * Creates the ParentBindings for owner and registers owner with the rest of the graph: as a child of everything it
     * references, with its extended parents computed, and as an extended child of each of those.
     */
    static ParentBindings initialize(Node owner, Map<String, Object> bindings) {
        bindings.forEach(ParentBindings::requireBindable);
        ParentBindings parentBindings = new ParentBindings(owner, bindings);
        UndoJournal journal = UndoJournal.untracked();
        parentBindings.bindings.values().forEach(reference -> RelationRegistry.bindReference(owner, reference, journal));
        owner.setExtendedParents(Closures.extendParents(parentBindings.bindings.values()), journal);
        RelationRegistry.attachExtendedParents(owner, journal);
        parentBindings.attached = true;
        return parentBindings;
    }

    /**
     * Checks that reference can be bound as a parent: it must not be, or contain, a Node without a value.
     *
     * @throws IllegalArgumentException if reference is, or contains, a Node that isn't ValueBearing.
     */
    static void requireBindable(String name, Object reference) {
        boolean bindable = RelationRegistry.nodesReferencedBy(reference)
                .stream()
                .allMatch(node -> node.getKind().hasValue());
        if (!bindable) {
            String message = String.format(
                    "Parent '%s' can't be bound to '%s': only Nodes with values (and Containers of them) can be parents",
                    name, reference);
            throw new IllegalArgumentException(message);
        }
    }

    public Node getOwner() {
        return owner;
    }

    /** @throws IllegalArgumentException if there's no parent with the given name. */
    public Object get(String name) {
        requireKnownName(name);
        return bindings.get(name);
    }

    public Set<String> names() {
        return unmodifiableBindings.keySet();
    }

    /** An unmodifiable view of the name-to-reference mappings. */
    public Map<String, Object> asMap() {
        return unmodifiableBindings;
    }

    /** Every Node referenced by any name, including those inside Containers. */
    public Set<Node> getVariables() {
        return bindings.values()
                .stream()
                .flatMap(reference -> RelationRegistry.nodesReferencedBy(reference).stream())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Resolves every reference to its current value. */
    public Arguments getValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        bindings.forEach((name, reference) -> values.put(name, Container.valueOf(reference)));
        return Arguments.of(values);
    }

    /** Answers whether the owner is currently registered with the rest of the graph (see {@link #detach()}). */
    public boolean isAttached() {
        return attached;
    }

    /**
     * Binds newReference under name, replacing the old reference, and updates the graph to match. The update is
     * transactional: if any part of it fails (including the owner's LazyFunction failing to compute with its new
     * parents), every change is undone, leaving bindings, relations, extended parents and LazyFunctions exactly as they
     * were, and the failure is rethrown.
     *
     * When the owner is a Deterministic, the closures of every downstream Node that looks through it are recomputed as
     * part of the same transaction.
     *
     * @throws IllegalArgumentException if there's no parent with the given name, or if newReference can't be bound
     *         (see {@link Node.Builder#parent(String, Object)}).
     * @throws IllegalStateException if the owner is detached.
     * @throws CyclicDependencyException if binding newReference would make the owner its own ancestor.
     */
    public void rebind(String name, Object newReference) {
        requireKnownName(name);
        requireBindable(name, newReference);
        requireAttached();
        requireNoCycle(name, newReference);

        Object oldReference = bindings.get(name);
        LOGGER.debug("Rebinding parent '{}' of {} from '{}' to '{}'", name, owner, oldReference, newReference);
        UndoJournal journal = UndoJournal.tracking();
        try {
            RelationRegistry.detachExtendedParents(owner, journal);
            RelationRegistry.unbindReference(owner, oldReference, journal);
            RelationRegistry.bindReference(owner, newReference, journal);
            bindings.put(name, newReference);
            journal.record(() -> bindings.put(name, oldReference));
            refreshClosure(owner, journal);
            if (owner.getKind() == Node.Kind.DETERMINISTIC) {
                refreshDownstreamClosures(journal);
            }
        } catch (RuntimeException | Error e) {
            LOGGER.warn("Rolling back failed rebind of parent '{}' of {} to '{}'", name, owner, newReference, e);
            Try.runCatchThrowable(journal::rollback).getFailure().ifPresent(e::addSuppressed);
            throw e;
        }
    }

    private void requireKnownName(String name) {
        if (!bindings.containsKey(name)) {
            String message = String.format("%s has no parent named '%s'. Available parents: %s", owner, name,
                    bindings.keySet());
            throw new IllegalArgumentException(message);
        }
    }

    private void requireAttached() {
        if (!attached) {
            throw new IllegalStateException("Can't rebind the parents of a detached node: " + owner);
        }
    }

    private void requireNoCycle(String name, Object newReference) {
        for (Node newParent : RelationRegistry.nodesReferencedBy(newReference)) {
            List<Node> path = findPathToAncestor(newParent, owner, new HashSet<>(), new ArrayDeque<>());
            if (path != null) {
                String pathString = Stream.concat(Stream.of(owner), path.stream())
                        .map(node -> node.getRole().toString())
                        .collect(Collectors.joining("->", "(", ")"));
                String message = String.format(
                        "Binding parent '%s' of %s to '%s' would create a dependency cycle in path '%s'", name, owner,
                        newParent, pathString);
                throw new CyclicDependencyException(message);
            }
        }
    }

    /**
     * Returns the path from node up to ancestor (inclusive at both ends, following parent links), or null if ancestor
     * is not node or one of its ancestors.
     */
    private static List<Node> findPathToAncestor(Node node, Node ancestor, Set<Node> alreadyCheckedNodes,
            Deque<Node> currentPath) {
        currentPath.addLast(node);
        if (node == ancestor) {
            return new ArrayList<>(currentPath);
        }
        if (alreadyCheckedNodes.add(node) && node.getParents() != null) {
            for (Node parent : node.getParents().getVariables()) {
                List<Node> path = findPathToAncestor(parent, ancestor, alreadyCheckedNodes, currentPath);
                if (path != null) {
                    return path;
                }
            }
        }
        currentPath.removeLast();
        return null;
    }

    /**
     * Recomputes node's extended parents from its current references, re-registers it as an extended child, and
     * regenerates its LazyFunction.
     */
    private static void refreshClosure(Node node, UndoJournal journal) {
        RelationRegistry.detachExtendedParents(node, journal);
        node.setExtendedParents(Closures.extendParents(node.getParents().asMap().values()), journal);
        RelationRegistry.attachExtendedParents(node, journal);
        node.regenerateLazyFunction(journal);
    }

    /**
     * Refreshes every Node whose closure looks through the owner: first the downstream Deterministics, parents before
     * children, and then the density-bearing Nodes at the end of those chains.
     */
    private void refreshDownstreamClosures(UndoJournal journal) {
        List<Node> deterministicsInPostOrder = new ArrayList<>();
        Set<Node> visited = new HashSet<>();
        owner.getChildren()
                .stream()
                .filter(child -> child.getKind() == Node.Kind.DETERMINISTIC)
                .forEach(child -> collectDeterministicsInPostOrder(child, visited, deterministicsInPostOrder));
        Collections.reverse(deterministicsInPostOrder);
        deterministicsInPostOrder.forEach(deterministic -> refreshClosure(deterministic, journal));
        // Copy: refreshing re-registers extended children, which would otherwise disturb iteration
        List.copyOf(Closures.extendChildren(owner.getChildren()))
                .forEach(densityBearing -> refreshClosure(densityBearing, journal));
    }

    private static void collectDeterministicsInPostOrder(Node deterministic, Set<Node> visited,
            List<Node> postOrder) {
        if (!visited.add(deterministic)) {
            return;
        }
        deterministic.getChildren()
                .stream()
                .filter(child -> child.getKind() == Node.Kind.DETERMINISTIC)
                .forEach(child -> collectDeterministicsInPostOrder(child, visited, postOrder));
        postOrder.add(deterministic);
    }

    /**
     * Removes the owner from the graph: it stops being a child of its parents and an extended child of its extended
     * parents. Its own bindings and extended parents are kept, so that {@link #attach()} can restore it. Does nothing
     * if the owner is already detached.
     */
    public void detach() {
        if (!attached) {
            return;
        }
        LOGGER.debug("Detaching {} from its parents", owner);
        UndoJournal journal = UndoJournal.untracked();
        RelationRegistry.detachExtendedParents(owner, journal);
        bindings.values().forEach(reference -> RelationRegistry.unbindReference(owner, reference, journal));
        attached = false;
    }

    /**
     * Reverses {@link #detach()}. The graph may have changed while the owner was detached, so the owner's extended
     * parents and LazyFunction are recomputed from its current references; when the owner is a Deterministic, so are
     * the closures of every Node downstream of it. Does nothing if the owner is already attached.
     */
    public void attach() {
        if (attached) {
            return;
        }
        LOGGER.debug("Attaching {} to its parents", owner);
        UndoJournal journal = UndoJournal.untracked();
        bindings.values().forEach(reference -> RelationRegistry.bindReference(owner, reference, journal));
        attached = true;
        refreshClosure(owner, journal);
        if (owner.getKind() == Node.Kind.DETERMINISTIC) {
            refreshDownstreamClosures(journal);
        }
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}
