/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Nodes in a Bayra model. Multiple nodes together form a directed acyclic graph that describes a joint probability
 * distribution: each Node is bound to its parents by name through its {@link ParentBindings}, and either owns a value,
 * computes a value from its parents, or contributes a log-probability term given its parents (or some combination).
 *
 * Each Node also knows the graph from the other direction: its children (the Nodes that bound it as a parent) and,
 * through {@link Closures}, its extended parents and extended children (the nearest density-bearing Nodes in each
 * direction, looking through Deterministics). Samplers rely on these to know which log-probability terms change when a
 * value changes.
 *
 * Every Node owns exactly one {@link LazyFunction}, which computes its value or log-probability and memoizes the
 * result for as long as its inputs don't change. The LazyFunction is regenerated every time the Node's parents are
 * rebound.
 *
 * Clients don't create Nodes directly. Instead, they use the builders in io.github.graydavid.bayra.nodes to create
 * specific kinds of nodes. The construction sequence is always the same: bind parents (registering the Node as their
 * child), create the LazyFunction, force an initial computation, and validate the result.
 *
 * Nodes are not thread-safe. A model must be built, mutated, and read from one thread at a time. Node identity is
 * instance identity: Nodes don't override equals or hashCode.
 */
public abstract class Node {
    /**
     * The log-probability at or below which a state is treated as impossible: the representation of log(0). It's the
     * most negative finite double, so that -infinity is also covered.
     */
    public static final double LOG_ZERO = -Double.MAX_VALUE;
    public static final int DEFAULT_CACHE_DEPTH = 2;

    private final Kind kind;
    private final Role role;
    private final String documentation;
    private final int cacheDepth;
    private final Map<String, Object> initialBindings;
    private final Relations relations = new Relations();
    private Set<Node> extendedParents = Set.of();
    private ParentBindings parents;
    private LazyFunction<?> lazyFunction;

    protected Node(Kind kind, Builder<?> builder) {
        this.kind = Objects.requireNonNull(kind);
        this.role = Objects.requireNonNull(builder.role);
        this.documentation = builder.documentation;
        this.cacheDepth = builder.cacheDepth;
        this.initialBindings = new LinkedHashMap<>(builder.parents);
    }

    /** The capabilities of the different kinds of Nodes. */
    public enum Kind {
        STOCHASTIC(true, true),
        DETERMINISTIC(true, false),
        POTENTIAL(false, true);

        private final boolean hasValue;
        private final boolean hasLogp;

        private Kind(boolean hasValue, boolean hasLogp) {
            this.hasValue = hasValue;
            this.hasLogp = hasLogp;
        }

        /** Answers whether Nodes of this Kind are {@link ValueBearing}, and so can be parents. */
        public boolean hasValue() {
            return hasValue;
        }

        /** Answers whether Nodes of this Kind are density-bearing: contribute a term to the joint log-probability. */
        public boolean hasLogp() {
            return hasLogp;
        }
    }

    public Kind getKind() {
        return kind;
    }

    public Role getRole() {
        return role;
    }

    public String getDocumentation() {
        return documentation;
    }

    /** The number of past results that this Node's LazyFunction remembers. */
    public int getCacheDepth() {
        return cacheDepth;
    }

    public ParentBindings getParents() {
        return parents;
    }

    /** The Nodes that bound this Node as a parent, either directly or through a Container. */
    public Set<Node> getChildren() {
        return relations.getChildren();
    }

    /** The nearest density-bearing ancestors of this Node, with Deterministics collapsed through. */
    public Set<Node> getExtendedParents() {
        return extendedParents;
    }

    /**
     * The nearest density-bearing descendants of this Node, with Deterministics collapsed through. Only Stochastics
     * have extended children, since only Stochastics can be extended parents.
     */
    public Set<Node> getExtendedChildren() {
        return relations.getExtendedChildren();
    }

    Relations getRelations() {
        return relations;
    }

    void setExtendedParents(Set<Node> newExtendedParents, UndoJournal journal) {
        Set<Node> oldExtendedParents = extendedParents;
        extendedParents = Set.copyOf(newExtendedParents);
        journal.record(() -> extendedParents = oldExtendedParents);
    }

    /**
     * Binds this Node to the parents it was built with. This is the first step of every Node's construction sequence,
     * and must be called exactly once, from the constructor, before anything that needs parent values.
     *
     * @throws IllegalStateException if parents have already been bound.
     * @throws IllegalArgumentException if any parent can't be bound (see {@link ParentBindings#rebind(String, Object)}).
     */
    protected final void bindParents() {
        if (parents != null) {
            throw new IllegalStateException("Parents have already been bound for " + this);
        }
        parents = ParentBindings.initialize(this, initialBindings);
    }

    /**
     * Undoes {@link #bindParents()} for a Node whose construction failed after binding, so that no half-built Node
     * remains registered as a child of anything.
     */
    protected final void abandonConstruction() {
        if (parents != null) {
            parents.detach();
        }
    }

    /**
     * Creates a new LazyFunction for this Node based on its current parents and extended parents. Called during
     * construction and after every rebind.
     */
    protected abstract LazyFunction<?> createLazyFunction();

    /** Replaces this Node's LazyFunction with a new one and forces it to compute immediately. */
    protected final void regenerateLazyFunction() {
        regenerateLazyFunction(UndoJournal.untracked());
    }

    void regenerateLazyFunction(UndoJournal journal) {
        LazyFunction<?> oldLazyFunction = lazyFunction;
        lazyFunction = createLazyFunction();
        journal.record(() -> lazyFunction = oldLazyFunction);
        lazyFunction.forceCompute();
    }

    /** Returns the (possibly memoized) result of this Node's LazyFunction. */
    protected final Object evaluateLazyFunction() {
        if (lazyFunction == null) {
            throw new IllegalStateException("LazyFunction has not been created yet for " + this);
        }
        return lazyFunction.get();
    }

    /** Exposes the current LazyFunction so that callers can inspect its ultimate arguments and cache depth. */
    public LazyFunction<?> getLazyFunction() {
        return lazyFunction;
    }

    @Override
    public String toString() {
        return kind + "(" + role + ")";
    }

    /**
     * An abstract Builder for creating a Node. Builders are good for only one use: as soon as a build method is called,
     * calling any other method on the builder throws an IllegalStateException.
     */
    public abstract static class Builder<B extends Builder<B>> {
        private boolean hasBuilt;
        private final Role role;
        private String documentation = "";
        private int cacheDepth = DEFAULT_CACHE_DEPTH;
        private final Map<String, Object> parents = new LinkedHashMap<>();

        protected Builder(Role role) {
            this.hasBuilt = false;
            this.role = Objects.requireNonNull(role);
        }

        protected abstract B getThis();

        /** Checks that this builder has not yet been built and throws an IllegalStateException if it has. */
        public void requireHasNotBuilt() {
            if (hasBuilt) {
                throw new IllegalStateException("Builders can't be used further after they've built.");
            }
        }

        protected void setHasBuilt() {
            hasBuilt = true;
        }

        /** A description of what the Node represents. Purely informational. */
        public B documentation(String documentation) {
            requireHasNotBuilt();
            this.documentation = Objects.requireNonNull(documentation);
            return getThis();
        }

        /**
         * Binds a parent under the given name. The reference may be a ValueBearing Node, a {@link Container}, or a
         * constant (including null). Binding the same name twice replaces the previous reference.
         *
         * @throws IllegalArgumentException if reference is a Node without a value (i.e. a Potential).
         */
        public B parent(String name, Object reference) {
            requireHasNotBuilt();
            ParentBindings.requireBindable(Objects.requireNonNull(name), reference);
            parents.put(name, reference);
            return getThis();
        }

        /** Calls {@link #parent(String, Object)} for every mapping in parents. */
        public B parents(Map<String, ?> parents) {
            parents.forEach(this::parent);
            return getThis();
        }

        /**
         * The number of past results that the Node's LazyFunction remembers. The default value is
         * {@link Node#DEFAULT_CACHE_DEPTH}: enough to remember both the current and the last state, so that a sampler
         * rejecting a proposal and reverting a value doesn't cause any recomputation.
         *
         * @throws IllegalArgumentException if cacheDepth is not positive.
         */
        public B cacheDepth(int cacheDepth) {
            requireHasNotBuilt();
            if (cacheDepth < 1) {
                throw new IllegalArgumentException("cacheDepth must be positive but was " + cacheDepth);
            }
            this.cacheDepth = cacheDepth;
            return getThis();
        }

        protected Map<String, Object> getParents() {
            return parents;
        }
    }
}
