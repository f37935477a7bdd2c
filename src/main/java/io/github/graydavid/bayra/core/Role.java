/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The name of a Node: the part it plays in a model (e.g. "mu", "observed-counts", "switchpoint"). Roles show up in
 * every exception message that describes a Node, so they should be short and meaningful. There's no enforcement of
 * uniqueness across Nodes, but samplers and trace recorders will usually treat them as unique.
 */
public class Role {
    private final String name;

    private Role(String name) {
        this.name = requireValidName(name);
    }

    private static String requireValidName(String name) {
        if (name.isBlank()) {
            StringJoiner codePoints = name.codePoints()
                    .collect(() -> new StringJoiner(", ", "[", "]"),
                            (joiner, point) -> joiner.add(String.valueOf(point)), StringJoiner::merge);
            throw new IllegalArgumentException(
                    "Role names must not be blank but found whitespace character in code points: " + codePoints);
        }
        return name;
    }

    /**
     * Creates a role with the given name.
     *
     * @throws NullPointerException if name is null
     * @throws IllegalArgumentException if name is blank, as per {@link String#isBlank()}.
     */
    public static Role of(String name) {
        return new Role(name);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object object) {
        if (this == object) {
            return true;
        }

        if (!(object instanceof Role)) {
            return false;
        }

        Role other = (Role) object;
        return Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }
}
