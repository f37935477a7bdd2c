/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

/** Indicates that binding a parent would make a Node (indirectly) depend on itself. */
public class CyclicDependencyException extends ModelException {
    private static final long serialVersionUID = 1;

    public CyclicDependencyException(String message) {
        super(message);
    }
}
