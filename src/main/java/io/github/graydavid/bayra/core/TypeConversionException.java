/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

/**
 * Indicates that a computed log-probability, a value, or a function argument can't be converted to the type required
 * of it.
 */
public class TypeConversionException extends ModelException {
    private static final long serialVersionUID = 1;

    public TypeConversionException(String message) {
        super(message);
    }

    public TypeConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
