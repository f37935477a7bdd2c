/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.bayra.core;

import java.util.function.Supplier;

/** Validation shared by every density-bearing Node for its computed log-probability. */
public class LogProbabilities {
    private LogProbabilities() {}

    /**
     * Converts a raw computed log-probability to a double and checks it.
     *
     * @param role the Node whose log-probability this is, for error messages.
     * @param raw the result of the Node's log-probability function.
     * @param zeroProbability creates the exception to throw when the log-probability represents log(0).
     *
     * @throws TypeConversionException if raw is null.
     * @throws NumericValidityException if raw is NaN or positive infinity.
     * @throws ZeroProbabilityException (from zeroProbability) if raw is at or below {@link Node#LOG_ZERO}.
     */
    public static double requireValid(Role role, Object raw,
            Supplier<ZeroProbabilityException> zeroProbability) {
        if (!(raw instanceof Number)) {
            String message = String.format("%s: computed log-probability '%s' cannot be converted to a double", role,
                    raw);
            throw new TypeConversionException(message);
        }
        double logp = ((Number) raw).doubleValue();
        if (Double.isNaN(logp)) {
            throw new NumericValidityException(role + ": computed log-probability is NaN");
        }
        if (logp == Double.POSITIVE_INFINITY) {
            throw new NumericValidityException(role + ": computed log-probability is positive infinity");
        }
        if (logp <= Node.LOG_ZERO) {
            throw zeroProbability.get();
        }
        return logp;
    }
}
