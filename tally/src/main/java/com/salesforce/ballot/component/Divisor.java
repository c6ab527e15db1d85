/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.component;

import java.util.Optional;

import org.apache.commons.math3.fraction.BigFraction;

/**
 * The divisor applied to a contestant's votes given the number of seats it has
 * been awarded so far.
 *
 * @author hal.hildebrand
 *
 */
@FunctionalInterface
public interface Divisor {

    BigFraction apply(int order);

    /**
     * The rounding point s such that the divisor sequence is the standard one
     * d(k) = k + s, scaled. Only known for the divisors that have one.
     */
    default Optional<BigFraction> signpost() {
        return Optional.empty();
    }
}
