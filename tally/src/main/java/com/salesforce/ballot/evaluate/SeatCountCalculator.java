/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.Map;

/**
 * Computes an adjustment to the seat count of an evaluation.
 *
 * @author hal.hildebrand
 *
 */
@FunctionalInterface
public interface SeatCountCalculator<V, G extends Map<?, ?>> {

    /**
     * @return the number of seats to add to the baseline seat count
     */
    int calculate(V votes, int seats, G prevGains, G maxSeats);
}
