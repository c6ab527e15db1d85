/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.Map;

import com.salesforce.ballot.Distribution;

/**
 * Enlarges the seat count by the overhang: the seats parties gained in an
 * earlier round beyond their proportional share. The other parties receive no
 * leveling seats.
 *
 * @author hal.hildebrand
 *
 */
public class AllowOverhang<V, C> implements SeatCountCalculator<V, Map<C, Integer>> {
    private final Evaluator<V, Map<C, Integer>, Distribution<C>> evaluator;

    /**
     * @param evaluator - produces the proportional result the overhang is
     *                  measured against
     */
    public AllowOverhang(Evaluator<V, Map<C, Integer>, Distribution<C>> evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public int calculate(V votes, int seats, Map<C, Integer> prevGains, Map<C, Integer> maxSeats) {
        var proportional = evaluator.evaluate(votes,
                                              Seats.of(seats, Map.<C, Integer>of(), maxSeats)
                                                   .restrictTo(evaluator.capabilities()))
                                    .resolved();
        int overhang = 0;
        for (var e : prevGains.entrySet()) {
            overhang += Math.max(0, e.getValue() - proportional.getOrDefault(e.getKey(), 0));
        }
        return overhang;
    }

    public Evaluator<V, Map<C, Integer>, Distribution<C>> getEvaluator() {
        return evaluator;
    }
}
