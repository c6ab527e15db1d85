/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.ConfigurationException;

/**
 * Evaluates with the seat count enlarged by a calculator, e.g. to keep overhang
 * seats from an earlier round.
 *
 * @author hal.hildebrand
 *
 */
public class AdjustedSeatCount<V, G extends Map<?, ?>, R> implements Evaluator<V, G, R> {
    private static final Logger log = LoggerFactory.getLogger(AdjustedSeatCount.class);

    private final SeatCountCalculator<V, G> calculator;
    private final Evaluator<V, G, R>        evaluator;

    public AdjustedSeatCount(SeatCountCalculator<V, G> calculator, Evaluator<V, G, R> evaluator) {
        if (!evaluator.accepts(Capability.SEATS)) {
            throw new ConfigurationException(String.format("Cannot adjust the seat count of seatless evaluator %s",
                                                           evaluator));
        }
        this.calculator = calculator;
        this.evaluator = evaluator;
    }

    @Override
    public Set<Capability> capabilities() {
        return ImmutableSet.of(Capability.SEATS, Capability.PREVIOUS_GAINS);
    }

    @Override
    public R evaluate(V votes, Seats<G> seats) {
        var baseline = seats.required();
        var adjustment = calculator.calculate(votes, baseline, seats.prevGains(), seats.maxSeats());
        log.debug("Seat count adjusted by {} from {}", adjustment, baseline);
        return evaluator.evaluate(votes, seats.withCount(baseline + adjustment).restrictTo(evaluator.capabilities()));
    }

    public SeatCountCalculator<V, G> getCalculator() {
        return calculator;
    }

    public Evaluator<V, G, R> getEvaluator() {
        return evaluator;
    }
}
