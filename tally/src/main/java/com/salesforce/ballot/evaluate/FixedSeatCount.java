/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.salesforce.ballot.ConfigurationException;

/**
 * Runs an evaluator always with the same, predefined seat count.
 *
 * @author hal.hildebrand
 *
 */
public class FixedSeatCount<V, G extends Map<?, ?>, R> implements Evaluator<V, G, R> {
    private final ImmutableSet<Capability> capabilities;
    private final Evaluator<V, G, R>       evaluator;
    private final int                      seats;

    public FixedSeatCount(Evaluator<V, G, R> evaluator, int seats) {
        if (!evaluator.accepts(Capability.SEATS)) {
            throw new ConfigurationException(String.format("Cannot fix the seat count of seatless evaluator %s",
                                                           evaluator));
        }
        if (seats < 0) {
            throw new ConfigurationException("Negative seat count: " + seats);
        }
        this.evaluator = evaluator;
        this.seats = seats;
        this.capabilities = ImmutableSet.copyOf(Sets.difference(evaluator.capabilities(),
                                                                EnumSet.of(Capability.SEATS)));
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public R evaluate(V votes, Seats<G> seats) {
        return evaluator.evaluate(votes, seats.withCount(this.seats).restrictTo(evaluator.capabilities()));
    }

    public Evaluator<V, G, R> getEvaluator() {
        return evaluator;
    }

    public int getSeats() {
        return seats;
    }

    @Override
    public String toString() {
        return String.format("FixedSeatCount[%s, %s]", evaluator, seats);
    }
}
