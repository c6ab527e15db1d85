/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.Map;
import java.util.Set;

/**
 * Evaluates votes to a result. Each evaluator declares up front which seat
 * parameters it uses, so that composition errors surface when evaluators are
 * assembled rather than when they are run.
 *
 * @author hal.hildebrand
 *
 * @param <V> - the vote tally type
 * @param <G> - the seat gains type, keyed by contestant
 * @param <R> - the result type
 */
public interface Evaluator<V, G extends Map<?, ?>, R> {

    default boolean accepts(Capability capability) {
        return capabilities().contains(capability);
    }

    Set<Capability> capabilities();

    default R evaluate(V votes) {
        return evaluate(votes, Seats.none());
    }

    default R evaluate(V votes, int seats) {
        return evaluate(votes, Seats.of(seats));
    }

    default R evaluate(V votes, int seats, G prevGains, G maxSeats) {
        return evaluate(votes, Seats.of(seats, prevGains, maxSeats));
    }

    /**
     * @param votes - the votes to evaluate, never mutated
     * @param seats - the seat parameters; those not declared in
     *              {@link #capabilities()} are ignored
     */
    R evaluate(V votes, Seats<G> seats);
}
