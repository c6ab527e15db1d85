/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Converts the result of the wrapped evaluator, e.g. a selection of
 * candidates to the seats of their parties.
 *
 * @author hal.hildebrand
 *
 */
public class PostConverted<V, G extends Map<?, ?>, R, S> implements Evaluator<V, G, S> {
    private final Function<? super R, ? extends S> converter;
    private final Evaluator<V, G, R>               evaluator;

    public PostConverted(Evaluator<V, G, R> evaluator, Function<? super R, ? extends S> converter) {
        this.evaluator = evaluator;
        this.converter = converter;
    }

    @Override
    public Set<Capability> capabilities() {
        return evaluator.capabilities();
    }

    @Override
    public S evaluate(V votes, Seats<G> seats) {
        return converter.apply(evaluator.evaluate(votes, seats));
    }

    public Function<? super R, ? extends S> getConverter() {
        return converter;
    }

    public Evaluator<V, G, R> getEvaluator() {
        return evaluator;
    }
}
