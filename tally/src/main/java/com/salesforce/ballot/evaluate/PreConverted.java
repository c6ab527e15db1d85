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
 * Converts the votes to the shape the wrapped evaluator understands before
 * evaluating them.
 *
 * @author hal.hildebrand
 *
 */
public class PreConverted<U, V, G extends Map<?, ?>, R> implements Evaluator<U, G, R> {
    private final Function<? super U, ? extends V> converter;
    private final Evaluator<V, G, R>               evaluator;

    public PreConverted(Function<? super U, ? extends V> converter, Evaluator<V, G, R> evaluator) {
        this.converter = converter;
        this.evaluator = evaluator;
    }

    @Override
    public Set<Capability> capabilities() {
        return evaluator.capabilities();
    }

    @Override
    public R evaluate(U votes, Seats<G> seats) {
        return evaluator.evaluate(converter.apply(votes), seats);
    }

    public Function<? super U, ? extends V> getConverter() {
        return converter;
    }

    public Evaluator<V, G, R> getEvaluator() {
        return evaluator;
    }
}
