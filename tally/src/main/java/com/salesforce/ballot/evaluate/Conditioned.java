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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.vote.Subsetter;

/**
 * Evaluates only the candidates that pass an eliminator, such as an electoral
 * threshold. The eliminator decides independently of the seat count; it sees
 * the previous gains if it declares so.
 *
 * @author hal.hildebrand
 *
 */
public class Conditioned<V, G extends Map<?, ?>, C, R> implements Evaluator<V, G, R> {
    private static final Logger log = LoggerFactory.getLogger(Conditioned.class);

    private final ImmutableSet<Capability>        capabilities;
    private final Evaluator<V, G, Selection<C>> eliminator;
    private final Evaluator<V, G, R>              evaluator;
    private final Subsetter<V, C>                 subsetter;

    public Conditioned(Evaluator<V, G, Selection<C>> eliminator, Evaluator<V, G, R> evaluator,
                       Subsetter<V, C> subsetter) {
        if (eliminator.accepts(Capability.SEATS)) {
            throw new ConfigurationException(String.format("Eliminator %s must not depend on the seat count",
                                                           eliminator));
        }
        this.eliminator = eliminator;
        this.evaluator = evaluator;
        this.subsetter = subsetter;
        var caps = EnumSet.noneOf(Capability.class);
        caps.addAll(evaluator.capabilities());
        if (eliminator.accepts(Capability.PREVIOUS_GAINS)) {
            caps.add(Capability.PREVIOUS_GAINS);
        }
        capabilities = ImmutableSet.copyOf(caps);
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public R evaluate(V votes, Seats<G> seats) {
        Set<C> passed = ImmutableSet.copyOf(eliminator.evaluate(votes, seats.restrictTo(eliminator.capabilities()))
                                                      .winners());
        log.trace("Passed eliminator: {}", passed);
        return evaluator.evaluate(subsetter.subset(votes, passed), seats.restrictTo(evaluator.capabilities()));
    }

    public Evaluator<V, G, Selection<C>> getEliminator() {
        return eliminator;
    }

    public Evaluator<V, G, R> getEvaluator() {
        return evaluator;
    }

    public Subsetter<V, C> getSubsetter() {
        return subsetter;
    }
}
