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

import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Result;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.vote.Subsetter;

/**
 * Breaks the ties of the main evaluation with a dedicated tiebreaker, which is
 * given the votes restricted to the tied candidates. Tiebreakers of decreasing
 * priority nest by wrapping.
 *
 * @author hal.hildebrand
 *
 */
public class TieBreaking<V, G extends Map<?, ?>, C, R extends Result<C, R>> implements Evaluator<V, G, R> {
    private static final Logger log = LoggerFactory.getLogger(TieBreaking.class);

    private final Evaluator<V, G, R>                            main;
    private final Subsetter<V, C>                               subsetter;
    private final Evaluator<V, Map<C, Integer>, Selection<C>> tiebreaker;

    public TieBreaking(Evaluator<V, G, R> main, Evaluator<V, Map<C, Integer>, Selection<C>> tiebreaker,
                       Subsetter<V, C> subsetter) {
        if (!tiebreaker.accepts(Capability.SEATS)) {
            throw new ConfigurationException(String.format("Tiebreaker %s must accept a seat count", tiebreaker));
        }
        this.main = main;
        this.tiebreaker = tiebreaker;
        this.subsetter = subsetter;
    }

    @Override
    public Set<Capability> capabilities() {
        return main.capabilities();
    }

    /**
     * @throws com.salesforce.ballot.UnresolvedTieException if the tiebreaker
     *                                                      ties as well
     */
    @Override
    public R evaluate(V votes, Seats<G> seats) {
        var result = main.evaluate(votes, seats);
        for (var tie : result.ties().entrySet()) {
            var tiedVotes = subsetter.subset(votes, tie.getKey().members());
            var broken = tiebreaker.evaluate(tiedVotes, tie.getValue()).winners();
            log.trace("Broke {} for {} seats: {}", tie.getKey(), tie.getValue(), broken);
            result = result.breakTie(tie.getKey(), broken);
        }
        return result;
    }

    public Evaluator<V, G, R> getMain() {
        return main;
    }

    public Subsetter<V, C> getSubsetter() {
        return subsetter;
    }

    public Evaluator<V, Map<C, Integer>, Selection<C>> getTiebreaker() {
        return tiebreaker;
    }
}
