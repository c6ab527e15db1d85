/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.threshold;

import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Evaluator;
import com.salesforce.ballot.evaluate.Seats;
import com.salesforce.ballot.evaluate.Selector;
import com.salesforce.ballot.vote.Votes;

/**
 * Applies a threshold to the seats gained in earlier rounds instead of the
 * votes, e.g. qualifying parties that won at least three districts.
 *
 * @author hal.hildebrand
 *
 */
public class PreviousGainThreshold<V, C> implements Selector<V, C> {
    private final Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>> selector;

    public PreviousGainThreshold(Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>> selector) {
        if (selector.accepts(Capability.SEATS)) {
            throw new ConfigurationException(String.format("Threshold %s must not depend on the seat count",
                                                           selector));
        }
        this.selector = selector;
    }

    @Override
    public Set<Capability> capabilities() {
        return ImmutableSet.of(Capability.PREVIOUS_GAINS);
    }

    /**
     * The votes are disregarded.
     */
    @Override
    public Selection<C> evaluate(V votes, Seats<Map<C, Integer>> seats) {
        return selector.evaluate(Votes.of(seats.prevGains()));
    }

    public Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>> getSelector() {
        return selector;
    }
}
