/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.threshold;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Seats;
import com.salesforce.ballot.evaluate.Selector;
import com.salesforce.ballot.vote.Votes;

/**
 * Selects every candidate with more votes than a fixed number, or exactly as
 * many when equality is accepted.
 *
 * @author hal.hildebrand
 *
 */
public class AbsoluteThreshold<C> implements Selector<Map<C, BigFraction>, C> {
    private final boolean     acceptEqual;
    private final BigFraction threshold;

    public AbsoluteThreshold(BigFraction threshold) {
        this(threshold, true);
    }

    public AbsoluteThreshold(BigFraction threshold, boolean acceptEqual) {
        this.threshold = threshold;
        this.acceptEqual = acceptEqual;
    }

    @Override
    public Set<Capability> capabilities() {
        return ImmutableSet.of();
    }

    @Override
    public Selection<C> evaluate(Map<C, BigFraction> votes, Seats<Map<C, Integer>> seats) {
        List<C> passed = new ArrayList<>();
        for (var e : Votes.sorted(votes)) {
            int cmp = e.getValue().compareTo(threshold);
            if (cmp > 0 || (acceptEqual && cmp == 0)) {
                passed.add(e.getKey());
            }
        }
        return Selection.ofWinners(passed);
    }

    public BigFraction getThreshold() {
        return threshold;
    }

    public boolean isAcceptEqual() {
        return acceptEqual;
    }
}
