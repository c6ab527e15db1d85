/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.stv;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;

import com.salesforce.ballot.vote.RankedVote;

/**
 * Transfers each ballot of a departing candidate to its next preference,
 * leaving the subtraction of used votes and the splitting of shared ranks to
 * the concrete transfer method.
 *
 * @author hal.hildebrand
 *
 */
public abstract class AbstractSession implements VoteTransfer.Session {

    @Override
    public <C> Allocation<C> subtract(Allocation<C> allocation, Map<C, BigFraction> elected) {
        var result = allocation.copy();
        elected.forEach((candidate, used) -> result.replace(candidate, subtract(result.held(candidate), used)));
        return result;
    }

    @Override
    public <C> Allocation<C> transfer(Allocation<C> allocation, Collection<? extends C> removed) {
        var result = allocation.copy();
        var continuing = new LinkedHashSet<C>(result.continuing());
        continuing.removeAll(removed);
        List<C> departing = new ArrayList<>(result.continuing());
        departing.removeIf(c -> !removed.contains(c));
        for (C candidate : departing) {
            result.remove(candidate).forEach((vote, count) -> {
                var targets = vote.next(candidate, continuing);
                if (targets.isEmpty()) {
                    result.exhaust(vote, count);
                } else if (targets.size() == 1) {
                    result.add(targets.iterator().next(), vote, count);
                } else {
                    split(List.copyOf(targets), count).forEach((target, share) -> result.add(target, vote, share));
                }
            });
        }
        return result;
    }

    /**
     * Remove the used amount from the votes of one elected candidate.
     *
     * @return the votes left to the candidate
     */
    protected abstract <C> Map<RankedVote<C>, BigFraction> subtract(Map<RankedVote<C>, BigFraction> held,
                                                                    BigFraction used);
}
