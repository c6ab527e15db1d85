/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.stv;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;

import com.salesforce.ballot.vote.RankedVote;
import com.salesforce.ballot.vote.Votes;

/**
 * Fractional transfers, as in the weighted inclusive Gregory method: every
 * ballot of an elected candidate is reduced by the same factor, and shared
 * ranks split a ballot evenly. Exact and never random.
 *
 * @author hal.hildebrand
 *
 */
public class Gregory implements VoteTransfer {
    private static final VoteTransfer.Session SESSION = new AbstractSession() {

        @Override
        public <C> Map<C, BigFraction> split(List<C> targets, BigFraction votes) {
            var share = votes.divide(targets.size());
            Map<C, BigFraction> shares = new LinkedHashMap<>();
            targets.forEach(t -> shares.put(t, share));
            return shares;
        }

        @Override
        protected <C> Map<RankedVote<C>, BigFraction> subtract(Map<RankedVote<C>, BigFraction> held,
                                                               BigFraction used) {
            var current = Votes.total(held);
            if (used.compareTo(current) >= 0) {
                return Map.of();
            }
            var factor = current.subtract(used).divide(current);
            Map<RankedVote<C>, BigFraction> reduced = new LinkedHashMap<>();
            held.forEach((vote, count) -> reduced.put(vote, count.multiply(factor)));
            return reduced;
        }
    };

    @Override
    public boolean isStable() {
        return true;
    }

    @Override
    public Session session() {
        return SESSION;
    }

    @Override
    public String toString() {
        return "Gregory";
    }
}
