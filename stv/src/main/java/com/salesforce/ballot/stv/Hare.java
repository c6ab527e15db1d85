/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.stv;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.random.BitsStreamGenerator;
import org.apache.commons.math3.random.MersenneTwister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.ballot.InvalidVoteException;
import com.salesforce.ballot.vote.RankedVote;
import com.salesforce.ballot.vote.Votes;

/**
 * Random ballot transfers, as in Irish elections: an elected candidate loses
 * whole ballots drawn at random, the rest move on unchanged, and shared ranks
 * hand out the ballots that do not split evenly at random.
 * <p>
 * Ballot counts must be whole numbers. Without a seed each evaluation draws
 * differently.
 *
 * @author hal.hildebrand
 *
 */
public class Hare implements VoteTransfer {
    private class RandomSession extends AbstractSession {
        private final BitsStreamGenerator entropy;

        private RandomSession(BitsStreamGenerator entropy) {
            this.entropy = entropy;
        }

        @Override
        public <C> Map<C, BigFraction> split(List<C> targets, BigFraction votes) {
            var n = whole(votes, targets);
            var k = BigInteger.valueOf(targets.size());
            var each = new BigFraction(n.divide(k));
            int remainder = n.mod(k).intValueExact();
            Map<C, BigFraction> shares = new LinkedHashMap<>();
            if (each.compareTo(BigFraction.ZERO) > 0) {
                targets.forEach(t -> shares.put(t, each));
            }
            // a random subset of the targets receives one extra ballot each
            List<C> order = new ArrayList<>(targets);
            for (int i = 0; i < remainder; i++) {
                int j = i + entropy.nextInt(order.size() - i);
                var chosen = order.get(j);
                order.set(j, order.get(i));
                order.set(i, chosen);
                shares.merge(chosen, BigFraction.ONE, BigFraction::add);
            }
            return shares;
        }

        @Override
        protected <C> Map<RankedVote<C>, BigFraction> subtract(Map<RankedVote<C>, BigFraction> held,
                                                               BigFraction used) {
            Map<RankedVote<C>, Long> ballots = new LinkedHashMap<>();
            long total = 0;
            for (var e : held.entrySet()) {
                long count = whole(e.getValue(), e.getKey()).longValueExact();
                ballots.put(e.getKey(), count);
                total += count;
            }
            long discard = Votes.floor(used).longValueExact();
            if (!new BigFraction(discard).equals(used)) {
                discard++;
            }
            if (discard >= total) {
                return Map.of();
            }
            for (long i = 0; i < discard; i++) {
                long drawn = entropy.nextLong(total - i);
                for (var e : ballots.entrySet()) {
                    if (drawn < e.getValue()) {
                        e.setValue(e.getValue() - 1);
                        break;
                    }
                    drawn -= e.getValue();
                }
            }
            Map<RankedVote<C>, BigFraction> kept = new LinkedHashMap<>();
            ballots.forEach((vote, count) -> {
                if (count > 0) {
                    kept.put(vote, new BigFraction(count));
                }
            });
            return kept;
        }

        private BigInteger whole(BigFraction count, Object context) {
            if (!count.getDenominator().equals(BigInteger.ONE)) {
                throw new InvalidVoteException(String.format("Hare transfers need whole ballots, got %s for %s", count,
                                                             context));
            }
            return count.getNumerator();
        }
    }

    private static final Logger log = LoggerFactory.getLogger(Hare.class);

    private final Long seed;

    /**
     * Unseeded transfers, differing from one evaluation to the next.
     */
    public Hare() {
        this(null);
    }

    public Hare(Long seed) {
        this.seed = seed;
    }

    public Long getSeed() {
        return seed;
    }

    @Override
    public boolean isStable() {
        return seed != null;
    }

    @Override
    public Session session() {
        if (seed == null) {
            log.warn("Unseeded Hare transfer, the result is not reproducible");
            return new RandomSession(new MersenneTwister());
        }
        return new RandomSession(new MersenneTwister(seed));
    }

    @Override
    public String toString() {
        return seed == null ? "Hare" : "Hare[" + seed + "]";
    }
}
