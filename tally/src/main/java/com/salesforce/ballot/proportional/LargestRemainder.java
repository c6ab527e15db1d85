/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.proportional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.Tie;
import com.salesforce.ballot.Winner;
import com.salesforce.ballot.component.Quota;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Distributor;
import com.salesforce.ballot.evaluate.Plurality;
import com.salesforce.ballot.evaluate.Seats;
import com.salesforce.ballot.vote.Votes;

/**
 * Awards the full quotas first, then one more seat each to the contestants
 * with the largest remainders until the seats are filled.
 *
 * @author hal.hildebrand
 *
 */
public class LargestRemainder<C> implements Distributor<Map<C, BigFraction>, C> {
    private final Quota               quota;
    private final QuotaDistributor<C> quotaDistributor;

    public LargestRemainder(Quota quota) {
        this.quota = quota;
        this.quotaDistributor = new QuotaDistributor<>(quota);
    }

    @Override
    public Set<Capability> capabilities() {
        return ImmutableSet.of(Capability.SEATS, Capability.PREVIOUS_GAINS);
    }

    @Override
    public Distribution<C> evaluate(Map<C, BigFraction> votes, Seats<Map<C, Integer>> seats) {
        int n = seats.required();
        var byQuota = quotaDistributor.evaluate(votes, seats).seats();
        var q = quota.apply(Votes.total(votes), n);
        var gained = Votes.merge(byQuota, seats.prevGains());
        int left = n - gained.values().stream().mapToInt(Integer::intValue).sum();
        Map<C, BigFraction> remainders = new LinkedHashMap<>();
        votes.forEach((candidate, count) -> {
            int held = gained.getOrDefault(candidate, 0);
            var max = seats.maxSeats().get(candidate);
            if (max == null || held < max) {
                remainders.put(candidate, count.divide(q).subtract(held));
            }
        });
        Map<C, Integer> selected = new LinkedHashMap<>(byQuota);
        Map<Tie<C>, Integer> ties = new LinkedHashMap<>();
        for (var entry : Plurality.topN(remainders, Math.max(left, 0))) {
            if (entry instanceof Tie<C> tie) {
                ties.merge(tie, 1, Integer::sum);
            } else if (entry instanceof Winner<C> winner) {
                selected.merge(winner.candidate(), 1, Integer::sum);
            }
        }
        return Distribution.of(selected, ties);
    }

    public Quota getQuota() {
        return quota;
    }
}
