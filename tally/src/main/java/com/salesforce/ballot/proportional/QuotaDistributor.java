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
import com.salesforce.ballot.component.Quota;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Distributor;
import com.salesforce.ballot.evaluate.Seats;
import com.salesforce.ballot.vote.Votes;

/**
 * Awards each contestant a seat for every full quota its votes reach, less
 * the seats it gained previously. Usually leaves seats unfilled.
 *
 * @author hal.hildebrand
 *
 */
public class QuotaDistributor<C> implements Distributor<Map<C, BigFraction>, C> {
    private final Quota quota;

    public QuotaDistributor(Quota quota) {
        this.quota = quota;
    }

    @Override
    public Set<Capability> capabilities() {
        return ImmutableSet.of(Capability.SEATS, Capability.PREVIOUS_GAINS);
    }

    @Override
    public Distribution<C> evaluate(Map<C, BigFraction> votes, Seats<Map<C, Integer>> seats) {
        var q = quota.apply(Votes.total(votes), seats.required());
        Map<C, Integer> selected = new LinkedHashMap<>();
        votes.forEach((candidate, count) -> {
            if (count.compareTo(q) < 0) {
                return;
            }
            int prev = seats.prevGains().getOrDefault(candidate, 0);
            int fresh = Votes.floorInt(count.divide(q)) - prev;
            var max = seats.maxSeats().get(candidate);
            if (max != null) {
                fresh = Math.min(fresh, max - prev);
            }
            if (fresh > 0) {
                selected.put(candidate, fresh);
            }
        });
        return Distribution.of(selected);
    }

    public Quota getQuota() {
        return quota;
    }
}
