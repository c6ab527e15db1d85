/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.Elected;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.Tie;
import com.salesforce.ballot.Winner;
import com.salesforce.ballot.vote.Votes;

/**
 * Elects the candidates with the most votes. Candidates tied across the seat
 * boundary are returned as a tie, once per seat left for them.
 *
 * @author hal.hildebrand
 *
 */
public class Plurality<C> implements Selector<Map<C, BigFraction>, C> {

    /**
     * Select the n candidates with the highest counts.
     *
     * @return min(n, candidates) entries in descending order of count
     */
    public static <C> List<Elected<C>> topN(Map<C, BigFraction> counts, int n) {
        var sorted = Votes.sorted(counts);
        List<Elected<C>> selected = new ArrayList<>(Math.min(n, sorted.size()));
        if (sorted.size() <= n) {
            sorted.forEach(e -> selected.add(new Winner<>(e.getKey())));
            return selected;
        }
        if (n == 0) {
            return selected;
        }
        var boundary = sorted.get(n - 1).getValue();
        if (sorted.get(n).getValue().compareTo(boundary) != 0) {
            sorted.subList(0, n).forEach(e -> selected.add(new Winner<>(e.getKey())));
            return selected;
        }
        List<C> tied = new ArrayList<>();
        for (var e : sorted) {
            int cmp = e.getValue().compareTo(boundary);
            if (cmp > 0) {
                selected.add(new Winner<>(e.getKey()));
            } else if (cmp == 0) {
                tied.add(e.getKey());
            }
        }
        var tie = Tie.<C>of(tied);
        while (selected.size() < n) {
            selected.add(tie);
        }
        return selected;
    }

    @Override
    public Set<Capability> capabilities() {
        return ImmutableSet.of(Capability.SEATS);
    }

    /**
     * Elects a single winner when no seat count is given.
     */
    @Override
    public Selection<C> evaluate(Map<C, BigFraction> votes, Seats<Map<C, Integer>> seats) {
        return Selection.of(topN(votes, seats.count().orElse(1)));
    }

    @Override
    public String toString() {
        return "Plurality";
    }
}
