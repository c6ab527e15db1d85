/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.proportional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.Tie;
import com.salesforce.ballot.component.Divisor;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Distributor;
import com.salesforce.ballot.evaluate.Seats;

/**
 * Awards seats one by one to the contestant with the highest quotient of votes
 * divided by the divisor for the seats it holds so far. Contestants tied for
 * the last seats share them as a tie.
 * <p>
 * The seat count includes the previous gains, which set the starting divisors.
 * A zero divisor ranks the contestant above every finite quotient.
 *
 * @author hal.hildebrand
 *
 */
public class HighestAverages<C> implements Distributor<Map<C, BigFraction>, C> {
    private record Quotient<C>(C candidate, BigFraction votes, BigFraction divisor) {

        static <C> Comparator<Quotient<C>> descending() {
            return (a, b) -> b.votes.multiply(a.divisor).compareTo(a.votes.multiply(b.divisor));
        }

        boolean ties(Quotient<C> other) {
            return votes.multiply(other.divisor).equals(other.votes.multiply(divisor));
        }
    }

    private static final Logger log = LoggerFactory.getLogger(HighestAverages.class);

    private final Divisor divisor;

    public HighestAverages(Divisor divisor) {
        this.divisor = divisor;
    }

    @Override
    public Set<Capability> capabilities() {
        return ImmutableSet.of(Capability.SEATS, Capability.PREVIOUS_GAINS);
    }

    @Override
    public Distribution<C> evaluate(Map<C, BigFraction> votes, Seats<Map<C, Integer>> seats) {
        final int n = seats.required();
        var prevGains = seats.prevGains();
        var maxSeats = seats.maxSeats();
        Map<C, Integer> held = new LinkedHashMap<>(prevGains);
        int remaining = n - held.values().stream().mapToInt(Integer::intValue).sum();
        List<Quotient<C>> quotients = new ArrayList<>();
        votes.forEach((candidate, count) -> {
            var q = quotient(candidate, count, held.getOrDefault(candidate, 0), maxSeats.getOrDefault(candidate, n));
            if (q != null) {
                quotients.add(q);
            }
        });
        Map<Tie<C>, Integer> ties = new LinkedHashMap<>();
        while (remaining > 0 && !quotients.isEmpty()) {
            quotients.sort(Quotient.descending());
            var top = quotients.get(0);
            int tied = 1;
            while (tied < quotients.size() && quotients.get(tied).ties(top)) {
                tied++;
            }
            var awarded = new ArrayList<>(quotients.subList(0, tied));
            quotients.subList(0, tied).clear();
            if (tied > remaining) {
                var tie = Tie.<C>of(awarded.stream().map(Quotient::candidate).toList());
                log.trace("{} tied for the last {} seats", tie, remaining);
                ties.put(tie, remaining);
                break;
            }
            remaining -= tied;
            for (var q : awarded) {
                int count = held.merge(q.candidate(), 1, Integer::sum);
                var next = quotient(q.candidate(), q.votes(), count, maxSeats.getOrDefault(q.candidate(), n));
                if (next != null) {
                    quotients.add(next);
                }
            }
        }
        Map<C, Integer> gained = new LinkedHashMap<>();
        held.forEach((candidate, count) -> {
            int fresh = count - prevGains.getOrDefault(candidate, 0);
            if (fresh > 0) {
                gained.put(candidate, fresh);
            }
        });
        return Distribution.of(gained, ties);
    }

    public Divisor getDivisor() {
        return divisor;
    }

    @Override
    public String toString() {
        return "HighestAverages[" + divisor + "]";
    }

    private Quotient<C> quotient(C candidate, BigFraction votes, int held, int max) {
        if (held >= max) {
            return null;
        }
        var d = divisor.apply(held);
        int sign = d.compareTo(BigFraction.ZERO);
        if (sign < 0 || (sign == 0 && votes.compareTo(BigFraction.ZERO) == 0)) {
            return null;
        }
        return new Quotient<>(candidate, votes, d);
    }
}
