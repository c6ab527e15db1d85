/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Seats awarded per candidate. Candidates without seats are absent; seats that
 * could not be decided are held by ties.
 *
 * @author hal.hildebrand
 *
 */
public final class Distribution<C> implements Result<C, Distribution<C>> {
    private static final Distribution<?> EMPTY = new Distribution<>(ImmutableMap.of(), ImmutableMap.of());

    @SuppressWarnings("unchecked")
    public static <C> Distribution<C> empty() {
        return (Distribution<C>) EMPTY;
    }

    public static <C> Distribution<C> of(Map<C, Integer> seats) {
        return of(seats, Map.of());
    }

    public static <C> Distribution<C> of(Map<C, Integer> seats, Map<Tie<C>, Integer> ties) {
        return new Distribution<>(positive(seats), positive(ties));
    }

    private static <K> ImmutableMap<K, Integer> positive(Map<K, Integer> counts) {
        var builder = ImmutableMap.<K, Integer>builder();
        counts.forEach((k, n) -> {
            if (n < 0) {
                throw new IllegalArgumentException(String.format("Negative seat count %s for %s", n, k));
            }
            if (n > 0) {
                builder.put(k, n);
            }
        });
        return builder.build();
    }

    private final ImmutableMap<C, Integer>      seats;
    private final ImmutableMap<Tie<C>, Integer> ties;

    private Distribution(ImmutableMap<C, Integer> seats, ImmutableMap<Tie<C>, Integer> ties) {
        this.seats = seats;
        this.ties = ties;
    }

    @Override
    public Distribution<C> breakTie(Tie<C> tie, List<C> broken) {
        Integer tied = ties.get(tie);
        if (tied == null) {
            return this;
        }
        if (tied != broken.size()) {
            throw new IllegalArgumentException(String.format("%s holds %s seats, cannot be broken by %s", tie, tied,
                                                             broken));
        }
        Map<C, Integer> newSeats = new LinkedHashMap<>(seats);
        broken.forEach(c -> newSeats.merge(c, 1, Integer::sum));
        Map<Tie<C>, Integer> newTies = new LinkedHashMap<>(ties);
        newTies.remove(tie);
        return of(newSeats, newTies);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Distribution<?> other && seats.equals(other.seats) && ties.equals(other.ties);
    }

    public int get(C candidate) {
        return seats.getOrDefault(candidate, 0);
    }

    @Override
    public int hashCode() {
        return seats.hashCode() * 31 + ties.hashCode();
    }

    public boolean isEmpty() {
        return seats.isEmpty() && ties.isEmpty();
    }

    /**
     * @return this distribution with the seats added to each candidate's count
     */
    public Distribution<C> plus(Map<C, Integer> other) {
        Map<C, Integer> sum = new LinkedHashMap<>(seats);
        other.forEach((c, n) -> sum.merge(c, n, Integer::sum));
        return of(sum, ties);
    }

    /**
     * @return the seats per candidate
     * @throws UnresolvedTieException if any seat is held by a tie
     */
    public Map<C, Integer> resolved() {
        if (!ties.isEmpty()) {
            throw new UnresolvedTieException("Distribution contains a tie", ties.keySet().iterator().next());
        }
        return seats;
    }

    public Map<C, Integer> seats() {
        return seats;
    }

    @Override
    public Map<Tie<C>, Integer> ties() {
        return ties;
    }

    @Override
    public String toString() {
        return ties.isEmpty() ? seats.toString() : seats + " " + ties;
    }

    /**
     * @return the number of seats awarded, tied seats included
     */
    public int total() {
        return seats.values().stream().mapToInt(Integer::intValue).sum()
        + ties.values().stream().mapToInt(Integer::intValue).sum();
    }
}
