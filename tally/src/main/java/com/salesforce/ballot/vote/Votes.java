/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.vote;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableMap;
import com.salesforce.ballot.InvalidVoteException;

/**
 * Operations on vote tallies: maps from whatever the votes are cast for to
 * exact, non-negative counts.
 *
 * @author hal.hildebrand
 *
 */
public final class Votes {

    /**
     * Aggregate votes nested by constituency into totals per constituency.
     */
    public static <K> Map<K, BigFraction> constituencyTotals(Map<K, ? extends Map<?, BigFraction>> votes) {
        var builder = ImmutableMap.<K, BigFraction>builder();
        votes.forEach((constituency, cvotes) -> builder.put(constituency, total(cvotes)));
        return builder.build();
    }

    public static BigInteger floor(BigFraction value) {
        var floor = value.getNumerator().divide(value.getDenominator());
        if (value.getNumerator().signum() < 0 && !floor.multiply(value.getDenominator()).equals(value.getNumerator())) {
            floor = floor.subtract(BigInteger.ONE);
        }
        return floor;
    }

    public static int floorInt(BigFraction value) {
        return floor(value).intValueExact();
    }

    public static BigFraction max(BigFraction a, BigFraction b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static BigFraction min(BigFraction a, BigFraction b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * Sum integer seat counts key by key.
     */
    public static <K> Map<K, Integer> merge(Map<K, Integer> a, Map<K, Integer> b) {
        Map<K, Integer> merged = new LinkedHashMap<>(a);
        b.forEach((k, n) -> merged.merge(k, n, Integer::sum));
        return merged;
    }

    /**
     * Convert plain counts to an exact tally, keeping the iteration order.
     *
     * @throws InvalidVoteException if a count is negative or not an exact number
     */
    public static <K> Map<K, BigFraction> of(Map<K, ? extends Number> counts) {
        var tally = new Tally<K>();
        counts.forEach((key, count) -> tally.addCount(key, exact(key, count)));
        return tally.toMap();
    }

    /**
     * @return the entries ordered by descending count, equal counts keeping
     *         their iteration order
     */
    public static <K> List<Entry<K, BigFraction>> sorted(Map<K, BigFraction> votes) {
        List<Entry<K, BigFraction>> entries = new ArrayList<>(votes.entrySet());
        entries.sort(Entry.<K, BigFraction>comparingByValue(Comparator.reverseOrder()));
        return entries;
    }

    public static BigFraction sum(Collection<BigFraction> values) {
        var sum = BigFraction.ZERO;
        for (BigFraction v : values) {
            sum = sum.add(v);
        }
        return sum;
    }

    public static BigFraction total(Map<?, BigFraction> votes) {
        return sum(votes.values());
    }

    /**
     * Aggregate votes nested by constituency into overall totals.
     */
    public static <X> Map<X, BigFraction> totals(Map<?, ? extends Map<X, BigFraction>> votes) {
        var tally = new Tally<X>();
        votes.values().forEach(tally::addAll);
        return tally.toMap();
    }

    /**
     * Swap the levels of a two level mapping.
     */
    public static <A, B, T> Map<B, Map<A, T>> transpose(Map<A, ? extends Map<B, T>> nested) {
        Map<B, Map<A, T>> transposed = new LinkedHashMap<>();
        nested.forEach((a, inner) -> inner.forEach((b, value) -> transposed.computeIfAbsent(b,
                                                                                             k -> new LinkedHashMap<>())
                                                                          .put(a, value)));
        return transposed;
    }

    private static BigFraction exact(Object key, Number count) {
        if (count instanceof BigFraction f) {
            return f;
        }
        if (count instanceof BigInteger i) {
            return new BigFraction(i);
        }
        if (count instanceof Integer || count instanceof Long || count instanceof Short || count instanceof Byte) {
            return new BigFraction(count.longValue());
        }
        throw new InvalidVoteException(String.format("Inexact vote count %s (%s) for %s", count,
                                                     count.getClass().getSimpleName(), key));
    }

    private Votes() {
    }
}
