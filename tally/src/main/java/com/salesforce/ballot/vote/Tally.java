/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.vote;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableMap;
import com.salesforce.ballot.InvalidVoteException;

/**
 * A mutable accumulator of exact vote counts, keyed by anything a vote can be
 * cast for. Keys keep the order in which they were first counted.
 *
 * @author hal.hildebrand
 *
 */
public class Tally<K> {
    public record Mode<K>(K key, BigFraction count) {}

    public static <K> Tally<K> of(Map<K, BigFraction> counts) {
        var tally = new Tally<K>();
        counts.forEach(tally::addCount);
        return tally;
    }

    private final Map<K, BigFraction> counts       = new LinkedHashMap<>();
    private final Set<K>              metThreshold = new LinkedHashSet<>();
    private K                         mode;
    private BigFraction               modeCount    = BigFraction.ZERO;
    private BigFraction               threshold    = BigFraction.ZERO;
    private BigFraction               total        = BigFraction.ZERO;

    @SafeVarargs
    public final void add(K... keys) {
        for (K key : keys) {
            addCount(key, BigFraction.ONE);
        }
    }

    public void addCount(K key, BigFraction count) {
        if (count.compareTo(BigFraction.ZERO) < 0) {
            throw new InvalidVoteException(String.format("Negative vote count %s for %s", count, key));
        }
        var totalCount = counts.getOrDefault(key, BigFraction.ZERO).add(count);
        counts.put(key, totalCount);
        total = total.add(count);
        if (mode == null || totalCount.compareTo(modeCount) > 0) {
            mode = key;
            modeCount = totalCount;
        }
        if (totalCount.compareTo(threshold) >= 0) {
            metThreshold.add(key);
        }
    }

    public void addCount(K key, long count) {
        addCount(key, new BigFraction(count));
    }

    public void addAll(Map<K, BigFraction> votes) {
        votes.forEach(this::addCount);
    }

    public BigFraction count(K key) {
        return counts.getOrDefault(key, BigFraction.ZERO);
    }

    public Tally<K> filter(Predicate<? super K> predicate) {
        var filtered = new Tally<K>();
        filtered.setThreshold(threshold);
        counts.forEach((key, count) -> {
            if (predicate.test(key)) {
                filtered.addCount(key, count);
            }
        });
        return filtered;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public Set<K> keys() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    /**
     * @return the key counted highest, the earliest one on equal counts
     */
    public Optional<Mode<K>> mode() {
        return mode == null ? Optional.empty() : Optional.of(new Mode<>(mode, modeCount));
    }

    public void setThreshold(BigFraction threshold) {
        if (this.threshold.equals(threshold)) {
            return;
        }
        this.threshold = threshold;
        metThreshold.clear();

        counts.forEach((key, count) -> {
            if (count.compareTo(threshold) >= 0) {
                metThreshold.add(key);
            }
        });
    }

    public int size() {
        return counts.size();
    }

    /**
     * @return the keys whose count reaches the threshold
     */
    public Set<K> threshold() {
        return Collections.unmodifiableSet(metThreshold);
    }

    public ImmutableMap<K, BigFraction> toMap() {
        return ImmutableMap.copyOf(counts);
    }

    public BigFraction total() {
        return total;
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
