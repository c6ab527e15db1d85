/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.stv;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;

import com.salesforce.ballot.vote.RankedVote;
import com.salesforce.ballot.vote.Votes;

/**
 * The ranked votes held by each continuing candidate, plus the exhausted
 * ballots that no longer count towards anyone. A ballot may be split among
 * several holders, each holding a fraction of its count.
 *
 * @author hal.hildebrand
 *
 */
public final class Allocation<C> {

    public static <C> Allocation<C> of(Collection<? extends C> candidates) {
        var allocation = new Allocation<C>();
        candidates.forEach(c -> allocation.held.put(c, new LinkedHashMap<>()));
        return allocation;
    }

    private static <K> void add(Map<K, BigFraction> votes, K vote, BigFraction count) {
        votes.merge(vote, count, BigFraction::add);
    }

    private final Map<RankedVote<C>, BigFraction>            exhausted = new LinkedHashMap<>();
    private final Map<C, Map<RankedVote<C>, BigFraction>> held      = new LinkedHashMap<>();

    private Allocation() {
    }

    public void add(C holder, RankedVote<C> vote, BigFraction count) {
        add(held.computeIfAbsent(holder, c -> new LinkedHashMap<>()), vote, count);
    }

    /**
     * @return the continuing candidates, in the order they were first allocated
     */
    public Set<C> continuing() {
        return Collections.unmodifiableSet(held.keySet());
    }

    public Allocation<C> copy() {
        var copy = new Allocation<C>();
        held.forEach((c, votes) -> copy.held.put(c, new LinkedHashMap<>(votes)));
        copy.exhausted.putAll(exhausted);
        return copy;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Allocation<?> other && held.equals(other.held) && exhausted.equals(other.exhausted);
    }

    public void exhaust(RankedVote<C> vote, BigFraction count) {
        add(exhausted, vote, count);
    }

    public Map<RankedVote<C>, BigFraction> exhausted() {
        return Collections.unmodifiableMap(exhausted);
    }

    public BigFraction exhaustedTotal() {
        return Votes.total(exhausted);
    }

    @Override
    public int hashCode() {
        return Objects.hash(held, exhausted);
    }

    public Map<RankedVote<C>, BigFraction> held(C holder) {
        var votes = held.get(holder);
        return votes == null ? Map.of() : Collections.unmodifiableMap(votes);
    }

    /**
     * Remove the candidate from the contest.
     *
     * @return the votes the candidate held
     */
    public Map<RankedVote<C>, BigFraction> remove(C holder) {
        var votes = held.remove(holder);
        return votes == null ? Map.of() : votes;
    }

    /**
     * Replace the votes held by a continuing candidate.
     */
    public void replace(C holder, Map<RankedVote<C>, BigFraction> votes) {
        if (!held.containsKey(holder)) {
            throw new IllegalArgumentException("Not a continuing candidate: " + holder);
        }
        held.put(holder, new LinkedHashMap<>(votes));
    }

    @Override
    public String toString() {
        return "Allocation[" + totals() + ", exhausted=" + exhaustedTotal() + "]";
    }

    /**
     * @return the sum of the vote weights held by each continuing candidate
     */
    public Map<C, BigFraction> totals() {
        Map<C, BigFraction> totals = new LinkedHashMap<>();
        held.forEach((c, votes) -> totals.put(c, Votes.total(votes)));
        return totals;
    }
}
