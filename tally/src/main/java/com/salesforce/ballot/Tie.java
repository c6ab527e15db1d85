/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableSet;

/**
 * Candidates tied for a seat. A tie occupying several seats appears in a result
 * once per seat. Ties are unordered: two ties are equal when they have the same
 * members.
 *
 * @author hal.hildebrand
 *
 */
public final class Tie<C> implements Elected<C>, Iterable<C> {

    /**
     * @return true if any of the entries is a tie
     */
    public static <C> boolean any(Collection<? extends Elected<C>> entries) {
        return entries.stream().anyMatch(Elected::isTie);
    }

    /**
     * Replace every tie occurrence by the highest priority member not yet used
     * for an earlier occurrence of the same tie.
     *
     * @param entries  - the selection entries
     * @param priority - candidates in order of precedence, must contain every
     *                 tied candidate
     * @return the entries with all ties broken
     */
    public static <C> List<C> breakByList(List<? extends Elected<C>> entries, List<C> priority) {
        Map<Tie<C>, Deque<C>> pending = new HashMap<>();
        List<C> broken = new ArrayList<>(entries.size());
        for (Elected<C> entry : entries) {
            if (entry instanceof Tie<C> tie) {
                var remaining = pending.computeIfAbsent(tie, t -> {
                    var ordered = new ArrayList<>(t.members);
                    for (C member : ordered) {
                        if (!priority.contains(member)) {
                            throw new IllegalArgumentException(String.format("Tied candidate %s missing from priority list %s",
                                                                             member, priority));
                        }
                    }
                    ordered.sort(Comparator.comparingInt(priority::indexOf));
                    return new ArrayDeque<>(ordered);
                });
                broken.add(remaining.removeFirst());
            } else if (entry instanceof Winner<C> winner) {
                broken.add(winner.candidate());
            }
        }
        return broken;
    }

    public static <C> Tie<C> of(Collection<? extends C> members) {
        return new Tie<>(ImmutableSet.copyOf(members));
    }

    /**
     * Detect tied candidates whose fractional shares over all tie occurrences in
     * the entries amount to a whole seat. Such ties could be resolved
     * unambiguously but no policy for doing so exists, so they are reported as
     * unresolved.
     *
     * @return the entries, unchanged
     * @throws UnresolvedTieException if a member holds a whole seat by
     *                                accumulated tie shares
     */
    public static <C, L extends List<? extends Elected<C>>> L reconcile(L entries) {
        Map<C, BigFraction> places = new LinkedHashMap<>();
        Map<C, Tie<C>> owner = new HashMap<>();
        for (Elected<C> entry : entries) {
            if (entry instanceof Tie<C> tie) {
                var share = new BigFraction(1, tie.size());
                for (C member : tie) {
                    places.merge(member, share, BigFraction::add);
                    owner.putIfAbsent(member, tie);
                }
            }
        }
        for (var e : places.entrySet()) {
            if (e.getValue().compareTo(BigFraction.ONE) >= 0) {
                throw new UnresolvedTieException("Tie reconciliation not supported", owner.get(e.getKey()));
            }
        }
        return entries;
    }

    private final ImmutableSet<C> members;

    private Tie(ImmutableSet<C> members) {
        if (members.size() < 2) {
            throw new IllegalArgumentException("A tie needs at least two members: " + members);
        }
        this.members = members;
    }

    public boolean contains(Object candidate) {
        return members.contains(candidate);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Tie<?> other)) {
            return false;
        }
        return members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public boolean isTie() {
        return true;
    }

    public boolean isSubsetOf(Collection<?> candidates) {
        return candidates.containsAll(members);
    }

    @Override
    public Iterator<C> iterator() {
        return members.iterator();
    }

    @Override
    public Set<C> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    @Override
    public String toString() {
        return "Tie" + members;
    }
}
