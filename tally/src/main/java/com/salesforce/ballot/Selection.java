/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * The outcome of a selection: candidates ordered by decreasing strength, winner
 * first. A tie for k seats occupies k consecutive entries.
 *
 * @author hal.hildebrand
 *
 */
public final class Selection<C> implements Result<C, Selection<C>>, Iterable<Elected<C>> {
    private static final Selection<?> EMPTY = new Selection<>(ImmutableList.of());

    @SuppressWarnings("unchecked")
    public static <C> Selection<C> empty() {
        return (Selection<C>) EMPTY;
    }

    public static <C> Selection<C> of(List<? extends Elected<C>> entries) {
        return new Selection<>(ImmutableList.copyOf(entries));
    }

    public static <C> Selection<C> ofWinners(Collection<? extends C> winners) {
        var builder = ImmutableList.<Elected<C>>builder();
        for (C winner : winners) {
            builder.add(new Winner<>(winner));
        }
        return new Selection<>(builder.build());
    }

    private final ImmutableList<Elected<C>> entries;

    private Selection(ImmutableList<Elected<C>> entries) {
        this.entries = entries;
    }

    @Override
    public Selection<C> breakTie(Tie<C> tie, List<C> broken) {
        var replacements = broken.iterator();
        List<Elected<C>> result = new ArrayList<>(entries.size());
        for (Elected<C> entry : entries) {
            if (entry.equals(tie)) {
                if (!replacements.hasNext()) {
                    throw new IllegalArgumentException(String.format("Too few candidates %s to break %s in %s", broken,
                                                                     tie, this));
                }
                result.add(new Winner<>(replacements.next()));
            } else {
                result.add(entry);
            }
        }
        return new Selection<>(ImmutableList.copyOf(result));
    }

    /**
     * @return every candidate mentioned, tied or not, in order of first mention
     */
    public Set<C> candidates() {
        Set<C> candidates = new LinkedHashSet<>();
        entries.forEach(e -> candidates.addAll(e.members()));
        return candidates;
    }

    public List<Elected<C>> entries() {
        return entries;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Selection<?> other && entries.equals(other.entries);
    }

    public Elected<C> get(int index) {
        return entries.get(index);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Iterator<Elected<C>> iterator() {
        return entries.iterator();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public Map<Tie<C>, Integer> ties() {
        Map<Tie<C>, Integer> ties = new LinkedHashMap<>();
        for (Elected<C> entry : entries) {
            if (entry instanceof Tie<C> tie) {
                ties.merge(tie, 1, Integer::sum);
            }
        }
        return ties;
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    /**
     * @return the selected candidates
     * @throws UnresolvedTieException if the selection contains a tie
     */
    public List<C> winners() {
        var builder = ImmutableList.<C>builder();
        for (Elected<C> entry : entries) {
            if (entry instanceof Tie<C> tie) {
                throw new UnresolvedTieException("Selection contains a tie", tie);
            }
            builder.add(((Winner<C>) entry).candidate());
        }
        return builder.build();
    }
}
