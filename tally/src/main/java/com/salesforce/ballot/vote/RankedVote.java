/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.vote;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.salesforce.ballot.InvalidVoteException;

/**
 * A ranked ballot: candidates in order of preference, where a rank may be
 * shared by several candidates. No candidate appears twice.
 *
 * @author hal.hildebrand
 *
 */
public record RankedVote<C>(ImmutableList<ImmutableSet<C>> ranks) {

    /**
     * A ballot ranking each candidate on its own.
     */
    @SafeVarargs
    public static <C> RankedVote<C> of(C... candidates) {
        return ofRanks(Arrays.stream(candidates).map(ImmutableSet::of).collect(Collectors.toList()));
    }

    public static <C> RankedVote<C> ofRanks(List<? extends Collection<? extends C>> ranks) {
        var builder = ImmutableList.<ImmutableSet<C>>builder();
        for (var rank : ranks) {
            builder.add(ImmutableSet.copyOf(rank));
        }
        return new RankedVote<>(builder.build());
    }

    public RankedVote {
        Set<C> seen = new HashSet<>();
        for (var rank : ranks) {
            if (rank.isEmpty()) {
                throw new InvalidVoteException("Empty rank in " + ranks);
            }
            for (C candidate : rank) {
                if (!seen.add(candidate)) {
                    throw new InvalidVoteException(String.format("Candidate %s ranked twice in %s", candidate, ranks));
                }
            }
        }
    }

    public Set<C> candidates() {
        Set<C> candidates = new LinkedHashSet<>();
        ranks.forEach(candidates::addAll);
        return candidates;
    }

    /**
     * @return the first rank, empty for a blank ballot
     */
    public Set<C> first() {
        return ranks.isEmpty() ? ImmutableSet.of() : ranks.get(0);
    }

    public boolean isEmpty() {
        return ranks.isEmpty();
    }

    /**
     * The next preference after the holder among the allowed candidates. Ranks
     * without an allowed candidate are skipped.
     *
     * @return the allowed members of the next rank, empty if the ballot is
     *         exhausted
     */
    public Set<C> next(C holder, Set<C> allowed) {
        boolean passed = false;
        for (var rank : ranks) {
            if (passed) {
                var available = Sets.intersection(rank, allowed);
                if (!available.isEmpty()) {
                    return ImmutableSet.copyOf(available);
                }
            } else if (rank.contains(holder)) {
                passed = true;
            }
        }
        return ImmutableSet.of();
    }

    public RankedVote<C> reversed() {
        return new RankedVote<>(ranks.reverse());
    }

    /**
     * @return this ballot with only the allowed candidates left, empty ranks
     *         dropped
     */
    public RankedVote<C> subset(Set<?> allowed) {
        List<ImmutableSet<C>> kept = new ArrayList<>();
        for (var rank : ranks) {
            var remaining = rank.stream().filter(allowed::contains).collect(ImmutableSet.toImmutableSet());
            if (!remaining.isEmpty()) {
                kept.add(remaining);
            }
        }
        return new RankedVote<>(ImmutableList.copyOf(kept));
    }

    @Override
    public String toString() {
        return ranks.stream()
                    .map(rank -> rank.size() == 1 ? String.valueOf(rank.iterator().next())
                                                  : rank.stream()
                                                        .map(String::valueOf)
                                                        .collect(Collectors.joining("=", "(", ")")))
                    .collect(Collectors.joining(">"));
    }
}
