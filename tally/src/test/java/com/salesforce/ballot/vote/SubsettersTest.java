/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.vote;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

/**
 * @author hal.hildebrand
 *
 */
public class SubsettersTest {

    @Test
    public void nested() {
        Map<String, Map<String, BigFraction>> regional = ImmutableMap.of("north",
                                                                         Votes.of(ImmutableMap.of("A", 1, "B", 2)),
                                                                         "south", Votes.of(ImmutableMap.of("B", 4)));
        var subset = Subsetters.<String, Map<String, BigFraction>, String>nested(Subsetters.simple())
                               .subset(regional, Set.of("A"));
        assertEquals(Map.of("north", Map.of("A", BigFraction.ONE), "south", Map.of()), subset);
    }

    @Test
    public void ranked() {
        Map<RankedVote<String>, BigFraction> votes = ImmutableMap.of(RankedVote.of("A", "B", "C"),
                                                                     new BigFraction(3), RankedVote.of("B", "A"),
                                                                     new BigFraction(2), RankedVote.of("C", "A"),
                                                                     new BigFraction(4), RankedVote.of("C"),
                                                                     new BigFraction(1));
        var subset = Subsetters.<String>ranked().subset(votes, Set.of("A", "C"));
        assertEquals(Map.of(RankedVote.of("A", "C"), new BigFraction(3), RankedVote.of("A"), new BigFraction(2),
                            RankedVote.of("C", "A"), new BigFraction(4), RankedVote.of("C"), new BigFraction(1)),
                     subset);

        var merged = Subsetters.<String>ranked().subset(votes, Set.of("A"));
        assertEquals(Map.of(RankedVote.of("A"), new BigFraction(9)), merged);
        assertEquals(List.of(), List.copyOf(Subsetters.<String>ranked().subset(votes, Set.of("D")).keySet()));
    }

    @Test
    public void simple() {
        var votes = Votes.of(ImmutableMap.of("A", 1, "B", 2, "C", 3));
        assertEquals(Map.of("A", BigFraction.ONE, "C", new BigFraction(3)),
                     Subsetters.<String>simple().subset(votes, Set.of("A", "C", "D")));
    }
}
