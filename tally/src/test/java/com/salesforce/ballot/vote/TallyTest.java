/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.vote;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;
import com.salesforce.ballot.InvalidVoteException;

/**
 * @author hal.hildebrand
 *
 */
public class TallyTest {

    @Test
    public void counts() {
        var tally = new Tally<String>();
        assertTrue(tally.mode().isEmpty());
        tally.add("A", "B", "A");
        tally.addCount("C", new BigFraction(5, 2));
        assertEquals(new BigFraction(2), tally.count("A"));
        assertEquals(BigFraction.ZERO, tally.count("D"));
        assertEquals(new BigFraction(11, 2), tally.total());
        assertEquals(3, tally.size());
        assertEquals("C", tally.mode().get().key());
        assertEquals(List.of("A", "B", "C"), List.copyOf(tally.keys()));
        assertThrows(InvalidVoteException.class, () -> tally.addCount("A", -1));
    }

    @Test
    public void modeKeepsEarliest() {
        var tally = new Tally<String>();
        tally.add("B", "A", "B", "A");
        assertEquals(new Tally.Mode<>("B", new BigFraction(2)), tally.mode().get());
    }

    @Test
    public void threshold() {
        var tally = Tally.of(Votes.of(ImmutableMap.of("A", 5, "B", 2, "C", 3)));
        tally.setThreshold(new BigFraction(3));
        assertEquals(Set.of("A", "C"), tally.threshold());
        tally.addCount("B", 1);
        assertEquals(Set.of("A", "B", "C"), tally.threshold());

        var filtered = tally.filter(k -> !k.equals("A"));
        assertEquals(Set.of("B", "C"), filtered.threshold());
        assertEquals(new BigFraction(6), filtered.total());
        assertFalse(filtered.isEmpty());
    }

    @Test
    public void votes() {
        var votes = Votes.of(ImmutableMap.of("A", 3, "B", 7L, "C", BigInteger.TWO));
        assertEquals(new BigFraction(12), Votes.total(votes));
        assertEquals(List.of("B", "A", "C"), Votes.sorted(votes).stream().map(Map.Entry::getKey).toList());
        assertThrows(InvalidVoteException.class, () -> Votes.of(Map.of("A", 1.5)));
        assertEquals(2, Votes.floorInt(new BigFraction(5, 2)));
        assertEquals(BigInteger.valueOf(-3), Votes.floor(new BigFraction(-5, 2)));
        assertEquals(Map.of("A", 3, "B", 1), Votes.merge(Map.of("A", 1, "B", 1), Map.of("A", 2)));

        Map<String, Map<String, BigFraction>> regional = ImmutableMap.of("north",
                                                                         Votes.of(ImmutableMap.of("A", 1, "B", 2)),
                                                                         "south", Votes.of(ImmutableMap.of("A", 4)));
        assertEquals(Map.of("A", new BigFraction(5), "B", new BigFraction(2)), Votes.totals(regional));
        assertEquals(Map.of("north", new BigFraction(3), "south", new BigFraction(4)),
                     Votes.constituencyTotals(regional));
        assertEquals(Map.of("A", Map.of("north", new BigFraction(1), "south", new BigFraction(4)), "B",
                            Map.of("north", new BigFraction(2))),
                     Votes.transpose(regional));
    }
}
