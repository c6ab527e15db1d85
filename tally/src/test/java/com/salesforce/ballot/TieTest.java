/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

/**
 * @author hal.hildebrand
 *
 */
public class TieTest {

    @Test
    public void breakByListConsumesMembers() {
        var tie = Tie.of(List.of("B", "C"));
        List<Elected<String>> entries = List.of(new Winner<>("A"), tie, tie);
        assertEquals(List.of("A", "C", "B"), Tie.breakByList(entries, List.of("C", "B", "A")));
        assertEquals(List.of("A", "B", "C"), Tie.breakByList(entries, List.of("A", "B", "C")));
    }

    @Test
    public void breakByListRequiresTiedMembers() {
        List<Elected<String>> entries = List.of(Tie.of(List.of("B", "C")));
        assertThrows(IllegalArgumentException.class, () -> Tie.breakByList(entries, List.of("B")));
    }

    @Test
    public void distributionBreakTie() {
        var tie = Tie.of(List.of("A", "C"));
        var distribution = Distribution.of(Map.of("A", 1, "B", 1), Map.of(tie, 1));
        assertEquals(3, distribution.total());
        assertTrue(distribution.hasTies());
        var broken = distribution.breakTie(tie, List.of("A"));
        assertEquals(Distribution.of(Map.of("A", 2, "B", 1)), broken);
        assertFalse(broken.hasTies());
        assertThrows(IllegalArgumentException.class, () -> distribution.breakTie(tie, List.of("A", "C")));
    }

    @Test
    public void distributionDropsZeroSeats() {
        var distribution = Distribution.of(Map.of("A", 2, "B", 0));
        assertEquals(Map.of("A", 2), distribution.seats());
        assertEquals(0, distribution.get("B"));
        assertThrows(IllegalArgumentException.class, () -> Distribution.of(Map.of("A", -1)));
    }

    @Test
    public void equalityIgnoresOrder() {
        assertEquals(Tie.of(List.of("A", "B")), Tie.of(List.of("B", "A")));
        assertEquals(Tie.of(List.of("A", "B")).hashCode(), Tie.of(List.of("B", "A")).hashCode());
        assertTrue(Tie.of(List.of("A", "B")).isSubsetOf(List.of("C", "B", "A")));
    }

    @Test
    public void needsTwoMembers() {
        assertThrows(IllegalArgumentException.class, () -> Tie.of(List.of("A")));
        assertThrows(IllegalArgumentException.class, () -> Tie.of(List.of()));
    }

    @Test
    public void reconcile() {
        var tie = Tie.of(List.of("B", "C"));
        List<Elected<String>> single = List.of(new Winner<>("A"), tie);
        assertSame(single, Tie.reconcile(single));

        List<Elected<String>> whole = List.of(tie, tie);
        var e = assertThrows(UnresolvedTieException.class, () -> Tie.reconcile(whole));
        assertEquals(tie, e.getTie());
    }

    @Test
    public void selectionWinners() {
        var tie = Tie.of(List.of("B", "C"));
        var selection = Selection.<String>of(List.of(new Winner<>("A"), tie));
        assertEquals(Map.of(tie, 1), selection.ties());
        var e = assertThrows(UnresolvedTieException.class, () -> selection.winners());
        assertEquals(tie, e.getTie());

        var broken = selection.breakTie(tie, List.of("C"));
        assertEquals(List.of("A", "C"), broken.winners());
        assertEquals(Selection.ofWinners(List.of("A", "C")), broken);
    }
}
