/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;
import com.salesforce.ballot.Elected;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.Tie;
import com.salesforce.ballot.Winner;
import com.salesforce.ballot.vote.Votes;

/**
 * @author hal.hildebrand
 *
 */
public class PluralityTest {
    private static final Winner<String> A  = new Winner<>("A");
    private static final Tie<String>    BC = Tie.of(List.of("B", "C"));

    private final Plurality<String>        plurality = new Plurality<>();
    private final Map<String, BigFraction> votes     = Votes.of(ImmutableMap.of("A", 3, "B", 2, "C", 2, "D", 1));

    @Test
    public void noTieAcrossBoundary() {
        assertEquals(List.of(A), Plurality.topN(votes, 1));
        assertEquals(List.of("A", "B", "C", "D"), plurality.evaluate(votes, 4).winners());
        assertEquals(4, plurality.evaluate(votes, 7).size());
    }

    @Test
    public void selectionLength() {
        for (int n = 0; n <= 6; n++) {
            assertEquals(Math.min(n, votes.size()), Plurality.topN(votes, n).size(), "seats: " + n);
        }
    }

    @Test
    public void singleWinnerByDefault() {
        assertEquals(Selection.ofWinners(List.of("A")), plurality.evaluate(votes));
    }

    @Test
    public void tieAtBoundary() {
        List<Elected<String>> two = List.of(A, BC);
        assertEquals(two, Plurality.topN(votes, 2));
        assertEquals(Map.of(BC, 1), plurality.evaluate(votes, 2).ties());
    }

    @Test
    public void tiedPairInsideSelection() {
        assertEquals(List.of(A, new Winner<>("B"), new Winner<>("C")), Plurality.topN(votes, 3));
        assertEquals(Map.of(), plurality.evaluate(votes, 3).ties());
    }
}
