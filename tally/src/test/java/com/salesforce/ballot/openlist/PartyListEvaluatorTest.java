/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.openlist;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;
import com.salesforce.ballot.component.Divisors;
import com.salesforce.ballot.evaluate.Seats;
import com.salesforce.ballot.proportional.HighestAverages;
import com.salesforce.ballot.vote.Votes;

/**
 * @author hal.hildebrand
 *
 */
public class PartyListEvaluatorTest {
    private final Map<String, List<String>>               lists     = ImmutableMap.of("A", List.of("a1", "a2", "a3"),
                                                                                      "B", List.of("b1", "b2"));
    private final Map<String, Map<String, BigFraction>> listVotes = ImmutableMap.of("A",
                                                                                    Votes.of(ImmutableMap.of("a1", 10,
                                                                                                             "a2", 5,
                                                                                                             "a3", 40)),
                                                                                    "B",
                                                                                    Votes.of(ImmutableMap.of("b1", 1,
                                                                                                             "b2", 9)));
    private final Map<String, BigFraction>              votes     = Votes.of(ImmutableMap.of("A", 70, "B", 30));

    @Test
    public void closedLists() {
        var evaluator = new PartyListEvaluator<Map<String, BigFraction>, String, String>(new HighestAverages<>(Divisors.D_HONDT));
        var elected = evaluator.evaluate(votes, Seats.of(3), lists, Map.of());
        assertEquals(Map.of("A", List.of("a1", "a2"), "B", List.of("b1")), elected);
        assertThrows(IllegalArgumentException.class, () -> evaluator.evaluate(votes, Seats.of(3), lists, listVotes));
        assertThrows(IllegalArgumentException.class,
                     () -> evaluator.evaluate(votes, Seats.of(3), Map.of("A", List.of("a1")), null));
    }

    @Test
    public void openLists() {
        var open = ThresholdOpenList.newBuilder().setJumpFraction(new BigFraction(1, 5)).<String>build();
        var evaluator = new PartyListEvaluator<Map<String, BigFraction>, String, String>(new HighestAverages<>(Divisors.D_HONDT),
                                                                                         open);
        var elected = evaluator.evaluate(votes, Seats.of(3), lists, listVotes);
        assertEquals(Map.of("A", List.of("a3", "a1"), "B", List.of("b2")), elected);
        assertThrows(IllegalArgumentException.class, () -> evaluator.evaluate(votes, Seats.of(3), lists, null));
    }
}
