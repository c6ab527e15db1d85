/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.proportional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.Tie;
import com.salesforce.ballot.component.Divisors;
import com.salesforce.ballot.component.Quotas;
import com.salesforce.ballot.evaluate.Distributor;
import com.salesforce.ballot.vote.Votes;

/**
 * @author hal.hildebrand
 *
 */
public class ProportionalTest {
    private static final Map<String, Integer> CAPPED = Map.of("A", 5, "B", 5, "C", 5);

    private final Map<String, BigFraction> classic = Votes.of(ImmutableMap.of("A", 53000, "B", 24000, "C", 23000));
    private final Map<String, BigFraction> capped  = Votes.of(ImmutableMap.of("A", 500, "B", 300, "C", 160));

    @Test
    public void dHondt() {
        var dHondt = new HighestAverages<String>(Divisors.D_HONDT);
        assertEquals(Distribution.of(Map.of("A", 4, "B", 2, "C", 1)), dHondt.evaluate(classic, 7));
        assertEquals(Distribution.of(Map.of("A", 6, "B", 3, "C", 1)), dHondt.evaluate(capped, 10));
        assertEquals(Distribution.of(Map.of("A", 5, "B", 3, "C", 2)), dHondt.evaluate(capped, 10, Map.of(), CAPPED));
        assertThrows(ConfigurationException.class, () -> dHondt.evaluate(capped));
    }

    @Test
    public void previousGainsCountTowardsTheTotal() {
        var dHondt = new HighestAverages<String>(Divisors.D_HONDT);
        var result = dHondt.evaluate(capped, 10, Map.of("A", 3), Map.of());
        assertEquals(Distribution.of(Map.of("A", 3, "B", 3, "C", 1)), result);
        assertEquals(7, result.total());
    }

    @Test
    public void highestAveragesTie() {
        var dHondt = new HighestAverages<String>(Divisors.D_HONDT);
        var result = dHondt.evaluate(Votes.of(ImmutableMap.of("A", 4, "B", 3, "C", 2)), 3);
        assertEquals(Distribution.of(Map.of("A", 1, "B", 1), Map.of(Tie.of(List.of("A", "C")), 1)), result);
        assertEquals(3, result.total());
    }

    @Test
    public void largestRemainder() {
        assertEquals(Distribution.of(Map.of("A", 4, "B", 2, "C", 1)),
                     new LargestRemainder<String>(Quotas.HARE).evaluate(classic, 7));
        assertEquals(Distribution.of(Map.of("A", 4, "B", 2, "C", 1)),
                     new LargestRemainder<String>(Quotas.DROOP).evaluate(classic, 7));
        assertEquals(Distribution.of(Map.of("A", 5, "B", 3, "C", 2)),
                     new LargestRemainder<String>(Quotas.DROOP).evaluate(capped, 10, Map.of(), CAPPED));

        var tied = new LargestRemainder<String>(Quotas.HARE).evaluate(Votes.of(ImmutableMap.of("A", 1, "B", 1)), 1);
        assertEquals(Distribution.of(Map.of(), Map.of(Tie.of(List.of("A", "B")), 1)), tied);
    }

    @Test
    public void quotaDistributor() {
        assertEquals(Distribution.of(Map.of("A", 3, "B", 1, "C", 1)),
                     new QuotaDistributor<String>(Quotas.HARE).evaluate(classic, 7));
    }

    @Test
    public void previousGainsCountAgainstSeats() {
        List<Distributor<Map<String, BigFraction>, String>> distributors = List.of(new HighestAverages<>(Divisors.D_HONDT),
                                                                                   new HighestAverages<>(Divisors.SAINTE_LAGUE),
                                                                                   new LargestRemainder<>(Quotas.HARE),
                                                                                   new LargestRemainder<>(Quotas.DROOP));
        List<Map<String, Integer>> gains = List.of(Map.of("A", 1), Map.of("A", 2, "B", 1));
        for (var distributor : distributors) {
            for (var prev : gains) {
                int held = prev.values().stream().mapToInt(Integer::intValue).sum();
                for (int n = 5; n <= 20; n++) {
                    var result = distributor.evaluate(classic, n, prev, Map.of());
                    assertEquals(n - held, result.total(), distributor + ", seats: " + n + ", prev: " + prev);
                }
            }
        }
    }

    @Test
    public void sainteLague() {
        assertEquals(Distribution.of(Map.of("A", 3, "B", 2, "C", 2)),
                     new HighestAverages<String>(Divisors.SAINTE_LAGUE).evaluate(classic, 7));
    }

    @Test
    public void zeroFirstDivisor() {
        var votes = Votes.of(ImmutableMap.of("A", 100, "B", 1, "C", 1, "D", 0));
        var adams = new HighestAverages<String>(Divisors.modifiedFirst(Divisors.D_HONDT, BigFraction.ZERO));
        assertEquals(Distribution.of(Map.of("A", 1, "B", 1, "C", 1)), adams.evaluate(votes, 3));
        assertEquals(Distribution.of(Map.of(), Map.of(Tie.of(List.of("A", "B", "C")), 2)), adams.evaluate(votes, 2));
        assertEquals(Distribution.of(Map.of("A", 2, "B", 1, "C", 1)), adams.evaluate(votes, 4));
    }
}
