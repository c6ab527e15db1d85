/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.component.Divisors;
import com.salesforce.ballot.proportional.HighestAverages;
import com.salesforce.ballot.threshold.RelativeThreshold;
import com.salesforce.ballot.vote.Votes;

/**
 * @author hal.hildebrand
 *
 */
public class OverhangTest {
    private final HighestAverages<String>   sainteLague = new HighestAverages<>(Divisors.SAINTE_LAGUE);
    private final Map<String, BigFraction> votes       = Votes.of(ImmutableMap.of("A", 610, "B", 290, "C", 100));

    @Test
    public void allowOverhang() {
        var overhang = new AllowOverhang<>(sainteLague);
        assertEquals(2, overhang.calculate(votes, 10, Map.of("C", 3), Map.of()));
        assertEquals(0, overhang.calculate(votes, 10, Map.of("C", 1), Map.of()));

        var adjusted = new AdjustedSeatCount<>(overhang, sainteLague);
        assertEquals(Distribution.of(Map.of("A", 6, "B", 3)), adjusted.evaluate(votes, 10, Map.of("C", 3), Map.of()));
    }

    @Test
    public void levelOverhang() {
        assertEquals(Distribution.of(Map.of("A", 6, "B", 3, "C", 1)), sainteLague.evaluate(votes, 10));

        var level = new LevelOverhang<>(sainteLague);
        assertEquals(15, level.calculate(votes, 10, Map.of("C", 3), Map.of()));
        assertEquals(0, level.calculate(votes, 10, Map.of(), Map.of()));

        var adjusted = new AdjustedSeatCount<>(level, sainteLague);
        assertEquals(Distribution.of(Map.of("A", 15, "B", 7)), adjusted.evaluate(votes, 10, Map.of("C", 3), Map.of()));
        assertThrows(ConfigurationException.class, () -> adjusted.evaluate(votes));
    }

    @Test
    public void levelOverhangByConstituency() {
        Map<String, Map<String, BigFraction>> regional = ImmutableMap.of("north",
                                                                         Votes.of(ImmutableMap.of("A", 400, "B", 100)),
                                                                         "south",
                                                                         Votes.of(ImmutableMap.of("A", 210, "B", 190,
                                                                                                  "C", 110)));
        var constituencies = ByConstituency.<String, String, String>distributing(sainteLague,
                                                                                 Apportionment.by(new HighestAverages<>(Divisors.SAINTE_LAGUE)));
        Map<String, Map<String, Integer>> prevGains = ImmutableMap.of("north", Map.of("B", 3), "south", Map.of("C", 2));

        var overall = new LevelOverhangByConstituency<>(constituencies, sainteLague);
        assertEquals(6, overall.calculate(regional, 10, prevGains, Map.of()));

        var merged = new LevelOverhangByConstituency<String, String, String>(constituencies, null);
        assertEquals(6, merged.calculate(regional, 10, prevGains, Map.of()));
    }

    @Test
    public void seatlessEvaluatorCannotBeAdjusted() {
        assertThrows(ConfigurationException.class,
                     () -> new AdjustedSeatCount<>(new LevelOverhang<>(sainteLague),
                                                   new RelativeThreshold<String>(new BigFraction(1, 20))));
    }
}
