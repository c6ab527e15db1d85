/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.threshold;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Plurality;
import com.salesforce.ballot.evaluate.Seats;
import com.salesforce.ballot.evaluate.Selector;
import com.salesforce.ballot.vote.Votes;

/**
 * @author hal.hildebrand
 *
 */
public class ThresholdTest {
    private final Map<String, BigFraction> votes = Votes.of(ImmutableMap.of("A", 500, "B", 300, "C", 160, "D", 40));

    @Test
    public void absolute() {
        assertEquals(List.of("A", "B", "C"), new AbsoluteThreshold<String>(new BigFraction(160)).evaluate(votes)
                                                                                                 .winners());
        assertEquals(List.of("A", "B"), new AbsoluteThreshold<String>(new BigFraction(160), false).evaluate(votes)
                                                                                                   .winners());
    }

    @Test
    public void alternatives() {
        List<Selector<Map<String, BigFraction>, String>> partials = List.of(new RelativeThreshold<>(new BigFraction(1, 20)),
                                                                            new PreviousGainThreshold<>(new AbsoluteThreshold<>(new BigFraction(3))));
        var alternatives = new AlternativeThresholds<>(partials);
        assertEquals(Set.of(Capability.PREVIOUS_GAINS), alternatives.capabilities());
        var seats = Seats.<Map<String, Integer>>none().withGains(Map.of("D", 3), Map.of());
        assertEquals(List.of("A", "B", "C", "D"), alternatives.evaluate(votes, seats).winners());
        assertEquals(List.of("A", "B", "C"), alternatives.evaluate(votes).winners());
    }

    @Test
    public void alternativesRejectSeatBasedSelectors() {
        assertThrows(ConfigurationException.class,
                     () -> new AlternativeThresholds<>(List.<Selector<Map<String, BigFraction>, String>>of(new Plurality<>())));
        assertThrows(ConfigurationException.class, () -> new PreviousGainThreshold<Object, String>(new Plurality<>()));
    }

    @Test
    public void previousGains() {
        var threshold = new PreviousGainThreshold<Map<String, BigFraction>, String>(new AbsoluteThreshold<>(new BigFraction(3)));
        var seats = Seats.<Map<String, Integer>>none().withGains(Map.of("C", 1, "D", 3), Map.of());
        assertEquals(List.of("D"), threshold.evaluate(votes, seats).winners());
        assertTrue(threshold.evaluate(votes).isEmpty());
    }

    @Test
    public void relative() {
        assertEquals(List.of("A", "B", "C"), new RelativeThreshold<String>(new BigFraction(1, 20)).evaluate(votes)
                                                                                                   .winners());
        assertEquals(List.of("A", "B", "C", "D"),
                     new RelativeThreshold<String>(new BigFraction(1, 25)).evaluate(votes).winners());
        assertEquals(List.of("A", "B", "C"),
                     new RelativeThreshold<String>(new BigFraction(1, 25), false).evaluate(votes).winners());
        assertTrue(new RelativeThreshold<String>(new BigFraction(1, 25)).evaluate(Map.of()).isEmpty());
    }
}
