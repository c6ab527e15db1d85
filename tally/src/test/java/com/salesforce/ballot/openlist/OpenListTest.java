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
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.component.Quotas;
import com.salesforce.ballot.evaluate.Plurality;
import com.salesforce.ballot.threshold.RelativeThreshold;
import com.salesforce.ballot.vote.Votes;

/**
 * @author hal.hildebrand
 *
 */
public class OpenListTest {
    private static final List<Integer> LIST = List.of(1, 2, 3, 4, 5);

    private final Map<Integer, BigFraction> votes = Votes.of(ImmutableMap.of(1, 250, 2, 15, 3, 3, 4, 2, 5, 30));

    @Test
    public void closedWithoutThreshold() {
        var closed = ThresholdOpenList.newBuilder().<Integer>build();
        assertEquals(List.of(1, 2, 3), closed.evaluate(votes, 3, LIST));
        assertEquals(LIST, closed.evaluate(votes, 7, LIST));
    }

    @Test
    public void jumpFraction() {
        var open = ThresholdOpenList.newBuilder().setJumpFraction(new BigFraction(1, 20)).<Integer>build();
        assertEquals(List.of(1, 5, 2), open.evaluate(votes, 3, LIST));
        assertEquals(List.of(1), open.evaluate(votes, 1, LIST));

        var inclusive = ThresholdOpenList.newBuilder()
                                         .setJumpFraction(new BigFraction(1, 20))
                                         .setAcceptEqual(true)
                                         .<Integer>build();
        assertEquals(List.of(1, 5), inclusive.evaluate(votes, 2, LIST));
        assertEquals(List.of(1, 5, 2), inclusive.evaluate(votes, 3, LIST));
    }

    @Test
    public void listPrecedence() {
        var open = ThresholdOpenList.newBuilder()
                                    .setJumpFraction(new BigFraction(1, 20))
                                    .setAcceptEqual(true)
                                    .setListPrecedence(true)
                                    .<Integer>build();
        assertEquals(List.of(1, 2), open.evaluate(votes, 2, LIST));
    }

    @Test
    public void listOrderTieBreaker() {
        var votes = Votes.of(ImmutableMap.of("A", 4, "B", 3, "C", 3, "D", 2));
        var breaker = new ListOrderTieBreaker<String>(new Plurality<>());
        assertEquals(List.of("A", "B"), breaker.evaluate(votes, 2, List.of("A", "B", "C", "D")));
        assertEquals(List.of("A", "C"), breaker.evaluate(votes, 2, List.of("D", "C", "B", "A")));
        assertEquals(List.of("A", "B", "C"), breaker.evaluate(votes, 3, List.of("D", "C", "B", "A")));
        assertThrows(ConfigurationException.class,
                     () -> new ListOrderTieBreaker<String>(new RelativeThreshold<>(BigFraction.ONE)));
    }

    @Test
    public void quotaFraction() {
        var votes = Votes.of(ImmutableMap.<Integer, Integer>builder()
                                         .put(1, 3500)
                                         .put(2, 50)
                                         .put(3, 150)
                                         .put(4, 250)
                                         .put(5, 100)
                                         .put(6, 100)
                                         .put(7, 450)
                                         .put(8, 50)
                                         .build());
        var open = ThresholdOpenList.newBuilder()
                                    .setQuota(Quotas.HARE)
                                    .setQuotaFraction(new BigFraction(1, 4))
                                    .<Integer>build();
        assertEquals(List.of(1, 7, 4, 2, 3), open.evaluate(votes, 5, List.of(1, 2, 3, 4, 5, 6, 7, 8)));
        assertThrows(ConfigurationException.class,
                     () -> ThresholdOpenList.newBuilder().setQuotaFraction(BigFraction.ZERO).<Integer>build());
    }

    @Test
    public void takeHigher() {
        // jump threshold 15, quota 100
        var lower = ThresholdOpenList.newBuilder()
                                     .setJumpFraction(new BigFraction(1, 20))
                                     .setQuota(Quotas.HARE)
                                     .<Integer>build();
        assertEquals(List.of(1, 5, 2), lower.evaluate(votes, 3, LIST));
        var higher = ThresholdOpenList.newBuilder()
                                      .setJumpFraction(new BigFraction(1, 20))
                                      .setQuota(Quotas.HARE)
                                      .setTakeHigher(true)
                                      .<Integer>build();
        assertEquals(List.of(1, 2, 3), higher.evaluate(votes, 3, LIST));
    }
}
