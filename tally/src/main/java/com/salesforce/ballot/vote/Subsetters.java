/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.vote;

import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableMap;

/**
 * @author hal.hildebrand
 *
 */
public final class Subsetters {

    /**
     * Subset votes nested by constituency with the inner subsetter.
     */
    public static <K, V, C> Subsetter<Map<K, V>, C> nested(Subsetter<V, C> inner) {
        return (votes, allowed) -> {
            var builder = ImmutableMap.<K, V>builder();
            votes.forEach((constituency, cvotes) -> builder.put(constituency, inner.subset(cvotes, allowed)));
            return builder.build();
        };
    }

    /**
     * Subset ranked votes: candidates not allowed are struck from every ballot,
     * ballots that become identical are merged and blank ballots are dropped.
     */
    public static <C> Subsetter<Map<RankedVote<C>, BigFraction>, C> ranked() {
        return (votes, allowed) -> {
            var tally = new Tally<RankedVote<C>>();
            votes.forEach((vote, count) -> {
                var subset = vote.subset(allowed);
                if (!subset.isEmpty()) {
                    tally.addCount(subset, count);
                }
            });
            return tally.toMap();
        };
    }

    /**
     * Subset simple votes by dropping the candidates not allowed.
     */
    public static <C> Subsetter<Map<C, BigFraction>, C> simple() {
        return (votes, allowed) -> Tally.of(votes).filter(allowed::contains).toMap();
    }

    private Subsetters() {
    }
}
