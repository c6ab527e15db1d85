/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntFunction;

import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.VotingSystemException;
import com.salesforce.ballot.vote.Votes;

/**
 * Levels overhang detected per constituency, such as the states of a federal
 * election, while keeping the overall result proportional. Each party's
 * minimum is the sum over constituencies of the larger of its earlier gains and
 * its proportional seats there; the seat count grows until the overall
 * proportional result meets every minimum.
 *
 * @author hal.hildebrand
 *
 * @param <K> - constituency type
 * @param <X> - the type votes are cast for in each constituency
 * @param <C> - party type
 */
public class LevelOverhangByConstituency<K, X, C>
                                        implements SeatCountCalculator<Map<K, Map<X, BigFraction>>, Map<K, Map<C, Integer>>> {
    private static final Logger log = LoggerFactory.getLogger(LevelOverhangByConstituency.class);

    private final Evaluator<Map<K, Map<X, BigFraction>>, Map<K, Map<C, Integer>>, Map<K, Distribution<C>>> constituencyEvaluator;
    private final Evaluator<Map<X, BigFraction>, Map<C, Integer>, Distribution<C>>                         overallEvaluator;

    /**
     * @param constituencyEvaluator - the proportional result per constituency
     * @param overallEvaluator      - the proportional result on the aggregated
     *                              votes; if null, the merged constituency
     *                              results are used
     */
    public LevelOverhangByConstituency(Evaluator<Map<K, Map<X, BigFraction>>, Map<K, Map<C, Integer>>, Map<K, Distribution<C>>> constituencyEvaluator,
                                       Evaluator<Map<X, BigFraction>, Map<C, Integer>, Distribution<C>> overallEvaluator) {
        this.constituencyEvaluator = constituencyEvaluator;
        this.overallEvaluator = overallEvaluator;
    }

    @Override
    public int calculate(Map<K, Map<X, BigFraction>> votes, int seats, Map<K, Map<C, Integer>> prevGains,
                         Map<K, Map<C, Integer>> maxSeats) {
        var byConstituency = constituencyEvaluator.evaluate(votes,
                                                            Seats.of(seats, Map.<K, Map<C, Integer>>of(), maxSeats)
                                                                 .restrictTo(constituencyEvaluator.capabilities()));
        Map<C, Integer> minimum = new LinkedHashMap<>();
        byConstituency.forEach((constituency, result) -> {
            var gained = prevGains.getOrDefault(constituency, Map.of());
            result.resolved()
                  .forEach((party, n) -> minimum.merge(party, Math.max(n, gained.getOrDefault(party, 0)),
                                                       Integer::sum));
        });
        int outside = 0;
        for (var cgains : prevGains.values()) {
            for (var e : cgains.entrySet()) {
                if (!minimum.containsKey(e.getKey())) {
                    outside += e.getValue();
                }
            }
        }
        IntFunction<Map<C, Integer>> overall = overall(votes, maxSeats);
        int count = seats - outside;
        var proportional = overall.apply(count);
        while (!LevelOverhang.satisfies(proportional, minimum)) {
            count++;
            proportional = overall.apply(count);
            if (proportional.values().stream().mapToInt(Integer::intValue).sum() < count) {
                throw new VotingSystemException(String.format("Overhang cannot be leveled at %s seats", count));
            }
        }
        log.debug("Leveled overhang by constituency at {} proportional seats, {} outside", count, outside);
        return count + outside - seats;
    }

    public Evaluator<Map<K, Map<X, BigFraction>>, Map<K, Map<C, Integer>>, Map<K, Distribution<C>>> getConstituencyEvaluator() {
        return constituencyEvaluator;
    }

    public Evaluator<Map<X, BigFraction>, Map<C, Integer>, Distribution<C>> getOverallEvaluator() {
        return overallEvaluator;
    }

    private IntFunction<Map<C, Integer>> overall(Map<K, Map<X, BigFraction>> votes,
                                                 Map<K, Map<C, Integer>> maxSeats) {
        if (overallEvaluator != null) {
            var national = Votes.totals(votes);
            return n -> overallEvaluator.evaluate(national, Seats.<Map<C, Integer>>of(n)
                                                                 .restrictTo(overallEvaluator.capabilities()))
                                        .resolved();
        }
        return n -> {
            Map<C, Integer> merged = new LinkedHashMap<>();
            constituencyEvaluator.evaluate(votes, Seats.of(n, Map.<K, Map<C, Integer>>of(), maxSeats)
                                                       .restrictTo(constituencyEvaluator.capabilities()))
                                 .values()
                                 .forEach(d -> d.resolved().forEach((party, s) -> merged.merge(party, s, Integer::sum)));
            return merged;
        };
    }
}
