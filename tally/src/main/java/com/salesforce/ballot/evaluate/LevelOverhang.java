/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.VotingSystemException;

/**
 * Enlarges the seat count until the proportional result gives every party at
 * least the seats it gained in an earlier round, so parties keep their
 * overhang and the others receive leveling seats.
 * <p>
 * Parties with earlier gains that are absent from the proportional result,
 * e.g. because they failed a threshold, keep their seats outside of the
 * proportional count.
 *
 * @author hal.hildebrand
 *
 */
public class LevelOverhang<V, C> implements SeatCountCalculator<V, Map<C, Integer>> {
    private static final Logger log = LoggerFactory.getLogger(LevelOverhang.class);

    private final Evaluator<V, Map<C, Integer>, Distribution<C>> evaluator;

    public LevelOverhang(Evaluator<V, Map<C, Integer>, Distribution<C>> evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public int calculate(V votes, int seats, Map<C, Integer> prevGains, Map<C, Integer> maxSeats) {
        var proportional = proportional(votes, seats, maxSeats);
        Map<C, Integer> minimum = new LinkedHashMap<>();
        proportional.forEach((party, n) -> minimum.put(party, Math.max(n, prevGains.getOrDefault(party, 0))));
        int outside = 0;
        for (var e : prevGains.entrySet()) {
            if (!minimum.containsKey(e.getKey())) {
                outside += e.getValue();
            }
        }
        int count = seats - outside;
        while (!satisfies(proportional, minimum)) {
            count++;
            proportional = proportional(votes, count, maxSeats);
            if (proportional.values().stream().mapToInt(Integer::intValue).sum() < count) {
                throw new VotingSystemException(String.format("Overhang cannot be leveled at %s seats, maximum seats %s reached",
                                                              count, maxSeats));
            }
        }
        log.debug("Leveled overhang at {} proportional seats, {} outside", count, outside);
        return count + outside - seats;
    }

    public Evaluator<V, Map<C, Integer>, Distribution<C>> getEvaluator() {
        return evaluator;
    }

    private Map<C, Integer> proportional(V votes, int seats, Map<C, Integer> maxSeats) {
        return evaluator.evaluate(votes,
                                  Seats.of(seats, Map.<C, Integer>of(), maxSeats).restrictTo(evaluator.capabilities()))
                        .resolved();
    }

    static <C> boolean satisfies(Map<C, Integer> proportional, Map<C, Integer> minimum) {
        for (var e : minimum.entrySet()) {
            if (proportional.getOrDefault(e.getKey(), 0) < e.getValue()) {
                return false;
            }
        }
        return true;
    }
}
