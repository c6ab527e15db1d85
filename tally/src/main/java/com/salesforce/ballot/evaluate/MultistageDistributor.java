/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.vote.Votes;

/**
 * Distributes seats in several rounds, each round seeing the seats gained in
 * the rounds before it as previous gains. The result is the accumulated seats,
 * including the previous gains the evaluation started with.
 *
 * @author hal.hildebrand
 *
 */
public class MultistageDistributor<V, G extends Map<?, ?>, R> implements Evaluator<V, G, R> {

    /**
     * Accumulates stage results into the gains passed to the next stage.
     */
    public interface Accumulator<G, R> {
        G add(G elected, R stage);

        R result(G elected);
    }

    private static final Logger log = LoggerFactory.getLogger(MultistageDistributor.class);

    /**
     * Rounds whose results are distributions per constituency.
     */
    public static <V, K, C> MultistageDistributor<V, Map<K, Map<C, Integer>>, Map<K, Distribution<C>>> byConstituency(List<? extends Evaluator<V, Map<K, Map<C, Integer>>, Map<K, Distribution<C>>>> rounds) {
        return new MultistageDistributor<V, Map<K, Map<C, Integer>>, Map<K, Distribution<C>>>(rounds,
                                                                                              new Accumulator<Map<K, Map<C, Integer>>, Map<K, Distribution<C>>>() {

            @Override
            public Map<K, Map<C, Integer>> add(Map<K, Map<C, Integer>> elected, Map<K, Distribution<C>> stage) {
                Set<K> constituencies = new LinkedHashSet<>(elected.keySet());
                constituencies.addAll(stage.keySet());
                Map<K, Map<C, Integer>> sum = new LinkedHashMap<>();
                for (K k : constituencies) {
                    var stageSeats = stage.getOrDefault(k, Distribution.empty()).resolved();
                    sum.put(k, Votes.merge(elected.getOrDefault(k, Map.of()), stageSeats));
                }
                return sum;
            }

            @Override
            public Map<K, Distribution<C>> result(Map<K, Map<C, Integer>> elected) {
                var builder = ImmutableMap.<K, Distribution<C>>builder();
                elected.forEach((k, seats) -> builder.put(k, Distribution.of(seats)));
                return builder.build();
            }
        });
    }

    /**
     * Rounds distributing seats to the same contestants.
     */
    public static <V, C> MultistageDistributor<V, Map<C, Integer>, Distribution<C>> flat(List<? extends Evaluator<V, Map<C, Integer>, Distribution<C>>> rounds) {
        return new MultistageDistributor<V, Map<C, Integer>, Distribution<C>>(rounds,
                                                                              new Accumulator<Map<C, Integer>, Distribution<C>>() {

            @Override
            public Map<C, Integer> add(Map<C, Integer> elected, Distribution<C> stage) {
                return Votes.merge(elected, stage.resolved());
            }

            @Override
            public Distribution<C> result(Map<C, Integer> elected) {
                return Distribution.of(elected);
            }
        });
    }

    private final Accumulator<G, R>                 accumulator;
    private final ImmutableSet<Capability>          capabilities;
    private final ImmutableList<Evaluator<V, G, R>> rounds;

    public MultistageDistributor(List<? extends Evaluator<V, G, R>> rounds, Accumulator<G, R> accumulator) {
        if (rounds.isEmpty()) {
            throw new IllegalArgumentException("At least one round is required");
        }
        this.rounds = ImmutableList.copyOf(rounds);
        this.accumulator = accumulator;
        var caps = EnumSet.of(Capability.PREVIOUS_GAINS);
        rounds.forEach(r -> caps.addAll(r.capabilities()));
        capabilities = ImmutableSet.copyOf(caps);
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    /**
     * Evaluate all rounds on the same votes.
     */
    @Override
    public R evaluate(V votes, Seats<G> seats) {
        return evaluateRounds(Collections.nCopies(rounds.size(), votes), seats);
    }

    /**
     * Evaluate each round on its own votes.
     *
     * @throws com.salesforce.ballot.UnresolvedTieException if a round ties
     */
    public R evaluateRounds(List<V> votes, Seats<G> seats) {
        if (votes.size() != rounds.size()) {
            throw new IllegalArgumentException(String.format("%s vote sets given for %s rounds", votes.size(),
                                                             rounds.size()));
        }
        var elected = seats.prevGains();
        for (int i = 0; i < rounds.size(); i++) {
            var round = rounds.get(i);
            var stage = round.evaluate(votes.get(i),
                                       new Seats<>(seats.count(), elected, seats.maxSeats()).restrictTo(round.capabilities()));
            log.trace("Round {}: {}", i, stage);
            elected = accumulator.add(elected, stage);
        }
        return accumulator.result(elected);
    }

    public List<Evaluator<V, G, R>> getRounds() {
        return rounds;
    }
}
