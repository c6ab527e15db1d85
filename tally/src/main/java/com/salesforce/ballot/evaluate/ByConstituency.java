/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.vote.Subsetter;
import com.salesforce.ballot.vote.Votes;

/**
 * Evaluates each constituency separately after apportioning the seats among
 * them. An optional preselector, run on the votes aggregated over all
 * constituencies, excludes candidates everywhere; it runs after the
 * apportionment so that excluded votes still count towards it.
 *
 * @author hal.hildebrand
 *
 * @param <K> - constituency type
 * @param <X> - the type votes are cast for in each constituency
 * @param <C> - candidate type
 * @param <R> - the result type per constituency
 */
public class ByConstituency<K, X, C, R>
                           implements Evaluator<Map<K, Map<X, BigFraction>>, Map<K, Map<C, Integer>>, Map<K, R>> {
    private static final Logger log = LoggerFactory.getLogger(ByConstituency.class);

    public static <K, X, C> ByConstituency<K, X, C, Distribution<C>> distributing(Evaluator<Map<X, BigFraction>, Map<C, Integer>, Distribution<C>> evaluator,
                                                                                  Apportionment<K> apportionment) {
        return new ByConstituency<>(evaluator, apportionment, Distribution::empty, null, null);
    }

    public static <K, X, C> ByConstituency<K, X, C, Selection<C>> selecting(Evaluator<Map<X, BigFraction>, Map<C, Integer>, Selection<C>> evaluator,
                                                                            Apportionment<K> apportionment) {
        return new ByConstituency<>(evaluator, apportionment, Selection::empty, null, null);
    }

    private final Apportionment<K>                                                 apportionment;
    private final ImmutableSet<Capability>                                         capabilities;
    private final Supplier<R>                                                      empty;
    private final Evaluator<Map<X, BigFraction>, Map<C, Integer>, R>            evaluator;
    private final Evaluator<Map<X, BigFraction>, Map<C, Integer>, Selection<C>> preselector;
    private final Subsetter<Map<X, BigFraction>, C>                                subsetter;

    /**
     * @param evaluator     - evaluates a single constituency
     * @param apportionment - seats per constituency
     * @param empty         - the result of a constituency without seats
     * @param preselector   - selects the candidates eligible in all
     *                      constituencies, may be null
     * @param subsetter     - restricts constituency votes to the preselected
     *                      candidates, required with a preselector
     */
    public ByConstituency(Evaluator<Map<X, BigFraction>, Map<C, Integer>, R> evaluator,
                          Apportionment<K> apportionment, Supplier<R> empty,
                          Evaluator<Map<X, BigFraction>, Map<C, Integer>, Selection<C>> preselector,
                          Subsetter<Map<X, BigFraction>, C> subsetter) {
        if (preselector != null && subsetter == null) {
            throw new IllegalArgumentException("Preselection requires a subsetter");
        }
        this.evaluator = evaluator;
        this.apportionment = apportionment;
        this.empty = empty;
        this.preselector = preselector;
        this.subsetter = subsetter;
        var caps = EnumSet.noneOf(Capability.class);
        if (apportionment.needsSeats() || (preselector != null && preselector.accepts(Capability.SEATS))) {
            caps.add(Capability.SEATS);
        }
        if (evaluator.accepts(Capability.PREVIOUS_GAINS)) {
            caps.add(Capability.PREVIOUS_GAINS);
        }
        capabilities = ImmutableSet.copyOf(caps);
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public Map<K, R> evaluate(Map<K, Map<X, BigFraction>> votes, Seats<Map<K, Map<C, Integer>>> seats) {
        var apportioned = apportionment.apportion(Votes.constituencyTotals(votes), seats.count());
        log.trace("Apportioned: {}", apportioned);
        var eligible = preselect(votes, seats);
        Map<K, R> results = new LinkedHashMap<>();
        votes.forEach((constituency, cvotes) -> {
            int n = apportioned.getOrDefault(constituency, 0);
            if (n == 0) {
                results.put(constituency, empty.get());
                return;
            }
            var constituencyVotes = eligible == null ? cvotes : subsetter.subset(cvotes, eligible);
            Map<C, Integer> prevGains = seats.prevGains().getOrDefault(constituency, Map.of());
            Map<C, Integer> maxSeats = seats.maxSeats().getOrDefault(constituency, Map.of());
            results.put(constituency,
                        evaluator.evaluate(constituencyVotes,
                                           Seats.of(n, prevGains, maxSeats).restrictTo(evaluator.capabilities())));
        });
        return results;
    }

    public Apportionment<K> getApportionment() {
        return apportionment;
    }

    public Evaluator<Map<X, BigFraction>, Map<C, Integer>, R> getEvaluator() {
        return evaluator;
    }

    public Evaluator<Map<X, BigFraction>, Map<C, Integer>, Selection<C>> getPreselector() {
        return preselector;
    }

    public Subsetter<Map<X, BigFraction>, C> getSubsetter() {
        return subsetter;
    }

    /**
     * @return a copy of this evaluator, excluding candidates not selected by the
     *         preselector
     */
    public ByConstituency<K, X, C, R> withPreselector(Evaluator<Map<X, BigFraction>, Map<C, Integer>, Selection<C>> preselector,
                                                      Subsetter<Map<X, BigFraction>, C> subsetter) {
        return new ByConstituency<>(evaluator, apportionment, empty, preselector, subsetter);
    }

    private Set<C> preselect(Map<K, Map<X, BigFraction>> votes, Seats<Map<K, Map<C, Integer>>> seats) {
        if (preselector == null) {
            return null;
        }
        var national = Votes.totals(votes);
        var selected = preselector.evaluate(national,
                                            Seats.<Map<C, Integer>>of(seats.count())
                                                 .restrictTo(preselector.capabilities()));
        var eligible = ImmutableSet.copyOf(selected.winners());
        log.trace("Preselected nationally: {}", eligible);
        return eligible;
    }
}
