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

import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.vote.Subsetter;
import com.salesforce.ballot.vote.Votes;

/**
 * Distributes the seats among parties on the aggregated votes first, then
 * allocates each party's seats to the constituencies by the party's votes in
 * each of them.
 *
 * @author hal.hildebrand
 *
 * @param <K> - constituency type
 * @param <X> - the type votes are cast for in each constituency
 * @param <C> - party type
 */
public class ByParty<K, X, C>
                    implements Evaluator<Map<K, Map<X, BigFraction>>, Map<K, Map<C, Integer>>, Map<K, Distribution<C>>> {
    private static final Logger log = LoggerFactory.getLogger(ByParty.class);

    private static <K, C> Map<K, Integer> forParty(Map<K, Map<C, Integer>> gains, C party) {
        Map<K, Integer> partyGains = new LinkedHashMap<>();
        gains.forEach((constituency, cgains) -> {
            var n = cgains.get(party);
            if (n != null) {
                partyGains.put(constituency, n);
            }
        });
        return partyGains;
    }

    private final Evaluator<Map<K, BigFraction>, Map<K, Integer>, Distribution<K>> allocator;
    private final ImmutableSet<Capability>                                           capabilities;
    private final Evaluator<Map<X, BigFraction>, Map<C, Integer>, Distribution<C>> overall;
    private final Subsetter<Map<X, BigFraction>, C>                                  subsetter;

    /**
     * @param overall   - distributes the seats among the parties nationally
     * @param allocator - distributes a party's seats among the constituencies
     * @param subsetter - extracts the votes for a single party
     */
    public ByParty(Evaluator<Map<X, BigFraction>, Map<C, Integer>, Distribution<C>> overall,
                   Evaluator<Map<K, BigFraction>, Map<K, Integer>, Distribution<K>> allocator,
                   Subsetter<Map<X, BigFraction>, C> subsetter) {
        this.overall = overall;
        this.allocator = allocator;
        this.subsetter = subsetter;
        var caps = EnumSet.noneOf(Capability.class);
        if (overall.accepts(Capability.SEATS)) {
            caps.add(Capability.SEATS);
        }
        if (allocator.accepts(Capability.PREVIOUS_GAINS)) {
            caps.add(Capability.PREVIOUS_GAINS);
        }
        capabilities = ImmutableSet.copyOf(caps);
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    /**
     * The previous and maximum seats, given per constituency, only inform the
     * allocator.
     *
     * @throws com.salesforce.ballot.UnresolvedTieException if either the national
     *                                                      or a party's
     *                                                      distribution ties
     */
    @Override
    public Map<K, Distribution<C>> evaluate(Map<K, Map<X, BigFraction>> votes,
                                            Seats<Map<K, Map<C, Integer>>> seats) {
        var national = overall.evaluate(Votes.totals(votes),
                                        Seats.<Map<C, Integer>>of(seats.count()).restrictTo(overall.capabilities()))
                              .resolved();
        log.trace("National distribution: {}", national);
        Map<K, Map<C, Integer>> results = new LinkedHashMap<>();
        votes.keySet().forEach(k -> results.put(k, new LinkedHashMap<>()));
        national.forEach((party, partySeats) -> {
            var partyOnly = ImmutableSet.of(party);
            Map<K, BigFraction> partyVotes = new LinkedHashMap<>();
            votes.forEach((constituency, cvotes) -> partyVotes.put(constituency,
                                                                   Votes.total(subsetter.subset(cvotes, partyOnly))));
            var allocated = allocator.evaluate(partyVotes,
                                               Seats.of(partySeats, forParty(seats.prevGains(), party),
                                                        forParty(seats.maxSeats(), party))
                                                    .restrictTo(allocator.capabilities()))
                                     .resolved();
            log.trace("Allocated {} seats of {}: {}", partySeats, party, allocated);
            allocated.forEach((constituency, n) -> results.computeIfAbsent(constituency, k -> new LinkedHashMap<>())
                                                          .put(party, n));
        });
        var builder = ImmutableMap.<K, Distribution<C>>builder();
        results.forEach((constituency, cseats) -> builder.put(constituency, Distribution.of(cseats)));
        return builder.build();
    }

    public Evaluator<Map<K, BigFraction>, Map<K, Integer>, Distribution<K>> getAllocator() {
        return allocator;
    }

    public Evaluator<Map<X, BigFraction>, Map<C, Integer>, Distribution<C>> getOverall() {
        return overall;
    }

    public Subsetter<Map<X, BigFraction>, C> getSubsetter() {
        return subsetter;
    }
}
