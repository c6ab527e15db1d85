/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.openlist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.evaluate.Evaluator;
import com.salesforce.ballot.evaluate.Seats;

/**
 * Determines the representatives elected from party lists: the party seats are
 * distributed first, then each party's seats are filled from its list, in list
 * order for closed lists or by an open list evaluator over the list votes.
 *
 * @author hal.hildebrand
 *
 */
public class PartyListEvaluator<V, P, C> {
    private static final Logger log = LoggerFactory.getLogger(PartyListEvaluator.class);

    private final OpenListEvaluator<C>                               listEvaluator;
    private final Evaluator<V, Map<P, Integer>, Distribution<P>> partyEvaluator;

    /**
     * Closed lists.
     */
    public PartyListEvaluator(Evaluator<V, Map<P, Integer>, Distribution<P>> partyEvaluator) {
        this(partyEvaluator, null);
    }

    public PartyListEvaluator(Evaluator<V, Map<P, Integer>, Distribution<P>> partyEvaluator,
                              OpenListEvaluator<C> listEvaluator) {
        this.partyEvaluator = partyEvaluator;
        this.listEvaluator = listEvaluator;
    }

    /**
     * @param votes      - the votes for the parties
     * @param seats      - seat parameters for the party distribution
     * @param partyLists - the candidates of each party in list order
     * @param listVotes  - preferential votes per party, required for open lists
     *                   and rejected for closed ones
     * @return the elected candidates of each party that won seats
     * @throws com.salesforce.ballot.UnresolvedTieException if the party
     *                                                      distribution ties
     */
    public Map<P, List<C>> evaluate(V votes, Seats<Map<P, Integer>> seats, Map<P, List<C>> partyLists,
                                    Map<P, Map<C, BigFraction>> listVotes) {
        var partySeats = partyEvaluator.evaluate(votes, seats.restrictTo(partyEvaluator.capabilities())).resolved();
        log.trace("Party seats: {}", partySeats);
        Map<P, List<C>> elected = new LinkedHashMap<>();
        if (listEvaluator == null) {
            if (listVotes != null && !listVotes.isEmpty()) {
                throw new IllegalArgumentException("List votes given for closed lists");
            }
            partySeats.forEach((party, n) -> {
                var list = list(partyLists, party);
                elected.put(party, new ArrayList<>(list.subList(0, Math.min(n, list.size()))));
            });
        } else {
            if (listVotes == null || listVotes.isEmpty()) {
                throw new IllegalArgumentException("No list votes for open list evaluation");
            }
            partySeats.forEach((party, n) -> elected.put(party,
                                                         listEvaluator.evaluate(listVotes.getOrDefault(party, Map.of()),
                                                                                n, list(partyLists, party))));
        }
        return elected;
    }

    public OpenListEvaluator<C> getListEvaluator() {
        return listEvaluator;
    }

    public Evaluator<V, Map<P, Integer>, Distribution<P>> getPartyEvaluator() {
        return partyEvaluator;
    }

    private List<C> list(Map<P, List<C>> partyLists, P party) {
        var list = partyLists.get(party);
        if (list == null) {
            throw new IllegalArgumentException("No candidate list for party " + party);
        }
        return list;
    }
}
