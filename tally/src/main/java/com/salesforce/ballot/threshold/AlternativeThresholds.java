/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.threshold;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Evaluator;
import com.salesforce.ballot.evaluate.Seats;
import com.salesforce.ballot.evaluate.Selector;

/**
 * Selects the candidates passing any one of several thresholds, ordered by
 * their mean rank across the partial selections.
 *
 * @author hal.hildebrand
 *
 */
public class AlternativeThresholds<V, C> implements Selector<V, C> {
    private final ImmutableSet<Capability>                                         capabilities;
    private final ImmutableList<Evaluator<V, Map<C, Integer>, Selection<C>>> partials;

    public AlternativeThresholds(List<? extends Evaluator<V, Map<C, Integer>, Selection<C>>> partials) {
        for (var partial : partials) {
            if (partial.accepts(Capability.SEATS)) {
                throw new ConfigurationException(String.format("Seat based evaluator %s among thresholds", partial));
            }
        }
        this.partials = ImmutableList.copyOf(partials);
        var prev = partials.stream().anyMatch(p -> p.accepts(Capability.PREVIOUS_GAINS));
        capabilities = prev ? ImmutableSet.of(Capability.PREVIOUS_GAINS) : ImmutableSet.of();
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public Selection<C> evaluate(V votes, Seats<Map<C, Integer>> seats) {
        List<List<C>> results = new ArrayList<>();
        Set<C> passed = new LinkedHashSet<>();
        for (var partial : partials) {
            var result = partial.evaluate(votes, seats.restrictTo(partial.capabilities())).winners();
            results.add(result);
            passed.addAll(result);
        }
        List<C> ordered = new ArrayList<>(passed);
        ordered.sort(Comparator.comparing((C c) -> meanRank(c, results)));
        return Selection.ofWinners(ordered);
    }

    public List<Evaluator<V, Map<C, Integer>, Selection<C>>> getPartials() {
        return partials;
    }

    private BigFraction meanRank(C candidate, List<List<C>> results) {
        long sum = 0;
        for (var result : results) {
            int index = result.indexOf(candidate);
            sum += index < 0 ? result.size() : index;
        }
        return new BigFraction(sum).divide(results.size());
    }
}
