/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.openlist;

import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;

import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.Tie;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Evaluator;

/**
 * Elects list candidates by any selector, breaking its ties by list order.
 *
 * @author hal.hildebrand
 *
 */
public class ListOrderTieBreaker<C> implements OpenListEvaluator<C> {
    private final Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>> evaluator;

    public ListOrderTieBreaker(Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>> evaluator) {
        if (!evaluator.accepts(Capability.SEATS)) {
            throw new ConfigurationException(String.format("List evaluator %s must accept a seat count", evaluator));
        }
        this.evaluator = evaluator;
    }

    @Override
    public List<C> evaluate(Map<C, BigFraction> votes, int seats, List<C> candidateList) {
        var selection = evaluator.evaluate(votes, seats);
        return selection.hasTies() ? Tie.breakByList(selection.entries(), candidateList) : selection.winners();
    }

    public Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>> getEvaluator() {
        return evaluator;
    }
}
