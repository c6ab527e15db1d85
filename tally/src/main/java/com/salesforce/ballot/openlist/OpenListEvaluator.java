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

/**
 * Elects candidates from a party list, letting preferential votes override the
 * order the party submitted.
 *
 * @author hal.hildebrand
 *
 */
@FunctionalInterface
public interface OpenListEvaluator<C> {

    /**
     * @param votes         - preferential votes for the listed candidates
     * @param seats         - the seats won by the list
     * @param candidateList - the candidates in party order
     * @return the elected candidates, strongest first
     */
    List<C> evaluate(Map<C, BigFraction> votes, int seats, List<C> candidateList);
}
