/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.stv;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;

/**
 * Determines how votes move away from elected and eliminated candidates.
 *
 * @author hal.hildebrand
 *
 */
public interface VoteTransfer {

    /**
     * The transfers of a single evaluation. Sessions may hold state, such as a
     * random generator, and are never shared between evaluations.
     */
    interface Session {

        /**
         * Divide a vote count among candidates sharing a rank.
         */
        <C> Map<C, BigFraction> split(List<C> targets, BigFraction votes);

        /**
         * Remove the votes spent on electing candidates.
         *
         * @param elected - the candidates elected, mapped to the quota multiple
         *                of votes they used up
         * @return a new allocation
         */
        <C> Allocation<C> subtract(Allocation<C> allocation, Map<C, BigFraction> elected);

        /**
         * Pass the votes of candidates leaving the contest to the next
         * preference among the continuing candidates, exhausting ballots without
         * one.
         *
         * @return a new allocation
         */
        <C> Allocation<C> transfer(Allocation<C> allocation, Collection<? extends C> removed);
    }

    /**
     * @return true if every session transfers votes the same way
     */
    boolean isStable();

    Session session();
}
