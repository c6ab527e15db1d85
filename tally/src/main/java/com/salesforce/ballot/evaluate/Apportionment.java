/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

import org.apache.commons.math3.fraction.BigFraction;

import com.google.common.collect.ImmutableMap;
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Distribution;

/**
 * Determines the number of seats of each constituency.
 *
 * @author hal.hildebrand
 *
 */
public interface Apportionment<K> {

    /**
     * Apportion the seats by an evaluator distributing them according to the
     * total votes cast in each constituency.
     */
    static <K> Apportionment<K> by(Evaluator<Map<K, BigFraction>, Map<K, Integer>, Distribution<K>> apportioner) {
        return new Apportionment<K>() {

            @Override
            public Map<K, Integer> apportion(Map<K, BigFraction> totals, OptionalInt seats) {
                var restricted = Seats.<Map<K, Integer>>of(seats).restrictTo(apportioner.capabilities());
                return apportioner.evaluate(totals, restricted).resolved();
            }

            @Override
            public boolean needsSeats() {
                return apportioner.accepts(Capability.SEATS);
            }

            @Override
            public String toString() {
                return "Apportionment[" + apportioner + "]";
            }
        };
    }

    /**
     * Seats per constituency fixed up front.
     */
    static <K> Apportionment<K> fixed(Map<K, Integer> seats) {
        var fixed = ImmutableMap.copyOf(seats);
        return (totals, count) -> fixed;
    }

    /**
     * Every constituency fills the seat count the evaluation is asked for.
     */
    static <K> Apportionment<K> requested() {
        return new Apportionment<K>() {

            @Override
            public Map<K, Integer> apportion(Map<K, BigFraction> totals, OptionalInt seats) {
                return uniform(totals, seats.orElseThrow(() -> new ConfigurationException("A seat count is required")));
            }

            @Override
            public boolean needsSeats() {
                return true;
            }
        };
    }

    /**
     * Every constituency fills the same number of seats.
     */
    static <K> Apportionment<K> uniform(int seats) {
        return (totals, count) -> uniform(totals, seats);
    }

    private static <K> Map<K, Integer> uniform(Map<K, BigFraction> totals, int seats) {
        Map<K, Integer> apportioned = new LinkedHashMap<>();
        totals.keySet().forEach(k -> apportioned.put(k, seats));
        return apportioned;
    }

    /**
     * @param totals - the total votes cast per constituency
     * @param seats  - the overall seat count, if given
     */
    Map<K, Integer> apportion(Map<K, BigFraction> totals, OptionalInt seats);

    default boolean needsSeats() {
        return false;
    }
}
