/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.component;

import java.math.BigInteger;
import java.util.Arrays;

import org.apache.commons.math3.fraction.BigFraction;

import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.vote.Votes;

/**
 * The common quota functions, addressable by name. The unrounded variants are
 * exact fractions.
 *
 * @author hal.hildebrand
 *
 */
public enum Quotas implements Quota {
    DROOP("droop") {
        @Override
        public BigFraction apply(BigFraction totalVotes, int seats) {
            return new BigFraction(Votes.floor(totalVotes.divide(seats + 1)).add(BigInteger.ONE));
        }
    },
    HAGENBACH_BISCHOFF("hagenbach_bischoff") {
        @Override
        public BigFraction apply(BigFraction totalVotes, int seats) {
            return totalVotes.divide(seats + 1);
        }
    },
    HAGENBACH_BISCHOFF_CEIL("hagenbach_bischoff_ceil") {
        @Override
        public BigFraction apply(BigFraction totalVotes, int seats) {
            return ceil(totalVotes.divide(seats + 1));
        }
    },
    HAGENBACH_BISCHOFF_ROUNDED("hagenbach_bischoff_rounded") {
        @Override
        public BigFraction apply(BigFraction totalVotes, int seats) {
            return roundHalfUp(totalVotes.divide(seats + 1));
        }
    },
    HARE("hare") {
        @Override
        public BigFraction apply(BigFraction totalVotes, int seats) {
            return totalVotes.divide(seats);
        }
    },
    HARE_ROUNDED("hare_rounded") {
        @Override
        public BigFraction apply(BigFraction totalVotes, int seats) {
            return roundHalfUp(totalVotes.divide(seats));
        }
    },
    IMPERIALI("imperiali") {
        @Override
        public BigFraction apply(BigFraction totalVotes, int seats) {
            return totalVotes.divide(seats + 2);
        }
    };

    private static final BigFraction HALF = new BigFraction(1, 2);

    /**
     * A quota independent of the votes and seats.
     */
    public static Quota constant(BigFraction quota) {
        return (totalVotes, seats) -> quota;
    }

    public static Quotas named(String name) {
        return Arrays.stream(values())
                     .filter(q -> q.quotaName.equals(name))
                     .findFirst()
                     .orElseThrow(() -> new ConfigurationException("Unknown quota: " + name));
    }

    /**
     * The quota multiplied by a constant factor.
     */
    public static Quota scaled(Quota quota, BigFraction factor) {
        return (totalVotes, seats) -> quota.apply(totalVotes, seats).multiply(factor);
    }

    private static BigFraction ceil(BigFraction value) {
        var floor = Votes.floor(value);
        var f = new BigFraction(floor);
        return f.equals(value) ? f : new BigFraction(floor.add(BigInteger.ONE));
    }

    private static BigFraction roundHalfUp(BigFraction value) {
        return new BigFraction(Votes.floor(value.add(HALF)));
    }

    private final String quotaName;

    Quotas(String quotaName) {
        this.quotaName = quotaName;
    }

    public String quotaName() {
        return quotaName;
    }
}
