/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Arrays;
import java.util.Optional;

import org.apache.commons.math3.fraction.BigFraction;

import com.salesforce.ballot.ConfigurationException;

/**
 * The common divisor sequences, addressable by name.
 *
 * @author hal.hildebrand
 *
 */
public enum Divisors implements Divisor {
    D_HONDT("d_hondt", BigFraction.ZERO) {
        @Override
        public BigFraction apply(int order) {
            return new BigFraction(order + 1);
        }
    },
    DANISH("danish", null) {
        @Override
        public BigFraction apply(int order) {
            return new BigFraction(3L * order + 1);
        }
    },
    /**
     * sqrt(k(k + 1)), rounded to 34 significant digits. Quotients compared
     * against it are exact only to that precision.
     */
    HUNTINGTON_HILL("huntington_hill", null) {
        @Override
        public BigFraction apply(int order) {
            var root = BigDecimal.valueOf((long) order * (order + 1)).sqrt(MathContext.DECIMAL128);
            return root.scale() > 0 ? new BigFraction(root.unscaledValue(), BigInteger.TEN.pow(root.scale()))
                                    : new BigFraction(root.toBigIntegerExact());
        }
    },
    IMPERIALI("imperiali", null) {
        @Override
        public BigFraction apply(int order) {
            return new BigFraction(order, 2).add(BigFraction.ONE);
        }
    },
    MACAU("macau", null) {
        @Override
        public BigFraction apply(int order) {
            return new BigFraction(BigInteger.TWO.pow(order));
        }
    },
    SAINTE_LAGUE("sainte_lague", new BigFraction(1, 2)) {
        @Override
        public BigFraction apply(int order) {
            return new BigFraction(2L * order + 1);
        }
    };

    /**
     * The divisor with its first element replaced, as in the modified
     * Sainte-Laguë method.
     */
    public static Divisor modifiedFirst(Divisor divisor, BigFraction first) {
        return order -> order == 0 ? first : divisor.apply(order);
    }

    public static Divisors named(String name) {
        return Arrays.stream(values())
                     .filter(d -> d.divisorName.equals(name))
                     .findFirst()
                     .orElseThrow(() -> new ConfigurationException("Unknown divisor: " + name));
    }

    private final String      divisorName;
    private final BigFraction signpost;

    Divisors(String divisorName, BigFraction signpost) {
        this.divisorName = divisorName;
        this.signpost = signpost;
    }

    public String divisorName() {
        return divisorName;
    }

    @Override
    public Optional<BigFraction> signpost() {
        return Optional.ofNullable(signpost);
    }
}
