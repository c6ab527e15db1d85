/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.component;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.Optional;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.salesforce.ballot.ConfigurationException;

/**
 * @author hal.hildebrand
 *
 */
public class DivisorsTest {

    private static BigFraction of(long n) {
        return new BigFraction(n);
    }

    @Test
    public void huntingtonHill() {
        assertEquals(BigFraction.ZERO, Divisors.HUNTINGTON_HILL.apply(0));
        assertEquals(Math.sqrt(2), Divisors.HUNTINGTON_HILL.apply(1).doubleValue(), 1e-12);
        assertEquals(Math.sqrt(6), Divisors.HUNTINGTON_HILL.apply(2).doubleValue(), 1e-12);
        // rounded to 34 significant digits
        assertEquals(new BigFraction(new BigInteger("1414213562373095048801688724209698"), BigInteger.TEN.pow(33)),
                     Divisors.HUNTINGTON_HILL.apply(1));
    }

    @Test
    public void modifiedFirst() {
        var modified = Divisors.modifiedFirst(Divisors.SAINTE_LAGUE, new BigFraction(7, 5));
        assertEquals(new BigFraction(7, 5), modified.apply(0));
        assertEquals(of(3), modified.apply(1));
        assertTrue(modified.signpost().isEmpty());
    }

    @Test
    public void named() {
        for (var divisor : Divisors.values()) {
            assertEquals(divisor, Divisors.named(divisor.divisorName()));
        }
        assertThrows(ConfigurationException.class, () -> Divisors.named("droop"));
    }

    @Test
    public void sequences() {
        for (int i = 0; i < 3; i++) {
            assertEquals(of(i + 1), Divisors.D_HONDT.apply(i));
            assertEquals(of(2 * i + 1), Divisors.SAINTE_LAGUE.apply(i));
            assertEquals(of(3 * i + 1), Divisors.DANISH.apply(i));
            assertEquals(of(1L << i), Divisors.MACAU.apply(i));
        }
        assertEquals(new BigFraction(3, 2), Divisors.IMPERIALI.apply(1));
    }

    @Test
    public void signposts() {
        assertEquals(Optional.of(BigFraction.ZERO), Divisors.D_HONDT.signpost());
        assertEquals(Optional.of(new BigFraction(1, 2)), Divisors.SAINTE_LAGUE.signpost());
        assertTrue(Divisors.DANISH.signpost().isEmpty());
    }
}
