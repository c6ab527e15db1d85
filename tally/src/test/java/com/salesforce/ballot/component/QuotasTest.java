/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.component;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.salesforce.ballot.ConfigurationException;

/**
 * @author hal.hildebrand
 *
 */
public class QuotasTest {

    private static BigFraction of(long n) {
        return new BigFraction(n);
    }

    @Test
    public void named() {
        for (var quota : Quotas.values()) {
            assertEquals(quota, Quotas.named(quota.quotaName()));
        }
        assertThrows(ConfigurationException.class, () -> Quotas.named("sainte_lague"));
    }

    @Test
    public void quotas() {
        assertEquals(of(600), Quotas.DROOP.apply(of(2397), 3));
        assertEquals(of(26), Quotas.DROOP.apply(of(100), 3));
        assertEquals(of(25), Quotas.HAGENBACH_BISCHOFF.apply(of(100), 3));
        assertEquals(of(26), Quotas.HAGENBACH_BISCHOFF_CEIL.apply(of(101), 3));
        assertEquals(of(25), Quotas.HAGENBACH_BISCHOFF_ROUNDED.apply(of(101), 3));
        assertEquals(new BigFraction(100, 3), Quotas.HARE.apply(of(100), 3));
        assertEquals(of(13), Quotas.HARE_ROUNDED.apply(of(50), 4));
        assertEquals(of(20), Quotas.IMPERIALI.apply(of(100), 3));
    }

    @Test
    public void derived() {
        assertEquals(of(7), Quotas.constant(of(7)).apply(of(1000), 9));
        assertEquals(of(5), Quotas.scaled(Quotas.HARE, new BigFraction(1, 4)).apply(of(100), 5));
    }
}
