/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.component;

import org.apache.commons.math3.fraction.BigFraction;

/**
 * The number of votes required to win a seat.
 *
 * @author hal.hildebrand
 *
 */
@FunctionalInterface
public interface Quota {

    BigFraction apply(BigFraction totalVotes, int seats);
}
