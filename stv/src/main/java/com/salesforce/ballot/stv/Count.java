/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.stv;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.math3.fraction.BigFraction;

/**
 * The state of a transferable vote count.
 *
 * @author hal.hildebrand
 *
 * @param number    - the 1-based count number, 0 if no count took place
 * @param totals    - the votes held by each continuing candidate at the start
 *                  of the count
 * @param exhausted - the votes on exhausted ballots at the start of the count
 * @param quota     - the election quota, if any
 * @param elected   - the candidates elected up to and including the count, in
 *                  order of election
 * @param gained    - the seats gained by each elected candidate
 */
public record Count<C>(int number, Map<C, BigFraction> totals, BigFraction exhausted, Optional<BigFraction> quota,
                       List<C> elected, Map<C, Integer> gained) {}
