/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.Map;

import com.salesforce.ballot.Distribution;

/**
 * An evaluator distributing seats among contestants.
 *
 * @author hal.hildebrand
 *
 */
public interface Distributor<V, C> extends Evaluator<V, Map<C, Integer>, Distribution<C>> {
}
