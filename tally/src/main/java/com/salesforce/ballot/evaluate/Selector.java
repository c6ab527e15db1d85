/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.Map;

import com.salesforce.ballot.Selection;

/**
 * An evaluator electing an ordered selection of candidates.
 *
 * @author hal.hildebrand
 *
 */
public interface Selector<V, C> extends Evaluator<V, Map<C, Integer>, Selection<C>> {
}
