/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.vote;

import java.util.Set;

/**
 * Restricts votes of some shape to a subset of the candidates.
 *
 * @author hal.hildebrand
 *
 * @param <V> - the vote tally type
 * @param <C> - candidate type
 */
@FunctionalInterface
public interface Subsetter<V, C> {

    V subset(V votes, Set<? extends C> allowed);
}
