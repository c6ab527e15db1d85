/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

import java.util.List;
import java.util.Map;

/**
 * An evaluation result that may contain ties.
 *
 * @author hal.hildebrand
 *
 * @param <C> - candidate type
 * @param <R> - concrete result type
 */
public interface Result<C, R extends Result<C, R>> {

    /**
     * Substitute the tie by the candidates that won it, one candidate per tied
     * seat.
     */
    R breakTie(Tie<C> tie, List<C> broken);

    default boolean hasTies() {
        return !ties().isEmpty();
    }

    /**
     * @return the number of seats held by each tie
     */
    Map<Tie<C>, Integer> ties();
}
