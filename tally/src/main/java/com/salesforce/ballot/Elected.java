/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

import java.util.Set;

/**
 * One entry of a selection: either a single winner or a tie between candidates
 * for a seat.
 *
 * @author hal.hildebrand
 *
 */
public interface Elected<C> {

    boolean isTie();

    Set<C> members();
}
