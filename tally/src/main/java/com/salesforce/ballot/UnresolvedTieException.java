/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

/**
 * A tie arose at a point of the evaluation that has no policy for resolving it.
 * Callers that need a winner regardless compose a tiebreaker explicitly.
 *
 * @author hal.hildebrand
 *
 */
public class UnresolvedTieException extends VotingSystemException {

    private static final long serialVersionUID = 1L;

    private final Tie<?> tie;

    public UnresolvedTieException(String message, Tie<?> tie) {
        super(String.format("%s: %s", message, tie));
        this.tie = tie;
    }

    public Tie<?> getTie() {
        return tie;
    }
}
