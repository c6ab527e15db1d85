/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

/**
 * The optional inputs an evaluator makes use of.
 *
 * @author hal.hildebrand
 *
 */
public enum Capability {
    /** The evaluator needs to be told how many seats to fill */
    SEATS,
    /** The evaluator takes previously gained and maximum seats into account */
    PREVIOUS_GAINS;
}
