/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

/**
 * @author hal.hildebrand
 *
 */
public class InvalidVoteException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidVoteException(String message) {
        super(message);
    }
}
