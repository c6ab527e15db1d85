/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

/**
 * An evaluation with a valid setup ended up in a state it cannot recover from,
 * such as a transferable vote count that stopped converging.
 *
 * @author hal.hildebrand
 *
 */
public class VotingSystemException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public VotingSystemException() {
        super();
    }

    public VotingSystemException(String message) {
        super(message);
    }

    public VotingSystemException(String message, Throwable cause) {
        super(message, cause);
    }

    public VotingSystemException(Throwable cause) {
        super(cause);
    }
}
