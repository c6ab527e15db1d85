/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.stv;

import com.salesforce.ballot.ConfigurationException;

/**
 * The vote transfer methods, addressable by name.
 *
 * @author hal.hildebrand
 *
 */
public final class Transfers {
    public static final String GREGORY = "gregory";
    public static final String HARE    = "hare";

    /**
     * @param name - "gregory", or "hare" for unseeded random transfers
     */
    public static VoteTransfer named(String name) {
        return switch (name.toLowerCase()) {
        case GREGORY -> new Gregory();
        case HARE -> new Hare();
        default -> throw new ConfigurationException("Unknown vote transfer: " + name);
        };
    }

    private Transfers() {
    }
}
