/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

/**
 * The apportionment inputs are infeasible or inconsistent, e.g. a district or a
 * party without any votes that is nevertheless entitled to seats.
 *
 * @author hal.hildebrand
 *
 */
public class ApportionmentException extends VotingSystemException {

    private static final long serialVersionUID = 1L;

    private final Object district;
    private final Object party;

    public ApportionmentException(String message, Object district, Object party) {
        super(String.format("%s [district: %s, party: %s]", message, district, party));
        this.district = district;
        this.party = party;
    }

    public Object getDistrict() {
        return district;
    }

    public Object getParty() {
        return party;
    }
}
