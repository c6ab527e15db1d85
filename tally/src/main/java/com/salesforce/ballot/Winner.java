/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot;

import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * @author hal.hildebrand
 *
 */
public record Winner<C>(C candidate) implements Elected<C> {

    public Winner {
        Objects.requireNonNull(candidate, "candidate");
    }

    @Override
    public boolean isTie() {
        return false;
    }

    @Override
    public Set<C> members() {
        return ImmutableSet.of(candidate);
    }

    @Override
    public String toString() {
        return String.valueOf(candidate);
    }
}
