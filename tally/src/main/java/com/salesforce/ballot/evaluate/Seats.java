/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.evaluate;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

import com.salesforce.ballot.ConfigurationException;

/**
 * The seat parameters of an evaluation: how many seats to fill, and the seats
 * already gained and the maximum seats obtainable by each contestant. Gains are
 * a map keyed by contestant, or nested maps for evaluations by constituency.
 * Absent gains are empty, immutable maps.
 *
 * @author hal.hildebrand
 *
 */
public record Seats<G extends Map<?, ?>>(OptionalInt count, G prevGains, G maxSeats) {

    public static <G extends Map<?, ?>> Seats<G> none() {
        return new Seats<>(OptionalInt.empty(), null, null);
    }

    public static <G extends Map<?, ?>> Seats<G> of(int count) {
        return new Seats<>(OptionalInt.of(count), null, null);
    }

    /**
     * Seat parameters carrying over only the seat count, if any.
     */
    public static <G extends Map<?, ?>> Seats<G> of(OptionalInt count) {
        return new Seats<>(count, null, null);
    }

    public static <G extends Map<?, ?>> Seats<G> of(int count, G prevGains, G maxSeats) {
        return new Seats<>(OptionalInt.of(count), prevGains, maxSeats);
    }

    @SuppressWarnings("unchecked")
    private static <G extends Map<?, ?>> G empty() {
        return (G) Map.of();
    }

    public Seats {
        Objects.requireNonNull(count, "count");
        if (count.isPresent() && count.getAsInt() < 0) {
            throw new ConfigurationException("Negative seat count: " + count.getAsInt());
        }
        prevGains = prevGains == null ? empty() : prevGains;
        maxSeats = maxSeats == null ? empty() : maxSeats;
    }

    /**
     * Keep only the parameters that an evaluator with the given capabilities
     * makes use of.
     */
    public Seats<G> restrictTo(Set<Capability> capabilities) {
        var prev = capabilities.contains(Capability.PREVIOUS_GAINS);
        return new Seats<>(capabilities.contains(Capability.SEATS) ? count : OptionalInt.empty(),
                           prev ? prevGains : null, prev ? maxSeats : null);
    }

    /**
     * @return the seat count
     * @throws ConfigurationException if no seat count was given
     */
    public int required() {
        return count.orElseThrow(() -> new ConfigurationException("A seat count is required"));
    }

    public Seats<G> withCount(int seats) {
        return new Seats<>(OptionalInt.of(seats), prevGains, maxSeats);
    }

    public Seats<G> withGains(G prevGains, G maxSeats) {
        return new Seats<>(count, prevGains, maxSeats);
    }

    public Seats<G> withoutCount() {
        return new Seats<>(OptionalInt.empty(), prevGains, maxSeats);
    }
}
