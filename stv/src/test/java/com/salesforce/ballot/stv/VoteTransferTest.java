/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.stv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Test;

import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.InvalidVoteException;
import com.salesforce.ballot.component.Quotas;
import com.salesforce.ballot.vote.RankedVote;
import com.salesforce.ballot.vote.Votes;

/**
 * @author hal.hildebrand
 *
 */
public class VoteTransferTest {

    private static TransferableVote.Selecting<String> hare(long seed) {
        return TransferableVote.selector(TransferableVote.Parameters.newBuilder()
                                                                    .setQuota(Quotas.DROOP)
                                                                    .setTransfer(new Hare(seed))
                                                                    .build());
    }

    @Test
    public void gregorySplitsEvenly() {
        var session = new Gregory().session();
        assertEquals(Map.of("A", new BigFraction(5, 3), "B", new BigFraction(5, 3), "C", new BigFraction(5, 3)),
                     session.split(List.of("A", "B", "C"), new BigFraction(5)));
    }

    @Test
    public void gregoryTransfersSurplusFractionally() {
        var allocation = Allocation.<String>of(List.of("A", "B"));
        allocation.add("A", RankedVote.of("A", "B"), new BigFraction(6));
        allocation.add("A", RankedVote.of("A"), new BigFraction(4));
        var session = new Gregory().session();

        var reduced = session.subtract(allocation, Map.of("A", new BigFraction(6)));
        assertEquals(new BigFraction(4), reduced.totals().get("A"));
        assertEquals(new BigFraction(10), allocation.totals().get("A"));

        var moved = session.transfer(reduced, List.of("A"));
        assertEquals(Map.of("B", new BigFraction(12, 5)), moved.totals());
        assertEquals(new BigFraction(8, 5), moved.exhaustedTotal());
    }

    @Test
    public void hareDrawsWholeBallots() {
        var allocation = Allocation.<String>of(List.of("A", "B"));
        allocation.add("A", RankedVote.of("A", "B"), new BigFraction(6));
        allocation.add("A", RankedVote.of("A"), new BigFraction(4));
        var session = new Hare(7L).session();

        var reduced = session.subtract(allocation, Map.of("A", new BigFraction(11, 2)));
        assertEquals(new BigFraction(4), reduced.totals().get("A"));
        reduced.held("A").values().forEach(v -> assertEquals(BigInteger.ONE, v.getDenominator()));

        var split = session.split(List.of("A", "B", "C"), new BigFraction(7));
        assertEquals(new BigFraction(7), Votes.sum(split.values()));
        split.values().forEach(v -> assertTrue(v.equals(new BigFraction(2)) || v.equals(new BigFraction(3))));
    }

    @Test
    public void hareIsReproducibleWithSeed() {
        var votes = TransferableVoteTest.SCOTTISH;
        assertEquals(hare(42).evaluate(votes, 3), hare(42).evaluate(votes, 3));
        assertEquals(3, hare(42).evaluate(votes, 3).size());

        var gregory = TransferableVote.<String>selector(TransferableVoteTest.STV);
        assertEquals(gregory.nthCount(votes, 3, 1).totals(), hare(42).nthCount(votes, 3, 1).totals());
        hare(42).nthCount(votes, 3, 2)
                .totals()
                .values()
                .forEach(v -> assertEquals(BigInteger.ONE, v.getDenominator()));

        assertTrue(new Hare(42L).isStable());
        assertFalse(new Hare().isStable());
        assertTrue(new Gregory().isStable());
    }

    @Test
    public void hareRejectsFractionalBallots() {
        var votes = Map.of(RankedVote.of("A", "B"), new BigFraction(7, 2), RankedVote.of("B"), BigFraction.ONE);
        assertThrows(InvalidVoteException.class, () -> hare(1).evaluate(votes));
    }

    @Test
    public void named() {
        assertInstanceOf(Gregory.class, Transfers.named("gregory"));
        assertInstanceOf(Hare.class, Transfers.named("Hare"));
        assertThrows(ConfigurationException.class, () -> Transfers.named("meek"));
    }
}
