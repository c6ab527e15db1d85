/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.stv;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.Elected;
import com.salesforce.ballot.InvalidVoteException;
import com.salesforce.ballot.Selection;
import com.salesforce.ballot.Tie;
import com.salesforce.ballot.UnresolvedTieException;
import com.salesforce.ballot.VotingSystemException;
import com.salesforce.ballot.component.Quota;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Distributor;
import com.salesforce.ballot.evaluate.Evaluator;
import com.salesforce.ballot.evaluate.Plurality;
import com.salesforce.ballot.evaluate.Seats;
import com.salesforce.ballot.evaluate.Selector;
import com.salesforce.ballot.vote.RankedVote;
import com.salesforce.ballot.vote.Votes;

/**
 * Transferable vote counting: single transferable vote, and instant runoff
 * voting as its single seat case.
 * <p>
 * Each count elects the candidates reaching the quota and transfers their
 * surplus, or, when nobody does, eliminates the weakest candidates and
 * transfers their votes to the next preferences. Once the continuing
 * candidates can take no more seats than remain, they are all elected without
 * reaching the quota.
 *
 * @author hal.hildebrand
 *
 * @param <C> - candidate type
 * @param <R> - result type
 */
public abstract class TransferableVote<C, R>
                                      implements Evaluator<Map<RankedVote<C>, BigFraction>, Map<C, Integer>, R> {

    /**
     * Distributes seats, a candidate winning a seat for every quota of votes.
     * Previous gains count against the seat count, and without a maximum a
     * candidate may hold at most the whole seat count.
     */
    public static final class Distributing<C> extends TransferableVote<C, Distribution<C>>
                                          implements Distributor<Map<RankedVote<C>, BigFraction>, C> {

        private Distributing(Parameters parameters) {
            super(parameters);
        }

        @Override
        public Set<Capability> capabilities() {
            return ImmutableSet.of(Capability.SEATS, Capability.PREVIOUS_GAINS);
        }

        @Override
        public String toString() {
            return "TransferableVote.Distributing[" + getParameters() + "]";
        }

        @Override
        int cap(C candidate, int seats, Seats<Map<C, Integer>> request) {
            return request.maxSeats().getOrDefault(candidate, seats);
        }

        @Override
        Distribution<C> result(Count<C> count) {
            return Distribution.of(count.gained());
        }

        @Override
        int seats(Seats<Map<C, Integer>> request) {
            return request.required();
        }
    }

    /**
     * Selects candidates, each elected to a single seat.
     */
    public static final class Selecting<C> extends TransferableVote<C, Selection<C>>
                                       implements Selector<Map<RankedVote<C>, BigFraction>, C> {

        private Selecting(Parameters parameters) {
            super(parameters);
        }

        @Override
        public Set<Capability> capabilities() {
            return ImmutableSet.of(Capability.SEATS);
        }

        @Override
        public String toString() {
            return "TransferableVote.Selecting[" + getParameters() + "]";
        }

        @Override
        int cap(C candidate, int seats, Seats<Map<C, Integer>> request) {
            return 1;
        }

        @Override
        Selection<C> result(Count<C> count) {
            return Selection.ofWinners(count.elected());
        }

        /**
         * Elects a single candidate when no seat count is given.
         */
        @Override
        int seats(Seats<Map<C, Integer>> request) {
            return request.count().orElse(1);
        }
    }

    public static class Parameters {

        public static class Builder {
            private boolean                acceptQuotaEqual = true;
            private int                    eliminateStep    = -1;
            private boolean                mandatoryQuota;
            private int                    maxCounts        = Integer.MAX_VALUE;
            private Quota                  quota;
            private Evaluator<?, ?, ?> retainer;
            private VoteTransfer           transfer         = new Gregory();

            /**
             * @throws ConfigurationException if the settings are inconsistent
             */
            public Parameters build() {
                var parameters = new Parameters(transfer, quota, retainer, eliminateStep, acceptQuotaEqual,
                                                mandatoryQuota, maxCounts);
                parameters.valid();
                return parameters;
            }

            public int getEliminateStep() {
                return eliminateStep;
            }

            public int getMaxCounts() {
                return maxCounts;
            }

            public Quota getQuota() {
                return quota;
            }

            public Evaluator<?, ?, ?> getRetainer() {
                return retainer;
            }

            public VoteTransfer getTransfer() {
                return transfer;
            }

            public boolean isAcceptQuotaEqual() {
                return acceptQuotaEqual;
            }

            public boolean isMandatoryQuota() {
                return mandatoryQuota;
            }

            /**
             * Elect candidates whose votes equal the quota, not only those
             * exceeding it.
             */
            public Builder setAcceptQuotaEqual(boolean acceptQuotaEqual) {
                this.acceptQuotaEqual = acceptQuotaEqual;
                return this;
            }

            /**
             * A negative step eliminates that many candidates per elimination; a
             * positive step retains that many candidates, e.g. 2 for a top two
             * runoff.
             */
            public Builder setEliminateStep(int eliminateStep) {
                this.eliminateStep = eliminateStep;
                return this;
            }

            /**
             * Require the quota even when the continuing candidates would fill
             * the remaining seats exactly; seats may then stay empty.
             */
            public Builder setMandatoryQuota(boolean mandatoryQuota) {
                this.mandatoryQuota = mandatoryQuota;
                return this;
            }

            public Builder setMaxCounts(int maxCounts) {
                this.maxCounts = maxCounts;
                return this;
            }

            /**
             * Without a quota candidates are only eliminated, until as many
             * remain as there are seats.
             */
            public Builder setQuota(Quota quota) {
                this.quota = quota;
                return this;
            }

            /**
             * Select the candidates retained at an elimination instead of the
             * ones with the most votes. A retainer accepting a seat count is
             * asked for the number of candidates to retain.
             */
            public <C> Builder setRetainer(Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>> retainer) {
                this.retainer = retainer;
                return this;
            }

            public Builder setTransfer(VoteTransfer transfer) {
                this.transfer = transfer;
                return this;
            }
        }

        public static Builder newBuilder() {
            return new Builder();
        }

        public final boolean            acceptQuotaEqual;
        public final int                eliminateStep;
        public final boolean            mandatoryQuota;
        public final int                maxCounts;
        public final Quota              quota;
        public final Evaluator<?, ?, ?> retainer;
        public final VoteTransfer       transfer;

        public Parameters(VoteTransfer transfer, Quota quota, Evaluator<?, ?, ?> retainer, int eliminateStep,
                          boolean acceptQuotaEqual, boolean mandatoryQuota, int maxCounts) {
            this.transfer = transfer;
            this.quota = quota;
            this.retainer = retainer;
            this.eliminateStep = eliminateStep;
            this.acceptQuotaEqual = acceptQuotaEqual;
            this.mandatoryQuota = mandatoryQuota;
            this.maxCounts = maxCounts;
        }

        @Override
        public String toString() {
            return String.format("transfer=%s, quota=%s, retainer=%s, eliminateStep=%s", transfer, quota, retainer,
                                 eliminateStep);
        }

        public void valid() throws ConfigurationException {
            if (transfer == null) {
                throw new ConfigurationException("A vote transfer is required");
            }
            if (eliminateStep == 0) {
                throw new ConfigurationException("EliminateStep = 0: Fails the condition that: EliminateStep != 0");
            }
            if (maxCounts <= 0) {
                throw new ConfigurationException(String.format("MaxCounts = %d: Fails the condition that: 0 < MaxCounts",
                                                               maxCounts));
            }
            if (mandatoryQuota && quota == null) {
                throw new ConfigurationException("A mandatory quota requires a quota");
            }
            if (retainer != null && !retainer.accepts(Capability.SEATS) && eliminateStep != -1) {
                throw new ConfigurationException(String.format("EliminateStep = %d: Retainer %s cannot be asked for a retained count",
                                                               eliminateStep, retainer));
            }
        }
    }

    private static final Logger log = LoggerFactory.getLogger(TransferableVote.class);

    public static <C> Distributing<C> distributor(Parameters parameters) {
        return new Distributing<>(parameters);
    }

    public static <C> Selecting<C> selector(Parameters parameters) {
        return new Selecting<>(parameters);
    }

    /**
     * @return all ranked candidates, in order of first appearance
     */
    private static <C> Set<C> candidates(Map<RankedVote<C>, BigFraction> votes) {
        Set<C> candidates = new LinkedHashSet<>();
        votes.keySet().forEach(v -> candidates.addAll(v.candidates()));
        return candidates;
    }

    private static <C> List<C> untied(List<Elected<C>> entries, String context) {
        List<C> candidates = new ArrayList<>(entries.size());
        for (var entry : entries) {
            if (entry instanceof Tie<C> tie) {
                throw new UnresolvedTieException(context + ": " + tie, tie);
            }
            candidates.addAll(entry.members());
        }
        return candidates;
    }

    private final Parameters parameters;

    private TransferableVote(Parameters parameters) {
        parameters.valid();
        this.parameters = parameters;
    }

    @Override
    public R evaluate(Map<RankedVote<C>, BigFraction> votes, Seats<Map<C, Integer>> seats) {
        return result(count(votes, seats.restrictTo(capabilities()), Integer.MAX_VALUE));
    }

    public Parameters getParameters() {
        return parameters;
    }

    /**
     * Run the count up to the given count number.
     *
     * @return the state of the last count run, which is earlier than the
     *         requested one if the seats were filled before
     */
    public Count<C> nthCount(Map<RankedVote<C>, BigFraction> votes, int seats, int count) {
        return nthCount(votes, Seats.of(seats), count);
    }

    public Count<C> nthCount(Map<RankedVote<C>, BigFraction> votes, Seats<Map<C, Integer>> seats, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Counts are numbered from 1: " + count);
        }
        return count(votes, seats.restrictTo(capabilities()), count);
    }

    /**
     * @return the most seats the candidate may hold, previous gains included
     */
    abstract int cap(C candidate, int seats, Seats<Map<C, Integer>> request);

    abstract R result(Count<C> count);

    abstract int seats(Seats<Map<C, Integer>> request);

    private Count<C> count(Map<RankedVote<C>, BigFraction> votes, Seats<Map<C, Integer>> request, int limit) {
        final int seats = seats(request);
        var prevGains = request.prevGains();
        // seats already held count against the total
        final int open = seats - prevGains.values().stream().mapToInt(Integer::intValue).sum();
        var session = parameters.transfer.session();
        var allocation = firstPreferences(votes, session);
        var quota = parameters.quota == null ? null : parameters.quota.apply(Votes.total(votes), seats);
        log.debug("Counting {} seats among {} with quota {}", seats, allocation.continuing(), quota);

        Map<C, Integer> held = new LinkedHashMap<>(prevGains);
        Map<C, Integer> gained = new LinkedHashMap<>();
        List<C> elected = new ArrayList<>();
        int filled = 0;
        int number = 0;
        var totals = allocation.totals();
        var exhausted = allocation.exhaustedTotal();
        int maxCounts = Math.min(limit, parameters.maxCounts);
        while (filled < open && !allocation.continuing().isEmpty() && number < maxCounts) {
            number++;
            totals = allocation.totals();
            exhausted = allocation.exhaustedTotal();
            int remaining = open - filled;
            Map<C, Integer> available = new LinkedHashMap<>();
            for (C candidate : totals.keySet()) {
                int free = cap(candidate, seats, request) - held.getOrDefault(candidate, 0);
                available.put(candidate, Math.max(0, Math.min(free, remaining)));
            }
            if (log.isDebugEnabled()) {
                log.debug("Count {}: {}, exhausted {}", number, totals, exhausted);
            }

            if (!parameters.mandatoryQuota && sum(available) <= remaining) {
                for (var e : Votes.sorted(totals)) {
                    int n = available.get(e.getKey());
                    if (n > 0) {
                        elect(e.getKey(), n, elected, gained, held);
                        filled += n;
                    }
                }
                log.debug("Count {}: elected all continuing candidates {}", number, available);
                break;
            }

            var fresh = electByQuota(totals, quota, remaining, seats, prevGains, held, request);
            if (!fresh.isEmpty()) {
                Map<C, BigFraction> used = new LinkedHashMap<>();
                fresh.forEach((candidate, n) -> used.put(candidate, quota.multiply(n)));
                allocation = session.subtract(allocation, used);
                for (var e : Votes.sorted(totals)) {
                    var n = fresh.get(e.getKey());
                    if (n != null) {
                        elect(e.getKey(), n, elected, gained, held);
                        filled += n;
                    }
                }
                List<C> full = new ArrayList<>();
                fresh.keySet().forEach(c -> {
                    if (held.get(c) >= cap(c, seats, request)) {
                        full.add(c);
                    }
                });
                log.debug("Count {}: elected {}", number, fresh);
                allocation = session.transfer(allocation, full);
            } else {
                var retained = retain(totals);
                List<C> eliminated = new ArrayList<>(totals.keySet());
                eliminated.removeAll(retained);
                log.debug("Count {}: eliminated {}", number, eliminated);
                var before = allocation;
                allocation = session.transfer(allocation, eliminated);
                if (allocation.equals(before)) {
                    throw new VotingSystemException(String.format("Count %s changed nothing, the count does not converge",
                                                                  number));
                }
            }
        }
        return new Count<>(number, ImmutableMap.copyOf(totals), exhausted, Optional.ofNullable(quota),
                           ImmutableList.copyOf(elected), ImmutableMap.copyOf(gained));
    }

    private void elect(C candidate, int n, List<C> elected, Map<C, Integer> gained, Map<C, Integer> held) {
        if (!gained.containsKey(candidate)) {
            elected.add(candidate);
        }
        gained.merge(candidate, n, Integer::sum);
        held.merge(candidate, n, Integer::sum);
    }

    /**
     * @return the seats newly won by quota, cut back by overcount if they exceed
     *         the remaining seats
     */
    private Map<C, Integer> electByQuota(Map<C, BigFraction> totals, BigFraction quota, int remaining, int seats,
                                         Map<C, Integer> prevGains, Map<C, Integer> held,
                                         Seats<Map<C, Integer>> request) {
        Map<C, Integer> fresh = new LinkedHashMap<>();
        if (quota == null || quota.compareTo(BigFraction.ZERO) <= 0) {
            return fresh;
        }
        totals.forEach((candidate, total) -> {
            int cmp = total.compareTo(quota);
            if (cmp > 0 || (parameters.acceptQuotaEqual && cmp == 0)) {
                int n = Votes.floorInt(total.divide(quota)) - prevGains.getOrDefault(candidate, 0);
                n = Math.min(n, cap(candidate, seats, request) - held.getOrDefault(candidate, 0));
                if (n > 0) {
                    fresh.put(candidate, n);
                }
            }
        });
        while (sum(fresh) > remaining) {
            Map<C, BigFraction> overcount = new LinkedHashMap<>();
            fresh.forEach((candidate, n) -> overcount.put(candidate,
                                                          totals.get(candidate)
                                                                .subtract(quota.multiply(n
                                                                + prevGains.getOrDefault(candidate, 0)))));
            int keep = fresh.size() - (sum(fresh) - remaining);
            Set<C> kept = keep > 0 ? new LinkedHashSet<>(untied(Plurality.topN(overcount, keep),
                                                                "Tie in overcount at the quota cutoff"))
                                   : Set.of();
            for (C candidate : List.copyOf(fresh.keySet())) {
                if (!kept.contains(candidate)) {
                    int n = fresh.get(candidate) - 1;
                    if (n > 0) {
                        fresh.put(candidate, n);
                    } else {
                        fresh.remove(candidate);
                    }
                }
            }
        }
        return fresh;
    }

    private Allocation<C> firstPreferences(Map<RankedVote<C>, BigFraction> votes, VoteTransfer.Session session) {
        var allocation = Allocation.<C>of(candidates(votes));
        votes.forEach((vote, count) -> {
            if (count.compareTo(BigFraction.ZERO) < 0) {
                throw new InvalidVoteException(String.format("Negative vote count %s for %s", count, vote));
            }
            var first = vote.first();
            if (first.isEmpty()) {
                allocation.exhaust(vote, count);
            } else if (first.size() == 1) {
                allocation.add(first.iterator().next(), vote, count);
            } else {
                session.split(List.copyOf(first), count).forEach((c, share) -> allocation.add(c, vote, share));
            }
        });
        return allocation;
    }

    /**
     * @return the candidates retained at an elimination
     * @throws UnresolvedTieException if the weakest candidates tie
     * @throws VotingSystemException  if the retainer keeps too many candidates
     */
    private List<C> retain(Map<C, BigFraction> totals) {
        int n = totals.size();
        int step = parameters.eliminateStep;
        int count = step < 0 ? Math.max(n + step, parameters.mandatoryQuota ? 0 : 1) : Math.min(step, n - 1);
        List<Elected<C>> entries;
        if (parameters.retainer == null) {
            entries = Plurality.topN(totals, count);
        } else {
            Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>> retainer = retainer();
            entries = (retainer.accepts(Capability.SEATS) ? retainer.evaluate(totals, count)
                                                         : retainer.evaluate(totals)).entries();
        }
        var retained = untied(entries, "Tie in elimination");
        if (retained.size() > count) {
            throw new VotingSystemException(String.format("Retained %s candidates, expected at most %s: %s",
                                                          retained.size(), count, retained));
        }
        return retained;
    }

    @SuppressWarnings("unchecked")
    private Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>> retainer() {
        return (Evaluator<Map<C, BigFraction>, Map<C, Integer>, Selection<C>>) parameters.retainer;
    }

    private int sum(Map<C, Integer> seats) {
        return seats.values().stream().mapToInt(Integer::intValue).sum();
    }
}
