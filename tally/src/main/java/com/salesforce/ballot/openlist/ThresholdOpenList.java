/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.openlist;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.fraction.BigFraction;

import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.component.Quota;
import com.salesforce.ballot.component.Quotas;
import com.salesforce.ballot.vote.Votes;

/**
 * Candidates whose preferential votes pass a jump threshold are elected first,
 * by their votes; the remaining seats go down the party list. The threshold is
 * a fraction of the list's total votes, a quota of the list's votes and seats,
 * or the lower (or higher) of both.
 *
 * @author hal.hildebrand
 *
 */
public class ThresholdOpenList<C> implements OpenListEvaluator<C> {

    public static class Builder {
        private boolean     acceptEqual;
        private BigFraction jumpFraction;
        private boolean     listPrecedence;
        private Quota       quota;
        private BigFraction quotaFraction = BigFraction.ONE;
        private boolean     takeHigher;

        public <C> ThresholdOpenList<C> build() {
            if (quotaFraction.compareTo(BigFraction.ZERO) <= 0) {
                throw new ConfigurationException("Quota fraction must be positive: " + quotaFraction);
            }
            var scaled = quota == null || quotaFraction.equals(BigFraction.ONE) ? quota
                                                                                 : Quotas.scaled(quota, quotaFraction);
            return new ThresholdOpenList<>(jumpFraction, scaled, takeHigher, acceptEqual, listPrecedence);
        }

        public BigFraction getJumpFraction() {
            return jumpFraction;
        }

        public Quota getQuota() {
            return quota;
        }

        public BigFraction getQuotaFraction() {
            return quotaFraction;
        }

        public boolean isAcceptEqual() {
            return acceptEqual;
        }

        public boolean isListPrecedence() {
            return listPrecedence;
        }

        public boolean isTakeHigher() {
            return takeHigher;
        }

        public Builder setAcceptEqual(boolean acceptEqual) {
            this.acceptEqual = acceptEqual;
            return this;
        }

        public Builder setJumpFraction(BigFraction jumpFraction) {
            this.jumpFraction = jumpFraction;
            return this;
        }

        /**
         * When more candidates jump than there are seats, keep the ones highest
         * on the list rather than the ones with the most votes.
         */
        public Builder setListPrecedence(boolean listPrecedence) {
            this.listPrecedence = listPrecedence;
            return this;
        }

        public Builder setQuota(Quota quota) {
            this.quota = quota;
            return this;
        }

        public Builder setQuotaFraction(BigFraction quotaFraction) {
            this.quotaFraction = quotaFraction;
            return this;
        }

        public Builder setTakeHigher(boolean takeHigher) {
            this.takeHigher = takeHigher;
            return this;
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    private final boolean     acceptEqual;
    private final BigFraction jumpFraction;
    private final boolean     listPrecedence;
    private final Quota       quota;
    private final boolean     takeHigher;

    public ThresholdOpenList(BigFraction jumpFraction, Quota quota, boolean takeHigher, boolean acceptEqual,
                             boolean listPrecedence) {
        this.jumpFraction = jumpFraction;
        this.quota = quota;
        this.takeHigher = takeHigher;
        this.acceptEqual = acceptEqual;
        this.listPrecedence = listPrecedence;
    }

    @Override
    public List<C> evaluate(Map<C, BigFraction> votes, int seats, List<C> candidateList) {
        var total = Votes.total(votes);
        BigFraction threshold = null;
        if (jumpFraction != null) {
            threshold = total.multiply(jumpFraction);
        }
        if (quota != null) {
            var q = quota.apply(total, seats);
            threshold = threshold == null ? q : takeHigher ? Votes.max(threshold, q) : Votes.min(threshold, q);
        }
        if (threshold == null) {
            return new ArrayList<>(candidateList.subList(0, Math.min(seats, candidateList.size())));
        }
        List<C> jumping = new ArrayList<>();
        for (var e : Votes.sorted(votes)) {
            int cmp = e.getValue().compareTo(threshold);
            if (cmp > 0 || (acceptEqual && cmp == 0)) {
                jumping.add(e.getKey());
            }
        }
        if (jumping.size() > seats) {
            if (listPrecedence) {
                jumping.sort(Comparator.comparingInt(candidateList::indexOf));
                jumping = new ArrayList<>(jumping.subList(0, seats));
                jumping.sort(Comparator.comparing((C c) -> votes.get(c)).reversed());
                return jumping;
            }
            return new ArrayList<>(jumping.subList(0, seats));
        }
        List<C> elected = new ArrayList<>(jumping);
        for (C candidate : candidateList) {
            if (elected.size() >= seats) {
                break;
            }
            if (!elected.contains(candidate)) {
                elected.add(candidate);
            }
        }
        return elected;
    }

    public BigFraction getJumpFraction() {
        return jumpFraction;
    }

    public Quota getQuota() {
        return quota;
    }

    public boolean isAcceptEqual() {
        return acceptEqual;
    }

    public boolean isListPrecedence() {
        return listPrecedence;
    }

    public boolean isTakeHigher() {
        return takeHigher;
    }
}
