/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.ballot.biproportional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.fraction.BigFraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.salesforce.ballot.ApportionmentException;
import com.salesforce.ballot.ConfigurationException;
import com.salesforce.ballot.Distribution;
import com.salesforce.ballot.InvalidVoteException;
import com.salesforce.ballot.UnresolvedTieException;
import com.salesforce.ballot.component.Divisor;
import com.salesforce.ballot.evaluate.Capability;
import com.salesforce.ballot.evaluate.Distributor;
import com.salesforce.ballot.evaluate.Evaluator;
import com.salesforce.ballot.evaluate.Seats;
import com.salesforce.ballot.proportional.HighestAverages;
import com.salesforce.ballot.vote.Votes;

/**
 * Biproportional apportionment of a district by party grid by the tie and
 * transfer algorithm.
 * <p>
 * Districts receive their seats from an apportionment of the district totals,
 * parties from a highest averages allocation over the national party totals.
 * The grid is then rounded so that each cell holds the divisor method rounding
 * of votes &times; district coefficient &times; party coefficient, with both
 * the district and the party sums matching their targets. All arithmetic is
 * exact.
 *
 * @author hal.hildebrand
 *
 * @param <D> - district type
 * @param <P> - party type
 */
public class BiproportionalEvaluator<D, P>
                                    implements Evaluator<Map<D, Map<P, BigFraction>>, Map<D, Integer>, Map<D, Map<P, Integer>>> {

    /**
     * The grid under adjustment, with its coefficients.
     */
    private class Solver {
        private final Map<D, Integer>         districtTargets;
        private final List<D>                 districts;
        private final Map<D, BigFraction>     lambda = new LinkedHashMap<>();
        private final Map<P, BigFraction>     mu     = new LinkedHashMap<>();
        private final List<P>                 parties;
        private final Map<D, Map<P, Integer>> seats  = new LinkedHashMap<>();
        private final Map<D, Map<P, BigFraction>> votes;

        private Solver(Map<D, Map<P, BigFraction>> votes, Map<D, Integer> districtTargets, Map<P, Integer> partyTargets) {
            this.votes = votes;
            this.districtTargets = districtTargets;
            this.districts = List.copyOf(votes.keySet());
            Set<P> parties = new LinkedHashSet<>();
            votes.values().forEach(row -> parties.addAll(row.keySet()));
            this.parties = List.copyOf(parties);
            districts.forEach(d -> {
                lambda.put(d, BigFraction.ONE);
                Map<P, Integer> row = new LinkedHashMap<>();
                this.parties.forEach(p -> row.put(p, 0));
                seats.put(d, row);
            });
            var byParty = Votes.transpose(votes);
            for (P party : this.parties) {
                int target = partyTargets.getOrDefault(party, 0);
                if (target > 0) {
                    apportionWithin(party, byParty.get(party), target).forEach((d, n) -> seats.get(d).put(party, n));
                }
                mu.put(party, initialCoefficient(party));
            }
        }

        private Map<D, Map<P, Integer>> solve() {
            int iteration = 0;
            while (true) {
                List<D> over = new ArrayList<>();
                List<D> under = new ArrayList<>();
                for (D district : districts) {
                    int held = seats.get(district).values().stream().mapToInt(Integer::intValue).sum();
                    int target = districtTargets.get(district);
                    if (held > target) {
                        over.add(district);
                    } else if (held < target) {
                        under.add(district);
                    }
                }
                if (over.isEmpty() && under.isEmpty()) {
                    log.debug("Biproportional grid solved after {} iterations", iteration);
                    return result();
                }
                iteration++;
                log.debug("Iteration {}: over {}, under {}", iteration, over, under);

                Map<D, P> districtLabels = new LinkedHashMap<>();
                Map<P, D> partyLabels = new LinkedHashMap<>();
                over.forEach(d -> districtLabels.put(d, null));
                var found = label(over, under, districtLabels, partyLabels);
                if (found != null) {
                    transfer(found, districtLabels, partyLabels);
                } else {
                    rescale(districtLabels, partyLabels);
                }
            }
        }

        private int cell(D district, P party) {
            return seats.get(district).get(party);
        }

        /**
         * A labeled cell whose quotient sits exactly on the lower rounding
         * boundary may lose a seat.
         */
        private boolean decrementable(D district, P party) {
            return cell(district, party) > 0
            && quotient(district, party).add(signpost).equals(new BigFraction(cell(district, party)));
        }

        /**
         * A cell whose quotient sits exactly on the upper rounding boundary may
         * gain a seat.
         */
        private boolean incrementable(D district, P party) {
            return votes(district, party).compareTo(BigFraction.ZERO) > 0
            && quotient(district, party).add(signpost).equals(new BigFraction(cell(district, party) + 1));
        }

        private BigFraction initialCoefficient(P party) {
            BigFraction lo = null;
            BigFraction hi = null;
            for (D district : districts) {
                var v = votes(district, party);
                if (v.compareTo(BigFraction.ZERO) > 0) {
                    var x = new BigFraction(cell(district, party));
                    var low = x.subtract(signpost).divide(v);
                    var high = x.add(BigFraction.ONE).subtract(signpost).divide(v);
                    lo = lo == null ? low : Votes.max(lo, low);
                    hi = hi == null ? high : Votes.min(hi, high);
                }
            }
            if (lo == null) {
                return BigFraction.ONE;
            }
            if (lo.compareTo(hi) > 0) {
                throw new ApportionmentException("No party coefficient fits the initial allocation", null, party);
            }
            return lo.compareTo(BigFraction.ZERO) > 0 ? lo : hi;
        }

        /**
         * Breadth first alternating labeling from the over supplied districts.
         *
         * @return the first under supplied district labeled, or null if none is
         *         reachable
         */
        private D label(List<D> over, List<D> under, Map<D, P> districtLabels, Map<P, D> partyLabels) {
            List<D> frontier = over;
            while (!frontier.isEmpty()) {
                List<D> next = new ArrayList<>();
                for (D district : frontier) {
                    for (P party : parties) {
                        if (partyLabels.containsKey(party) || !decrementable(district, party)) {
                            continue;
                        }
                        partyLabels.put(party, district);
                        for (D other : districts) {
                            if (!districtLabels.containsKey(other) && incrementable(other, party)) {
                                districtLabels.put(other, party);
                                next.add(other);
                                if (under.contains(other)) {
                                    return other;
                                }
                            }
                        }
                    }
                }
                frontier = next;
            }
            return null;
        }

        private BigFraction quotient(D district, P party) {
            return votes(district, party).multiply(lambda.get(district)).multiply(mu.get(party));
        }

        /**
         * Scale the labeled districts down and the labeled parties up until a
         * new cell reaches a rounding boundary.
         */
        private void rescale(Map<D, P> districtLabels, Map<P, D> partyLabels) {
            BigFraction alpha = null;
            D atDistrict = null;
            P atParty = null;
            for (D district : districtLabels.keySet()) {
                for (P party : parties) {
                    if (partyLabels.containsKey(party) || votes(district, party).compareTo(BigFraction.ZERO) <= 0) {
                        continue;
                    }
                    var floor = new BigFraction(cell(district, party)).subtract(signpost);
                    if (floor.compareTo(BigFraction.ZERO) > 0) {
                        var ratio = floor.divide(quotient(district, party));
                        if (alpha == null || ratio.compareTo(alpha) > 0) {
                            alpha = ratio;
                            atDistrict = district;
                            atParty = party;
                        }
                    }
                }
            }
            for (D district : districts) {
                if (districtLabels.containsKey(district)) {
                    continue;
                }
                for (P party : partyLabels.keySet()) {
                    var ceiling = new BigFraction(cell(district, party) + 1).subtract(signpost);
                    if (votes(district, party).compareTo(BigFraction.ZERO) <= 0
                    || ceiling.compareTo(BigFraction.ZERO) <= 0) {
                        continue;
                    }
                    var ratio = quotient(district, party).divide(ceiling);
                    if (alpha == null || ratio.compareTo(alpha) > 0) {
                        alpha = ratio;
                        atDistrict = district;
                        atParty = party;
                    }
                }
            }
            if (alpha == null) {
                throw new ApportionmentException("No coefficient adjustment is possible", districtLabels.keySet(),
                                                 partyLabels.keySet());
            }
            if (alpha.compareTo(BigFraction.ZERO) <= 0 || alpha.compareTo(BigFraction.ONE) >= 0) {
                throw new ApportionmentException(String.format("Adjustment coefficient %s outside (0, 1)", alpha),
                                                 atDistrict, atParty);
            }
            log.trace("Scaling districts {} by {}", districtLabels.keySet(), alpha);
            for (D district : districtLabels.keySet()) {
                lambda.put(district, lambda.get(district).multiply(alpha));
            }
            for (P party : partyLabels.keySet()) {
                mu.put(party, mu.get(party).divide(alpha));
            }
        }

        private Map<D, Map<P, Integer>> result() {
            var result = ImmutableMap.<D, Map<P, Integer>>builder();
            seats.forEach((district, row) -> {
                var filled = ImmutableMap.<P, Integer>builder();
                row.forEach((party, n) -> {
                    if (n > 0) {
                        filled.put(party, n);
                    }
                });
                result.put(district, filled.build());
            });
            return result.build();
        }

        /**
         * Move one seat along the labeled path, from the under supplied district
         * back to an over supplied one, keeping every party sum.
         */
        private void transfer(D found, Map<D, P> districtLabels, Map<P, D> partyLabels) {
            D district = found;
            while (districtLabels.get(district) != null) {
                P party = districtLabels.get(district);
                seats.get(district).merge(party, 1, Integer::sum);
                district = partyLabels.get(party);
                seats.get(district).merge(party, -1, Integer::sum);
            }
            log.trace("Moved a seat from {} to {}", district, found);
        }

        private BigFraction votes(D district, P party) {
            return votes.get(district).getOrDefault(party, BigFraction.ZERO);
        }
    }

    private static final Logger log = LoggerFactory.getLogger(BiproportionalEvaluator.class);

    private static <K> Map<K, Integer> untied(Distribution<K> distribution, String context) {
        if (!distribution.ties().isEmpty()) {
            var tie = distribution.ties().keySet().iterator().next();
            throw new UnresolvedTieException(context + ": " + tie, tie);
        }
        return distribution.seats();
    }

    private final Distributor<Map<D, BigFraction>, D> districtApportioner;
    private final Divisor                              divisor;
    private final BigFraction                          signpost;

    /**
     * @throws ConfigurationException if the divisor has no known signpost
     */
    public BiproportionalEvaluator(Divisor divisor) {
        this(divisor, null, null);
    }

    /**
     * @param signpost            - the rounding point of the divisor, or null to
     *                            use the divisor's own
     * @param districtApportioner - apportions seats to districts by their total
     *                            votes, or null for highest averages by the
     *                            divisor
     * @throws ConfigurationException if no signpost is given or known
     */
    public BiproportionalEvaluator(Divisor divisor, BigFraction signpost,
                                   Distributor<Map<D, BigFraction>, D> districtApportioner) {
        this.divisor = divisor;
        this.signpost = signpost != null ? signpost
                                         : divisor.signpost()
                                                  .orElseThrow(() -> new ConfigurationException(String.format("Divisor %s has no signpost, one must be given",
                                                                                                              divisor)));
        if (this.signpost.compareTo(BigFraction.ZERO) < 0 || this.signpost.compareTo(BigFraction.ONE) > 0) {
            throw new ConfigurationException("Signpost outside [0, 1]: " + this.signpost);
        }
        this.districtApportioner = districtApportioner != null ? districtApportioner : new HighestAverages<>(divisor);
    }

    /**
     * Apportion the grid to fixed district seat counts; the parties share the
     * sum of the district seats.
     *
     * @throws ConfigurationException  if the targets do not cover exactly the
     *                                 districts voted in
     * @throws UnresolvedTieException  if the party allocation ties
     * @throws ApportionmentException  if the grid cannot be rounded to the
     *                                 targets
     */
    public Map<D, Map<P, Integer>> apportion(Map<D, Map<P, BigFraction>> votes, Map<D, Integer> districtTargets) {
        if (!districtTargets.keySet().equals(votes.keySet())) {
            throw new ConfigurationException(String.format("District targets %s do not match the districts %s",
                                                           districtTargets.keySet(), votes.keySet()));
        }
        votes.forEach((district, row) -> row.forEach((party, count) -> {
            if (count.compareTo(BigFraction.ZERO) < 0) {
                throw new InvalidVoteException(String.format("Negative vote count %s for %s in %s", count, party,
                                                             district));
            }
        }));
        int total = districtTargets.values().stream().mapToInt(Integer::intValue).sum();
        var partyTargets = untied(new HighestAverages<P>(divisor).evaluate(Votes.totals(votes), total),
                                  "Tie in party seats");
        log.debug("District targets {}, party targets {}", districtTargets, partyTargets);
        return new Solver(votes, districtTargets, partyTargets).solve();
    }

    @Override
    public Set<Capability> capabilities() {
        return ImmutableSet.of(Capability.SEATS);
    }

    /**
     * Apportion the seats among districts, then solve the grid.
     */
    @Override
    public Map<D, Map<P, Integer>> evaluate(Map<D, Map<P, BigFraction>> votes, Seats<Map<D, Integer>> seats) {
        int n = seats.required();
        var apportioned = untied(districtApportioner.evaluate(Votes.constituencyTotals(votes), n),
                                 "Tie in district seats");
        Map<D, Integer> districtTargets = new LinkedHashMap<>();
        votes.keySet().forEach(d -> districtTargets.put(d, apportioned.getOrDefault(d, 0)));
        return apportion(votes, districtTargets);
    }

    public Divisor getDivisor() {
        return divisor;
    }

    public BigFraction getSignpost() {
        return signpost;
    }

    @Override
    public String toString() {
        return "Biproportional[" + divisor + ", signpost " + signpost + "]";
    }

    /**
     * Allocate a party's seats among the districts, shares of a tied last seat
     * going to the districts first in order.
     */
    private Map<D, Integer> apportionWithin(P party, Map<D, BigFraction> votes, int seats) {
        var distribution = new HighestAverages<D>(divisor).evaluate(votes, seats);
        for (var tie : distribution.ties().entrySet()) {
            List<D> broken = new ArrayList<>();
            for (D district : votes.keySet()) {
                if (broken.size() < tie.getValue() && tie.getKey().contains(district)) {
                    broken.add(district);
                }
            }
            log.trace("{} seats of {} tied among {}, given to {}", tie.getValue(), party, tie.getKey(), broken);
            distribution = distribution.breakTie(tie.getKey(), broken);
        }
        return distribution.seats();
    }
}
