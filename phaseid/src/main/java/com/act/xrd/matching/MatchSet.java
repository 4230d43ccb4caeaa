/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.act.xrd.matching;

import com.act.xrd.peaks.DetectedPeak;
import com.act.xrd.reference.ReferencePeak;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of one matching run: the matches, the detected peaks that were not identified and the reference peaks
 * that were never matched.  Both unmatched lists are filled whichever policy produced the set.
 */
public class MatchSet {
  @JsonProperty("policy")
  private MatchPolicy policy;

  @JsonProperty("tolerance")
  private Double tolerance;

  @JsonProperty("matches")
  private List<Match> matches;

  @JsonProperty("unmatched_detected")
  private List<DetectedPeak> unmatchedDetected;

  @JsonProperty("unmatched_reference")
  private List<ReferencePeak> unmatchedReference;

  public MatchSet(MatchPolicy policy, Double tolerance, List<Match> matches, List<DetectedPeak> unmatchedDetected,
                  List<ReferencePeak> unmatchedReference) {
    this.policy = policy;
    this.tolerance = tolerance;
    this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
    this.unmatchedDetected = Collections.unmodifiableList(new ArrayList<>(unmatchedDetected));
    this.unmatchedReference = Collections.unmodifiableList(new ArrayList<>(unmatchedReference));
  }

  public MatchPolicy getPolicy() {
    return policy;
  }

  public Double getTolerance() {
    return tolerance;
  }

  public List<Match> getMatches() {
    return matches;
  }

  public List<DetectedPeak> getUnmatchedDetected() {
    return unmatchedDetected;
  }

  public List<ReferencePeak> getUnmatchedReference() {
    return unmatchedReference;
  }

  /**
   * @return The matches of one phase, in the order they were made.
   */
  public List<Match> getMatchesForPhase(String phaseId) {
    List<Match> phaseMatches = new ArrayList<>();
    for (Match m : matches) {
      if (m.getReference().getPhaseId().equals(phaseId)) {
        phaseMatches.add(m);
      }
    }
    return phaseMatches;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    MatchSet matchSet = (MatchSet) o;
    return policy == matchSet.policy &&
        Objects.equals(tolerance, matchSet.tolerance) &&
        Objects.equals(matches, matchSet.matches) &&
        Objects.equals(unmatchedDetected, matchSet.unmatchedDetected) &&
        Objects.equals(unmatchedReference, matchSet.unmatchedReference);
  }

  @Override
  public int hashCode() {
    return Objects.hash(policy, tolerance, matches, unmatchedDetected, unmatchedReference);
  }
}
