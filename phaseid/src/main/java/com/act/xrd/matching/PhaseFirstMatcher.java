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
import com.act.xrd.reference.ReferenceCatalog;
import com.act.xrd.reference.ReferencePeak;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks phases in catalog order and, for each reference peak, claims the most intense unclaimed detected peak within
 * tolerance.  Among equally intense candidates the one earliest in the input wins.  Claimed peaks are unavailable to
 * every later reference peak, of any phase.
 */
public class PhaseFirstMatcher extends AbstractPeakMatcher {

  @Override
  public MatchPolicy getPolicy() {
    return MatchPolicy.PHASE_FIRST;
  }

  @Override
  protected List<Match> assign(List<DetectedPeak> detected, ReferenceCatalog catalog, Double tolerance) {
    List<DetectedPeak> byIntensity = new ArrayList<>(detected);
    // Stable, so ties keep input order.
    byIntensity.sort(Comparator.comparing(DetectedPeak::getIntensity).reversed());

    Map<DetectedPeak, Boolean> used = new IdentityHashMap<>();
    List<Match> matches = new ArrayList<>();

    for (Map.Entry<String, List<ReferencePeak>> phase : catalog.getPeaksByPhase().entrySet()) {
      for (ReferencePeak reference : phase.getValue()) {
        DetectedPeak best = null;
        for (DetectedPeak candidate : byIntensity) {
          if (used.containsKey(candidate) || !withinTolerance(candidate, reference, tolerance)) {
            continue;
          }
          if (best == null || candidate.getIntensity() > best.getIntensity()) {
            best = candidate;
          }
        }
        if (best != null) {
          used.put(best, true);
          matches.add(new Match(best, reference, tolerance));
        }
      }
    }
    return matches;
  }
}
