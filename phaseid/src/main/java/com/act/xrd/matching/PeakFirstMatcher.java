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
import java.util.List;

/**
 * Matches each detected peak to the catalog entry with the smallest angular distance within tolerance.  Equal
 * distances go to the more intense reference peak, then to the one earlier in the catalog.  Reference peaks are not
 * claimed, so several detected peaks can share one.
 */
public class PeakFirstMatcher extends AbstractPeakMatcher {

  @Override
  public MatchPolicy getPolicy() {
    return MatchPolicy.PEAK_FIRST;
  }

  @Override
  protected List<Match> assign(List<DetectedPeak> detected, ReferenceCatalog catalog, Double tolerance) {
    List<Match> matches = new ArrayList<>();
    for (DetectedPeak peak : detected) {
      ReferencePeak best = null;
      double bestDelta = Double.POSITIVE_INFINITY;
      for (ReferencePeak reference : catalog.getPeaks()) {
        if (!withinTolerance(peak, reference, tolerance)) {
          continue;
        }
        double delta = Math.abs(peak.getAngle() - reference.getAngle());
        if (best == null || delta < bestDelta ||
            (delta == bestDelta && reference.getIntensity() > best.getIntensity())) {
          best = reference;
          bestDelta = delta;
        }
      }
      if (best != null) {
        matches.add(new Match(peak, best, tolerance));
      }
    }
    return matches;
  }
}
