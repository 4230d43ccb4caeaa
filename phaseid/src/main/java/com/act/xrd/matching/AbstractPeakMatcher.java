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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input checks and bookkeeping shared by the matching policies.  Subclasses only decide which pairs match.
 */
public abstract class AbstractPeakMatcher implements PeakMatcher {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AbstractPeakMatcher.class);

  @Override
  public MatchSet match(List<DetectedPeak> detected, ReferenceCatalog catalog, Double tolerance)
      throws NoReferenceDataException {
    // Tolerance is checked before anything else is looked at.
    if (tolerance == null || tolerance.isNaN() || tolerance <= 0.0) {
      throw new InvalidToleranceException(tolerance);
    }
    if (catalog == null || catalog.isEmpty()) {
      throw new NoReferenceDataException("The reference catalog is empty, no phase identification is available");
    }

    List<Match> matches = assign(detected, catalog, tolerance);

    Map<DetectedPeak, Boolean> matchedDetected = new IdentityHashMap<>();
    Map<ReferencePeak, Boolean> matchedReference = new IdentityHashMap<>();
    for (Match m : matches) {
      matchedDetected.put(m.getDetected(), true);
      matchedReference.put(m.getReference(), true);
    }

    List<DetectedPeak> unmatchedDetected = new ArrayList<>();
    for (DetectedPeak peak : detected) {
      if (!matchedDetected.containsKey(peak)) {
        unmatchedDetected.add(peak);
      }
    }
    List<ReferencePeak> unmatchedReference = new ArrayList<>();
    for (ReferencePeak peak : catalog.getPeaks()) {
      if (!matchedReference.containsKey(peak)) {
        unmatchedReference.add(peak);
      }
    }

    LOGGER.info("%s matching with tolerance %.3f: %d of %d detected peaks matched, %d of %d reference peaks unmatched",
        getPolicy().getConfigName(), tolerance, detected.size() - unmatchedDetected.size(), detected.size(),
        unmatchedReference.size(), catalog.size());
    return new MatchSet(getPolicy(), tolerance, matches, unmatchedDetected, unmatchedReference);
  }

  /**
   * Chooses the matching pairs.  Arguments have already been validated.
   */
  protected abstract List<Match> assign(List<DetectedPeak> detected, ReferenceCatalog catalog, Double tolerance);

  protected static boolean withinTolerance(DetectedPeak detected, ReferencePeak reference, Double tolerance) {
    return Math.abs(detected.getAngle() - reference.getAngle()) <= tolerance;
  }
}
