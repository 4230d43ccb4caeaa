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

import java.util.List;

public interface PeakMatcher {
  /**
   * Matches detected peaks against a reference catalog.
   * @param detected Detected peaks, in any order.
   * @param catalog The reference peaks to match against.
   * @param tolerance Maximum angular distance, in degrees, between a detected peak and its reference peak.
   * @return The matches plus whatever remained unmatched on either side.
   * @throws InvalidToleranceException If the tolerance is null, not a number, zero or negative.
   * @throws NoReferenceDataException If the catalog is empty.
   */
  MatchSet match(List<DetectedPeak> detected, ReferenceCatalog catalog, Double tolerance)
      throws NoReferenceDataException;

  MatchPolicy getPolicy();
}
