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

package com.act.xrd.reference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered collection of reference peaks from one or more phases.  Phases are iterated in the order their first
 * peak was added; a phase's peaks keep the order they were added in.
 */
public class ReferenceCatalog {
  @JsonProperty("peaks")
  private List<ReferencePeak> peaks;

  public ReferenceCatalog(List<ReferencePeak> peaks) {
    this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
  }

  public static ReferenceCatalog empty() {
    return new ReferenceCatalog(Collections.emptyList());
  }

  public List<ReferencePeak> getPeaks() {
    return peaks;
  }

  @JsonIgnore
  public Set<String> getPhaseIds() {
    Set<String> phaseIds = new LinkedHashSet<>();
    for (ReferencePeak peak : peaks) {
      phaseIds.add(peak.getPhaseId());
    }
    return phaseIds;
  }

  /**
   * @return Each phase's peaks, keyed by phase id in catalog order.
   */
  @JsonIgnore
  public Map<String, List<ReferencePeak>> getPeaksByPhase() {
    Map<String, List<ReferencePeak>> byPhase = new LinkedHashMap<>();
    for (ReferencePeak peak : peaks) {
      byPhase.computeIfAbsent(peak.getPhaseId(), k -> new ArrayList<>()).add(peak);
    }
    return byPhase;
  }

  public List<ReferencePeak> getPeaksForPhase(String phaseId) {
    List<ReferencePeak> phasePeaks = new ArrayList<>();
    for (ReferencePeak peak : peaks) {
      if (peak.getPhaseId().equals(phaseId)) {
        phasePeaks.add(peak);
      }
    }
    return phasePeaks;
  }

  /**
   * @return The symbol of the phase's first peak, or null if the phase is not in this catalog.
   */
  public String getSymbolForPhase(String phaseId) {
    for (ReferencePeak peak : peaks) {
      if (peak.getPhaseId().equals(phaseId)) {
        return peak.getSymbol();
      }
    }
    return null;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return peaks.isEmpty();
  }

  public int size() {
    return peaks.size();
  }

  /**
   * Concatenates two catalogs, this one first.
   */
  public ReferenceCatalog merge(ReferenceCatalog other) {
    List<ReferencePeak> merged = new ArrayList<>(peaks);
    merged.addAll(other.getPeaks());
    return new ReferenceCatalog(merged);
  }
}
