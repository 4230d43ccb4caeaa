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

package com.act.xrd.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary counts for one matching run.  Phases are listed by descending match count.
 */
public class MatchReport {
  @JsonProperty("total_peaks")
  private Integer totalPeaks;

  @JsonProperty("matched_peaks")
  private Integer matchedPeaks;

  @JsonProperty("match_rate")
  private Double matchRate;

  @JsonProperty("phases")
  private List<PhaseStatistics> phases;

  public MatchReport(Integer totalPeaks, Integer matchedPeaks, Double matchRate, List<PhaseStatistics> phases) {
    this.totalPeaks = totalPeaks;
    this.matchedPeaks = matchedPeaks;
    this.matchRate = matchRate;
    this.phases = Collections.unmodifiableList(new ArrayList<>(phases));
  }

  public Integer getTotalPeaks() {
    return totalPeaks;
  }

  public Integer getMatchedPeaks() {
    return matchedPeaks;
  }

  /**
   * @return Matched peaks as a percentage of all detected peaks; 0 when nothing was detected.
   */
  public Double getMatchRate() {
    return matchRate;
  }

  public List<PhaseStatistics> getPhases() {
    return phases;
  }
}
