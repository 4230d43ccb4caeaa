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

import java.util.Objects;

/**
 * How many matched peaks one phase accounts for, and what share of all matched peaks that is.
 */
public class PhaseStatistics {
  @JsonProperty("phase_id")
  private String phaseId;

  @JsonProperty("count")
  private Integer count;

  @JsonProperty("percentage")
  private Double percentage;

  public PhaseStatistics(String phaseId, Integer count, Double percentage) {
    this.phaseId = phaseId;
    this.count = count;
    this.percentage = percentage;
  }

  public String getPhaseId() {
    return phaseId;
  }

  public Integer getCount() {
    return count;
  }

  public Double getPercentage() {
    return percentage;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PhaseStatistics that = (PhaseStatistics) o;
    return Objects.equals(phaseId, that.phaseId) &&
        Objects.equals(count, that.count) &&
        Objects.equals(percentage, that.percentage);
  }

  @Override
  public int hashCode() {
    return Objects.hash(phaseId, count, percentage);
  }

  @Override
  public String toString() {
    return String.format("%s: %d (%.1f%%)", phaseId, count, percentage);
  }
}
