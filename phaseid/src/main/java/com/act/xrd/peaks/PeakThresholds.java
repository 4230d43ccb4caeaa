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

package com.act.xrd.peaks;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The thresholds a peak search actually runs with.  Height and prominence are in intensity units; distance and width
 * are in samples.
 */
public class PeakThresholds {
  @JsonProperty("height")
  private Double height;

  @JsonProperty("distance")
  private Integer distance;

  @JsonProperty("prominence")
  private Double prominence;

  @JsonProperty("width")
  private Double width;

  public PeakThresholds(Double height, Integer distance, Double prominence, Double width) {
    this.height = height;
    this.distance = distance;
    this.prominence = prominence;
    this.width = width;
  }

  public Double getHeight() {
    return height;
  }

  public Integer getDistance() {
    return distance;
  }

  public Double getProminence() {
    return prominence;
  }

  public Double getWidth() {
    return width;
  }

  @Override
  public String toString() {
    return String.format("height >= %.2f, distance >= %d, prominence >= %.2f, width >= %.2f",
        height, distance, prominence, width);
  }
}
