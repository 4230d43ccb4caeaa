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

import java.util.Objects;

/**
 * A local maximum found in a sample: its 2-theta, intensity and position in the sample it came from.
 */
public class DetectedPeak {
  @JsonProperty("two_theta")
  private Double angle;

  @JsonProperty("intensity")
  private Double intensity;

  @JsonProperty("index")
  private Integer index;

  public DetectedPeak(Double angle, Double intensity, Integer index) {
    this.angle = angle;
    this.intensity = intensity;
    this.index = index;
  }

  protected DetectedPeak() {}

  public Double getAngle() {
    return angle;
  }

  public Double getIntensity() {
    return intensity;
  }

  public Integer getIndex() {
    return index;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DetectedPeak that = (DetectedPeak) o;
    return Objects.equals(angle, that.angle) &&
        Objects.equals(intensity, that.intensity) &&
        Objects.equals(index, that.index);
  }

  @Override
  public int hashCode() {
    return Objects.hash(angle, intensity, index);
  }

  @Override
  public String toString() {
    return String.format("DetectedPeak{2theta=%.4f, intensity=%.1f, index=%d}", angle, intensity, index);
  }
}
