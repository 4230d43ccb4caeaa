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

package com.act.xrd;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One (2-theta, intensity) reading of a diffraction curve.
 */
public class DiffractionPoint implements Serializable {
  private static final long serialVersionUID = 4207619376215089115L;

  @JsonProperty("two_theta")
  private Double angle;

  @JsonProperty("intensity")
  private Double intensity;

  public DiffractionPoint(Double angle, Double intensity) {
    this.angle = angle;
    this.intensity = intensity;
  }

  // For deserialization.
  protected DiffractionPoint() {}

  public Double getAngle() {
    return angle;
  }

  public Double getIntensity() {
    return intensity;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DiffractionPoint that = (DiffractionPoint) o;
    return Objects.equals(angle, that.angle) && Objects.equals(intensity, that.intensity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(angle, intensity);
  }

  @Override
  public String toString() {
    return String.format("(%.4f, %.2f)", angle, intensity);
  }
}
