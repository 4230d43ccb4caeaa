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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A cleaned diffraction curve: angles strictly increasing inside (0, 180), intensities non-negative.  Instances are
 * immutable once built.
 */
public class Sample {
  public static final Double MIN_ANGLE_EXCLUSIVE = 0.0;
  public static final Double MAX_ANGLE_EXCLUSIVE = 180.0;

  @JsonProperty("points")
  private final List<DiffractionPoint> points;

  public Sample(List<DiffractionPoint> points) {
    List<DiffractionPoint> copy = new ArrayList<>(points);
    Double previousAngle = null;
    for (int i = 0; i < copy.size(); i++) {
      DiffractionPoint p = copy.get(i);
      if (p.getAngle() == null || p.getIntensity() == null) {
        throw new IllegalArgumentException(String.format("Missing value at position %d", i));
      }
      if (!(p.getAngle() > MIN_ANGLE_EXCLUSIVE && p.getAngle() < MAX_ANGLE_EXCLUSIVE)) {
        throw new IllegalArgumentException(String.format("Angle %f at position %d is outside (0, 180)",
            p.getAngle(), i));
      }
      if (!(p.getIntensity() >= 0.0)) {
        throw new IllegalArgumentException(String.format("Intensity %f at position %d is negative",
            p.getIntensity(), i));
      }
      if (previousAngle != null && p.getAngle() <= previousAngle) {
        throw new IllegalArgumentException(String.format("Angles not strictly increasing at position %d: %f <= %f",
            i, p.getAngle(), previousAngle));
      }
      previousAngle = p.getAngle();
    }
    this.points = Collections.unmodifiableList(copy);
  }

  public List<DiffractionPoint> getPoints() {
    return points;
  }

  public DiffractionPoint get(int index) {
    return points.get(index);
  }

  public int size() {
    return points.size();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return points.isEmpty();
  }

  @JsonIgnore
  public double[] getAngles() {
    double[] angles = new double[points.size()];
    for (int i = 0; i < angles.length; i++) {
      angles[i] = points.get(i).getAngle();
    }
    return angles;
  }

  @JsonIgnore
  public double[] getIntensities() {
    double[] intensities = new double[points.size()];
    for (int i = 0; i < intensities.length; i++) {
      intensities[i] = points.get(i).getIntensity();
    }
    return intensities;
  }

  @JsonIgnore
  public Double getMinAngle() {
    return points.isEmpty() ? null : points.get(0).getAngle();
  }

  @JsonIgnore
  public Double getMaxAngle() {
    return points.isEmpty() ? null : points.get(points.size() - 1).getAngle();
  }
}
