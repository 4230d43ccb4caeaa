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
import com.act.xrd.reference.ReferencePeak;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A detected peak identified as a reference peak.  Quality is 1 at an exact overlap and falls linearly to 0 at the
 * tolerance.
 */
public class Match {
  @JsonProperty("detected")
  private DetectedPeak detected;

  @JsonProperty("reference")
  private ReferencePeak reference;

  @JsonProperty("angle_delta")
  private Double angleDelta;

  @JsonProperty("quality")
  private Double quality;

  public Match(DetectedPeak detected, ReferencePeak reference, Double tolerance) {
    this.detected = detected;
    this.reference = reference;
    this.angleDelta = Math.abs(detected.getAngle() - reference.getAngle());
    this.quality = 1.0 - angleDelta / tolerance;
  }

  public DetectedPeak getDetected() {
    return detected;
  }

  public ReferencePeak getReference() {
    return reference;
  }

  public Double getAngleDelta() {
    return angleDelta;
  }

  public Double getQuality() {
    return quality;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Match match = (Match) o;
    return Objects.equals(detected, match.detected) &&
        Objects.equals(reference, match.reference) &&
        Objects.equals(angleDelta, match.angleDelta) &&
        Objects.equals(quality, match.quality);
  }

  @Override
  public int hashCode() {
    return Objects.hash(detected, reference, angleDelta, quality);
  }

  @Override
  public String toString() {
    return String.format("Match{%.4f -> %s %.4f, delta=%.4f, quality=%.3f}", detected.getAngle(),
        reference.getPhaseId(), reference.getAngle(), angleDelta, quality);
  }
}
