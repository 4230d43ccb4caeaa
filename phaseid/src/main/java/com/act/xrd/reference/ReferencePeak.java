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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One expected peak of a reference phase: its 2-theta, relative intensity, owning phase and display symbol.
 */
public class ReferencePeak {
  @JsonProperty("two_theta")
  private Double angle;

  @JsonProperty("intensity")
  private Double intensity;

  @JsonProperty("phase_id")
  private String phaseId;

  @JsonProperty("symbol")
  private String symbol;

  public ReferencePeak(Double angle, Double intensity, String phaseId, String symbol) {
    this.angle = angle;
    this.intensity = intensity;
    this.phaseId = phaseId;
    this.symbol = symbol;
  }

  protected ReferencePeak() {}

  public Double getAngle() {
    return angle;
  }

  public Double getIntensity() {
    return intensity;
  }

  public String getPhaseId() {
    return phaseId;
  }

  public String getSymbol() {
    return symbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ReferencePeak that = (ReferencePeak) o;
    return Objects.equals(angle, that.angle) &&
        Objects.equals(intensity, that.intensity) &&
        Objects.equals(phaseId, that.phaseId) &&
        Objects.equals(symbol, that.symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(angle, intensity, phaseId, symbol);
  }

  @Override
  public String toString() {
    return String.format("ReferencePeak{2theta=%.4f, intensity=%.1f, phase=%s, symbol=%s}",
        angle, intensity, phaseId, symbol);
  }
}
