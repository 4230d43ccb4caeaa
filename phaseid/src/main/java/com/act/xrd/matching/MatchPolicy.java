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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How detected peaks are assigned to reference peaks.
 */
public enum MatchPolicy {
  /**
   * Phases in catalog order claim, for each of their reference peaks, the strongest unclaimed detected peak in
   * tolerance.  A detected peak is matched at most once.
   */
  @JsonProperty("phase_first")
  PHASE_FIRST("phase_first") {
    @Override
    public PeakMatcher newMatcher() {
      return new PhaseFirstMatcher();
    }
  },

  /**
   * Every detected peak takes its closest reference peak in tolerance.  A reference peak may be matched many times.
   */
  @JsonProperty("peak_first")
  PEAK_FIRST("peak_first") {
    @Override
    public PeakMatcher newMatcher() {
      return new PeakFirstMatcher();
    }
  };

  private final String configName;

  MatchPolicy(String configName) {
    this.configName = configName;
  }

  public String getConfigName() {
    return configName;
  }

  public abstract PeakMatcher newMatcher();

  /**
   * Looks up a policy by its configuration name, accepting either case and either '_' or '-'.
   * @throws IllegalArgumentException If no policy has that name.
   */
  public static MatchPolicy fromName(String name) {
    String normalized = name.trim().replace('-', '_');
    for (MatchPolicy policy : values()) {
      if (policy.configName.equalsIgnoreCase(normalized)) {
        return policy;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown match policy '%s', expected one of %s or %s",
        name, PHASE_FIRST.configName, PEAK_FIRST.configName));
  }
}
