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

import com.act.xrd.matching.MatchPolicy;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable parameters for a single analysis run.  Key names follow the JSON configuration files written by the
 * configuration editor; any key missing from a file keeps its default value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisParameters {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final Double DEFAULT_PEAK_HEIGHT = 100.0;
  public static final Integer DEFAULT_PEAK_DISTANCE = 15;
  public static final Double DEFAULT_PEAK_PROMINENCE = 50.0;
  public static final Double DEFAULT_PEAK_WIDTH = 2.0;
  public static final Double DEFAULT_MATCH_TOLERANCE = 0.2;
  public static final Double DEFAULT_ANGLE_MIN = 0.0;
  public static final Double DEFAULT_ANGLE_MAX = 180.0;
  public static final Double DEFAULT_INTENSITY_THRESHOLD = 0.0;
  public static final Integer DEFAULT_SMOOTH_WINDOW = 1;

  @JsonProperty("peak_height")
  private Double peakHeight = DEFAULT_PEAK_HEIGHT;

  @JsonProperty("peak_distance")
  private Integer peakDistance = DEFAULT_PEAK_DISTANCE;

  @JsonProperty("peak_prominence")
  private Double peakProminence = DEFAULT_PEAK_PROMINENCE;

  @JsonProperty("peak_width")
  private Double peakWidth = DEFAULT_PEAK_WIDTH;

  @JsonProperty("match_tolerance")
  private Double matchTolerance = DEFAULT_MATCH_TOLERANCE;

  @JsonProperty("angle_min")
  private Double angleMin = DEFAULT_ANGLE_MIN;

  @JsonProperty("angle_max")
  private Double angleMax = DEFAULT_ANGLE_MAX;

  @JsonProperty("intensity_threshold")
  private Double intensityThreshold = DEFAULT_INTENSITY_THRESHOLD;

  @JsonProperty("smooth_window")
  private Integer smoothWindow = DEFAULT_SMOOTH_WINDOW;

  @JsonProperty("match_policy")
  private MatchPolicy matchPolicy = MatchPolicy.PHASE_FIRST;

  public AnalysisParameters() {
  }

  public static AnalysisParameters fromJsonFile(File configFile) throws IOException {
    if (!configFile.exists() || configFile.isDirectory()) {
      throw new IOException(String.format("Configuration file %s does not exist or is a directory",
          configFile.getAbsolutePath()));
    }
    return OBJECT_MAPPER.readValue(configFile, AnalysisParameters.class);
  }

  /**
   * Checks every parameter against the ranges the configuration editor enforces.  Core stages never call this: an
   * out-of-range value reaching them is the caller's error.
   * @return A list of problems; empty if the parameters are usable.
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    checkRange(errors, "peak_height", peakHeight, 1.0, 10000.0);
    checkRange(errors, "peak_distance", peakDistance == null ? null : peakDistance.doubleValue(), 1.0, 200.0);
    checkRange(errors, "peak_prominence", peakProminence, 1.0, 5000.0);
    checkRange(errors, "peak_width", peakWidth, 0.1, 100.0);
    checkRange(errors, "match_tolerance", matchTolerance, 0.01, 5.0);
    checkRange(errors, "intensity_threshold", intensityThreshold, 0.0, 100000.0);
    checkRange(errors, "angle_min", angleMin, 0.0, 90.0);
    checkRange(errors, "angle_max", angleMax, 10.0, 180.0);
    checkRange(errors, "smooth_window", smoothWindow == null ? null : smoothWindow.doubleValue(), 1.0, 50.0);

    if (angleMin != null && angleMax != null && angleMin >= angleMax) {
      errors.add(String.format("angle_min (%.2f) must be less than angle_max (%.2f)", angleMin, angleMax));
    }
    if (matchPolicy == null) {
      errors.add("match_policy must be one of phase_first, peak_first");
    }
    return errors;
  }

  private static void checkRange(List<String> errors, String key, Double value, Double min, Double max) {
    if (value == null || value.isNaN() || value < min || value > max) {
      errors.add(String.format("%s should be between %s and %s, but was %s", key, min, max, value));
    }
  }

  public Double getPeakHeight() {
    return peakHeight;
  }

  public void setPeakHeight(Double peakHeight) {
    this.peakHeight = peakHeight;
  }

  public Integer getPeakDistance() {
    return peakDistance;
  }

  public void setPeakDistance(Integer peakDistance) {
    this.peakDistance = peakDistance;
  }

  public Double getPeakProminence() {
    return peakProminence;
  }

  public void setPeakProminence(Double peakProminence) {
    this.peakProminence = peakProminence;
  }

  public Double getPeakWidth() {
    return peakWidth;
  }

  public void setPeakWidth(Double peakWidth) {
    this.peakWidth = peakWidth;
  }

  public Double getMatchTolerance() {
    return matchTolerance;
  }

  public void setMatchTolerance(Double matchTolerance) {
    this.matchTolerance = matchTolerance;
  }

  public Double getAngleMin() {
    return angleMin;
  }

  public void setAngleMin(Double angleMin) {
    this.angleMin = angleMin;
  }

  public Double getAngleMax() {
    return angleMax;
  }

  public void setAngleMax(Double angleMax) {
    this.angleMax = angleMax;
  }

  public Double getIntensityThreshold() {
    return intensityThreshold;
  }

  public void setIntensityThreshold(Double intensityThreshold) {
    this.intensityThreshold = intensityThreshold;
  }

  public Integer getSmoothWindow() {
    return smoothWindow;
  }

  public void setSmoothWindow(Integer smoothWindow) {
    this.smoothWindow = smoothWindow;
  }

  public MatchPolicy getMatchPolicy() {
    return matchPolicy;
  }

  public void setMatchPolicy(MatchPolicy matchPolicy) {
    this.matchPolicy = matchPolicy;
  }
}
