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

import com.act.xrd.matching.MatchSet;
import com.act.xrd.peaks.DetectedPeak;
import com.act.xrd.peaks.PeakThresholds;
import com.act.xrd.report.MatchReport;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one analysis run produced.  When no reference data was usable the match set and report are null and
 * {@link #isPhaseIdentificationAvailable()} is false; the detection results are still complete.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {
  @JsonIgnore
  private Sample sample;

  @JsonProperty("sample_points")
  private Integer samplePoints;

  @JsonProperty("min_two_theta")
  private Double minAngle;

  @JsonProperty("max_two_theta")
  private Double maxAngle;

  @JsonProperty("thresholds")
  private PeakThresholds thresholds;

  @JsonProperty("detected_peaks")
  private List<DetectedPeak> detectedPeaks;

  @JsonProperty("phase_identification_available")
  private Boolean phaseIdentificationAvailable;

  @JsonProperty("unavailable_reason")
  private String unavailableReason;

  @JsonProperty("match_set")
  private MatchSet matchSet;

  @JsonProperty("report")
  private MatchReport report;

  private AnalysisResult(Sample sample, PeakThresholds thresholds, List<DetectedPeak> detectedPeaks) {
    this.sample = sample;
    this.samplePoints = sample.size();
    this.minAngle = sample.getMinAngle();
    this.maxAngle = sample.getMaxAngle();
    this.thresholds = thresholds;
    this.detectedPeaks = Collections.unmodifiableList(new ArrayList<>(detectedPeaks));
  }

  public static AnalysisResult withMatches(Sample sample, PeakThresholds thresholds, List<DetectedPeak> detectedPeaks,
                                           MatchSet matchSet, MatchReport report) {
    AnalysisResult result = new AnalysisResult(sample, thresholds, detectedPeaks);
    result.phaseIdentificationAvailable = true;
    result.matchSet = matchSet;
    result.report = report;
    return result;
  }

  public static AnalysisResult detectionOnly(Sample sample, PeakThresholds thresholds,
                                             List<DetectedPeak> detectedPeaks, String reason) {
    AnalysisResult result = new AnalysisResult(sample, thresholds, detectedPeaks);
    result.phaseIdentificationAvailable = false;
    result.unavailableReason = reason;
    return result;
  }

  public Sample getSample() {
    return sample;
  }

  public PeakThresholds getThresholds() {
    return thresholds;
  }

  public List<DetectedPeak> getDetectedPeaks() {
    return detectedPeaks;
  }

  public boolean isPhaseIdentificationAvailable() {
    return phaseIdentificationAvailable;
  }

  public String getUnavailableReason() {
    return unavailableReason;
  }

  public MatchSet getMatchSet() {
    return matchSet;
  }

  public MatchReport getReport() {
    return report;
  }
}
