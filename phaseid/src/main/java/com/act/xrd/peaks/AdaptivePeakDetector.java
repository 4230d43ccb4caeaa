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

import com.act.xrd.AnalysisParameters;
import com.act.xrd.Sample;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects peaks in a cleaned sample using height and prominence thresholds relaxed toward the sample's own intensity
 * profile.  Thresholds are never raised above the configured values, only lowered when the data's scale calls for it.
 */
public class AdaptivePeakDetector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AdaptivePeakDetector.class);

  // Empirical constants carried over from the bench software; tunable, not derived.
  public static final Double HEIGHT_SIGMA_MULTIPLIER = 2.0;
  public static final Double HEIGHT_FRACTION_OF_MAX = 0.05;
  public static final Double PROMINENCE_FRACTION_OF_MAX = 0.02;

  private final PeakFinder peakFinder;

  public AdaptivePeakDetector() {
    this(new PeakFinder());
  }

  public AdaptivePeakDetector(PeakFinder peakFinder) {
    this.peakFinder = peakFinder;
  }

  /**
   * Computes the thresholds a detection run over this sample will use.
   *
   * With mean m, population standard deviation s and maximum M of the intensities, the effective height is
   * min(nominal height, max(m + 2s, 0.05 M)) and the effective prominence is min(nominal prominence, max(s, 0.02 M)).
   * Distance and width are used as configured.  A sample whose maximum intensity is not positive gets the nominal
   * thresholds unchanged.
   *
   * @param sample The cleaned sample.
   * @param params Nominal thresholds.
   * @return The effective thresholds.
   */
  public PeakThresholds computeThresholds(Sample sample, AnalysisParameters params) {
    Double nominalHeight = valueOrDefault(params.getPeakHeight(), AnalysisParameters.DEFAULT_PEAK_HEIGHT);
    Integer distance = params.getPeakDistance() == null ?
        AnalysisParameters.DEFAULT_PEAK_DISTANCE : params.getPeakDistance();
    Double nominalProminence = valueOrDefault(params.getPeakProminence(), AnalysisParameters.DEFAULT_PEAK_PROMINENCE);
    Double width = valueOrDefault(params.getPeakWidth(), AnalysisParameters.DEFAULT_PEAK_WIDTH);

    double[] intensities = sample.getIntensities();
    if (intensities.length == 0) {
      return new PeakThresholds(nominalHeight, distance, nominalProminence, width);
    }

    double max = StatUtils.max(intensities);
    if (max <= 0.0) {
      LOGGER.warn("Maximum intensity is %.2f, keeping nominal peak thresholds", max);
      return new PeakThresholds(nominalHeight, distance, nominalProminence, width);
    }

    double mean = StatUtils.mean(intensities);
    // Population (biased) standard deviation.
    double sigma = new StandardDeviation(false).evaluate(intensities, mean);

    double adaptiveHeight = Math.max(mean + HEIGHT_SIGMA_MULTIPLIER * sigma, HEIGHT_FRACTION_OF_MAX * max);
    double adaptiveProminence = Math.max(sigma, PROMINENCE_FRACTION_OF_MAX * max);
    LOGGER.debug("Intensity mean %.2f, std %.2f, max %.2f", mean, sigma, max);

    return new PeakThresholds(Math.min(nominalHeight, adaptiveHeight), distance,
        Math.min(nominalProminence, adaptiveProminence), width);
  }

  /**
   * Finds the peaks of a cleaned sample.
   * @param sample The cleaned sample.
   * @param params Nominal detection parameters.
   * @return Detected peaks in ascending angle order; possibly empty.
   */
  public List<DetectedPeak> detect(Sample sample, AnalysisParameters params) {
    return detect(sample, computeThresholds(sample, params));
  }

  /**
   * Finds the peaks of a cleaned sample using already computed thresholds.
   */
  public List<DetectedPeak> detect(Sample sample, PeakThresholds thresholds) {
    LOGGER.info("Effective peak thresholds: %s", thresholds);

    List<Integer> indices = peakFinder.findPeaks(sample.getIntensities(), thresholds);
    List<DetectedPeak> peaks = new ArrayList<>(indices.size());
    for (Integer i : indices) {
      peaks.add(new DetectedPeak(sample.get(i).getAngle(), sample.get(i).getIntensity(), i));
    }
    LOGGER.info("Detected %d peaks", peaks.size());
    return peaks;
  }

  private static Double valueOrDefault(Double value, Double defaultValue) {
    return value == null ? defaultValue : value;
  }
}
