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

package com.act.xrd.processing;

import com.act.xrd.AnalysisParameters;
import com.act.xrd.DiffractionPoint;
import com.act.xrd.Sample;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns raw (angle, intensity) rows into a canonical {@link Sample}.
 *
 * Steps, in order: drop rows with missing values; drop rows with an angle outside (0, 180) or a negative intensity;
 * when parameters are supplied, keep only rows inside [angle_min, angle_max] with intensity at or above
 * intensity_threshold and optionally smooth the intensities; finally sort by angle and drop repeated angles.
 */
public class SeriesCleaner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SeriesCleaner.class);

  public static final Integer MIN_VALID_POINTS = 100;
  public static final Integer MAX_POLYNOMIAL_ORDER = 3;

  /**
   * Cleans a raw table without any user-configured filtering or smoothing.
   */
  public Sample clean(List<Pair<Double, Double>> raw) throws DataInsufficientException {
    return clean(raw, null);
  }

  /**
   * @param raw Raw rows; values may be null.
   * @param params Optional parameters supplying the angle window, intensity threshold and smoothing window.
   * @return The cleaned sample.
   * @throws DataInsufficientException If fewer than {@link #MIN_VALID_POINTS} rows remain.
   */
  public Sample clean(List<Pair<Double, Double>> raw, AnalysisParameters params) throws DataInsufficientException {
    List<DiffractionPoint> points = new ArrayList<>(raw.size());
    int missing = 0, outOfRange = 0;
    for (Pair<Double, Double> row : raw) {
      Double angle = row.getLeft();
      Double intensity = row.getRight();
      if (angle == null || intensity == null || angle.isNaN() || intensity.isNaN()) {
        missing++;
        continue;
      }
      if (!isPhysical(angle, intensity)) {
        outOfRange++;
        continue;
      }
      points.add(new DiffractionPoint(angle, intensity));
    }
    LOGGER.debug("Dropped %d rows with missing values and %d rows outside the physical range", missing, outOfRange);

    if (params != null) {
      points = applyWindow(points, params);
      points = applySmoothing(points, params.getSmoothWindow());
    }

    points = sortAndDeduplicate(points);

    if (points.size() < MIN_VALID_POINTS) {
      throw new DataInsufficientException(points.size(), MIN_VALID_POINTS);
    }

    Sample sample = new Sample(points);
    LOGGER.info("Cleaned sample has %d points, 2-theta range %.2f - %.2f", sample.size(),
        sample.getMinAngle(), sample.getMaxAngle());
    return sample;
  }

  public static boolean isPhysical(Double angle, Double intensity) {
    return angle > Sample.MIN_ANGLE_EXCLUSIVE && angle < Sample.MAX_ANGLE_EXCLUSIVE && intensity >= 0.0;
  }

  private List<DiffractionPoint> applyWindow(List<DiffractionPoint> points, AnalysisParameters params) {
    Double angleMin = params.getAngleMin() == null ? AnalysisParameters.DEFAULT_ANGLE_MIN : params.getAngleMin();
    Double angleMax = params.getAngleMax() == null ? AnalysisParameters.DEFAULT_ANGLE_MAX : params.getAngleMax();
    Double threshold = params.getIntensityThreshold() == null ?
        AnalysisParameters.DEFAULT_INTENSITY_THRESHOLD : params.getIntensityThreshold();

    List<DiffractionPoint> windowed = new ArrayList<>(points.size());
    for (DiffractionPoint p : points) {
      if (p.getAngle() >= angleMin && p.getAngle() <= angleMax && p.getIntensity() >= threshold) {
        windowed.add(p);
      }
    }
    return windowed;
  }

  /**
   * Smooths intensities with a Savitzky-Golay filter.  Even windows are widened by one; smoothing is skipped unless
   * there are more points than the window is long.  Smoothed values below zero are clamped to zero.  A failure while
   * smoothing is logged and the unsmoothed points are kept.
   */
  List<DiffractionPoint> applySmoothing(List<DiffractionPoint> points, Integer requestedWindow) {
    if (requestedWindow == null || requestedWindow <= 1) {
      return points;
    }
    int window = requestedWindow % 2 == 0 ? requestedWindow + 1 : requestedWindow;
    if (points.size() <= window) {
      LOGGER.warn("Not smoothing: %d points is not more than the smoothing window of %d", points.size(), window);
      return points;
    }

    try {
      SavitzkyGolayFilter filter = new SavitzkyGolayFilter(window, Math.min(MAX_POLYNOMIAL_ORDER, window - 1));
      double[] intensities = new double[points.size()];
      for (int i = 0; i < intensities.length; i++) {
        intensities[i] = points.get(i).getIntensity();
      }
      double[] smoothed = filter.smooth(intensities);

      List<DiffractionPoint> result = new ArrayList<>(points.size());
      for (int i = 0; i < smoothed.length; i++) {
        result.add(new DiffractionPoint(points.get(i).getAngle(), Math.max(0.0, smoothed[i])));
      }
      LOGGER.info("Smoothed %d points with window %d, polynomial order %d", result.size(),
          filter.getWindowLength(), filter.getPolynomialOrder());
      return result;
    } catch (RuntimeException e) {
      LOGGER.warn("Smoothing failed, using unsmoothed data: %s", e.getMessage());
      return points;
    }
  }

  /**
   * Stable sort on angle, keeping only the first row seen for any angle.
   */
  private List<DiffractionPoint> sortAndDeduplicate(List<DiffractionPoint> points) {
    List<DiffractionPoint> sorted = new ArrayList<>(points);
    sorted.sort(Comparator.comparing(DiffractionPoint::getAngle));

    List<DiffractionPoint> unique = new ArrayList<>(sorted.size());
    Double lastAngle = null;
    for (DiffractionPoint p : sorted) {
      if (lastAngle != null && p.getAngle().equals(lastAngle)) {
        continue;
      }
      unique.add(p);
      lastAngle = p.getAngle();
    }
    if (unique.size() < sorted.size()) {
      LOGGER.warn("Dropped %d rows with repeated 2-theta values", sorted.size() - unique.size());
    }
    return unique;
  }
}
