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
import com.act.xrd.DiffractionPoint;
import com.act.xrd.Sample;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AdaptivePeakDetectorTest {

  private AdaptivePeakDetector detector;
  private AnalysisParameters defaults;

  @Before
  public void setUp() {
    detector = new AdaptivePeakDetector();
    defaults = new AnalysisParameters();
  }

  /**
   * 1000 evenly spaced points over [10, 70] degrees: a noisy baseline with one Gaussian bump at 30 degrees.
   */
  static Sample noisyBaselineWithBump(long seed) {
    Random random = new Random(seed);
    List<DiffractionPoint> points = new ArrayList<>(1000);
    for (int i = 0; i < 1000; i++) {
      double angle = 10.0 + i * 60.0 / 999.0;
      double bump = 500.0 * Math.exp(-Math.pow(angle - 30.0, 2) / (2 * 0.3 * 0.3));
      double intensity = 50.0 + 5.0 * random.nextGaussian() + bump;
      points.add(new DiffractionPoint(angle, Math.max(0.0, intensity)));
    }
    return new Sample(points);
  }

  private static Sample fromIntensities(double... intensities) {
    List<DiffractionPoint> points = new ArrayList<>(intensities.length);
    for (int i = 0; i < intensities.length; i++) {
      points.add(new DiffractionPoint(10.0 + i * 0.01, intensities[i]));
    }
    return new Sample(points);
  }

  @Test
  public void testSingleBumpOnNoisyBaseline() {
    Sample sample = noisyBaselineWithBump(42L);
    List<DetectedPeak> peaks = detector.detect(sample, defaults);
    assertEquals("Only the bump is a peak", 1, peaks.size());
    assertEquals("The peak sits at the bump", 30.0, peaks.get(0).getAngle(), 0.2);
  }

  @Test
  public void testPeaksRespectEffectiveHeightAndSampleRange() {
    for (long seed = 1; seed <= 5; seed++) {
      Sample sample = noisyBaselineWithBump(seed);
      PeakThresholds thresholds = detector.computeThresholds(sample, defaults);
      for (DetectedPeak peak : detector.detect(sample, thresholds)) {
        assertTrue("Intensity reaches the effective height", peak.getIntensity() >= thresholds.getHeight());
        assertTrue("Angle lies in the sample", peak.getAngle() >= sample.getMinAngle() &&
            peak.getAngle() <= sample.getMaxAngle());
        assertEquals("Index points back into the sample", peak.getAngle(),
            sample.get(peak.getIndex()).getAngle());
      }
    }
  }

  @Test
  public void testThresholdsRelaxOnLowDynamicRange() {
    double[] intensities = new double[200];
    for (int i = 0; i < intensities.length; i++) {
      intensities[i] = i % 2 == 0 ? 10.0 : 20.0;
    }
    PeakThresholds thresholds = detector.computeThresholds(fromIntensities(intensities), defaults);
    // mean 15, population std 5, max 20
    assertEquals("Height relaxes to mean + 2 std", 25.0, thresholds.getHeight(), 1e-9);
    assertEquals("Prominence relaxes to the std", 5.0, thresholds.getProminence(), 1e-9);
    assertEquals("Distance is used as configured", AnalysisParameters.DEFAULT_PEAK_DISTANCE,
        thresholds.getDistance());
    assertEquals("Width is used as configured", AnalysisParameters.DEFAULT_PEAK_WIDTH, thresholds.getWidth());
  }

  @Test
  public void testFractionOfMaximumFloorsThresholds() {
    double[] intensities = new double[200];
    intensities[100] = 1000.0;
    // mean 5, std ~70.5, max 1000: mean + 2 std ~146 beats 5% of max; std beats 2% of max.
    PeakThresholds thresholds = detector.computeThresholds(fromIntensities(intensities), defaults);
    assertEquals("Nominal height is lower than the adaptive one", 100.0, thresholds.getHeight(), 1e-9);
    assertEquals("Nominal prominence is lower than the adaptive one", 50.0, thresholds.getProminence(), 1e-9);

    AnalysisParameters permissive = new AnalysisParameters();
    permissive.setPeakHeight(10000.0);
    permissive.setPeakProminence(5000.0);
    // A lone spike in 5000 points: mean + 2 std is under 3% of max and std under 1.5% of max.
    double[] spike = new double[5000];
    spike[2500] = 1000.0;
    PeakThresholds spikeThresholds = detector.computeThresholds(fromIntensities(spike), permissive);
    assertEquals("5% of max wins over mean + 2 std", 50.0, spikeThresholds.getHeight(), 1e-9);
    assertEquals("2% of max wins over std", 20.0, spikeThresholds.getProminence(), 1e-9);
  }

  @Test
  public void testThresholdsNeverExceedNominal() {
    AnalysisParameters strict = new AnalysisParameters();
    strict.setPeakHeight(5.0);
    strict.setPeakProminence(1.0);
    PeakThresholds thresholds = detector.computeThresholds(noisyBaselineWithBump(7L), strict);
    assertEquals(5.0, thresholds.getHeight(), 1e-9);
    assertEquals(1.0, thresholds.getProminence(), 1e-9);
  }

  @Test
  public void testAllZeroSignalKeepsNominalThresholds() {
    PeakThresholds thresholds = detector.computeThresholds(fromIntensities(new double[150]), defaults);
    assertEquals(AnalysisParameters.DEFAULT_PEAK_HEIGHT, thresholds.getHeight());
    assertEquals(AnalysisParameters.DEFAULT_PEAK_PROMINENCE, thresholds.getProminence());
    assertTrue("A flat signal has no peaks", detector.detect(fromIntensities(new double[150]), defaults).isEmpty());
  }

  @Test
  public void testDetectionIsRepeatable() {
    Sample sample = noisyBaselineWithBump(11L);
    assertEquals(detector.detect(sample, defaults), detector.detect(sample, defaults));
  }
}
