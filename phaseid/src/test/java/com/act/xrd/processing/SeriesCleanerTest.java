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
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SeriesCleanerTest {

  private SeriesCleaner cleaner;

  @Before
  public void setUp() {
    cleaner = new SeriesCleaner();
  }

  private static List<Pair<Double, Double>> evenlySpaced(int count) {
    List<Pair<Double, Double>> rows = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      rows.add(Pair.of(10.0 + i * 0.05, 100.0 + i));
    }
    return rows;
  }

  private static List<Pair<Double, Double>> toRows(Sample sample) {
    List<Pair<Double, Double>> rows = new ArrayList<>(sample.size());
    for (DiffractionPoint p : sample.getPoints()) {
      rows.add(Pair.of(p.getAngle(), p.getIntensity()));
    }
    return rows;
  }

  @Test
  public void testExactlyMinimumPointsSucceeds() throws Exception {
    Sample sample = cleaner.clean(evenlySpaced(100));
    assertEquals(100, sample.size());
  }

  @Test
  public void testOneBelowMinimumFails() {
    try {
      cleaner.clean(evenlySpaced(99));
      fail("99 points should not be enough");
    } catch (DataInsufficientException e) {
      assertEquals(99, e.getValidPoints());
      assertEquals(100, e.getRequiredPoints());
    }
  }

  @Test
  public void testMissingAndNonPhysicalRowsAreDropped() throws Exception {
    List<Pair<Double, Double>> rows = evenlySpaced(100);
    rows.add(Pair.of(null, 10.0));
    rows.add(Pair.of(20.0, null));
    rows.add(Pair.of(Double.NaN, 10.0));
    rows.add(Pair.of(0.0, 10.0));
    rows.add(Pair.of(180.0, 10.0));
    rows.add(Pair.of(-5.0, 10.0));
    rows.add(Pair.of(95.0, -1.0));

    Sample sample = cleaner.clean(rows);
    assertEquals("Only the valid rows remain", 100, sample.size());
  }

  @Test
  public void testOutputIsSortedAndDeduplicated() throws Exception {
    List<Pair<Double, Double>> rows = evenlySpaced(120);
    Collections.reverse(rows);
    rows.add(Pair.of(10.0, 999.0));

    Sample sample = cleaner.clean(rows);
    assertEquals("The repeated angle is dropped", 120, sample.size());
    double[] angles = sample.getAngles();
    for (int i = 1; i < angles.length; i++) {
      assertTrue("Angles are strictly increasing", angles[i] > angles[i - 1]);
    }
    assertEquals("The first row seen for an angle is kept", 100.0, sample.get(0).getIntensity(), 1e-9);
  }

  @Test
  public void testCleaningIsIdempotent() throws Exception {
    List<Pair<Double, Double>> rows = evenlySpaced(150);
    rows.add(Pair.of(null, 1.0));
    rows.add(Pair.of(12.0, 5.0));
    Sample once = cleaner.clean(rows);
    Sample twice = cleaner.clean(toRows(once));
    assertEquals("Cleaning clean data removes nothing", once.getPoints(), twice.getPoints());
  }

  @Test
  public void testAngleWindowAndIntensityThreshold() throws Exception {
    AnalysisParameters params = new AnalysisParameters();
    params.setAngleMin(14.99);
    params.setAngleMax(25.01);
    params.setIntensityThreshold(150.0);

    // Angles 10.0 .. 39.95, intensities 100 .. 699.
    Sample sample = cleaner.clean(evenlySpaced(600), params);
    assertTrue("Minimum angle respects the window", sample.getMinAngle() >= 14.99);
    assertTrue("Maximum angle respects the window", sample.getMaxAngle() <= 25.01);
    for (DiffractionPoint p : sample.getPoints()) {
      assertTrue("Intensities respect the threshold", p.getIntensity() >= 150.0);
    }
    assertEquals("Rows from 15.00 to 25.00", 201, sample.size());
  }

  @Test
  public void testEvenSmoothingWindowIsWidened() throws Exception {
    AnalysisParameters params = new AnalysisParameters();
    params.setSmoothWindow(4);

    List<Pair<Double, Double>> rows = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      rows.add(Pair.of(10.0 + i * 0.05, i % 2 == 0 ? 100.0 : 200.0));
    }
    Sample sample = cleaner.clean(rows, params);
    assertEquals(200, sample.size());
    double middle = sample.get(100).getIntensity();
    assertTrue("Alternating intensities are pulled toward their mean", middle > 100.0 && middle < 200.0);
  }

  @Test
  public void testSmoothedIntensitiesAreNeverNegative() throws Exception {
    AnalysisParameters params = new AnalysisParameters();
    params.setSmoothWindow(5);

    List<Pair<Double, Double>> rows = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      rows.add(Pair.of(10.0 + i * 0.05, i == 100 ? 1000.0 : 0.0));
    }
    Sample sample = cleaner.clean(rows, params);
    for (DiffractionPoint p : sample.getPoints()) {
      assertTrue("Smoothing ringing is clamped at zero", p.getIntensity() >= 0.0);
    }
  }

  @Test
  public void testSmoothingSkippedWhenWindowTooLong() {
    List<DiffractionPoint> points = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      points.add(new DiffractionPoint(10.0 + i, i * 10.0));
    }
    assertEquals("Too few points to smooth", points, cleaner.applySmoothing(points, 5));
    assertEquals("A window of one is a no-op", points, cleaner.applySmoothing(points, 1));
  }
}
