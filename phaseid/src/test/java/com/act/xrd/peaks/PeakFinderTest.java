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

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class PeakFinderTest {

  private PeakFinder finder;

  @Before
  public void setUp() {
    finder = new PeakFinder();
  }

  private static PeakThresholds only(Double height, Integer distance, Double prominence, Double width) {
    return new PeakThresholds(height, distance, prominence, width);
  }

  @Test
  public void testStrictLocalMaxima() {
    assertEquals(Arrays.asList(1, 3), PeakFinder.localMaxima(new double[]{0, 1, 0, 2, 0}));
    assertEquals("End points are never peaks", Collections.emptyList(),
        PeakFinder.localMaxima(new double[]{5, 1, 5}));
  }

  @Test
  public void testPlateauResolvesToMiddle() {
    assertEquals(Collections.singletonList(2), PeakFinder.localMaxima(new double[]{0, 2, 2, 2, 0}));
    assertEquals("Even plateaus round down", Collections.singletonList(1),
        PeakFinder.localMaxima(new double[]{0, 2, 2, 0}));
    assertEquals("A plateau running into the end is not a peak", Collections.emptyList(),
        PeakFinder.localMaxima(new double[]{0, 2, 2, 2}));
  }

  @Test
  public void testHeightIsInclusive() {
    double[] signal = new double[]{0, 5, 0, 3, 0};
    assertEquals(Arrays.asList(1, 3), finder.findPeaks(signal, only(3.0, null, null, null)));
    assertEquals(Collections.singletonList(1), finder.findPeaks(signal, only(3.5, null, null, null)));
  }

  @Test
  public void testDistanceKeepsHighestPeaks() {
    double[] signal = new double[]{0, 5, 0, 4, 0, 6, 0};
    assertEquals("The peak between two higher ones is dropped", Arrays.asList(1, 5),
        finder.findPeaks(signal, only(null, 3, null, null)));
    assertEquals("Peaks exactly distance apart survive", Arrays.asList(1, 3, 5),
        finder.findPeaks(signal, only(null, 2, null, null)));
  }

  @Test
  public void testDistanceTieKeepsFirst() {
    double[] signal = new double[]{0, 5, 0, 5, 0};
    assertEquals(Collections.singletonList(1), finder.findPeaks(signal, only(null, 3, null, null)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDistanceBelowOneRejected() {
    finder.findPeaks(new double[]{0, 1, 0}, only(null, 0, null, null));
  }

  @Test
  public void testProminence() {
    double[] signal = new double[]{0, 10, 4, 8, 0};
    PeakFinder.Prominence shoulder = PeakFinder.prominence(signal, 3);
    assertEquals("The shoulder only rises 4 above the higher of its bases", 4.0, shoulder.value, 1e-12);
    assertEquals(2, shoulder.leftBase);
    assertEquals(4, shoulder.rightBase);
    assertEquals("The main peak drops to the signal floor", 10.0, PeakFinder.prominence(signal, 1).value, 1e-12);

    assertEquals(Collections.singletonList(1), finder.findPeaks(signal, only(null, null, 5.0, null)));
    assertEquals("Prominence is inclusive", Arrays.asList(1, 3), finder.findPeaks(signal, only(null, null, 4.0, null)));
  }

  @Test
  public void testWidthAtHalfProminence() {
    double[] signal = new double[]{0, 0, 0, 4, 8, 4, 0, 0, 0};
    PeakFinder.Prominence prominence = PeakFinder.prominence(signal, 4);
    assertEquals(2.0, PeakFinder.width(signal, 4, prominence), 1e-12);

    double[] interpolated = new double[]{0, 0, 6, 8, 6, 0, 0};
    assertEquals("Crossings between samples are interpolated", 2.0 + 2.0 / 3.0,
        PeakFinder.width(interpolated, 3, PeakFinder.prominence(interpolated, 3)), 1e-12);

    assertEquals("Width is inclusive", Collections.singletonList(4), finder.findPeaks(signal, only(null, null, null, 2.0)));
    assertEquals(Collections.emptyList(), finder.findPeaks(signal, only(null, null, null, 2.5)));
  }

  @Test
  public void testNoThresholdsReturnsAllMaxima() {
    double[] signal = new double[]{0, 1, 0, 1, 0, 1, 0};
    List<Integer> peaks = finder.findPeaks(signal, only(null, null, null, null));
    assertEquals(Arrays.asList(1, 3, 5), peaks);
  }

  @Test
  public void testEmptyAndTinySignals() {
    assertEquals(Collections.emptyList(), finder.findPeaks(new double[0], only(1.0, 1, 1.0, 1.0)));
    assertEquals(Collections.emptyList(), finder.findPeaks(new double[]{3.0}, only(1.0, 1, 1.0, 1.0)));
  }
}
