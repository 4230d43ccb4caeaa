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
import com.act.xrd.reference.ReferenceCatalog;
import com.act.xrd.reference.ReferencePeak;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class PeakFirstMatcherTest {

  private PeakFirstMatcher matcher;

  @Before
  public void setUp() {
    matcher = new PeakFirstMatcher();
  }

  @Test
  public void testClosestReferenceWins() throws Exception {
    ReferencePeak far = new ReferencePeak(30.0, 100.0, "A", "①");
    ReferencePeak near = new ReferencePeak(30.04, 10.0, "B", "②");
    MatchSet matchSet = matcher.match(Collections.singletonList(new DetectedPeak(30.05, 500.0, 0)),
        new ReferenceCatalog(Arrays.asList(far, near)), 0.5);
    assertSame(near, matchSet.getMatches().get(0).getReference());
    assertEquals(MatchPolicy.PEAK_FIRST, matchSet.getPolicy());
  }

  @Test
  public void testEqualDistanceGoesToMoreIntenseReference() throws Exception {
    ReferencePeak weak = new ReferencePeak(29.75, 50.0, "A", "①");
    ReferencePeak strong = new ReferencePeak(30.25, 80.0, "B", "②");
    MatchSet matchSet = matcher.match(Collections.singletonList(new DetectedPeak(30.0, 500.0, 0)),
        new ReferenceCatalog(Arrays.asList(weak, strong)), 0.5);
    assertSame(strong, matchSet.getMatches().get(0).getReference());
    assertEquals(0.5, matchSet.getMatches().get(0).getQuality(), 1e-12);
  }

  @Test
  public void testFullTieGoesToCatalogOrder() throws Exception {
    ReferencePeak first = new ReferencePeak(29.75, 50.0, "A", "①");
    ReferencePeak second = new ReferencePeak(30.25, 50.0, "B", "②");
    MatchSet matchSet = matcher.match(Collections.singletonList(new DetectedPeak(30.0, 500.0, 0)),
        new ReferenceCatalog(Arrays.asList(first, second)), 0.5);
    assertSame(first, matchSet.getMatches().get(0).getReference());
  }

  @Test
  public void testReferencePeakCanBeShared() throws Exception {
    ReferencePeak ref = new ReferencePeak(30.0, 100.0, "A", "①");
    MatchSet matchSet = matcher.match(
        Arrays.asList(new DetectedPeak(29.9, 100.0, 0), new DetectedPeak(30.1, 200.0, 1)),
        new ReferenceCatalog(Collections.singletonList(ref)), 0.5);
    assertEquals(2, matchSet.getMatches().size());
    assertSame(ref, matchSet.getMatches().get(1).getReference());
    assertTrue(matchSet.getUnmatchedReference().isEmpty());
  }

  @Test
  public void testUnmatchedDetectedPeaksAreRecorded() throws Exception {
    DetectedPeak stray = new DetectedPeak(45.0, 300.0, 7);
    ReferencePeak lonely = new ReferencePeak(60.0, 20.0, "A", "①");
    MatchSet matchSet = matcher.match(
        Arrays.asList(new DetectedPeak(30.0, 100.0, 0), stray),
        new ReferenceCatalog(Arrays.asList(new ReferencePeak(30.1, 100.0, "A", "①"), lonely)), 0.2);
    assertEquals(1, matchSet.getMatches().size());
    assertEquals("Found but unidentified", Collections.singletonList(stray), matchSet.getUnmatchedDetected());
    assertEquals(Collections.singletonList(lonely), matchSet.getUnmatchedReference());
  }

  @Test(expected = InvalidToleranceException.class)
  public void testZeroTolerance() throws Exception {
    matcher.match(Collections.singletonList(new DetectedPeak(30.0, 1.0, 0)),
        new ReferenceCatalog(Collections.singletonList(new ReferencePeak(30.0, 1.0, "A", "①"))), 0.0);
  }

  @Test
  public void testPolicyLookup() {
    assertEquals(MatchPolicy.PEAK_FIRST, MatchPolicy.fromName("peak_first"));
    assertEquals(MatchPolicy.PEAK_FIRST, MatchPolicy.fromName("Peak-First"));
    assertEquals(MatchPolicy.PHASE_FIRST, MatchPolicy.fromName(" PHASE_FIRST "));
    assertTrue(MatchPolicy.PEAK_FIRST.newMatcher() instanceof PeakFirstMatcher);
    assertTrue(MatchPolicy.PHASE_FIRST.newMatcher() instanceof PhaseFirstMatcher);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownPolicy() {
    MatchPolicy.fromName("closest");
  }
}
