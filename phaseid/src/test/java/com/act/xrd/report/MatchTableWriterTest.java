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

package com.act.xrd.report;

import com.act.xrd.matching.Match;
import com.act.xrd.matching.MatchPolicy;
import com.act.xrd.matching.MatchSet;
import com.act.xrd.peaks.DetectedPeak;
import com.act.xrd.reference.ReferencePeak;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class MatchTableWriterTest {

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private final DetectedPeak matched = new DetectedPeak(26.64, 900.0, 3);
  private final DetectedPeak stray = new DetectedPeak(45.0, 300.0, 5);
  private final ReferencePeak quartz = new ReferencePeak(26.639, 100.0, "Quartz", "①");

  private MatchSet matchSet() {
    return new MatchSet(MatchPolicy.PHASE_FIRST, 0.2, Collections.singletonList(new Match(matched, quartz, 0.2)),
        Collections.singletonList(stray), Collections.emptyList());
  }

  private static String[] fields(String line) {
    return line.split("\t", -1);
  }

  @Test
  public void testWritePeaksAnnotatesMatchedRows() throws Exception {
    File out = temporaryFolder.newFile("sample.peaks.tsv");
    new MatchTableWriter().writePeaks(out, Arrays.asList(matched, stray), matchSet());

    List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertArrayEquals(new String[]{"index", "two_theta", "intensity", "phase_id", "symbol"}, fields(lines.get(0)));
    assertArrayEquals(new String[]{"3", "26.6400", "900.0000", "Quartz", "①"}, fields(lines.get(1)));
    assertArrayEquals(new String[]{"5", "45.0000", "300.0000", "", ""}, fields(lines.get(2)));
  }

  @Test
  public void testWritePeaksWithoutMatches() throws Exception {
    File out = temporaryFolder.newFile("detection-only.peaks.tsv");
    new MatchTableWriter().writePeaks(out, Collections.singletonList(matched), null);

    List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
    assertArrayEquals(new String[]{"3", "26.6400", "900.0000", "", ""}, fields(lines.get(1)));
  }

  @Test
  public void testWriteMatches() throws Exception {
    File out = temporaryFolder.newFile("sample.matches.tsv");
    new MatchTableWriter().writeMatches(out, matchSet());

    List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertEquals(8, fields(lines.get(0)).length);
    assertEquals("detected_two_theta", fields(lines.get(0))[2]);
    assertArrayEquals(new String[]{"Quartz", "①", "26.6400", "26.6390", "0.0010", "0.9950", "900.0000", "100.0000"},
        fields(lines.get(1)));
  }

  @Test
  public void testNumbersIgnoreDefaultLocale() throws Exception {
    Locale original = Locale.getDefault();
    File out = temporaryFolder.newFile("german.peaks.tsv");
    try {
      Locale.setDefault(Locale.GERMANY);
      new MatchTableWriter().writePeaks(out, Collections.singletonList(matched), matchSet());
    } finally {
      Locale.setDefault(original);
    }

    List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
    assertArrayEquals(new String[]{"3", "26.6400", "900.0000", "Quartz", "①"}, fields(lines.get(1)));
  }
}
