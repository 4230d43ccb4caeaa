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

package com.act.xrd.io;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class TabularReaderTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private TabularReader reader;

  @Before
  public void setUp() {
    reader = new TabularReader();
  }

  private File writeFile(String name, String... lines) throws IOException {
    File file = tempFolder.newFile(name);
    Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
    return file;
  }

  @Test
  public void testReadCommaSeparatedWithHeader() throws Exception {
    File file = writeFile("scan.csv",
        "2theta,intensity",
        "10.00,100.5",
        "# interleaved comment",
        "10.02,101.5",
        "10.04,99.0 # trailing comment"
    );
    List<Pair<Double, Double>> rows = reader.readExperimentalData(file);
    assertEquals("Comments and the header are not rows", 3, rows.size());
    assertEquals(Pair.of(10.00, 100.5), rows.get(0));
    assertEquals(Pair.of(10.04, 99.0), rows.get(2));
  }

  @Test
  public void testReadWhitespaceSeparated() throws Exception {
    File file = writeFile("scan.xy", "  10.00   100.5", "  10.02   101.5");
    List<Pair<Double, Double>> rows = reader.readExperimentalData(file);
    assertEquals(2, rows.size());
    assertEquals(Pair.of(10.02, 101.5), rows.get(1));
  }

  @Test
  public void testMissingValuesAreNull() throws Exception {
    File file = writeFile("gaps.csv", "10.00,100.5", "10.02,", "10.04,NaN");
    List<Pair<Double, Double>> rows = reader.readExperimentalData(file);
    assertEquals(3, rows.size());
    assertNull("An empty field is missing", rows.get(1).getRight());
    assertNull("NaN is missing", rows.get(2).getRight());
  }

  @Test
  public void testFallbackLayoutIsUsedWhenFirstFails() throws Exception {
    File file = writeFile("scan.xy", "10.00 100.5", "10.02 101.5");
    List<TableReadStrategy> strategies = Arrays.asList(
        new TableReadStrategy(ColumnDelimiter.COMMA, 0, Pair.of(0, 1), StandardCharsets.UTF_8),
        new TableReadStrategy(ColumnDelimiter.WHITESPACE, 0, Pair.of(0, 1), StandardCharsets.UTF_8)
    );
    List<Pair<Double, Double>> rows = reader.readWithFallbacks(file, strategies, r -> true);
    assertEquals("The whitespace layout reads both rows", 2, rows.size());
    assertEquals(Pair.of(10.00, 100.5), rows.get(0));
  }

  @Test
  public void testUnusableRowsMoveToNextLayout() throws Exception {
    File file = writeFile("scan.xy", "10.00 100.5", "10.02 101.5");
    List<TableReadStrategy> strategies = Arrays.asList(
        new TableReadStrategy(ColumnDelimiter.WHITESPACE, 1, Pair.of(0, 1), StandardCharsets.UTF_8),
        new TableReadStrategy(ColumnDelimiter.WHITESPACE, 0, Pair.of(0, 1), StandardCharsets.UTF_8)
    );
    List<Pair<Double, Double>> rows = reader.readWithFallbacks(file, strategies, r -> r.size() > 1);
    assertEquals("The first layout skipped a row and was rejected", 2, rows.size());
  }

  @Test(expected = IngestFormatException.class)
  public void testAllLayoutsFailing() throws Exception {
    File file = writeFile("words.txt", "alpha beta", "gamma delta");
    reader.readExperimentalData(file);
  }

  @Test(expected = IOException.class)
  public void testMissingFile() throws Exception {
    reader.readExperimentalData(new File(tempFolder.getRoot(), "does_not_exist.csv"));
  }

  @Test
  public void testReadReferenceCard() throws Exception {
    File card = new File(this.getClass().getResource("/com/act/xrd/reference/Quartz.txt").getFile());
    List<Pair<Double, Double>> rows = reader.readReferenceCard(card);
    assertEquals("Every line of the peak table is read", 6, rows.size());
    assertEquals(20.859, rows.get(0).getLeft(), 1e-9);
    assertEquals(59.960, rows.get(5).getLeft(), 1e-9);
  }

  @Test
  public void testReferenceCardStrategyOrder() {
    TabularFormat format = new TabularFormat(12, Pair.of(0, 2), ColumnDelimiter.TAB, StandardCharsets.UTF_8);
    List<TableReadStrategy> strategies = reader.referenceCardStrategies(format);
    assertEquals(5, strategies.size());
    assertEquals(ColumnDelimiter.TAB, strategies.get(0).getDelimiter());
    assertEquals(ColumnDelimiter.WHITESPACE, strategies.get(1).getDelimiter());
    assertEquals(ColumnDelimiter.COMMA, strategies.get(2).getDelimiter());
    assertEquals(ColumnDelimiter.TAB, strategies.get(3).getDelimiter());
    assertEquals("The last layout shortens the header by ten lines", Integer.valueOf(2),
        strategies.get(4).getLinesToSkip());
    assertEquals(Pair.of(0, 2), strategies.get(4).getColumns());
  }

  @Test
  public void testUndecodableByteBeyondProbedLinesFallsBackToOtherCharset() throws Exception {
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < 3000; i++) {
      if (i == 2499) {
        lines.add("# measured at 25\u00b0C");
      } else {
        lines.add(String.format(Locale.ROOT, "%.3f\t%.1f", 10.0 + i * 0.01, 100.0 + i % 7));
      }
    }
    File file = tempFolder.newFile("latin1.txt");
    Files.write(file.toPath(), lines, StandardCharsets.ISO_8859_1);

    List<Pair<Double, Double>> rows = reader.readExperimentalData(file);
    assertEquals("Every data line is read once the file decodes", 2999, rows.size());
    assertEquals(Pair.of(10.0, 100.0), rows.get(0));
    assertEquals(39.99, rows.get(2998).getLeft(), 1e-9);
  }

  @Test
  public void testByteOrderMarkDoesNotHideFirstRow() throws Exception {
    File file = writeFile("bom.csv", "\uFEFF10.00,100.5", "10.02,101.5");
    List<Pair<Double, Double>> rows = reader.readExperimentalData(file);
    assertEquals(2, rows.size());
    assertEquals(Pair.of(10.00, 100.5), rows.get(0));
  }
}
