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

import org.apache.commons.lang3.mutable.MutableBoolean;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Reads (angle, intensity) tables out of loosely structured text files.  The detected {@link TabularFormat} is tried
 * first; if it does not yield a numeric two-column table, a fixed chain of alternate layouts is tried in order.  Only
 * the failure of the whole chain is surfaced.
 */
public class TabularReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(TabularReader.class);

  // The last reference card layout retries whitespace splitting with this many fewer header lines.
  public static final Integer REDUCED_SKIP_LINES = 10;

  private TabularFormatDetector detector;

  public TabularReader() {
    this(new TabularFormatDetector());
  }

  public TabularReader(TabularFormatDetector detector) {
    this.detector = detector;
  }

  /**
   * Reads an experimental diffraction curve.  After the detected layout, plain whitespace, comma and tab layouts with
   * no header and columns [0, 1] are tried.
   * @param file The file to read.
   * @return Raw rows; individual values may be null where the file had no value.
   * @throws IngestFormatException If no layout yields a numeric table.
   */
  public List<Pair<Double, Double>> readExperimentalData(File file) throws IOException, IngestFormatException {
    verifyInputFile(file);
    TabularFormat format = detector.detect(file);
    LOGGER.info("Reading experimental data from %s (%s)", file.getName(), format);
    return readWithFallbacks(file, experimentalStrategies(format), rows -> true);
  }

  /**
   * Reads the peak table of a raw reference card.  After the detected layout, whitespace, comma and tab splitting are
   * tried with the detected header length and columns, then whitespace splitting with a shorter header.
   * @param file The card to read.
   * @return Raw rows; individual values may be null where the file had no value.
   * @throws IngestFormatException If none of the five layouts yields a numeric table.
   */
  public List<Pair<Double, Double>> readReferenceCard(File file) throws IOException, IngestFormatException {
    return readReferenceCard(file, rows -> true);
  }

  /**
   * Reads the peak table of a raw reference card, moving on to the next layout when a layout parses but its rows are
   * rejected by {@code usable}.
   */
  public List<Pair<Double, Double>> readReferenceCard(File file, Predicate<List<Pair<Double, Double>>> usable)
      throws IOException, IngestFormatException {
    verifyInputFile(file);
    TabularFormat format = detector.detect(file);
    return readWithFallbacks(file, referenceCardStrategies(format), usable);
  }

  List<TableReadStrategy> experimentalStrategies(TabularFormat format) {
    Pair<Integer, Integer> columns = Pair.of(0, 1);
    List<TableReadStrategy> strategies = new ArrayList<>();
    strategies.add(TableReadStrategy.fromFormat(format));
    strategies.add(new TableReadStrategy(ColumnDelimiter.WHITESPACE, 0, columns, format.getCharset()));
    strategies.add(new TableReadStrategy(ColumnDelimiter.COMMA, 0, columns, format.getCharset()));
    strategies.add(new TableReadStrategy(ColumnDelimiter.TAB, 0, columns, format.getCharset()));
    return strategies;
  }

  List<TableReadStrategy> referenceCardStrategies(TabularFormat format) {
    Integer skip = format.getHeaderLinesToSkip();
    Pair<Integer, Integer> columns = format.getColumns();
    List<TableReadStrategy> strategies = new ArrayList<>();
    strategies.add(TableReadStrategy.fromFormat(format));
    strategies.add(new TableReadStrategy(ColumnDelimiter.WHITESPACE, skip, columns, format.getCharset()));
    strategies.add(new TableReadStrategy(ColumnDelimiter.COMMA, skip, columns, format.getCharset()));
    strategies.add(new TableReadStrategy(ColumnDelimiter.TAB, skip, columns, format.getCharset()));
    strategies.add(new TableReadStrategy(ColumnDelimiter.WHITESPACE, Math.max(0, skip - REDUCED_SKIP_LINES), columns,
        format.getCharset()));
    return strategies;
  }

  /**
   * Tries each layout in order.  If any layout fails because the file does not decode in its charset, the whole chain
   * is run again with every remaining candidate charset before giving up.
   */
  List<Pair<Double, Double>> readWithFallbacks(File file, List<TableReadStrategy> strategies,
                                               Predicate<List<Pair<Double, Double>>> usable)
      throws IOException, IngestFormatException {
    List<String> failures = new ArrayList<>();
    Charset detectedCharset = strategies.get(0).getCharset();
    List<Charset> charsets = new ArrayList<>();
    charsets.add(detectedCharset);
    for (Charset candidate : TabularFormatDetector.CANDIDATE_CHARSETS) {
      if (!candidate.equals(detectedCharset)) {
        charsets.add(candidate);
      }
    }

    for (int c = 0; c < charsets.size(); c++) {
      List<TableReadStrategy> attempts = strategies;
      if (c > 0) {
        LOGGER.warn("Retrying read layouts for %s as %s", file.getName(), charsets.get(c).name());
        attempts = new ArrayList<>(strategies.size());
        for (TableReadStrategy strategy : strategies) {
          attempts.add(strategy.withCharset(charsets.get(c)));
        }
      }

      MutableBoolean undecodable = new MutableBoolean(false);
      List<Pair<Double, Double>> rows = tryLayouts(file, attempts, usable, failures, undecodable);
      if (rows != null) {
        return rows;
      }
      if (undecodable.isFalse()) {
        // The file decoded fine; other charsets would not change the outcome.
        break;
      }
    }
    throw new IngestFormatException(String.format("All %d read layouts failed for %s: %s",
        strategies.size(), file.getAbsolutePath(), String.join("; ", failures)));
  }

  private List<Pair<Double, Double>> tryLayouts(File file, List<TableReadStrategy> strategies,
                                                Predicate<List<Pair<Double, Double>>> usable, List<String> failures,
                                                MutableBoolean undecodable) throws IOException {
    for (int i = 0; i < strategies.size(); i++) {
      TableReadStrategy strategy = strategies.get(i);
      try {
        List<Pair<Double, Double>> rows = strategy.read(file);
        if (!usable.test(rows)) {
          LOGGER.debug("Layout %d (%s) for %s parsed but yielded no usable rows", i + 1, strategy, file.getName());
          failures.add(String.format("layout %d yielded no usable rows", i + 1));
          continue;
        }
        if (i > 0) {
          LOGGER.warn("Read %s using fallback layout %d (%s)", file.getName(), i + 1, strategy);
        } else {
          LOGGER.debug("Read %s using detected layout (%s)", file.getName(), strategy);
        }
        return rows;
      } catch (IngestFormatException e) {
        LOGGER.debug("Layout %d (%s) failed for %s: %s", i + 1, strategy, file.getName(), e.getMessage());
        failures.add(e.getMessage());
        if (e.getCause() instanceof CharacterCodingException) {
          undecodable.setTrue();
        }
      }
    }
    return null;
  }

  private static void verifyInputFile(File file) throws IOException {
    if (!file.exists()) {
      throw new IOException("Input file " + file.getAbsolutePath() + " does not exist.");
    }
    if (file.isDirectory()) {
      throw new IOException("Input file " + file.getAbsolutePath() + " is a directory.");
    }
  }
}
