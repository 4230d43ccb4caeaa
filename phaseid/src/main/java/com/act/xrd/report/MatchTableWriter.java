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
import com.act.xrd.matching.MatchSet;
import com.act.xrd.peaks.DetectedPeak;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes detected peaks and matches as tab separated tables.
 */
public class MatchTableWriter {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  public enum PEAK_HEADER {
    INDEX("index"),
    TWO_THETA("two_theta"),
    INTENSITY("intensity"),
    PHASE_ID("phase_id"),
    SYMBOL("symbol"),
    ;

    private String name;

    PEAK_HEADER(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public enum MATCH_HEADER {
    PHASE_ID("phase_id"),
    SYMBOL("symbol"),
    DETECTED_TWO_THETA("detected_two_theta"),
    REFERENCE_TWO_THETA("reference_two_theta"),
    ANGLE_DELTA("angle_delta"),
    QUALITY("quality"),
    DETECTED_INTENSITY("detected_intensity"),
    REFERENCE_INTENSITY("reference_intensity"),
    ;

    private String name;

    MATCH_HEADER(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Writes one row per detected peak.  The phase and symbol columns are filled for matched peaks and left empty
   * otherwise, including when matchSet is null.
   */
  public void writePeaks(File file, List<DetectedPeak> peaks, MatchSet matchSet) throws IOException {
    Map<DetectedPeak, Match> matchByPeak = new IdentityHashMap<>();
    if (matchSet != null) {
      for (Match m : matchSet.getMatches()) {
        matchByPeak.put(m.getDetected(), m);
      }
    }

    try (CSVPrinter printer = open(file, PEAK_HEADER.values())) {
      for (DetectedPeak peak : peaks) {
        Match m = matchByPeak.get(peak);
        printer.printRecord(
            peak.getIndex(),
            format(peak.getAngle()),
            format(peak.getIntensity()),
            m == null ? "" : m.getReference().getPhaseId(),
            m == null ? "" : m.getReference().getSymbol()
        );
      }
    }
  }

  public void writeMatches(File file, MatchSet matchSet) throws IOException {
    try (CSVPrinter printer = open(file, MATCH_HEADER.values())) {
      for (Match m : matchSet.getMatches()) {
        printer.printRecord(
            m.getReference().getPhaseId(),
            m.getReference().getSymbol(),
            format(m.getDetected().getAngle()),
            format(m.getReference().getAngle()),
            format(m.getAngleDelta()),
            format(m.getQuality()),
            format(m.getDetected().getIntensity()),
            format(m.getReference().getIntensity())
        );
      }
    }
  }

  private static CSVPrinter open(File file, Object[] header) throws IOException {
    String[] headerStrings = Arrays.stream(header).map(Object::toString).toArray(String[]::new);
    Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8);
    return new CSVPrinter(writer, TSV_FORMAT.withHeader(headerStrings));
  }

  private static String format(Double value) {
    return String.format(Locale.ROOT, "%.4f", value);
  }
}
