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

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Guesses the header length, delimiter, value columns and encoding of a diffraction or reference card text file by
 * probing its first lines.
 */
public class TabularFormatDetector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(TabularFormatDetector.class);

  public static final Integer MAX_PROBE_LINES = 50;
  public static final String BYTE_ORDER_MARK = "\uFEFF";

  // Lines starting with any of these are instrument/card metadata, never data.
  public static final String[] METADATA_PREFIXES = new String[] {
      "#", "PDF", "Ref:", "CELL:", "Strong", "Radiation", "%"
  };

  public static final List<Charset> CANDIDATE_CHARSETS;
  static {
    List<Charset> charsets = new ArrayList<>();
    charsets.add(StandardCharsets.UTF_8);
    if (Charset.isSupported("GBK")) {
      charsets.add(Charset.forName("GBK"));
    }
    charsets.add(StandardCharsets.ISO_8859_1);
    charsets.add(StandardCharsets.US_ASCII);
    CANDIDATE_CHARSETS = Collections.unmodifiableList(charsets);
  }

  public TabularFormat detect(File file) {
    for (Charset charset : CANDIDATE_CHARSETS) {
      List<String> lines;
      try {
        lines = readProbeLines(file, charset);
      } catch (IOException e) {
        LOGGER.debug("Unable to read %s as %s: %s", file.getName(), charset.name(), e.getMessage());
        continue;
      }
      TabularFormat format = detect(lines, charset);
      LOGGER.debug("Detected format of %s: %s", file.getName(), format);
      return format;
    }

    LOGGER.warn("Unable to read %s with any of %s, falling back to default layout", file.getName(),
        CANDIDATE_CHARSETS);
    return TabularFormat.fallback();
  }

  /**
   * Finds the first line whose leading columns parse as numbers.  Column pair [0, 1] is preferred; [0, 2] is accepted
   * when a non-numeric field (like an hkl index) sits between angle and intensity.
   * @param lines The probed lines, in file order.
   * @param charset The charset the lines were decoded with.
   * @return The detected format, or the fallback format if no line looks like data.
   */
  TabularFormat detect(List<String> lines, Charset charset) {
    for (int i = 0; i < lines.size(); i++) {
      String line = i == 0 ? StringUtils.removeStart(lines.get(i), BYTE_ORDER_MARK).trim() : lines.get(i).trim();
      if (line.isEmpty() || StringUtils.startsWithAny(line, METADATA_PREFIXES)) {
        continue;
      }

      ColumnDelimiter delimiter = ColumnDelimiter.sniff(line);
      String[] parts = delimiter.split(line);
      if (parts.length < 2) {
        continue;
      }

      if (isNumeric(parts[0]) && isNumeric(parts[1])) {
        return new TabularFormat(i, Pair.of(0, 1), delimiter, charset);
      }
      if (parts.length >= 3 && isNumeric(parts[0]) && isNumeric(parts[2])) {
        return new TabularFormat(i, Pair.of(0, 2), delimiter, charset);
      }
    }
    return TabularFormat.fallback(charset);
  }

  private List<String> readProbeLines(File file, Charset charset) throws IOException {
    List<String> lines = new ArrayList<>(MAX_PROBE_LINES);
    // Files.newBufferedReader decodes strictly, so a wrong charset surfaces as a MalformedInputException.
    try (BufferedReader reader = Files.newBufferedReader(file.toPath(), charset)) {
      String line;
      while (lines.size() < MAX_PROBE_LINES && (line = reader.readLine()) != null) {
        lines.add(line);
      }
    }
    return lines;
  }

  static boolean isNumeric(String field) {
    if (field == null || field.trim().isEmpty()) {
      return false;
    }
    try {
      Double.parseDouble(field.trim());
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
