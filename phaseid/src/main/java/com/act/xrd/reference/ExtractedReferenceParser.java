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

package com.act.xrd.reference;

import com.act.xrd.io.IngestFormatException;
import com.act.xrd.processing.SeriesCleaner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses reference files written by {@link ReferenceCardExtractor}: '#' header comments followed by
 * {@code angle,phase,symbol} lines.
 *
 * The phase id comes from the file name when it starts with {@value #FILE_PREFIX}, otherwise from the
 * {@value #PHASE_HEADER} comment.  The symbol comes from the {@value #SYMBOL_HEADER} comment, or from the symbol
 * column of the first data line when the header is absent.  Extracted files carry no intensities, so every peak gets
 * {@link #EXTRACTED_INTENSITY}.
 */
public class ExtractedReferenceParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ExtractedReferenceParser.class);

  public static final String FILE_PREFIX = "reference_";
  public static final String FILE_SUFFIX = ".txt";
  public static final String PHASE_HEADER = "# Phase:";
  public static final String SYMBOL_HEADER = "# Symbol:";
  public static final String COMMENT_PREFIX = "#";
  public static final String FIELD_DELIMITER = ",";
  public static final Integer MIN_FIELDS = 3;
  public static final Double EXTRACTED_INTENSITY = 0.0;

  /**
   * Lists the extracted reference files in a directory, sorted by name.
   */
  public List<File> discover(File directory) throws IOException {
    if (!directory.isDirectory()) {
      throw new IOException(String.format("Reference directory %s does not exist or is not a directory",
          directory.getAbsolutePath()));
    }
    File[] files = directory.listFiles((dir, name) -> name.startsWith(FILE_PREFIX) && name.endsWith(FILE_SUFFIX));
    if (files == null) {
      throw new IOException(String.format("Unable to list files in %s", directory.getAbsolutePath()));
    }
    List<File> sorted = new ArrayList<>(Arrays.asList(files));
    sorted.sort((a, b) -> a.getName().compareTo(b.getName()));
    return sorted;
  }

  /**
   * Parses each file in turn.  A file that cannot be read or holds no usable phase is logged and skipped.
   * @return A catalog of every usable file's peaks; empty if none were usable.
   */
  public ReferenceCatalog parse(List<File> files) {
    List<ReferencePeak> peaks = new ArrayList<>();
    for (File file : files) {
      try {
        List<ReferencePeak> filePeaks = parseFile(file);
        peaks.addAll(filePeaks);
        LOGGER.info("Loaded %d extracted reference peaks for phase %s from %s",
            filePeaks.size(), filePeaks.get(0).getPhaseId(), file.getName());
      } catch (IOException | IngestFormatException e) {
        LOGGER.error("Unable to load extracted reference file %s: %s", file.getAbsolutePath(), e.getMessage());
      }
    }
    return new ReferenceCatalog(peaks);
  }

  /**
   * @return The file's peaks, in file order; never empty.
   * @throws IngestFormatException If the file yields no phase id or no numeric angles.
   */
  public List<ReferencePeak> parseFile(File file) throws IOException, IngestFormatException {
    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);

    String phaseId = phaseIdFromFileName(file);
    String headerSymbol = "";
    String lineSymbol = "";
    List<Double> angles = new ArrayList<>();

    for (String rawLine : lines) {
      String line = rawLine.trim();
      if (line.startsWith(PHASE_HEADER)) {
        if (phaseId.isEmpty()) {
          phaseId = line.substring(PHASE_HEADER.length()).trim();
        }
      } else if (line.startsWith(SYMBOL_HEADER)) {
        headerSymbol = line.substring(SYMBOL_HEADER.length()).trim();
      } else if (!line.isEmpty() && !line.startsWith(COMMENT_PREFIX)) {
        String[] fields = line.split(FIELD_DELIMITER, -1);
        if (fields.length < MIN_FIELDS) {
          continue;
        }
        Double angle;
        try {
          angle = Double.valueOf(fields[0].trim());
        } catch (NumberFormatException e) {
          continue;
        }
        if (!SeriesCleaner.isPhysical(angle, EXTRACTED_INTENSITY)) {
          LOGGER.debug("Ignoring out of range angle %f in %s", angle, file.getName());
          continue;
        }
        angles.add(angle);
        if (lineSymbol.isEmpty()) {
          lineSymbol = fields[2].trim();
        }
      }
    }

    if (phaseId.isEmpty()) {
      throw new IngestFormatException(String.format("No phase name in file name or %s header of %s",
          PHASE_HEADER, file.getAbsolutePath()));
    }
    if (angles.isEmpty()) {
      throw new IngestFormatException(String.format("No reference angles found in %s", file.getAbsolutePath()));
    }

    String symbol = headerSymbol.isEmpty() ? lineSymbol : headerSymbol;
    List<ReferencePeak> peaks = new ArrayList<>(angles.size());
    for (Double angle : angles) {
      peaks.add(new ReferencePeak(angle, EXTRACTED_INTENSITY, phaseId, symbol));
    }
    return peaks;
  }

  static String phaseIdFromFileName(File file) {
    String name = file.getName();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    return stem.startsWith(FILE_PREFIX) ? stem.substring(FILE_PREFIX.length()) : "";
  }
}
