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

import com.act.xrd.io.TabularFormatDetector;
import com.act.xrd.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the strong lines out of a raw reference card and writes them as an extracted reference file
 * ({@code reference_<phase>.txt}) that {@link ExtractedReferenceParser} can load.
 */
public class ReferenceCardExtractor {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReferenceCardExtractor.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_SYMBOL = "s";
  public static final String OPTION_THRESHOLD = "t";
  public static final String OPTION_OUTPUT_DIR = "o";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class extracts the lines at or above a relative intensity threshold from raw reference cards and writes ",
      "them as reference_<phase>.txt files usable as extracted references.  The input may be a single card or a ",
      "directory, which is searched recursively for cards."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("card or directory")
        .desc("A raw reference card, or a directory to search for .txt cards")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_SYMBOL)
        .argName("symbol")
        .desc("The symbol used to label this phase's peaks (default: ♠)")
        .hasArg()
        .longOpt("symbol")
    );
    add(Option.builder(OPTION_THRESHOLD)
        .argName("threshold")
        .desc("Minimum relative intensity of an extracted line (default: 40)")
        .hasArg()
        .longOpt("threshold")
    );
    add(Option.builder(OPTION_OUTPUT_DIR)
        .argName("output directory")
        .desc("Where to write reference_<phase>.txt files (default: the working directory)")
        .hasArg()
        .longOpt("output-dir")
    );
  }};

  public static final List<String> CARD_SYMBOLS =
      Collections.unmodifiableList(Arrays.asList("♠", "♥", "♦", "♣", "●", "■", "▲", "◆"));
  public static final Double DEFAULT_INTENSITY_THRESHOLD = 40.0;
  public static final String UNKNOWN_PHASE = "UnknownPhase";
  public static final String CARD_SUFFIX = ".txt";
  public static final String PDF_NUMBER_MARKER = "PDF#";

  // Angle, one skipped numeric field (d-spacing), relative intensity.
  private static final Pattern PEAK_LINE_PATTERN = Pattern.compile("^\\s*(\\d+\\.\\d+)\\s+[\\d.]+\\s+([\\d.]+)");
  // Anything other than word characters, CJK ideographs and hyphens.
  private static final Pattern PHASE_NAME_DISALLOWED =
      Pattern.compile("[^\\w\\u4e00-\\u9fff\\-]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final List<String> PLACEHOLDER_NAMES = Arrays.asList("untitled", "unnamed", "file");

  private String symbol;
  private Double intensityThreshold;
  private TabularFormatDetector detector;

  public ReferenceCardExtractor() {
    this(CARD_SYMBOLS.get(0), DEFAULT_INTENSITY_THRESHOLD);
  }

  public ReferenceCardExtractor(String symbol, Double intensityThreshold) {
    this.symbol = symbol;
    this.intensityThreshold = intensityThreshold;
    this.detector = new TabularFormatDetector();
  }

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(ReferenceCardExtractor.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    File input = new File(cl.getOptionValue(OPTION_INPUT));
    if (!input.exists()) {
      cliUtil.failWithMessage("Input %s does not exist", input.getAbsolutePath());
    }

    Double threshold = DEFAULT_INTENSITY_THRESHOLD;
    if (cl.hasOption(OPTION_THRESHOLD)) {
      try {
        threshold = Double.valueOf(cl.getOptionValue(OPTION_THRESHOLD));
      } catch (NumberFormatException e) {
        cliUtil.failWithMessage("Threshold must be a number, got %s", cl.getOptionValue(OPTION_THRESHOLD));
      }
    }

    File outputDir = new File(cl.getOptionValue(OPTION_OUTPUT_DIR, "."));
    if (!outputDir.isDirectory()) {
      cliUtil.failWithMessage("Output directory %s does not exist", outputDir.getAbsolutePath());
    }

    List<File> cards = input.isDirectory() ? findCardFiles(input) : Collections.singletonList(input);
    if (cards.isEmpty()) {
      cliUtil.failWithMessage("No card files found under %s", input.getAbsolutePath());
    }

    ReferenceCardExtractor extractor =
        new ReferenceCardExtractor(cl.getOptionValue(OPTION_SYMBOL, CARD_SYMBOLS.get(0)), threshold);
    int written = 0;
    for (File card : cards) {
      if (extractor.extract(card, outputDir) != null) {
        written++;
      }
    }
    LOGGER.info("Wrote %d of %d reference files to %s", written, cards.size(), outputDir.getAbsolutePath());
  }

  /**
   * Recursively finds candidate card files: {@value #CARD_SUFFIX} files whose names do not start with
   * {@value ExtractedReferenceParser#FILE_PREFIX}.  Results are sorted by path.
   */
  public static List<File> findCardFiles(File directory) {
    List<File> found = new ArrayList<>();
    collectCardFiles(directory, found);
    found.sort((a, b) -> a.getPath().compareTo(b.getPath()));
    return found;
  }

  private static void collectCardFiles(File directory, List<File> found) {
    File[] children = directory.listFiles();
    if (children == null) {
      LOGGER.warn("Unable to list %s", directory.getAbsolutePath());
      return;
    }
    for (File child : children) {
      if (child.isDirectory()) {
        collectCardFiles(child, found);
      } else if (child.getName().endsWith(CARD_SUFFIX) &&
          !child.getName().startsWith(ExtractedReferenceParser.FILE_PREFIX)) {
        found.add(child);
      }
    }
  }

  /**
   * Extracts one card.
   * @param card The raw card.
   * @param outputDir The directory to write the extracted reference file to.
   * @return The written file, or null if the card has no lines at or above the threshold.
   */
  public File extract(File card, File outputDir) throws IOException {
    Charset charset = detector.detect(card).getCharset();
    List<String> lines = Files.readAllLines(card.toPath(), charset);

    String phaseName = resolvePhaseName(card, lines);
    List<Double> angles = extractPeakAngles(lines);
    if (angles.isEmpty()) {
      LOGGER.warn("No lines with relative intensity >= %s in %s, nothing written", intensityThreshold, card.getName());
      return null;
    }

    File output = new File(outputDir, ExtractedReferenceParser.FILE_PREFIX + phaseName + CARD_SUFFIX);
    try (BufferedWriter writer = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
      for (String header : headerLines(phaseName)) {
        writer.write(header);
        writer.newLine();
      }
      for (Double angle : angles) {
        writer.write(String.join(ExtractedReferenceParser.FIELD_DELIMITER, angle.toString(), phaseName, symbol));
        writer.newLine();
      }
    }
    LOGGER.info("Extracted %d lines for phase %s from %s into %s", angles.size(), phaseName, card.getName(),
        output.getAbsolutePath());
    return output;
  }

  List<String> headerLines(String phaseName) {
    return Arrays.asList(
        String.format("%s %s", ExtractedReferenceParser.PHASE_HEADER, phaseName),
        String.format("%s %s", ExtractedReferenceParser.SYMBOL_HEADER, symbol),
        String.format("# Intensity Threshold: >= %s", intensityThreshold),
        "# Format: 2-Theta,PhaseName,Symbol",
        "# ----------------------------------"
    );
  }

  /**
   * @return The angle of every peak line whose relative intensity is at or above the threshold, in file order.
   */
  List<Double> extractPeakAngles(List<String> lines) {
    List<Double> angles = new ArrayList<>();
    for (String line : lines) {
      Matcher matcher = PEAK_LINE_PATTERN.matcher(line);
      if (!matcher.find()) {
        continue;
      }
      try {
        Double angle = Double.valueOf(matcher.group(1));
        Double intensity = Double.valueOf(matcher.group(2));
        if (intensity >= intensityThreshold) {
          angles.add(angle);
        }
      } catch (NumberFormatException e) {
        // Fields like "1.2.3" match the pattern but are not numbers.
        LOGGER.debug("Skipping malformed peak line: %s", line);
      }
    }
    return angles;
  }

  /**
   * Names the phase after the card's file name.  A placeholder or empty name is replaced by the line following the
   * card's {@value #PDF_NUMBER_MARKER} line, or {@value #UNKNOWN_PHASE} if there is none.
   */
  static String resolvePhaseName(File card, List<String> lines) {
    String phaseName = cleanPhaseName(card.getName());
    if (!phaseName.isEmpty() && !PLACEHOLDER_NAMES.contains(phaseName.toLowerCase(Locale.ROOT))) {
      return phaseName;
    }

    for (int i = 0; i + 1 < lines.size(); i++) {
      if (lines.get(i).contains(PDF_NUMBER_MARKER)) {
        String fromCard = cleanPhaseName(lines.get(i + 1).trim());
        return fromCard.isEmpty() ? UNKNOWN_PHASE : fromCard;
      }
    }
    return UNKNOWN_PHASE;
  }

  /**
   * Reduces a file name or title to a phase name: the base name without its extension, keeping only word characters,
   * CJK ideographs and hyphens.
   * @return The cleaned name; empty if nothing is left.
   */
  public static String cleanPhaseName(String name) {
    if (name == null || name.isEmpty()) {
      return "";
    }
    String base = new File(name).getName();
    int dot = base.lastIndexOf('.');
    if (dot > 0) {
      base = base.substring(0, dot);
    }
    return PHASE_NAME_DISALLOWED.matcher(base).replaceAll("");
  }
}
