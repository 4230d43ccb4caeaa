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

package com.act.xrd;

import com.act.xrd.io.IngestFormatException;
import com.act.xrd.matching.MatchPolicy;
import com.act.xrd.matching.NoReferenceDataException;
import com.act.xrd.processing.DataInsufficientException;
import com.act.xrd.reference.ExtractedReferenceParser;
import com.act.xrd.reference.ReferenceCatalog;
import com.act.xrd.reference.ReferenceCatalogBuilder;
import com.act.xrd.report.AnalysisSummaryFormatter;
import com.act.xrd.report.MatchTableWriter;
import com.act.xrd.utils.CLIUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class XrdPhaseIdentifier {
  private static final Logger LOGGER = LogManager.getFormatterLogger(XrdPhaseIdentifier.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_REFERENCE = "r";
  public static final String OPTION_EXTRACTED = "e";
  public static final String OPTION_REFERENCE_DIR = "d";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_POLICY = "p";
  public static final String OPTION_OUTPUT_PREFIX = "o";

  public static final String PEAKS_SUFFIX = ".peaks.tsv";
  public static final String MATCHES_SUFFIX = ".matches.tsv";
  public static final String REPORT_SUFFIX = ".report.json";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class finds the peaks of an X-ray diffraction curve and identifies them against reference phases.  ",
      "References may be raw cards (-r), extracted reference files (-e) or a directory of extracted files (-d).  ",
      "Detected peaks, matches and a JSON report are written using the output prefix.  Without usable references ",
      "the detected peaks are still written."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("data file")
        .desc("The experimental diffraction curve to analyze")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_REFERENCE)
        .argName("card files")
        .desc("Raw reference cards, one phase per card; at most 20 are used")
        .hasArgs().valueSeparator(',')
        .longOpt("reference")
    );
    add(Option.builder(OPTION_EXTRACTED)
        .argName("reference files")
        .desc("Extracted reference files (angle,phase,symbol lines)")
        .hasArgs().valueSeparator(',')
        .longOpt("extracted")
    );
    add(Option.builder(OPTION_REFERENCE_DIR)
        .argName("directory")
        .desc("A directory whose reference_*.txt files are loaded as extracted references")
        .hasArg()
        .longOpt("reference-dir")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("config file")
        .desc("A JSON file of analysis parameters; missing keys keep their defaults")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_POLICY)
        .argName("policy")
        .desc("Match policy, overriding the configuration: phase_first or peak_first")
        .hasArg()
        .longOpt("policy")
    );
    add(Option.builder(OPTION_OUTPUT_PREFIX)
        .argName("output prefix")
        .desc("A prefix for the peak table, match table and JSON report")
        .hasArg().required()
        .longOpt("output")
    );
  }};

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(XrdPhaseIdentifier.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    File inputFile = new File(cl.getOptionValue(OPTION_INPUT));
    if (!inputFile.exists()) {
      cliUtil.failWithMessage("Input file %s does not exist", inputFile.getAbsolutePath());
    }

    AnalysisParameters params = new AnalysisParameters();
    if (cl.hasOption(OPTION_CONFIG)) {
      params = AnalysisParameters.fromJsonFile(new File(cl.getOptionValue(OPTION_CONFIG)));
    }
    if (cl.hasOption(OPTION_POLICY)) {
      try {
        params.setMatchPolicy(MatchPolicy.fromName(cl.getOptionValue(OPTION_POLICY)));
      } catch (IllegalArgumentException e) {
        cliUtil.failWithMessage(e.getMessage());
      }
    }
    List<String> problems = params.validate();
    if (!problems.isEmpty()) {
      cliUtil.failWithMessage("Invalid analysis parameters: %s", StringUtils.join(problems, "; "));
    }

    ReferenceCatalog catalog = loadCatalog(cl);

    XrdAnalysisPipeline pipeline = new XrdAnalysisPipeline();
    AnalysisResult result;
    try {
      result = pipeline.run(inputFile, catalog, params);
    } catch (IngestFormatException | DataInsufficientException e) {
      LOGGER.error("Unable to analyze %s: %s", inputFile.getAbsolutePath(), e.getMessage());
      System.exit(1);
      return;
    }

    String prefix = cl.getOptionValue(OPTION_OUTPUT_PREFIX);
    writeOutputs(prefix, result, catalog);
    LOGGER.info("Done");
  }

  /**
   * Loads every reference source named on the command line into one catalog.  Raw cards come first, then extracted
   * files.  A source that yields nothing is logged; an empty catalog is returned if none yield anything.
   */
  static ReferenceCatalog loadCatalog(CommandLine cl) throws IOException {
    ReferenceCatalog catalog = ReferenceCatalog.empty();

    if (cl.hasOption(OPTION_REFERENCE)) {
      List<File> cards = toFiles(cl.getOptionValues(OPTION_REFERENCE));
      try {
        catalog = catalog.merge(new ReferenceCatalogBuilder().build(cards));
      } catch (NoReferenceDataException e) {
        LOGGER.warn("No raw reference cards could be used: %s", e.getMessage());
      }
    }

    ExtractedReferenceParser parser = new ExtractedReferenceParser();
    List<File> extracted = new ArrayList<>();
    if (cl.hasOption(OPTION_EXTRACTED)) {
      extracted.addAll(toFiles(cl.getOptionValues(OPTION_EXTRACTED)));
    }
    if (cl.hasOption(OPTION_REFERENCE_DIR)) {
      extracted.addAll(parser.discover(new File(cl.getOptionValue(OPTION_REFERENCE_DIR))));
    }
    if (!extracted.isEmpty()) {
      catalog = catalog.merge(parser.parse(extracted));
    }

    LOGGER.info("Reference catalog: %d peaks from %d phases", catalog.size(), catalog.getPhaseIds().size());
    return catalog;
  }

  static void writeOutputs(String prefix, AnalysisResult result, ReferenceCatalog catalog) throws IOException {
    MatchTableWriter tableWriter = new MatchTableWriter();
    File peaksFile = new File(prefix + PEAKS_SUFFIX);
    tableWriter.writePeaks(peaksFile, result.getDetectedPeaks(), result.getMatchSet());
    LOGGER.info("Wrote %d detected peaks to %s", result.getDetectedPeaks().size(), peaksFile.getAbsolutePath());

    if (result.isPhaseIdentificationAvailable()) {
      File matchesFile = new File(prefix + MATCHES_SUFFIX);
      tableWriter.writeMatches(matchesFile, result.getMatchSet());
      LOGGER.info("Wrote %d matches to %s", result.getMatchSet().getMatches().size(), matchesFile.getAbsolutePath());

      for (String line : new AnalysisSummaryFormatter().format(result.getMatchSet(), catalog)) {
        LOGGER.info("%s", line);
      }
    } else {
      LOGGER.info("No phase identification available; only detected peaks were written");
    }

    File reportFile = new File(prefix + REPORT_SUFFIX);
    OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(reportFile, result);
    LOGGER.info("Wrote analysis report to %s", reportFile.getAbsolutePath());
  }

  private static List<File> toFiles(String[] paths) {
    List<File> files = new ArrayList<>(paths.length);
    for (String path : paths) {
      files.add(new File(path));
    }
    return files;
  }
}
