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
import com.act.xrd.io.TabularReader;
import com.act.xrd.matching.MatchPolicy;
import com.act.xrd.matching.MatchSet;
import com.act.xrd.matching.NoReferenceDataException;
import com.act.xrd.matching.PeakMatcher;
import com.act.xrd.peaks.AdaptivePeakDetector;
import com.act.xrd.peaks.DetectedPeak;
import com.act.xrd.peaks.PeakThresholds;
import com.act.xrd.processing.DataInsufficientException;
import com.act.xrd.processing.SeriesCleaner;
import com.act.xrd.reference.ReferenceCatalog;
import com.act.xrd.report.MatchReport;
import com.act.xrd.report.StatisticsAggregator;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Runs the analysis stages in sequence: ingest, clean, detect, match, summarize.  Every stage gets its parameters
 * explicitly; nothing is shared between runs.
 */
public class XrdAnalysisPipeline {
  private static final Logger LOGGER = LogManager.getFormatterLogger(XrdAnalysisPipeline.class);

  private TabularReader reader;
  private SeriesCleaner cleaner;
  private AdaptivePeakDetector detector;
  private StatisticsAggregator aggregator;

  public XrdAnalysisPipeline() {
    this(new TabularReader(), new SeriesCleaner(), new AdaptivePeakDetector(), new StatisticsAggregator());
  }

  public XrdAnalysisPipeline(TabularReader reader, SeriesCleaner cleaner, AdaptivePeakDetector detector,
                             StatisticsAggregator aggregator) {
    this.reader = reader;
    this.cleaner = cleaner;
    this.detector = detector;
    this.aggregator = aggregator;
  }

  /**
   * Reads and cleans an experimental curve.
   * @throws IngestFormatException If the file cannot be read as a numeric table.
   * @throws DataInsufficientException If too few valid points remain after cleaning.
   */
  public Sample loadSample(File dataFile, AnalysisParameters params)
      throws IOException, IngestFormatException, DataInsufficientException {
    List<Pair<Double, Double>> rows = reader.readExperimentalData(dataFile);
    LOGGER.info("Read %d rows from %s", rows.size(), dataFile.getName());
    return cleaner.clean(rows, params);
  }

  /**
   * Detects peaks and, when the catalog has peaks, matches them.  An empty catalog is not an error here: the result
   * then carries the detected peaks and states that no phase identification is available.
   * @throws com.act.xrd.matching.InvalidToleranceException If the match tolerance is not positive.
   */
  public AnalysisResult analyze(Sample sample, ReferenceCatalog catalog, AnalysisParameters params) {
    PeakThresholds thresholds = detector.computeThresholds(sample, params);
    List<DetectedPeak> peaks = detector.detect(sample, thresholds);

    MatchPolicy policy = params.getMatchPolicy() == null ? MatchPolicy.PHASE_FIRST : params.getMatchPolicy();
    PeakMatcher matcher = policy.newMatcher();
    MatchSet matchSet;
    try {
      matchSet = matcher.match(peaks, catalog, params.getMatchTolerance());
    } catch (NoReferenceDataException e) {
      LOGGER.warn("No phase identification available: %s", e.getMessage());
      return AnalysisResult.detectionOnly(sample, thresholds, peaks, e.getMessage());
    }

    MatchReport report = aggregator.aggregate(peaks.size(), matchSet);
    LOGGER.info("Matched %d of %d peaks (%.1f%%)", report.getMatchedPeaks(), report.getTotalPeaks(),
        report.getMatchRate());
    return AnalysisResult.withMatches(sample, thresholds, peaks, matchSet, report);
  }

  public AnalysisResult run(File dataFile, ReferenceCatalog catalog, AnalysisParameters params)
      throws IOException, IngestFormatException, DataInsufficientException {
    return analyze(loadSample(dataFile, params), catalog, params);
  }
}
