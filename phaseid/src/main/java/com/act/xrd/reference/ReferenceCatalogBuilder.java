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
import com.act.xrd.io.TabularReader;
import com.act.xrd.matching.NoReferenceDataException;
import com.act.xrd.processing.SeriesCleaner;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Builds a {@link ReferenceCatalog} from raw reference cards.  Each card becomes one phase, named after the card's
 * file name and labelled with the symbol at the card's position in {@link #SYMBOLS}.  Cards beyond the symbol pool are
 * skipped; cards that cannot be read are logged and left out.
 */
public class ReferenceCatalogBuilder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReferenceCatalogBuilder.class);

  public static final List<String> SYMBOLS = Collections.unmodifiableList(Arrays.asList(
      "①", "②", "③", "④", "⑤", "⑥", "⑦", "⑧", "⑨", "⑩",
      "⑪", "⑫", "⑬", "⑭", "⑮", "⑯", "⑰", "⑱", "⑲", "⑳"
  ));

  private TabularReader reader;

  public ReferenceCatalogBuilder() {
    this(new TabularReader());
  }

  public ReferenceCatalogBuilder(TabularReader reader) {
    this.reader = reader;
  }

  /**
   * Reads every card and merges their peaks into a single catalog, in card order.
   * @param cardFiles The raw cards to load; at most {@link #SYMBOLS}.size() are used.
   * @return A catalog holding the peaks of every card that could be read.
   * @throws NoReferenceDataException If no card produced any peaks.
   */
  public ReferenceCatalog build(List<File> cardFiles) throws NoReferenceDataException {
    List<ReferencePeak> peaks = new ArrayList<>();
    List<String> loadedPhases = new ArrayList<>();

    for (int i = 0; i < cardFiles.size(); i++) {
      File card = cardFiles.get(i);
      if (i >= SYMBOLS.size()) {
        LOGGER.warn("Only %d reference symbols are available, ignoring %d remaining cards starting with %s",
            SYMBOLS.size(), cardFiles.size() - i, card.getName());
        break;
      }

      String phaseId = phaseIdForCard(card);
      try {
        List<ReferencePeak> cardPeaks = readCard(card, phaseId, SYMBOLS.get(i));
        peaks.addAll(cardPeaks);
        loadedPhases.add(phaseId);
        LOGGER.info("Loaded %d reference peaks for phase %s from %s", cardPeaks.size(), phaseId, card.getName());
      } catch (IOException | IngestFormatException e) {
        LOGGER.error("Unable to load reference card %s: %s", card.getAbsolutePath(), e.getMessage());
      }
    }

    if (peaks.isEmpty()) {
      throw new NoReferenceDataException(String.format("None of the %d reference cards yielded usable peaks",
          cardFiles.size()));
    }

    LOGGER.info("Reference catalog holds %d peaks from phases %s", peaks.size(), loadedPhases);
    return new ReferenceCatalog(peaks);
  }

  /**
   * Reads one card.  A read layout that parses but leaves no usable rows after cleaning is treated as a failed
   * layout, so the next one is tried.
   */
  List<ReferencePeak> readCard(File card, String phaseId, String symbol) throws IOException, IngestFormatException {
    List<Pair<Double, Double>> rows = reader.readReferenceCard(card, r -> !cleanCardRows(r).isEmpty());

    List<ReferencePeak> peaks = new ArrayList<>();
    for (Pair<Double, Double> row : cleanCardRows(rows)) {
      peaks.add(new ReferencePeak(row.getLeft(), row.getRight(), phaseId, symbol));
    }
    return peaks;
  }

  /**
   * Drops rows with missing or non-physical values and sorts by angle.  Repeated angles are kept and the card is
   * never smoothed.
   */
  static List<Pair<Double, Double>> cleanCardRows(List<Pair<Double, Double>> rows) {
    List<Pair<Double, Double>> clean = new ArrayList<>(rows.size());
    for (Pair<Double, Double> row : rows) {
      Double angle = row.getLeft();
      Double intensity = row.getRight();
      if (angle == null || intensity == null || angle.isNaN() || intensity.isNaN()) {
        continue;
      }
      if (SeriesCleaner.isPhysical(angle, intensity)) {
        clean.add(row);
      }
    }
    clean.sort(Comparator.comparing(Pair::getLeft));
    return clean;
  }

  /**
   * The phase id of a raw card is its file name up to the first '.'.
   */
  static String phaseIdForCard(File card) {
    String name = card.getName();
    int dot = name.indexOf('.');
    return dot >= 0 ? name.substring(0, dot) : name;
  }
}
