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
import com.act.xrd.reference.ReferenceCatalog;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders a match set as human readable lines: one table row per identified phase with its strongest matched angles,
 * followed by the individual matches of each phase.
 */
public class AnalysisSummaryFormatter {
  public static final Integer STRONGEST_ANGLES_SHOWN = 3;
  public static final Integer MATCHES_SHOWN_PER_PHASE = 5;

  private static final String RULE = StringUtils.repeat('=', 60);

  public List<String> format(MatchSet matchSet, ReferenceCatalog catalog) {
    List<String> lines = new ArrayList<>();

    Set<String> identified = new LinkedHashSet<>();
    for (Match m : matchSet.getMatches()) {
      identified.add(m.getReference().getPhaseId());
    }
    if (identified.isEmpty()) {
      lines.add("No phases identified.");
      return lines;
    }

    lines.add(RULE);
    lines.add(String.format("Phases identified: %d", identified.size()));
    lines.add(String.format("Matched peaks: %d", matchSet.getMatches().size()));
    lines.add(String.format("Angle tolerance: +/-%s degrees", matchSet.getTolerance()));
    lines.add(String.format("%-20s %-6s %-8s %s", "Phase", "Symbol", "Matches", "Strongest peaks (2-theta)"));
    lines.add(StringUtils.repeat('-', 60));
    for (String phaseId : identified) {
      List<Match> phaseMatches = matchSet.getMatchesForPhase(phaseId);
      lines.add(String.format("%-20s %-6s %-8d %s", phaseId, symbolFor(phaseId, phaseMatches, catalog),
          phaseMatches.size(), strongestAngles(phaseMatches)));
    }
    lines.add(RULE);

    lines.add("Annotations:");
    for (String phaseId : identified) {
      List<Match> phaseMatches = matchSet.getMatchesForPhase(phaseId);
      lines.add(String.format("  Phase %s (%s):", phaseId, symbolFor(phaseId, phaseMatches, catalog)));
      for (Match m : phaseMatches.subList(0, Math.min(MATCHES_SHOWN_PER_PHASE, phaseMatches.size()))) {
        lines.add(String.format("    %.2f (reference %.2f, delta %.3f)", m.getDetected().getAngle(),
            m.getReference().getAngle(), m.getAngleDelta()));
      }
      if (phaseMatches.size() > MATCHES_SHOWN_PER_PHASE) {
        lines.add(String.format("    ... %d more matched peaks", phaseMatches.size() - MATCHES_SHOWN_PER_PHASE));
      }
    }
    return lines;
  }

  static String strongestAngles(List<Match> phaseMatches) {
    List<Match> byIntensity = new ArrayList<>(phaseMatches);
    byIntensity.sort(Comparator.comparing((Match m) -> m.getDetected().getIntensity()).reversed());
    List<String> angles = new ArrayList<>(STRONGEST_ANGLES_SHOWN);
    for (Match m : byIntensity.subList(0, Math.min(STRONGEST_ANGLES_SHOWN, byIntensity.size()))) {
      angles.add(String.format("%.2f", m.getDetected().getAngle()));
    }
    return StringUtils.join(angles, ", ");
  }

  private static String symbolFor(String phaseId, List<Match> phaseMatches, ReferenceCatalog catalog) {
    String symbol = catalog == null ? null : catalog.getSymbolForPhase(phaseId);
    if (symbol == null && !phaseMatches.isEmpty()) {
      symbol = phaseMatches.get(0).getReference().getSymbol();
    }
    return StringUtils.defaultString(symbol);
  }
}
