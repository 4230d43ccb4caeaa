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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class StatisticsAggregator {

  /**
   * Summarizes a match set.  Phases with equal counts keep the order of their first match.
   * @param totalDetected The number of detected peaks that were matched against.
   * @param matchSet The matches.
   * @return Match counts, the overall match rate and a per-phase breakdown.
   */
  public MatchReport aggregate(int totalDetected, MatchSet matchSet) {
    List<Match> matches = matchSet.getMatches();
    int matched = matches.size();
    double matchRate = totalDetected > 0 ? matched * 100.0 / totalDetected : 0.0;

    Map<String, Integer> counts = new LinkedHashMap<>();
    for (Match m : matches) {
      counts.merge(m.getReference().getPhaseId(), 1, Integer::sum);
    }

    List<PhaseStatistics> phases = new ArrayList<>(counts.size());
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      phases.add(new PhaseStatistics(entry.getKey(), entry.getValue(), entry.getValue() * 100.0 / matched));
    }
    phases.sort(Comparator.comparing(PhaseStatistics::getCount).reversed());

    return new MatchReport(totalDetected, matched, matchRate, phases);
  }
}
