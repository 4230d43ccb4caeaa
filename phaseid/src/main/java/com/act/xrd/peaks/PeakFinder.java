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

package com.act.xrd.peaks;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds local maxima in a one-dimensional signal and filters them, in this order, by height, minimum separation,
 * prominence and width.
 *
 * A local maximum is a sample (or the middle sample of a flat run) that is strictly higher than both neighbors; the
 * first and last samples are never maxima.  Separation is enforced by visiting maxima from highest to lowest and
 * discarding every lower maximum closer than the required distance; equal heights are visited left to right.
 * Prominence is the drop from the peak to the higher of the two lowest points found before the signal rises above the
 * peak again (or reaches its end) on either side.  Width is measured in samples at half the prominence, with linear
 * interpolation between samples.
 */
public class PeakFinder {
  public static final Double WIDTH_RELATIVE_HEIGHT = 0.5;

  static class Prominence {
    final double value;
    final int leftBase;
    final int rightBase;

    Prominence(double value, int leftBase, int rightBase) {
      this.value = value;
      this.leftBase = leftBase;
      this.rightBase = rightBase;
    }
  }

  /**
   * @param signal The signal to search.
   * @param thresholds Minimum height, distance, prominence and width; any null threshold is not applied.
   * @return Indices of qualifying peaks in ascending order.
   */
  public List<Integer> findPeaks(double[] signal, PeakThresholds thresholds) {
    List<Integer> peaks = localMaxima(signal);

    if (thresholds.getHeight() != null) {
      List<Integer> tallEnough = new ArrayList<>(peaks.size());
      for (Integer p : peaks) {
        if (signal[p] >= thresholds.getHeight()) {
          tallEnough.add(p);
        }
      }
      peaks = tallEnough;
    }

    if (thresholds.getDistance() != null) {
      if (thresholds.getDistance() < 1) {
        throw new IllegalArgumentException(String.format("Peak distance must be at least 1, got %d",
            thresholds.getDistance()));
      }
      peaks = selectByDistance(signal, peaks, thresholds.getDistance());
    }

    if (thresholds.getProminence() == null && thresholds.getWidth() == null) {
      return peaks;
    }

    List<Integer> selected = new ArrayList<>(peaks.size());
    for (Integer p : peaks) {
      Prominence prominence = prominence(signal, p);
      if (thresholds.getProminence() != null && prominence.value < thresholds.getProminence()) {
        continue;
      }
      if (thresholds.getWidth() != null && width(signal, p, prominence) < thresholds.getWidth()) {
        continue;
      }
      selected.add(p);
    }
    return selected;
  }

  static List<Integer> localMaxima(double[] x) {
    List<Integer> maxima = new ArrayList<>();
    int last = x.length - 1;
    int i = 1;
    while (i < last) {
      if (x[i - 1] < x[i]) {
        int ahead = i + 1;
        // Walk across a plateau.
        while (ahead < last && x[ahead] == x[i]) {
          ahead++;
        }
        if (x[ahead] < x[i]) {
          int leftEdge = i;
          int rightEdge = ahead - 1;
          maxima.add((leftEdge + rightEdge) / 2);
          i = ahead;
        }
      }
      i++;
    }
    return maxima;
  }

  static List<Integer> selectByDistance(double[] x, List<Integer> peaks, int distance) {
    int n = peaks.size();
    boolean[] keep = new boolean[n];
    List<Integer> byPriority = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      keep[i] = true;
      byPriority.add(i);
    }
    // Stable sort: equal heights keep their left-to-right order.
    byPriority.sort(Comparator.comparingDouble((Integer i) -> x[peaks.get(i)]).reversed());

    for (Integer j : byPriority) {
      if (!keep[j]) {
        continue;
      }
      for (int k = j - 1; k >= 0 && peaks.get(j) - peaks.get(k) < distance; k--) {
        keep[k] = false;
      }
      for (int k = j + 1; k < n && peaks.get(k) - peaks.get(j) < distance; k++) {
        keep[k] = false;
      }
    }

    List<Integer> kept = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      if (keep[i]) {
        kept.add(peaks.get(i));
      }
    }
    return kept;
  }

  static Prominence prominence(double[] x, int peak) {
    double leftMin = x[peak];
    int leftBase = peak;
    for (int i = peak; i >= 0 && x[i] <= x[peak]; i--) {
      if (x[i] < leftMin) {
        leftMin = x[i];
        leftBase = i;
      }
    }

    double rightMin = x[peak];
    int rightBase = peak;
    for (int i = peak; i < x.length && x[i] <= x[peak]; i++) {
      if (x[i] < rightMin) {
        rightMin = x[i];
        rightBase = i;
      }
    }

    return new Prominence(x[peak] - Math.max(leftMin, rightMin), leftBase, rightBase);
  }

  static double width(double[] x, int peak, Prominence prominence) {
    double height = x[peak] - prominence.value * WIDTH_RELATIVE_HEIGHT;

    int i = peak;
    while (prominence.leftBase < i && height < x[i]) {
      i--;
    }
    double leftPosition = i;
    if (x[i] < height) {
      leftPosition += (height - x[i]) / (x[i + 1] - x[i]);
    }

    i = peak;
    while (i < prominence.rightBase && height < x[i]) {
      i++;
    }
    double rightPosition = i;
    if (x[i] < height) {
      rightPosition -= (height - x[i]) / (x[i - 1] - x[i]);
    }

    return rightPosition - leftPosition;
  }
}
