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

package com.act.xrd.processing;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Local least-squares polynomial smoothing over a sliding, centered window.
 *
 * Interior points are replaced by the value at the window center of a polynomial fit to the surrounding window.  The
 * first and last half-windows are evaluated on the polynomial fit to the first and last full windows respectively, so
 * the output has the same length as the input and no padding values are invented.
 */
public class SavitzkyGolayFilter {
  private int windowLength;
  private int polynomialOrder;
  private int halfWindow;

  // Rows are polynomial coefficients, columns are window positions: coefficients = projection * window.
  private RealMatrix projection;

  public SavitzkyGolayFilter(int windowLength, int polynomialOrder) {
    if (windowLength < 1 || windowLength % 2 == 0) {
      throw new IllegalArgumentException(String.format("Window length must be a positive odd number, got %d",
          windowLength));
    }
    if (polynomialOrder < 0 || polynomialOrder >= windowLength) {
      throw new IllegalArgumentException(String.format("Polynomial order %d must be in [0, %d)",
          polynomialOrder, windowLength));
    }
    this.windowLength = windowLength;
    this.polynomialOrder = polynomialOrder;
    this.halfWindow = windowLength / 2;
    this.projection = buildProjection();
  }

  /**
   * Computes the least squares pseudo-inverse of the Vandermonde matrix over offsets [-halfWindow, halfWindow].
   */
  private RealMatrix buildProjection() {
    double[][] vandermonde = new double[windowLength][polynomialOrder + 1];
    for (int i = 0; i < windowLength; i++) {
      double offset = i - halfWindow;
      double power = 1.0;
      for (int k = 0; k <= polynomialOrder; k++) {
        vandermonde[i][k] = power;
        power *= offset;
      }
    }
    return new SingularValueDecomposition(new Array2DRowRealMatrix(vandermonde, false)).getSolver().getInverse();
  }

  public double[] smooth(double[] values) {
    if (values.length < windowLength) {
      throw new IllegalArgumentException(String.format("Need at least %d values to smooth, got %d",
          windowLength, values.length));
    }

    double[] result = new double[values.length];
    for (int center = halfWindow; center < values.length - halfWindow; center++) {
      result[center] = evaluate(fit(values, center - halfWindow), 0);
    }

    double[] head = fit(values, 0);
    for (int i = 0; i < halfWindow; i++) {
      result[i] = evaluate(head, i - halfWindow);
    }
    int lastWindowStart = values.length - windowLength;
    double[] tail = fit(values, lastWindowStart);
    for (int i = values.length - halfWindow; i < values.length; i++) {
      result[i] = evaluate(tail, i - lastWindowStart - halfWindow);
    }
    return result;
  }

  private double[] fit(double[] values, int windowStart) {
    double[] coefficients = new double[polynomialOrder + 1];
    for (int k = 0; k <= polynomialOrder; k++) {
      double sum = 0.0;
      for (int j = 0; j < windowLength; j++) {
        sum += projection.getEntry(k, j) * values[windowStart + j];
      }
      coefficients[k] = sum;
    }
    return coefficients;
  }

  private static double evaluate(double[] coefficients, double offset) {
    // Horner's rule.
    double value = 0.0;
    for (int k = coefficients.length - 1; k >= 0; k--) {
      value = value * offset + coefficients[k];
    }
    return value;
  }

  public int getWindowLength() {
    return windowLength;
  }

  public int getPolynomialOrder() {
    return polynomialOrder;
  }
}
