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

/**
 * Thrown when too few valid readings survive cleaning for a curve to be analyzed.
 */
public class DataInsufficientException extends Exception {
  private final int validPoints;
  private final int requiredPoints;

  public DataInsufficientException(int validPoints, int requiredPoints) {
    super(String.format("Only %d valid data points after cleaning, at least %d are required",
        validPoints, requiredPoints));
    this.validPoints = validPoints;
    this.requiredPoints = requiredPoints;
  }

  public int getValidPoints() {
    return validPoints;
  }

  public int getRequiredPoints() {
    return requiredPoints;
  }
}
