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

package com.act.xrd.io;

import org.apache.commons.lang3.tuple.Pair;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * A best-effort guess at how a loosely structured text table is laid out.  Callers should treat this as a hint: the
 * reader retries with other layouts when this one does not yield a numeric two-column table.
 */
public class TabularFormat {
  public static final Integer FALLBACK_HEADER_LINES = 20;
  public static final Pair<Integer, Integer> FALLBACK_COLUMNS = Pair.of(0, 1);

  private Integer headerLinesToSkip;
  private Pair<Integer, Integer> columns;
  private ColumnDelimiter delimiter;
  private Charset charset;

  public TabularFormat(Integer headerLinesToSkip, Pair<Integer, Integer> columns, ColumnDelimiter delimiter,
                       Charset charset) {
    this.headerLinesToSkip = headerLinesToSkip;
    this.columns = columns;
    this.delimiter = delimiter;
    this.charset = charset;
  }

  public static TabularFormat fallback(Charset charset) {
    return new TabularFormat(FALLBACK_HEADER_LINES, FALLBACK_COLUMNS, ColumnDelimiter.WHITESPACE, charset);
  }

  public static TabularFormat fallback() {
    return fallback(StandardCharsets.UTF_8);
  }

  public Integer getHeaderLinesToSkip() {
    return headerLinesToSkip;
  }

  public Pair<Integer, Integer> getColumns() {
    return columns;
  }

  public ColumnDelimiter getDelimiter() {
    return delimiter;
  }

  public Charset getCharset() {
    return charset;
  }

  @Override
  public String toString() {
    return String.format("skip %d lines, columns [%d, %d], %s delimited, %s",
        headerLinesToSkip, columns.getLeft(), columns.getRight(), delimiter, charset.name());
  }
}
