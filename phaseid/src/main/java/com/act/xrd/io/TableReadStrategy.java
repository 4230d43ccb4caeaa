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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * One way of reading a two-column numeric table out of a text file: a fixed delimiter, header length, column pair and
 * charset.  Text following a '#' on any line is treated as a comment; blank lines are ignored.
 *
 * A strategy either produces a table in which every present value is numeric, or fails with an
 * {@link IngestFormatException}.  Fields that are absent (short rows, empty cells, NaN) are reported as null so that
 * downstream cleaning can drop them.
 */
public class TableReadStrategy {
  private static final char COMMENT_MARKER = '#';

  private ColumnDelimiter delimiter;
  private Integer linesToSkip;
  private Pair<Integer, Integer> columns;
  private Charset charset;

  public TableReadStrategy(ColumnDelimiter delimiter, Integer linesToSkip, Pair<Integer, Integer> columns,
                           Charset charset) {
    this.delimiter = delimiter;
    this.linesToSkip = Math.max(0, linesToSkip);
    this.columns = columns;
    this.charset = charset;
  }

  public static TableReadStrategy fromFormat(TabularFormat format) {
    return new TableReadStrategy(format.getDelimiter(), format.getHeaderLinesToSkip(), format.getColumns(),
        format.getCharset());
  }

  public TableReadStrategy withCharset(Charset otherCharset) {
    return new TableReadStrategy(delimiter, linesToSkip, columns, otherCharset);
  }

  public List<Pair<Double, Double>> read(File file) throws IOException, IngestFormatException {
    List<String> body = new ArrayList<>();
    List<Integer> lineNumbers = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file.toPath(), charset)) {
      int lineNumber = 0;
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (lineNumber <= linesToSkip) {
          continue;
        }
        if (lineNumber == 1) {
          line = StringUtils.removeStart(line, TabularFormatDetector.BYTE_ORDER_MARK);
        }
        String content = stripComment(line);
        if (content.trim().isEmpty()) {
          continue;
        }
        body.add(content);
        lineNumbers.add(lineNumber);
      }
    } catch (CharacterCodingException e) {
      throw new IngestFormatException(String.format("Unable to decode %s as %s", file.getName(), charset.name()), e);
    }

    List<Pair<Double, Double>> rows = delimiter == ColumnDelimiter.WHITESPACE ?
        readWhitespaceDelimited(file, body, lineNumbers) :
        readCharacterDelimited(file, body, lineNumbers);

    boolean hasCompleteRow = false;
    for (Pair<Double, Double> row : rows) {
      if (row.getLeft() != null && row.getRight() != null) {
        hasCompleteRow = true;
        break;
      }
    }
    if (!hasCompleteRow) {
      throw new IngestFormatException(String.format("No complete numeric rows found in %s using %s",
          file.getName(), this));
    }
    return rows;
  }

  private List<Pair<Double, Double>> readWhitespaceDelimited(File file, List<String> body, List<Integer> lineNumbers)
      throws IngestFormatException {
    List<Pair<Double, Double>> rows = new ArrayList<>(body.size());
    for (int i = 0; i < body.size(); i++) {
      String[] fields = delimiter.split(body.get(i));
      rows.add(toRow(file, fields, lineNumbers.get(i)));
    }
    return rows;
  }

  private List<Pair<Double, Double>> readCharacterDelimited(File file, List<String> body, List<Integer> lineNumbers)
      throws IOException, IngestFormatException {
    CSVFormat format = CSVFormat.newFormat(delimiter.getCharacter()).
        withQuote('"').withIgnoreSurroundingSpaces(true).withIgnoreEmptyLines(true);

    List<Pair<Double, Double>> rows = new ArrayList<>(body.size());
    try (CSVParser parser = CSVParser.parse(String.join("\n", body), format)) {
      int i = 0;
      for (CSVRecord record : parser) {
        String[] fields = new String[record.size()];
        for (int j = 0; j < record.size(); j++) {
          fields[j] = record.get(j);
        }
        int lineNumber = i < lineNumbers.size() ? lineNumbers.get(i) : -1;
        rows.add(toRow(file, fields, lineNumber));
        i++;
      }
    } catch (IllegalStateException | UncheckedIOException e) {
      // commons-csv signals malformed quoting through unchecked exceptions while iterating.
      throw new IngestFormatException(String.format("Malformed delimited text in %s: %s", file.getName(),
          e.getMessage()), e);
    }
    return rows;
  }

  private Pair<Double, Double> toRow(File file, String[] fields, int lineNumber) throws IngestFormatException {
    Double angle = parseField(file, fields, columns.getLeft(), lineNumber);
    Double intensity = parseField(file, fields, columns.getRight(), lineNumber);
    return Pair.of(angle, intensity);
  }

  private Double parseField(File file, String[] fields, int column, int lineNumber) throws IngestFormatException {
    if (column >= fields.length) {
      return null;
    }
    String field = fields[column].trim();
    if (field.isEmpty()) {
      return null;
    }
    try {
      Double value = Double.valueOf(field);
      return value.isNaN() ? null : value;
    } catch (NumberFormatException e) {
      throw new IngestFormatException(String.format("Non-numeric value '%s' in column %d at line %d of %s",
          field, column, lineNumber, file.getName()));
    }
  }

  private static String stripComment(String line) {
    int idx = line.indexOf(COMMENT_MARKER);
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  public ColumnDelimiter getDelimiter() {
    return delimiter;
  }

  public Integer getLinesToSkip() {
    return linesToSkip;
  }

  public Pair<Integer, Integer> getColumns() {
    return columns;
  }

  public Charset getCharset() {
    return charset;
  }

  @Override
  public String toString() {
    return String.format("%s delimited, skip %d, columns [%d, %d], %s",
        delimiter, linesToSkip, columns.getLeft(), columns.getRight(), charset.name());
  }
}
