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

import java.util.regex.Pattern;

public enum ColumnDelimiter {
  TAB('\t'),
  COMMA(','),
  // Runs of spaces and/or tabs.
  WHITESPACE(null);

  private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

  private final Character character;

  ColumnDelimiter(Character character) {
    this.character = character;
  }

  /**
   * @return The delimiting character, or null for whitespace-delimited text.
   */
  public Character getCharacter() {
    return character;
  }

  /**
   * Picks a delimiter for a single line of text: tab if present, else comma, else whitespace.
   */
  public static ColumnDelimiter sniff(String line) {
    if (line.indexOf('\t') >= 0) {
      return TAB;
    }
    if (line.indexOf(',') >= 0) {
      return COMMA;
    }
    return WHITESPACE;
  }

  /**
   * Splits a line into trimmed fields.  Empty fields between two delimiters are preserved for tab and comma splits.
   */
  public String[] split(String line) {
    String[] parts;
    if (this == WHITESPACE) {
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        return new String[0];
      }
      parts = WHITESPACE_PATTERN.split(trimmed);
    } else {
      parts = line.split(Pattern.quote(String.valueOf(character)), -1);
    }
    for (int i = 0; i < parts.length; i++) {
      parts[i] = parts[i].trim();
    }
    return parts;
  }
}
