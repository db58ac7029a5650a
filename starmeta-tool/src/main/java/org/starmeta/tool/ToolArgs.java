/**
 * starmeta: STAR metadata toolkit.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of starmeta.
 *
 * starmeta is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.starmeta.tool;

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Splitter;
import com.google.common.primitives.Doubles;

/**
 * Helpers for parsing values of command line options.
 *
 * @author Bastian Gloeckle
 */
public class ToolArgs {
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  /**
   * @return The comma separated values.
   */
  public static List<String> parseList(String value) {
    return LIST_SPLITTER.splitToList(value);
  }

  /**
   * @throws ToolExecutionException
   *           if a value is no number.
   */
  public static double[] parseDoubles(String optionName, String value) throws ToolExecutionException {
    List<Double> res = parseList(value).stream().map(Doubles::tryParse).collect(Collectors.toList());
    if (res.contains(null))
      throw new ToolExecutionException("Invalid numbers for option '" + optionName + "': " + value);
    return Doubles.toArray(res);
  }

  /**
   * @throws ToolExecutionException
   *           if the value is no number.
   */
  public static double parseDouble(String optionName, String value) throws ToolExecutionException {
    Double res = Doubles.tryParse(value.trim());
    if (res == null)
      throw new ToolExecutionException("Invalid number for option '" + optionName + "': " + value);
    return res;
  }

  private ToolArgs() {
  }
}
