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
package org.starmeta.loader;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.starmeta.data.ColumnType;
import org.starmeta.data.schema.StarField;

import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;

/**
 * Contains information about the type of each column for the parser.
 *
 * <p>
 * The types of all fields that have a fixed type in {@link StarField} are registered automatically. The type of all
 * other columns is inferred from the raw values: {@link ColumnType#LONG} if all values are integral,
 * {@link ColumnType#DOUBLE} if all values are numbers and {@link ColumnType#STRING} otherwise.
 *
 * <p>
 * Missing numeric values are encoded as "nan" in STAR files, infinite values as "inf"/"-inf".
 *
 * @author Bastian Gloeckle
 */
public class StarColumnInfo {
  private static final Function<String[], Object[]> STRING_COL_FN = sa -> {
    Object[] res = new Object[sa.length];
    System.arraycopy(sa, 0, res, 0, sa.length);
    return res;
  };
  private static final Function<String[], Object[]> LONG_COL_FN = sa -> {
    Object[] res = new Object[sa.length];
    for (int i = 0; i < sa.length; i++)
      res[i] = isMissing(sa[i]) ? null : parseLong(sa[i]);
    return res;
  };
  private static final Function<String[], Object[]> DOUBLE_COL_FN = sa -> {
    Object[] res = new Object[sa.length];
    for (int i = 0; i < sa.length; i++)
      res[i] = isMissing(sa[i]) ? null : parseDouble(sa[i]);
    return res;
  };

  private Map<String, ColumnType> columnType = new HashMap<>();

  /**
   * Create new {@link StarColumnInfo} with the fixed types of all {@link StarField}s registered.
   */
  public StarColumnInfo() {
    for (StarField field : StarField.values())
      field.getFixedType().ifPresent(type -> registerColumnType(field.getFieldName(), type));
  }

  /**
   * Register a specific column type for a column, disabling type inference of that column.
   */
  public void registerColumnType(String colName, ColumnType columnType) {
    this.columnType.put(colName, columnType);
  }

  /**
   * @return The registered {@link ColumnType} for the given column, empty if the type will be inferred.
   */
  public Optional<ColumnType> getRegisteredColumnType(String colName) {
    return Optional.ofNullable(columnType.get(colName));
  }

  /**
   * @return The type of the given column, which is either the registered one or the one inferred from the raw values.
   */
  public ColumnType getFinalColumnType(String colName, String[] rawValues) {
    ColumnType registered = columnType.get(colName);
    if (registered != null)
      return registered;
    return inferColumnType(rawValues);
  }

  /**
   * Return the transformation function for a given column type, transforming each input string into a result object
   * according to the {@link ColumnType}.
   *
   * <p>
   * The function throws {@link NumberFormatException} if a value cannot be parsed.
   */
  public Function<String[], Object[]> getTransformationFunction(ColumnType type) {
    switch (type) {
    case LONG:
      return LONG_COL_FN;
    case DOUBLE:
      return DOUBLE_COL_FN;
    default:
      return STRING_COL_FN;
    }
  }

  /**
   * @return The narrowest type all of the given raw values can be represented with.
   */
  public static ColumnType inferColumnType(String[] rawValues) {
    boolean allLong = true;
    for (String s : rawValues) {
      if (isMissing(s)) {
        allLong = false;
        continue;
      }
      if (allLong && Longs.tryParse(s) != null)
        continue;
      allLong = false;
      if (tryParseDouble(s) == null)
        return ColumnType.STRING;
    }
    return allLong ? ColumnType.LONG : ColumnType.DOUBLE;
  }

  private static boolean isMissing(String s) {
    return "nan".equalsIgnoreCase(s);
  }

  private static Double tryParseDouble(String s) {
    if ("inf".equalsIgnoreCase(s) || "+inf".equalsIgnoreCase(s))
      return Double.POSITIVE_INFINITY;
    if ("-inf".equalsIgnoreCase(s))
      return Double.NEGATIVE_INFINITY;
    return Doubles.tryParse(s);
  }

  private static Long parseLong(String s) throws NumberFormatException {
    Long res = Longs.tryParse(s);
    if (res == null)
      throw new NumberFormatException("Not an integer: '" + s + "'");
    return res;
  }

  private static Double parseDouble(String s) throws NumberFormatException {
    Double res = tryParseDouble(s);
    if (res == null)
      throw new NumberFormatException("Not a number: '" + s + "'");
    return res;
  }
}
