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
package org.starmeta.data;

import java.util.Arrays;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A single named column of a {@link StarTable}, holding one value per record.
 *
 * <p>
 * All values of a column are of the Java type matching the {@link ColumnType} of the column (String, Double or Long)
 * or <code>null</code>, which denotes a missing value.
 *
 * <p>
 * Instances are mutable, see {@link #set(int, Object)}. Use {@link #copy()} to get an independent instance.
 *
 * @author Bastian Gloeckle
 */
public class StarColumn {
  private final String name;
  private final ColumnType type;
  private final Object[] values;

  /**
   * Create a new column. The given array is taken over, not copied.
   *
   * @throws IllegalArgumentException
   *           if a value does not match the given type.
   */
  public StarColumn(String name, ColumnType type, Object[] values) {
    this.name = Preconditions.checkNotNull(name);
    this.type = Preconditions.checkNotNull(type);
    this.values = Preconditions.checkNotNull(values);
    for (int i = 0; i < values.length; i++)
      values[i] = coerce(values[i]);
  }

  public static StarColumn ofDoubles(String name, double[] values) {
    Object[] res = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      res[i] = Double.isNaN(values[i]) ? null : values[i];
    return new StarColumn(name, ColumnType.DOUBLE, res);
  }

  public static StarColumn ofLongs(String name, long[] values) {
    Object[] res = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      res[i] = values[i];
    return new StarColumn(name, ColumnType.LONG, res);
  }

  public static StarColumn ofStrings(String name, String... values) {
    return new StarColumn(name, ColumnType.STRING, Arrays.copyOf(values, values.length, Object[].class));
  }

  /**
   * @return A column with the given value for each of the "size" records.
   */
  public static StarColumn ofConstant(String name, ColumnType type, Object value, int size) {
    Object[] res = new Object[size];
    Arrays.fill(res, value);
    return new StarColumn(name, type, res);
  }

  /**
   * @return A column where all values are missing.
   */
  public static StarColumn ofMissing(String name, ColumnType type, int size) {
    return new StarColumn(name, type, new Object[size]);
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  /**
   * @return number of values.
   */
  public int size() {
    return values.length;
  }

  /**
   * @return The raw value, <code>null</code> if missing.
   */
  public Object get(int row) {
    return values[row];
  }

  public boolean isMissing(int row) {
    return values[row] == null;
  }

  /**
   * @return true if at least one value of this column is missing.
   */
  public boolean hasMissing() {
    for (Object o : values)
      if (o == null)
        return true;
    return false;
  }

  /**
   * @return The numeric value of the given row, {@link Double#NaN} if missing.
   * @throws IllegalStateException
   *           if this is a {@link ColumnType#STRING} column.
   */
  public double getDouble(int row) {
    if (type == ColumnType.STRING)
      throw new IllegalStateException("Column '" + name + "' is not numeric.");
    Object o = values[row];
    if (o == null)
      return Double.NaN;
    return ((Number) o).doubleValue();
  }

  /**
   * @return The value of the given row as long, rounding doubles towards zero.
   * @throws IllegalStateException
   *           if this is a {@link ColumnType#STRING} column or the value is missing.
   */
  public long getLong(int row) {
    if (type == ColumnType.STRING)
      throw new IllegalStateException("Column '" + name + "' is not numeric.");
    Object o = values[row];
    if (o == null)
      throw new IllegalStateException("Value " + row + " of column '" + name + "' is missing.");
    return ((Number) o).longValue();
  }

  /**
   * @return The value of the given row as String, <code>null</code> if missing. Numbers are formatted by
   *         {@link String#valueOf(Object)}.
   */
  public String getString(int row) {
    Object o = values[row];
    if (o == null)
      return null;
    return o.toString();
  }

  /**
   * Returns a value that is suitable to compare values of different columns for equality, e.g. when joining tables.
   *
   * <p>
   * Numeric values are returned as {@link Double}, so a {@link ColumnType#LONG} value 10 and a {@link ColumnType#DOUBLE}
   * value 10.0 compare equal.
   *
   * @return The comparable value, <code>null</code> if missing.
   */
  public Object getKeyValue(int row) {
    Object o = values[row];
    if (o == null || type == ColumnType.STRING)
      return o;
    return ((Number) o).doubleValue();
  }

  /**
   * Set a value. Numbers are converted to the type of this column, {@link Double#NaN} is stored as missing value.
   *
   * @throws IllegalArgumentException
   *           if the value cannot be represented in this column.
   */
  public void set(int row, Object value) {
    values[row] = coerce(value);
  }

  /**
   * Set a numeric value, {@link Double#NaN} is stored as missing value.
   */
  public void setDouble(int row, double value) {
    values[row] = coerce(value);
  }

  /**
   * @return All values as double array, missing values as {@link Double#NaN}.
   */
  public double[] toDoubleArray() {
    double[] res = new double[values.length];
    for (int i = 0; i < res.length; i++)
      res[i] = getDouble(i);
    return res;
  }

  /**
   * @return An independent copy of this column.
   */
  public StarColumn copy() {
    return new StarColumn(name, type, Arrays.copyOf(values, values.length));
  }

  /**
   * @return A copy of this column with a different name.
   */
  public StarColumn rename(String newName) {
    return new StarColumn(newName, type, Arrays.copyOf(values, values.length));
  }

  /**
   * @return A new column containing the values of the given rows, in the given order.
   */
  public StarColumn select(int[] rows) {
    Object[] res = new Object[rows.length];
    for (int i = 0; i < rows.length; i++)
      res[i] = values[rows[i]];
    return new StarColumn(name, type, res);
  }

  /**
   * @return A copy of this column with type {@link ColumnType#DOUBLE}. Returns a plain copy if this already is a double
   *         column.
   * @throws IllegalStateException
   *           if this is a {@link ColumnType#STRING} column.
   */
  public StarColumn toDoubleColumn() {
    if (type == ColumnType.STRING)
      throw new IllegalStateException("Column '" + name + "' is not numeric.");
    Object[] res = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      res[i] = (values[i] == null) ? null : ((Number) values[i]).doubleValue();
    return new StarColumn(name, ColumnType.DOUBLE, res);
  }

  /**
   * @return A copy of this column with type {@link ColumnType#STRING}.
   */
  public StarColumn toStringColumn() {
    Object[] res = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      res[i] = getString(i);
    return new StarColumn(name, ColumnType.STRING, res);
  }

  private Object coerce(Object value) {
    if (value == null)
      return null;

    switch (type) {
    case STRING:
      if (value instanceof String)
        return value;
      break;
    case DOUBLE:
      if (value instanceof Number) {
        double d = ((Number) value).doubleValue();
        return Double.isNaN(d) ? null : d;
      }
      break;
    case LONG:
      if (value instanceof Long)
        return value;
      if (value instanceof Integer || value instanceof Short || value instanceof Byte)
        return ((Number) value).longValue();
      if (value instanceof Number) {
        double d = ((Number) value).doubleValue();
        if (Double.isNaN(d))
          return null;
        if (d == Math.rint(d) && !Double.isInfinite(d))
          return (long) d;
      }
      break;
    }
    throw new IllegalArgumentException(
        "Value '" + value + "' cannot be stored in column '" + name + "' of type " + type);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StarColumn))
      return false;
    StarColumn other = (StarColumn) obj;
    return name.equals(other.name) && type == other.type && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, Arrays.hashCode(values));
  }

  @Override
  public String toString() {
    return "StarColumn[name=" + name + ", type=" + type + ", size=" + values.length + "]";
  }
}
