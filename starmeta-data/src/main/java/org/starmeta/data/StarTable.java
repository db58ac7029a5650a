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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntPredicate;

import org.starmeta.data.schema.StarField;

import com.google.common.base.Preconditions;

/**
 * An in-memory table of STAR metadata: an ordered set of uniquely named {@link StarColumn}s of equal length.
 *
 * <p>
 * Each row of the table is a "record", identified by its 0-based position. Which fields are available is not fixed,
 * but depends on the columns that are present - usually these are the fields defined in {@link StarField}.
 *
 * <p>
 * A {@link StarTable} is mutable. Operations that are not executed "in place" work on a {@link #copy()}.
 *
 * @author Bastian Gloeckle
 */
public class StarTable {
  private final Map<String, StarColumn> columns = new LinkedHashMap<>();

  private int numberOfRows;

  /**
   * Create an empty table which has the given number of records but no columns yet.
   */
  public StarTable(int numberOfRows) {
    Preconditions.checkArgument(numberOfRows >= 0, "Negative number of rows");
    this.numberOfRows = numberOfRows;
  }

  /**
   * Create a table from the given columns, which all need to have the same size. At least one column needs to be
   * provided.
   */
  public StarTable(Collection<StarColumn> columns) {
    Preconditions.checkArgument(!columns.isEmpty(), "No columns provided");
    this.numberOfRows = columns.iterator().next().size();
    for (StarColumn col : columns) {
      Preconditions.checkArgument(!this.columns.containsKey(col.getName()), "Duplicate column '%s'", col.getName());
      putColumn(col);
    }
  }

  public int getNumberOfRows() {
    return numberOfRows;
  }

  /**
   * @return Names of all columns in their order. The returned list is a copy.
   */
  public List<String> getColumnNames() {
    return new ArrayList<>(columns.keySet());
  }

  /**
   * @return All columns in their order. The returned list is a copy, the columns themselves are not.
   */
  public List<StarColumn> getColumns() {
    return new ArrayList<>(columns.values());
  }

  public int getNumberOfColumns() {
    return columns.size();
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  public boolean hasColumn(StarField field) {
    return hasColumn(field.getFieldName());
  }

  /**
   * @return true if all of the given columns are available.
   */
  public boolean hasColumns(Collection<String> names) {
    return columns.keySet().containsAll(names);
  }

  /**
   * @throws FieldNotFoundException
   *           if there is no such column.
   */
  public StarColumn getColumn(String name) throws FieldNotFoundException {
    StarColumn res = columns.get(name);
    if (res == null)
      throw new FieldNotFoundException("Field '" + name + "' is not available.");
    return res;
  }

  /**
   * @throws FieldNotFoundException
   *           if there is no such column.
   */
  public StarColumn getColumn(StarField field) throws FieldNotFoundException {
    return getColumn(field.getFieldName());
  }

  public Optional<StarColumn> findColumn(String name) {
    return Optional.ofNullable(columns.get(name));
  }

  /**
   * Add a column or replace the column with the same name. A replaced column keeps its position, new columns are
   * appended.
   *
   * @throws IllegalArgumentException
   *           if the size of the column does not match the number of records of this table.
   */
  public void putColumn(StarColumn column) {
    Preconditions.checkArgument(column.size() == numberOfRows, "Column '%s' has %s values, but table has %s rows.",
        column.getName(), column.size(), numberOfRows);
    columns.put(column.getName(), column);
  }

  /**
   * Replace or add a {@link ColumnType#DOUBLE} column with the given values.
   */
  public void putDoubles(String name, double[] values) {
    putColumn(StarColumn.ofDoubles(name, values));
  }

  /**
   * @return true if the column was available and has been removed.
   */
  public boolean removeColumn(String name) {
    return columns.remove(name) != null;
  }

  /**
   * Rename a column in place, keeping its position.
   *
   * @throws FieldNotFoundException
   *           if there is no column with the old name.
   * @throws IllegalArgumentException
   *           if there is a column with the new name already.
   */
  public void renameColumn(String oldName, String newName) {
    StarColumn col = getColumn(oldName);
    if (oldName.equals(newName))
      return;
    Preconditions.checkArgument(!columns.containsKey(newName), "Column '%s' exists already", newName);
    List<StarColumn> all = new ArrayList<>(columns.values());
    columns.clear();
    for (StarColumn c : all)
      columns.put(c == col ? newName : c.getName(), c == col ? col.rename(newName) : c);
  }

  /**
   * Reorder the columns of this table in place.
   *
   * @param order
   *          The names of all columns of this table, in the new order.
   */
  public void reorderColumns(List<String> order) {
    Preconditions.checkArgument(order.size() == columns.size() && columns.keySet().containsAll(order),
        "Order %s does not contain exactly the columns of the table %s", order, columns.keySet());
    Map<String, StarColumn> old = new LinkedHashMap<>(columns);
    columns.clear();
    for (String name : order)
      columns.put(name, old.get(name));
  }

  /**
   * Replace the records of this table in place by the given rows of the current table.
   *
   * @param rows
   *          The current indices of the rows to keep, in their new order. Rows may be repeated.
   */
  public void reorderRows(int[] rows) {
    for (StarColumn col : new ArrayList<>(columns.values()))
      columns.put(col.getName(), col.select(rows));
    numberOfRows = rows.length;
  }

  /**
   * @return A new table containing copies of the given rows.
   */
  public StarTable selectRows(int[] rows) {
    StarTable res = new StarTable(rows.length);
    for (StarColumn col : columns.values())
      res.putColumn(col.select(rows));
    return res;
  }

  /**
   * @return The indices of all rows matching the given predicate.
   */
  public int[] findRows(IntPredicate predicate) {
    int[] res = new int[numberOfRows];
    int cnt = 0;
    for (int row = 0; row < numberOfRows; row++)
      if (predicate.test(row))
        res[cnt++] = row;
    int[] trimmed = new int[cnt];
    System.arraycopy(res, 0, trimmed, 0, cnt);
    return trimmed;
  }

  /**
   * @return A view on a single record of this table.
   */
  public StarRecord getRecord(int row) {
    Preconditions.checkElementIndex(row, numberOfRows);
    return new StarRecord(this, row);
  }

  /**
   * @return An independent deep copy of this table.
   */
  public StarTable copy() {
    StarTable res = new StarTable(numberOfRows);
    for (StarColumn col : columns.values())
      res.putColumn(col.copy());
    return res;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StarTable))
      return false;
    StarTable other = (StarTable) obj;
    return numberOfRows == other.numberOfRows && new ArrayList<>(columns.values())
        .equals(new ArrayList<>(other.columns.values()));
  }

  @Override
  public int hashCode() {
    return columns.hashCode() ^ numberOfRows;
  }

  @Override
  public String toString() {
    return "StarTable[rows=" + numberOfRows + ", columns=" + columns.keySet() + "]";
  }
}
