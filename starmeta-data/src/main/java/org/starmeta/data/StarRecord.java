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

import java.util.OptionalDouble;

import org.starmeta.data.schema.StarField;

/**
 * A view on a single record (row) of a {@link StarTable}.
 * 
 * <p>
 * The view is backed by the table, changes to the table are visible.
 *
 * @author Bastian Gloeckle
 */
public class StarRecord {
  private final StarTable table;
  private final int row;

  /* package */ StarRecord(StarTable table, int row) {
    this.table = table;
    this.row = row;
  }

  public int getRowIndex() {
    return row;
  }

  public boolean hasField(String field) {
    return table.hasColumn(field);
  }

  public boolean hasField(StarField field) {
    return table.hasColumn(field);
  }

  /**
   * @return The raw value of the field, <code>null</code> if missing.
   * @throws FieldNotFoundException
   *           if the field is not available.
   */
  public Object get(String field) throws FieldNotFoundException {
    return table.getColumn(field).get(row);
  }

  /**
   * @throws FieldNotFoundException
   *           if the field is not available.
   */
  public double getDouble(StarField field) throws FieldNotFoundException {
    return table.getColumn(field).getDouble(row);
  }

  /**
   * @throws FieldNotFoundException
   *           if the field is not available.
   */
  public String getString(StarField field) throws FieldNotFoundException {
    return table.getColumn(field).getString(row);
  }

  /**
   * @return The numeric value of the field if the field is available and the value is not missing.
   */
  public OptionalDouble findDouble(StarField field) {
    return table.findColumn(field.getFieldName()).filter(c -> c.getType().isNumeric() && !c.isMissing(row))
        .map(c -> OptionalDouble.of(c.getDouble(row))).orElse(OptionalDouble.empty());
  }

  @Override
  public String toString() {
    return "StarRecord[row=" + row + "]";
  }
}
