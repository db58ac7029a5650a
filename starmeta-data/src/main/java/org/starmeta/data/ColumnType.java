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

/**
 * Type of a {@link StarColumn}.
 * 
 * <p>
 * The values of a column are of type String, Double or Long respectively, any value might be <code>null</code>
 * ("missing").
 *
 * @author Bastian Gloeckle
 */
public enum ColumnType {
  STRING, DOUBLE, LONG;

  /**
   * @return true if values of this type are numbers.
   */
  public boolean isNumeric() {
    return this != STRING;
  }
}
