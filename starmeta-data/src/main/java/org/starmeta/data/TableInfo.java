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

import org.starmeta.data.schema.FieldGroups;
import org.starmeta.data.schema.StarField;

/**
 * Information about what kind of data a {@link StarTable} holds.
 *
 * @author Bastian Gloeckle
 */
public class TableInfo {
  /**
   * @return <code>true</code> if the table describes particles, i.e. it contains an image reference or particle
   *         coordinates. Otherwise the table describes micrographs (or something unknown).
   */
  public static boolean isParticleTable(StarTable table) {
    if (table.hasColumn(StarField.IMAGE_NAME))
      return true;
    return FieldGroups.COORDS.stream().anyMatch(table::hasColumn);
  }

  private TableInfo() {
  }
}
