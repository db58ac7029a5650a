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
package org.starmeta.serialize;

import java.util.ArrayList;
import java.util.List;

import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldGroups;

/**
 * Sorts the columns of a {@link StarTable} into the canonical order of {@link FieldGroups#FIELD_ORDER}. Columns that
 * are not contained in that list follow in their current order.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class FieldSorter {
  public StarTable sortFields(StarTable table, boolean inPlace) {
    StarTable res = inPlace ? table : table.copy();

    List<String> order = new ArrayList<>();
    for (String field : FieldGroups.FIELD_ORDER)
      if (res.hasColumn(field))
        order.add(field);
    for (String col : res.getColumnNames())
      if (!FieldGroups.FIELD_ORDER.contains(col))
        order.add(col);

    res.reorderColumns(order);
    return res;
  }
}
