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
package org.starmeta.ops.table;

import java.util.List;

import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.FieldNotFoundException;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldGroups;
import org.starmeta.data.schema.StarField;

import com.google.common.collect.ImmutableList;

/**
 * Scales fields by a constant factor, e.g. after the micrographs or particles have been rescaled.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class ScalingOperations {
  /**
   * @throws FieldNotFoundException
   *           if one of {@link FieldGroups#COORDS} is not available.
   */
  public StarTable scaleCoordinates(StarTable table, double factor, boolean inPlace) throws FieldNotFoundException {
    return scale(table, FieldGroups.COORDS, factor, inPlace);
  }

  /**
   * @throws FieldNotFoundException
   *           if one of {@link FieldGroups#ORIGINS} is not available.
   */
  public StarTable scaleOrigins(StarTable table, double factor, boolean inPlace) throws FieldNotFoundException {
    return scale(table, FieldGroups.ORIGINS, factor, inPlace);
  }

  /**
   * @throws FieldNotFoundException
   *           if {@link StarField#MAGNIFICATION} is not available.
   */
  public StarTable scaleMagnification(StarTable table, double factor, boolean inPlace)
      throws FieldNotFoundException {
    return scale(table, ImmutableList.of(StarField.MAGNIFICATION.getFieldName()), factor, inPlace);
  }

  private StarTable scale(StarTable table, List<String> fields, double factor, boolean inPlace)
      throws FieldNotFoundException {
    // check all fields before changing anything.
    for (String field : fields)
      table.getColumn(field);

    StarTable res = inPlace ? table : table.copy();
    for (String field : fields) {
      double[] values = res.getColumn(field).toDoubleArray();
      for (int i = 0; i < values.length; i++)
        values[i] *= factor;
      res.putDoubles(field, values);
    }
    return res;
  }
}
