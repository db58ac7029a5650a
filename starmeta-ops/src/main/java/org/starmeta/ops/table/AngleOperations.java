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

import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.FieldNotFoundException;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.StarField;

/**
 * Operations on the Euler angles of particles.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class AngleOperations {
  /**
   * Flip the handedness of the orientations: rot becomes -rot, tilt becomes 180 - tilt.
   *
   * @throws FieldNotFoundException
   *           if {@link StarField#ANGLEROT} or {@link StarField#ANGLETILT} are not available.
   */
  public StarTable invertHandedness(StarTable table, boolean inPlace) throws FieldNotFoundException {
    double[] rot = table.getColumn(StarField.ANGLEROT).toDoubleArray();
    double[] tilt = table.getColumn(StarField.ANGLETILT).toDoubleArray();
    for (int i = 0; i < rot.length; i++) {
      rot[i] = -rot[i];
      tilt[i] = 180. - tilt[i];
    }

    StarTable res = inPlace ? table : table.copy();
    res.putDoubles(StarField.ANGLEROT.getFieldName(), rot);
    res.putDoubles(StarField.ANGLETILT.getFieldName(), tilt);
    return res;
  }
}
