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

import java.util.function.DoubleUnaryOperator;

import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.FieldNotFoundException;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldGroups;
import org.starmeta.data.schema.StarField;

import com.google.common.collect.Iterables;

/**
 * Moves the particle origins (sub-pixel offsets) into the particle coordinates.
 *
 * <p>
 * All operations keep "coordinate - origin" for each record, as this is the actual position of the particle on the
 * micrograph. All require {@link StarField#COORDX}, {@link StarField#COORDY}, {@link StarField#ORIGINX} and
 * {@link StarField#ORIGINY} and throw {@link FieldNotFoundException} if any is missing.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class OriginOperations {
  /**
   * Move the integer part of the origins into the coordinates, rounding to the nearest integer (ties to even). The
   * remaining origins are in [-0.5, 0.5].
   */
  public StarTable recenter(StarTable table, boolean inPlace) throws FieldNotFoundException {
    return move(table, inPlace, Math::rint);
  }

  /**
   * Move the integer part of the origins into the coordinates, truncating towards zero. The remaining origins are in
   * (-1, 1) and keep the sign of the original origin.
   */
  public StarTable recenterFractional(StarTable table, boolean inPlace) throws FieldNotFoundException {
    return move(table, inPlace, d -> (d < 0) ? Math.ceil(d) : Math.floor(d));
  }

  /**
   * Move the origins into the coordinates completely, setting the origins to 0.
   */
  public StarTable zeroOrigins(StarTable table, boolean inPlace) throws FieldNotFoundException {
    return move(table, inPlace, d -> d);
  }

  private StarTable move(StarTable table, boolean inPlace, DoubleUnaryOperator integralPart)
      throws FieldNotFoundException {
    // check all fields before changing anything.
    for (String field : Iterables.concat(FieldGroups.COORDS, FieldGroups.ORIGINS))
      table.getColumn(field);

    StarTable res = inPlace ? table : table.copy();
    move(res, StarField.COORDX, StarField.ORIGINX, integralPart);
    move(res, StarField.COORDY, StarField.ORIGINY, integralPart);
    return res;
  }

  private void move(StarTable table, StarField coordField, StarField originField,
      DoubleUnaryOperator integralPart) throws FieldNotFoundException {
    double[] coords = table.getColumn(coordField).toDoubleArray();
    double[] origins = table.getColumn(originField).toDoubleArray();
    for (int i = 0; i < coords.length; i++) {
      double offset = integralPart.applyAsDouble(origins[i]);
      coords[i] -= offset;
      origins[i] -= offset;
    }
    table.putDoubles(coordField.getFieldName(), coords);
    table.putDoubles(originField.getFieldName(), origins);
  }
}
