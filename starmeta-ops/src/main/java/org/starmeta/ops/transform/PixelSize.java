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
package org.starmeta.ops.transform;

import java.util.OptionalDouble;

import org.starmeta.data.StarRecord;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.StarField;

/**
 * Calculates the pixel size in Angstrom from {@link StarField#DETECTORPIXELSIZE} (in microns) and
 * {@link StarField#MAGNIFICATION}.
 *
 * @author Bastian Gloeckle
 */
public class PixelSize {
  /**
   * @return The pixel size according to the first record of the table, empty if not available.
   */
  public static OptionalDouble calculatePixelSize(StarTable table) {
    if (table.getNumberOfRows() == 0)
      return OptionalDouble.empty();
    return calculatePixelSize(table.getRecord(0));
  }

  /**
   * @return The pixel size of the record, empty if not available.
   */
  public static OptionalDouble calculatePixelSize(StarRecord record) {
    OptionalDouble detectorPixelSize = record.findDouble(StarField.DETECTORPIXELSIZE);
    OptionalDouble magnification = record.findDouble(StarField.MAGNIFICATION);
    if (!detectorPixelSize.isPresent() || !magnification.isPresent())
      return OptionalDouble.empty();
    return OptionalDouble.of(10000.0 * detectorPixelSize.getAsDouble() / magnification.getAsDouble());
  }

  private PixelSize() {
  }
}
