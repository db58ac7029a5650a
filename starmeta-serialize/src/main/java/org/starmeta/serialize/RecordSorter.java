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

import java.util.Arrays;
import java.util.Comparator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.TableInfo;
import org.starmeta.data.schema.StarField;
import org.starmeta.util.NaturalOrderComparator;

/**
 * Sorts the records of a {@link StarTable} in natural order, so that e.g. "mic9" comes before "mic10".
 *
 * <p>
 * Particle tables are sorted by image path and index, micrograph tables by micrograph name. The sort is stable.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class RecordSorter {
  private static final Logger logger = LoggerFactory.getLogger(RecordSorter.class);

  private static final Comparator<String> KEY_COMPARATOR = Comparator.nullsLast(new NaturalOrderComparator());

  public StarTable sortRecords(StarTable table, boolean inPlace) {
    StarTable res = inPlace ? table : table.copy();

    String[] keys;
    if (TableInfo.isParticleTable(res)) {
      if (!res.hasColumn(StarField.IMAGE_INDEX) || !res.hasColumn(StarField.IMAGE_PATH)) {
        logger.debug("Particle table has no {}/{}, not sorting records.", StarField.IMAGE_PATH, StarField.IMAGE_INDEX);
        return res;
      }
      StarColumn pathCol = res.getColumn(StarField.IMAGE_PATH);
      StarColumn indexCol = res.getColumn(StarField.IMAGE_INDEX);
      keys = new String[res.getNumberOfRows()];
      for (int row = 0; row < keys.length; row++)
        keys[row] = pathCol.getString(row) + "_" + indexCol.getString(row);
    } else if (res.hasColumn(StarField.MICROGRAPH_NAME)) {
      StarColumn micCol = res.getColumn(StarField.MICROGRAPH_NAME);
      keys = new String[res.getNumberOfRows()];
      for (int row = 0; row < keys.length; row++)
        keys[row] = micCol.getString(row);
    } else {
      logger.debug("No field to sort records by.");
      return res;
    }

    Integer[] rows = new Integer[keys.length];
    for (int i = 0; i < rows.length; i++)
      rows[i] = i;
    // Arrays.sort on objects is stable.
    Arrays.sort(rows, Comparator.comparing((Integer row) -> keys[row], KEY_COMPARATOR));
    res.reorderRows(Arrays.stream(rows).mapToInt(Integer::intValue).toArray());
    return res;
  }
}
