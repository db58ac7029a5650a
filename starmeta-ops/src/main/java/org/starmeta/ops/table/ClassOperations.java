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

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.ColumnType;
import org.starmeta.data.EmptyResultException;
import org.starmeta.data.FieldNotFoundException;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldNames;
import org.starmeta.data.schema.StarField;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;

/**
 * Operations on the class assignments of particles.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class ClassOperations {
  private static final Logger logger = LoggerFactory.getLogger(ClassOperations.class);

  /**
   * Select the records that are assigned to one of the given classes.
   *
   * <p>
   * The class column is {@link StarField#CLASS} or, if that is not available, the first column containing its name.
   *
   * @return A new table containing the selected records.
   * @throws FieldNotFoundException
   *           if there is no class column.
   * @throws EmptyResultException
   *           if no record belongs to any of the classes.
   */
  public StarTable selectByClass(StarTable table, Collection<? extends Number> classValues)
      throws FieldNotFoundException, EmptyResultException {
    Optional<String> classColName = FieldNames.findClassColumn(table.getColumnNames());
    if (!classColName.isPresent())
      throw new FieldNotFoundException("No class labels found.");

    StarColumn classCol = table.getColumn(classColName.get());
    Set<Object> wanted = new HashSet<>();
    for (Number n : classValues)
      wanted.add(classCol.getType() == ColumnType.STRING ? n.toString() : (Object) n.doubleValue());

    int[] rows = table.findRows(row -> !classCol.isMissing(row) && wanted.contains(classCol.getKeyValue(row)));
    if (rows.length == 0)
      throw new EmptyResultException("Classes " + classValues + " have no members.");

    logger.debug("Selected {} of {} records of classes {}.", rows.length, table.getNumberOfRows(), classValues);
    return table.selectRows(rows);
  }

  /**
   * Keep only those records whose (image, class) combination is contained as often as the most frequent image.
   *
   * <p>
   * This is useful for tables that contain each particle multiple times, e.g. once per symmetry copy: If a particle is
   * contained less often in a specific class, some of its copies have been classified differently and it is removed.
   * The order of the remaining records is kept.
   *
   * @return A new table.
   * @throws FieldNotFoundException
   *           if {@link StarField#IMAGE_NAME} or {@link StarField#CLASS} are not available.
   */
  public StarTable allSameClass(StarTable table) throws FieldNotFoundException {
    StarColumn imageCol = table.getColumn(StarField.IMAGE_NAME);
    StarColumn classCol = table.getColumn(StarField.CLASS);

    Multiset<Object> imageCounts = HashMultiset.create();
    Map<List<Object>, Integer> groupCounts = new HashMap<>();
    for (int row = 0; row < table.getNumberOfRows(); row++) {
      imageCounts.add(String.valueOf(imageCol.getString(row)));
      groupCounts.merge(group(imageCol, classCol, row), 1, Integer::sum);
    }
    int max = imageCounts.entrySet().stream().mapToInt(Multiset.Entry::getCount).max().orElse(0);

    int[] rows = table.findRows(row -> groupCounts.get(group(imageCol, classCol, row)) == max);
    logger.debug("{} of {} records are in groups with the maximum size {}.", rows.length, table.getNumberOfRows(),
        max);
    return table.selectRows(rows);
  }

  private List<Object> group(StarColumn imageCol, StarColumn classCol, int row) {
    return ImmutableList.of(String.valueOf(imageCol.getString(row)), String.valueOf(classCol.getKeyValue(row)));
  }
}
