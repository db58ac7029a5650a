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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.ColumnType;
import org.starmeta.data.FieldNotFoundException;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldGroups;
import org.starmeta.data.schema.StarField;
import org.starmeta.util.PathUtils;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * Operations grouping records by their {@link StarField#MICROGRAPH_NAME}.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class MicrographOperations {
  private static final Logger logger = LoggerFactory.getLogger(MicrographOperations.class);

  private static final List<String> AGGREGATED_FIELDS = ImmutableList.<String> builder()
      .addAll(FieldGroups.CTF_PARAMS).addAll(FieldGroups.MICROSCOPE_PARAMS).build();

  /**
   * Create a micrograph table from a particle table: One record per micrograph, containing the mean of each numeric
   * CTF and microscope parameter of the particles. Missing values are ignored when calculating the mean.
   *
   * @return A new table, sorted by micrograph name.
   * @throws FieldNotFoundException
   *           if there is no {@link StarField#MICROGRAPH_NAME}.
   */
  public StarTable aggregateToMicrographs(StarTable table) throws FieldNotFoundException {
    SortedMap<String, int[]> groups = groupByMicrograph(table);

    List<StarColumn> columns = new ArrayList<>();
    columns.add(StarColumn.ofStrings(StarField.MICROGRAPH_NAME.getFieldName(),
        groups.keySet().toArray(new String[groups.size()])));

    for (String field : AGGREGATED_FIELDS) {
      if (!table.hasColumn(field) || !table.getColumn(field).getType().isNumeric())
        continue;
      StarColumn col = table.getColumn(field);
      double[] means = new double[groups.size()];
      int i = 0;
      for (int[] rows : groups.values()) {
        double sum = 0.;
        int cnt = 0;
        for (int row : rows)
          if (!col.isMissing(row)) {
            sum += col.getDouble(row);
            cnt++;
          }
        means[i++] = (cnt == 0) ? Double.NaN : sum / cnt;
      }
      columns.add(StarColumn.ofDoubles(field, means));
    }

    logger.debug("Aggregated {} records into {} micrographs.", table.getNumberOfRows(), groups.size());
    return new StarTable(columns);
  }

  /**
   * Split a table into one table per micrograph. The tables do not contain the {@link StarField#MICROGRAPH_NAME} column
   * anymore. Records without micrograph name are ignored.
   *
   * @return Map from micrograph name to new table, sorted by micrograph name.
   * @throws FieldNotFoundException
   *           if there is no {@link StarField#MICROGRAPH_NAME}.
   */
  public SortedMap<String, StarTable> splitByMicrograph(StarTable table) throws FieldNotFoundException {
    SortedMap<String, StarTable> res = new TreeMap<>();
    for (Map.Entry<String, int[]> group : groupByMicrograph(table).entrySet()) {
      StarTable sub = table.selectRows(group.getValue());
      sub.removeColumn(StarField.MICROGRAPH_NAME.getFieldName());
      res.put(group.getKey(), sub);
    }
    return res;
  }

  /**
   * Replace the directory of all micrograph names, keeping the file names.
   *
   * @param newDirectory
   *          The new directory.
   * @throws FieldNotFoundException
   *           if there is no {@link StarField#MICROGRAPH_NAME}.
   */
  public StarTable rebaseMicrographPath(StarTable table, String newDirectory, boolean inPlace)
      throws FieldNotFoundException {
    StarTable res = inPlace ? table : table.copy();
    StarColumn micCol = res.getColumn(StarField.MICROGRAPH_NAME);
    Object[] values = new Object[res.getNumberOfRows()];
    for (int row = 0; row < values.length; row++) {
      String name = micCol.getString(row);
      values[row] = (name == null) ? null : PathUtils.join(newDirectory, PathUtils.basename(name));
    }
    res.putColumn(new StarColumn(micCol.getName(), ColumnType.STRING, values));
    return res;
  }

  private SortedMap<String, int[]> groupByMicrograph(StarTable table) throws FieldNotFoundException {
    StarColumn micCol = table.getColumn(StarField.MICROGRAPH_NAME);
    SortedMap<String, List<Integer>> groups = new TreeMap<>();
    for (int row = 0; row < table.getNumberOfRows(); row++) {
      String name = micCol.getString(row);
      if (name != null)
        groups.computeIfAbsent(name, k -> new ArrayList<>()).add(row);
    }
    SortedMap<String, int[]> res = new TreeMap<>();
    groups.forEach((name, rows) -> res.put(name, Ints.toArray(rows)));
    return res;
  }
}
