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
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.config.Config;
import org.starmeta.config.ConfigKey;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.ColumnType;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldNames;
import org.starmeta.data.schema.StarField;

/**
 * Reverts what the {@code StarAugmenter} of the loader does: Collapses the derived fields back into the native ones
 * and removes all derived fields.
 *
 * <p>
 * Image references are re-encoded from {@link StarField#IMAGE_INDEX} and {@link StarField#IMAGE_PATH} (and their
 * "original" counterparts) as "&lt;1-based zero padded index&gt;@&lt;path&gt;", e.g. index 0 and path "a.mrcs" become
 * "000001@a.mrcs".
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class StarSimplifier {
  private static final Logger logger = LoggerFactory.getLogger(StarSimplifier.class);

  @Config(ConfigKey.IMAGE_INDEX_DIGITS)
  private int imageIndexDigits;

  /**
   * Simplify a table.
   *
   * @param resortIndex
   *          If <code>true</code> and the table contains a bookkeeping {@link FieldNames#INDEX_COLUMN}, the records are
   *          sorted by that column (stable) before it is removed.
   * @param inPlace
   *          <code>true</code> to change and return the given table, <code>false</code> to work on a copy.
   * @return The simplified table.
   */
  public StarTable simplify(StarTable table, boolean resortIndex, boolean inPlace) {
    StarTable res = inPlace ? table : table.copy();

    joinImageReference(res, StarField.IMAGE_ORIGINAL_INDEX, StarField.IMAGE_ORIGINAL_PATH,
        StarField.IMAGE_ORIGINAL_NAME);
    joinImageReference(res, StarField.IMAGE_INDEX, StarField.IMAGE_PATH, StarField.IMAGE_NAME);

    for (String colName : res.getColumnNames())
      if (FieldNames.isDerived(colName)) {
        logger.trace("Removing derived field {}", colName);
        res.removeColumn(colName);
      }

    if (res.hasColumn(FieldNames.INDEX_COLUMN)) {
      if (resortIndex) {
        StarColumn indexCol = res.getColumn(FieldNames.INDEX_COLUMN);
        Integer[] rows = new Integer[res.getNumberOfRows()];
        for (int i = 0; i < rows.length; i++)
          rows[i] = i;
        Comparator<Integer> byIndex =
            Comparator.comparing(row -> indexCol.getKeyValue(row), Comparator.nullsLast(SimplifyKeyComparator.INSTANCE));
        Arrays.sort(rows, byIndex);
        res.reorderRows(Arrays.stream(rows).mapToInt(Integer::intValue).toArray());
      }
      res.removeColumn(FieldNames.INDEX_COLUMN);
    }

    return res;
  }

  private void joinImageReference(StarTable table, StarField indexField, StarField pathField, StarField targetField) {
    if (!table.hasColumn(indexField) || !table.hasColumn(pathField))
      return;

    StarColumn indexCol = table.getColumn(indexField);
    StarColumn pathCol = table.getColumn(pathField);
    Object[] refs = new Object[table.getNumberOfRows()];
    for (int row = 0; row < refs.length; row++) {
      String path = pathCol.getString(row);
      if (path == null)
        continue;
      if (indexCol.isMissing(row))
        // was no valid image reference when augmenting, keep what we have.
        refs[row] = path;
      else
        refs[row] = encodeImageReference(indexCol.getLong(row), path);
    }
    table.putColumn(new StarColumn(targetField.getFieldName(), ColumnType.STRING, refs));
  }

  /**
   * @param index
   *          0-based index.
   * @return The image reference string.
   */
  public String encodeImageReference(long index, String path) {
    return String.format(Locale.ROOT, "%0" + imageIndexDigits + "d@%s", index + 1, path);
  }

  /** Compares the values of an index column, which are either all Doubles or all Strings. */
  private static class SimplifyKeyComparator implements Comparator<Object> {
    private static final SimplifyKeyComparator INSTANCE = new SimplifyKeyComparator();

    @SuppressWarnings({ "unchecked", "rawtypes" })
    @Override
    public int compare(Object o1, Object o2) {
      return ((Comparable) o1).compareTo(o2);
    }
  }
}
