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
package org.starmeta.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.ColumnType;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldNames;
import org.starmeta.data.schema.StarField;
import org.starmeta.util.PathUtils;

import com.google.common.primitives.Longs;

/**
 * Adds derived fields to a {@link StarTable} which make working with the table easier.
 *
 * <p>
 * An image reference "000012@Extract/mic1.mrcs" in {@link StarField#IMAGE_NAME} is split into the 0-based
 * {@link StarField#IMAGE_INDEX} 11, the {@link StarField#IMAGE_PATH} "Extract/mic1.mrcs" and the
 * {@link StarField#IMAGE_BASENAME} "mic1.mrcs". The same is done for {@link StarField#IMAGE_ORIGINAL_NAME} and the base
 * name of {@link StarField#MICROGRAPH_NAME} is extracted.
 *
 * <p>
 * The 0-based position of each record is stored in the bookkeeping column {@link FieldNames#INDEX_COLUMN}, so the
 * original record order can be restored after sorting.
 *
 * <p>
 * Derived fields that are available in the table already are left untouched. Derived fields whose source fields are
 * not available are simply not added.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class StarAugmenter {
  private static final Logger logger = LoggerFactory.getLogger(StarAugmenter.class);

  private static final char IMAGE_REFERENCE_SEPARATOR = '@';

  /**
   * Add derived fields to the table.
   *
   * <p>
   * If the table has an {@link StarField#IMAGE_NAME} but no {@link StarField#IMAGE_ORIGINAL_NAME}, the image name is
   * copied to the original image name first.
   *
   * @param inPlace
   *          <code>true</code> to change and return the given table, <code>false</code> to work on a copy.
   * @return The augmented table.
   */
  public StarTable augment(StarTable table, boolean inPlace) {
    StarTable res = inPlace ? table : table.copy();

    if (res.hasColumn(StarField.IMAGE_NAME)) {
      splitImageReference(res, StarField.IMAGE_NAME, StarField.IMAGE_INDEX, StarField.IMAGE_PATH);

      if (!res.hasColumn(StarField.IMAGE_ORIGINAL_NAME))
        res.putColumn(res.getColumn(StarField.IMAGE_NAME).rename(StarField.IMAGE_ORIGINAL_NAME.getFieldName()));
    } else
      logger.debug("No {} available, not deriving image fields.", StarField.IMAGE_NAME);

    if (res.hasColumn(StarField.IMAGE_ORIGINAL_NAME))
      splitImageReference(res, StarField.IMAGE_ORIGINAL_NAME, StarField.IMAGE_ORIGINAL_INDEX,
          StarField.IMAGE_ORIGINAL_PATH);

    deriveBasename(res, StarField.IMAGE_PATH, StarField.IMAGE_BASENAME);
    deriveBasename(res, StarField.IMAGE_ORIGINAL_PATH, StarField.IMAGE_ORIGINAL_BASENAME);
    deriveBasename(res, StarField.MICROGRAPH_NAME, StarField.MICROGRAPH_BASENAME);

    if (!res.hasColumn(FieldNames.INDEX_COLUMN)) {
      long[] positions = new long[res.getNumberOfRows()];
      for (int row = 0; row < positions.length; row++)
        positions[row] = row;
      res.putColumn(StarColumn.ofLongs(FieldNames.INDEX_COLUMN, positions));
    }

    return res;
  }

  /**
   * Copy {@link StarField#IMAGE_NAME}, {@link StarField#IMAGE_INDEX} and {@link StarField#IMAGE_PATH} into their
   * "original" counterparts, overwriting any existing values. Fields that are not available are skipped.
   *
   * @param inPlace
   *          <code>true</code> to change and return the given table, <code>false</code> to work on a copy.
   * @return The resulting table.
   */
  public StarTable setOriginalFields(StarTable table, boolean inPlace) {
    StarTable res = inPlace ? table : table.copy();
    copyField(res, StarField.IMAGE_NAME, StarField.IMAGE_ORIGINAL_NAME);
    copyField(res, StarField.IMAGE_INDEX, StarField.IMAGE_ORIGINAL_INDEX);
    copyField(res, StarField.IMAGE_PATH, StarField.IMAGE_ORIGINAL_PATH);
    return res;
  }

  private void copyField(StarTable table, StarField source, StarField target) {
    if (table.hasColumn(source))
      table.putColumn(table.getColumn(source).rename(target.getFieldName()));
  }

  private void splitImageReference(StarTable table, StarField reference, StarField indexField, StarField pathField) {
    if (table.hasColumn(indexField) && table.hasColumn(pathField))
      return;

    StarColumn refCol = table.getColumn(reference);
    int rows = table.getNumberOfRows();
    Object[] indices = new Object[rows];
    Object[] paths = new Object[rows];
    int invalid = 0;

    for (int row = 0; row < rows; row++) {
      String ref = refCol.getString(row);
      if (ref == null)
        continue;

      int sepIdx = ref.indexOf(IMAGE_REFERENCE_SEPARATOR);
      if (sepIdx < 0) {
        paths[row] = ref;
        invalid++;
        continue;
      }
      Long index = Longs.tryParse(ref.substring(0, sepIdx).trim());
      if (index == null)
        invalid++;
      else
        indices[row] = index - 1;
      paths[row] = ref.substring(sepIdx + 1);
    }

    if (invalid > 0)
      logger.warn("{} values of {} are no valid image references, their index is missing.", invalid, reference);

    if (!table.hasColumn(indexField))
      table.putColumn(new StarColumn(indexField.getFieldName(), ColumnType.LONG, indices));
    if (!table.hasColumn(pathField))
      table.putColumn(new StarColumn(pathField.getFieldName(), ColumnType.STRING, paths));
  }

  private void deriveBasename(StarTable table, StarField pathField, StarField basenameField) {
    if (!table.hasColumn(pathField)) {
      logger.trace("No {} available, not deriving {}.", pathField, basenameField);
      return;
    }
    if (table.hasColumn(basenameField))
      return;

    StarColumn pathCol = table.getColumn(pathField);
    Object[] basenames = new Object[table.getNumberOfRows()];
    for (int row = 0; row < basenames.length; row++) {
      String path = pathCol.getString(row);
      basenames[row] = (path == null) ? null : PathUtils.basename(path);
    }
    table.putColumn(new StarColumn(basenameField.getFieldName(), ColumnType.STRING, basenames));
  }
}
