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
package org.starmeta.ops.merge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.inject.Inject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.config.Config;
import org.starmeta.config.ConfigKey;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.ColumnType;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldNames;

import com.google.common.base.Preconditions;

/**
 * Merges fields of a secondary table into a primary table.
 *
 * <p>
 * The merge is a left join: Each record of the primary table is kept, in its order, and receives the values of the
 * secondary record with the same key. Primary records without a matching secondary record receive missing values.
 *
 * <p>
 * If a merged field is available in the primary table already, the primary value is kept where it is not missing;
 * missing primary values are filled with the secondary value.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class StarMerger {
  private static final Logger logger = LoggerFactory.getLogger(StarMerger.class);

  @Inject
  private MergeKeyInference keyInference;

  @Config(ConfigKey.MERGE_DUPLICATE_KEY_POLICY)
  private DuplicateKeyPolicy duplicateKeyPolicy;

  /**
   * Merge using an inferred key.
   *
   * @see #merge(StarTable, StarTable, Collection, MergeKey, MergeKey)
   */
  public StarTable merge(StarTable primary, StarTable secondary, Collection<String> fields) {
    return merge(primary, secondary, fields, null, null);
  }

  /**
   * Merge fields of the secondary table into a copy of the primary table.
   *
   * @param fields
   *          The fields to take from the secondary table. Fields that are not available in the secondary table are
   *          ignored.
   * @param key
   *          The key of the secondary table. If <code>null</code>, the key is inferred, see {@link MergeKeyInference}.
   *          If no key can be inferred, the fields are added to the primary table with all values missing.
   * @param leftKey
   *          The key of the primary table, needs to have as many fields as the key. If <code>null</code> the same as
   *          key.
   * @return The merged table, having the same number of records as the primary table.
   * @throws DuplicateMergeKeyException
   *           if the key is not unique in the secondary table and the policy is {@link DuplicateKeyPolicy#FAIL}.
   * @throws org.starmeta.data.FieldNotFoundException
   *           if a key field is not available.
   */
  public StarTable merge(StarTable primary, StarTable secondary, Collection<String> fields, MergeKey key,
      MergeKey leftKey) throws DuplicateMergeKeyException {
    List<StarColumn> incoming = new ArrayList<>();
    for (StarColumn col : secondary.getColumns())
      // the record positions of the secondary table are meaningless for the result.
      if (fields.contains(col.getName()) && !col.getName().equals(FieldNames.INDEX_COLUMN))
        incoming.add(col);

    StarTable res = primary.copy();

    if (key == null) {
      Optional<MergeKey> inferred = keyInference.inferKey(primary, secondary);
      if (!inferred.isPresent()) {
        logger.warn("No merge key found, adding fields {} without values.", fields);
        for (StarColumn col : incoming)
          if (!res.hasColumn(col.getName()))
            res.putColumn(StarColumn.ofMissing(col.getName(), col.getType(), res.getNumberOfRows()));
        return res;
      }
      key = inferred.get();
    }
    if (leftKey == null)
      leftKey = key;
    Preconditions.checkArgument(key.size() == leftKey.size(), "Keys %s and %s have a different number of fields", key,
        leftKey);

    logger.info("Merging fields {} on key {} (primary key {}).", fields, key, leftKey);

    Map<List<Object>, Integer> secondaryIndex = indexSecondary(secondary, key);

    int[] matches = new int[primary.getNumberOfRows()];
    int matched = 0;
    for (int row = 0; row < matches.length; row++) {
      List<Object> keyValue = keyValue(primary, leftKey, row);
      Integer match = (keyValue == null) ? null : secondaryIndex.get(keyValue);
      matches[row] = (match == null) ? -1 : match;
      if (match != null)
        matched++;
    }
    logger.debug("{} of {} primary records have a matching secondary record.", matched, matches.length);

    for (StarColumn col : incoming)
      mergeColumn(res, col, matches);

    return res;
  }

  private Map<List<Object>, Integer> indexSecondary(StarTable secondary, MergeKey key) {
    Map<List<Object>, Integer> res = new HashMap<>();
    for (int row = 0; row < secondary.getNumberOfRows(); row++) {
      List<Object> keyValue = keyValue(secondary, key, row);
      if (keyValue == null)
        continue;
      Integer previous = res.put(keyValue, row);
      if (previous != null) {
        if (duplicateKeyPolicy == DuplicateKeyPolicy.FAIL)
          throw new DuplicateMergeKeyException("Key " + keyValue + " of fields " + key
              + " is contained multiple times in secondary table (records " + previous + " and " + row + ").");
        logger.trace("Duplicate key {}, using record {}", keyValue, row);
      }
    }
    return res;
  }

  /**
   * @return The values of the key fields in the given row, <code>null</code> if any of them is missing.
   */
  private List<Object> keyValue(StarTable table, MergeKey key, int row) {
    List<Object> res = new ArrayList<>(key.size());
    for (String field : key.getFields()) {
      StarColumn col = table.getColumn(field);
      if (col.isMissing(row))
        return null;
      res.add(col.getKeyValue(row));
    }
    return res;
  }

  private void mergeColumn(StarTable res, StarColumn incoming, int[] matches) {
    Object[] values = new Object[matches.length];
    for (int row = 0; row < matches.length; row++)
      if (matches[row] >= 0)
        values[row] = incoming.get(matches[row]);

    if (!res.hasColumn(incoming.getName())) {
      res.putColumn(new StarColumn(incoming.getName(), incoming.getType(), values));
      return;
    }

    StarColumn existing = res.getColumn(incoming.getName());
    ColumnType targetType = commonType(existing.getType(), incoming.getType());
    StarColumn target = convert(existing, targetType);
    if (targetType == ColumnType.STRING && incoming.getType() != ColumnType.STRING)
      for (int row = 0; row < values.length; row++)
        values[row] = (values[row] == null) ? null : values[row].toString();

    for (int row = 0; row < values.length; row++)
      if (target.isMissing(row) && values[row] != null)
        target.set(row, values[row]);

    res.putColumn(target);
  }

  private ColumnType commonType(ColumnType a, ColumnType b) {
    if (a == b)
      return a;
    if (a.isNumeric() && b.isNumeric())
      return ColumnType.DOUBLE;
    return ColumnType.STRING;
  }

  private StarColumn convert(StarColumn col, ColumnType type) {
    if (col.getType() == type)
      return col;
    if (type == ColumnType.DOUBLE)
      return col.toDoubleColumn();
    return col.toStringColumn();
  }

  /** for tests */
  /* package */ void setKeyInference(MergeKeyInference keyInference) {
    this.keyInference = keyInference;
  }

  /** for tests */
  /* package */ void setDuplicateKeyPolicy(DuplicateKeyPolicy duplicateKeyPolicy) {
    this.duplicateKeyPolicy = duplicateKeyPolicy;
  }
}
