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

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.config.Config;
import org.starmeta.config.ConfigKey;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.FieldGroups;
import org.starmeta.data.schema.StarField;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;

/**
 * Finds the fields two tables can be merged on.
 *
 * <p>
 * The candidates are checked in the following order, the first one that is available in both tables and that
 * "covers" the primary table is used:
 *
 * <ol>
 * <li>{@link StarField#IMAGE_NAME}
 * <li>{@link StarField#IMAGE_BASENAME} together with {@link StarField#IMAGE_INDEX} (coverage is checked on the
 * basename only)
 * <li>{@link StarField#MICROGRAPH_NAME}, together with the coordinates if both tables have them.
 * <li>{@link StarField#MICROGRAPH_BASENAME}
 * </ol>
 *
 * A field covers the primary table if at least "threshold" times the number of primary records have a value that is
 * contained somewhere in the secondary table. Each primary record is counted, so a value that is contained k times in
 * the primary table counts k times.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class MergeKeyInference {
  private static final Logger logger = LoggerFactory.getLogger(MergeKeyInference.class);

  @Config(ConfigKey.MERGE_KEY_THRESHOLD)
  private double defaultThreshold;

  /**
   * Infer the merge key using the configured threshold.
   *
   * @see #inferKey(StarTable, StarTable, double)
   */
  public Optional<MergeKey> inferKey(StarTable primary, StarTable secondary) {
    return inferKey(primary, secondary, defaultThreshold);
  }

  /**
   * @param threshold
   *          Fraction of primary records that need a matching value in the secondary table.
   * @return The key to merge the two tables on or empty if there is none.
   */
  public Optional<MergeKey> inferKey(StarTable primary, StarTable secondary, double threshold) {
    if (isSharedAndCovering(primary, secondary, StarField.IMAGE_NAME, threshold))
      return found(MergeKey.of(StarField.IMAGE_NAME));

    if (primary.hasColumn(StarField.IMAGE_INDEX) && secondary.hasColumn(StarField.IMAGE_INDEX)
        && isSharedAndCovering(primary, secondary, StarField.IMAGE_BASENAME, threshold))
      return found(MergeKey.of(StarField.IMAGE_BASENAME, StarField.IMAGE_INDEX));

    if (isSharedAndCovering(primary, secondary, StarField.MICROGRAPH_NAME, threshold)) {
      if (primary.hasColumns(FieldGroups.COORDS) && secondary.hasColumns(FieldGroups.COORDS))
        return found(MergeKey.of(FieldGroups.MICROGRAPH_COORDS));
      return found(MergeKey.of(StarField.MICROGRAPH_NAME));
    }

    if (isSharedAndCovering(primary, secondary, StarField.MICROGRAPH_BASENAME, threshold))
      return found(MergeKey.of(StarField.MICROGRAPH_BASENAME));

    logger.debug("No merge key found.");
    return Optional.empty();
  }

  private Optional<MergeKey> found(MergeKey key) {
    logger.debug("Inferred merge key {}", key);
    return Optional.of(key);
  }

  private boolean isSharedAndCovering(StarTable primary, StarTable secondary, StarField field, double threshold) {
    if (!primary.hasColumn(field) || !secondary.hasColumn(field))
      return false;

    StarColumn primaryCol = primary.getColumn(field);
    Multiset<Object> primaryValues = HashMultiset.create();
    for (int row = 0; row < primaryCol.size(); row++)
      if (!primaryCol.isMissing(row))
        primaryValues.add(primaryCol.getKeyValue(row));

    StarColumn secondaryCol = secondary.getColumn(field);
    Set<Object> secondaryValues = new HashSet<>();
    for (int row = 0; row < secondaryCol.size(); row++)
      if (!secondaryCol.isMissing(row))
        secondaryValues.add(secondaryCol.getKeyValue(row));

    long shared = 0;
    for (Object value : secondaryValues)
      shared += primaryValues.count(value);

    boolean res = shared >= primary.getNumberOfRows() * threshold;
    logger.trace("Field {}: {} of {} primary records shared, threshold {}: {}", field, shared,
        primary.getNumberOfRows(), threshold, res);
    return res;
  }
}
