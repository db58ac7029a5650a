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
package org.starmeta.config;

/**
 * Configuration keys which can be used to resolve configuration values.
 * 
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation.
 *
 * @author Bastian Gloeckle
 */
public class ConfigKey {
  /**
   * Fraction of the records of the primary table whose key value needs to be present in the secondary table so that a
   * field is accepted as merge key when inferring the key automatically.
   */
  public static final String MERGE_KEY_THRESHOLD = "mergeKeyThreshold";

  /**
   * What to do if the key of a merge is not unique in the secondary table.
   * 
   * <p>
   * "FAIL" aborts the merge, "LAST_WINS" uses the last record with the key.
   */
  public static final String MERGE_DUPLICATE_KEY_POLICY = "mergeDuplicateKeyPolicy";

  /**
   * Number of digits after the decimal point when writing floating point values.
   */
  public static final String FLOAT_DECIMALS = "floatDecimals";

  /**
   * Number of digits the 1-based index of an image reference is zero-padded to when re-encoding it.
   */
  public static final String IMAGE_INDEX_DIGITS = "imageIndexDigits";

  /**
   * The name of the data block written into STAR files (without the leading "data_").
   */
  public static final String DATA_BLOCK_NAME = "dataBlockName";
}
