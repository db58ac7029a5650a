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
package org.starmeta.data.schema;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for interpreting field names.
 *
 * @author Bastian Gloeckle
 */
public class FieldNames {
  /** Marker contained in the names of all fields holding class labels. */
  public static final String CLASS_LABEL_MARKER = StarField.CLASS.getFieldName();

  /** Name of the bookkeeping column holding the position of each record in the file it was read from. */
  public static final String INDEX_COLUMN = "index";

  /** Markers of derived fields, which are not written to STAR files. */
  private static final String[] DERIVED_MARKERS = new String[] { "ucsf", "eman" };

  /** "#n" ordinal suffix at the end of a header name. */
  private static final Pattern INDEX_SUFFIX = Pattern.compile("#\\d+$");

  private static final Pattern WORD = Pattern.compile("[A-Z][a-z]+");
  private static final Pattern LEAD = Pattern.compile("^.*?[a-z].*?(?=[A-Z])");

  /**
   * Find the column holding class labels.
   *
   * <p>
   * If {@link StarField#CLASS} is available, it is returned. Otherwise the first column whose name contains the class
   * label marker is returned (e.g. a column named "rlnClassNumber #12" of a file loaded with index suffixes).
   *
   * @return The name of the class column, if any.
   */
  public static Optional<String> findClassColumn(Collection<String> columnNames) {
    if (columnNames.contains(StarField.CLASS.getFieldName()))
      return Optional.of(StarField.CLASS.getFieldName());

    return columnNames.stream().filter(c -> c.contains(CLASS_LABEL_MARKER)).findFirst();
  }

  /**
   * @return true if the given field is a derived field that should not be written to a STAR file.
   */
  public static boolean isDerived(String fieldName) {
    for (String marker : DERIVED_MARKERS)
      if (fieldName.contains(marker))
        return true;
    return false;
  }

  /**
   * @return true if the given header name ends with an ordinal suffix like "#3".
   */
  public static boolean hasIndexSuffix(String headerName) {
    return INDEX_SUFFIX.matcher(headerName).find();
  }

  /**
   * Derive the name of the field holding the "original" value of the given field, which is where the value is stored
   * before it is changed by re-extraction of particles etc.
   *
   * <p>
   * Example: "rlnImageName" results in "rlnImageOriginalName", "ucsfImagePath" in "ucsfImageOriginalPath".
   *
   * @throws IllegalArgumentException
   *           if the field name does not consist of a lower case prefix and at least one capitalized word.
   */
  public static String originalField(String fieldName) {
    Matcher words = WORD.matcher(fieldName);
    StringBuilder tok = new StringBuilder();
    boolean first = true;
    while (words.find()) {
      tok.append(words.group());
      if (first)
        tok.append("Original");
      first = false;
    }
    Matcher lead = LEAD.matcher(fieldName);
    if (first || !lead.find())
      throw new IllegalArgumentException("Cannot derive original field name of '" + fieldName + "'");

    return lead.group() + tok;
  }

  private FieldNames() {
  }
}
