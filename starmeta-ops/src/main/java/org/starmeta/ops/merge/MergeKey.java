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

import java.util.Arrays;
import java.util.List;

import org.starmeta.data.schema.StarField;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The fields whose values identify a record when merging two tables. A key may consist of multiple fields (compound
 * key), in which case records match if the values of all fields match.
 *
 * @author Bastian Gloeckle
 */
public final class MergeKey {
  private final ImmutableList<String> fields;

  private MergeKey(List<String> fields) {
    Preconditions.checkArgument(!fields.isEmpty(), "Merge key needs at least one field");
    this.fields = ImmutableList.copyOf(fields);
  }

  public static MergeKey of(String... fields) {
    return new MergeKey(Arrays.asList(fields));
  }

  public static MergeKey of(StarField... fields) {
    return new MergeKey(Arrays.stream(fields).map(StarField::getFieldName).collect(ImmutableList.toImmutableList()));
  }

  public static MergeKey of(List<String> fields) {
    return new MergeKey(fields);
  }

  public ImmutableList<String> getFields() {
    return fields;
  }

  public int size() {
    return fields.size();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof MergeKey))
      return false;
    return fields.equals(((MergeKey) obj).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return fields.toString();
  }
}
