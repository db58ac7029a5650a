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

import java.util.Arrays;
import java.util.SortedMap;
import java.util.TreeSet;

import org.starmeta.data.FieldNotFoundException;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.StarField;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link MicrographOperations}.
 *
 * @author Bastian Gloeckle
 */
public class MicrographOperationsTest {
  private MicrographOperations micrographOperations = new MicrographOperations();

  private StarTable particles() {
    return new StarTable(Arrays.asList( //
        StarColumn.ofStrings("rlnMicrographName", "raw/m2.mrc", "raw/m1.mrc", "raw/m2.mrc"), //
        StarColumn.ofDoubles("rlnCoordinateX", new double[] { 1., 2., 3. }), //
        StarColumn.ofDoubles("rlnDefocusU", new double[] { 100., 50., Double.NaN }), //
        StarColumn.ofDoubles("rlnVoltage", new double[] { 300., 300., 200. }), //
        StarColumn.ofStrings("rlnCtfImage", "x", "y", "z")));
  }

  @Test
  public void aggregate() {
    // WHEN
    StarTable res = micrographOperations.aggregateToMicrographs(particles());

    // THEN
    Assert.assertEquals(res.getColumnNames(), Arrays.asList("rlnMicrographName", "rlnDefocusU", "rlnVoltage"));
    Assert.assertEquals(res.getColumn(StarField.MICROGRAPH_NAME),
        StarColumn.ofStrings("rlnMicrographName", "raw/m1.mrc", "raw/m2.mrc"));
    Assert.assertEquals(res.getColumn(StarField.DEFOCUSU).toDoubleArray(), new double[] { 50., 100. },
        "Expected missing values to be ignored");
    Assert.assertEquals(res.getColumn(StarField.VOLTAGE).toDoubleArray(), new double[] { 300., 250. });
  }

  @Test
  public void split() {
    // WHEN
    SortedMap<String, StarTable> res = micrographOperations.splitByMicrograph(particles());

    // THEN
    Assert.assertEquals(res.keySet(), new TreeSet<>(Arrays.asList("raw/m1.mrc", "raw/m2.mrc")));
    StarTable m2 = res.get("raw/m2.mrc");
    Assert.assertFalse(m2.hasColumn(StarField.MICROGRAPH_NAME));
    Assert.assertEquals(m2.getColumn(StarField.COORDX).toDoubleArray(), new double[] { 1., 3. });
  }

  @Test(expectedExceptions = FieldNotFoundException.class)
  public void splitWithoutMicrographs() {
    micrographOperations.splitByMicrograph(new StarTable(Arrays.asList(StarColumn.ofStrings("rlnImageName", "a"))));
  }

  @Test
  public void rebase() {
    // GIVEN
    StarTable table = particles();

    // WHEN
    micrographOperations.rebaseMicrographPath(table, "/data/new", true);

    // THEN
    Assert.assertEquals(table.getColumn(StarField.MICROGRAPH_NAME),
        StarColumn.ofStrings("rlnMicrographName", "/data/new/m2.mrc", "/data/new/m1.mrc", "/data/new/m2.mrc"));
  }
}
