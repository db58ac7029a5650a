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
package org.starmeta.ops.transform;

import java.util.Arrays;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.starmeta.data.FieldNotFoundException;
import org.starmeta.data.StarColumn;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.StarField;
import org.starmeta.geom.EulerAngles;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link GeometricTransformer}.
 *
 * @author Bastian Gloeckle
 */
public class GeometricTransformerTest {
  private static final double DELTA = 1e-9;

  /** 90 degrees around X. */
  private static final RealMatrix ROT_X_90 =
      MatrixUtils.createRealMatrix(new double[][] { { 1, 0, 0 }, { 0, 0, -1 }, { 0, 1, 0 } });

  private GeometricTransformer transformer;

  @BeforeMethod
  public void setUp() {
    transformer = new GeometricTransformer();
  }

  private StarTable table(double[] rot, double[] tilt, double[] psi) {
    int rows = rot.length;
    return new StarTable(Arrays.asList( //
        StarColumn.ofDoubles("rlnAngleRot", rot), //
        StarColumn.ofDoubles("rlnAngleTilt", tilt), //
        StarColumn.ofDoubles("rlnAnglePsi", psi), //
        StarColumn.ofDoubles("rlnOriginX", new double[rows]), //
        StarColumn.ofDoubles("rlnOriginY", new double[rows])));
  }

  private StarTable identityOrientations(int rows) {
    return table(new double[rows], new double[rows], new double[rows]);
  }

  private RealMatrix orientation(StarTable table, int row) {
    return EulerAngles.eulerDegreesToMatrix(table.getColumn(StarField.ANGLEROT).getDouble(row),
        table.getColumn(StarField.ANGLETILT).getDouble(row), table.getColumn(StarField.ANGLEPSI).getDouble(row));
  }

  private void assertMatrixEquals(RealMatrix actual, RealMatrix expected) {
    for (int i = 0; i < 3; i++)
      for (int j = 0; j < 3; j++)
        Assert.assertEquals(actual.getEntry(i, j), expected.getEntry(i, j), DELTA,
            "Entry " + i + "," + j + " of " + actual + " vs " + expected);
  }

  @Test
  public void identityKeepsAngles() {
    // GIVEN
    StarTable table = table(new double[] { 30. }, new double[] { 60. }, new double[] { -45. });

    // WHEN
    StarTable res = transformer.transform(table, MatrixUtils.createRealIdentityMatrix(3));

    // THEN
    Assert.assertEquals(res.getColumn(StarField.ANGLEROT).getDouble(0), 30., DELTA);
    Assert.assertEquals(res.getColumn(StarField.ANGLETILT).getDouble(0), 60., DELTA);
    Assert.assertEquals(res.getColumn(StarField.ANGLEPSI).getDouble(0), -45., DELTA);
  }

  @Test
  public void chainedTransformsCompose() {
    // GIVEN
    StarTable table = table(new double[] { 30., -100., 5. }, new double[] { 60., 120., 80. },
        new double[] { -45., 10., 170. });
    RealMatrix r1 = EulerAngles.eulerDegreesToMatrix(10., 20., 30.);
    RealMatrix r2 = EulerAngles.eulerDegreesToMatrix(-50., 70., 15.);

    // WHEN
    StarTable chained = transformer.transform(transformer.transform(table, r1), r2);
    StarTable once = transformer.transform(table, r1.multiply(r2));

    // THEN
    for (int row = 0; row < 3; row++)
      assertMatrixEquals(orientation(chained, row), orientation(once, row));
  }

  @Test
  public void newOrientationIsRightProduct() {
    // GIVEN
    StarTable table = table(new double[] { 30. }, new double[] { 60. }, new double[] { -45. });
    RealMatrix orig = orientation(table, 0);

    // WHEN
    StarTable res = transformer.transform(table, ROT_X_90);

    // THEN
    assertMatrixEquals(orientation(res, 0), orig.multiply(ROT_X_90));
    Assert.assertEquals(table.getColumn(StarField.ANGLEROT).getDouble(0), 30., "Expected input to be unchanged");
  }

  @Test
  public void invertUndoesRotation() {
    // GIVEN
    StarTable table = table(new double[] { 30. }, new double[] { 60. }, new double[] { -45. });
    RealMatrix orig = orientation(table, 0);

    // WHEN
    StarTable rotated = transformer.transform(table, ROT_X_90);
    StarTable back = transformer.transform(rotated, ROT_X_90, null, true, true, false, null, false);

    // THEN
    assertMatrixEquals(orientation(back, 0), orig);
  }

  @Test
  public void vectorTranslation() {
    // GIVEN
    StarTable table = identityOrientations(2);
    table.putDoubles("rlnOriginZ", new double[] { 0., 1. });

    // WHEN
    StarTable res = transformer.transform(table, ROT_X_90, Translation.vector(1., 2., 3.));

    // THEN
    // new orientation is ROT_X_90, which maps (1, 2, 3) to (1, -3, 2).
    Assert.assertEquals(res.getColumn(StarField.ORIGINX).getDouble(1), 1., DELTA);
    Assert.assertEquals(res.getColumn(StarField.ORIGINY).getDouble(1), -3., DELTA);
    Assert.assertEquals(res.getColumn(StarField.ORIGINZ).getDouble(1), 3., DELTA);
  }

  @Test
  public void invertedVectorTranslationUsesOldOrientation() {
    // GIVEN
    StarTable table = identityOrientations(1);

    // WHEN
    StarTable res =
        transformer.transform(table, ROT_X_90, Translation.vector(1., 2., 3.), true, true, false, null, false);

    // THEN
    Assert.assertEquals(res.getColumn(StarField.ORIGINX).getDouble(0), -1., DELTA);
    Assert.assertEquals(res.getColumn(StarField.ORIGINY).getDouble(0), -2., DELTA);
    Assert.assertFalse(res.hasColumn("rlnOriginZ"), "Expected no Z origin to be added");
  }

  @Test
  public void scalarTranslationAlongZ() {
    // GIVEN
    StarTable table = identityOrientations(1);

    // WHEN
    StarTable res = transformer.transform(table, ROT_X_90, Translation.scalar(2.));

    // THEN
    // Z axis of ROT_X_90 is (0, -1, 0)
    Assert.assertEquals(res.getColumn(StarField.ORIGINX).getDouble(0), 0., DELTA);
    Assert.assertEquals(res.getColumn(StarField.ORIGINY).getDouble(0), -2., DELTA);
  }

  @Test
  public void translationFromFourthColumn() {
    // GIVEN
    StarTable table = identityOrientations(1);
    RealMatrix m = MatrixUtils.createRealMatrix(new double[][] { { 1, 0, 0, 5 }, { 0, 1, 0, 6 }, { 0, 0, 1, 7 } });

    // WHEN
    StarTable res = transformer.transform(table, m);

    // THEN
    Assert.assertEquals(res.getColumn(StarField.ORIGINX).getDouble(0), 5., DELTA);
    Assert.assertEquals(res.getColumn(StarField.ORIGINY).getDouble(0), 6., DELTA);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void fourColumnsAndTranslation() {
    RealMatrix m = MatrixUtils.createRealMatrix(3, 4);
    transformer.transform(identityOrientations(1), m, Translation.scalar(1.));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void wrongShape() {
    transformer.transform(identityOrientations(1), MatrixUtils.createRealIdentityMatrix(2));
  }

  @Test
  public void precomputedOrientationsAndNoRotate() {
    // GIVEN
    StarTable table = table(new double[] { 30. }, new double[] { 60. }, new double[] { -45. });
    RealMatrix[] orientations = new RealMatrix[] { MatrixUtils.createRealIdentityMatrix(3) };

    // WHEN
    StarTable rotated = transformer.transform(table, ROT_X_90, null, false, true, false, orientations, false);
    StarTable notRotated =
        transformer.transform(table, ROT_X_90, Translation.scalar(2.), false, false, false, orientations, false);

    // THEN
    assertMatrixEquals(orientation(rotated, 0), ROT_X_90);
    Assert.assertEquals(notRotated.getColumn(StarField.ANGLEROT).getDouble(0), 30.);
    Assert.assertEquals(notRotated.getColumn(StarField.ORIGINY).getDouble(0), -2., DELTA,
        "Expected translation to be based on precomputed orientation");
  }

  @Test
  public void defocusAdjustedAndAngleFromDefocusV() {
    // GIVEN
    StarTable table = identityOrientations(2);
    table.putDoubles("rlnDefocusU", new double[] { 10000., 10000. });
    table.putDoubles("rlnDefocusV", new double[] { 9000., -9000. });
    table.putDoubles("rlnDefocusAngle", new double[] { 12., 12. });
    table.putDoubles("rlnDetectorPixelSize", new double[] { 5., 5. });
    table.putDoubles("rlnMagnification", new double[] { 10000., 10000. });

    // WHEN
    StarTable res = transformer.transform(table, MatrixUtils.createRealIdentityMatrix(3),
        Translation.vector(0., 0., 10.), false, true, true, null, false);

    // THEN
    Assert.assertEquals(res.getColumn(StarField.DEFOCUSU).getDouble(0), 10050., DELTA);
    Assert.assertEquals(res.getColumn(StarField.DEFOCUSV).getDouble(0), 9050., DELTA);
    Assert.assertEquals(res.getColumn(StarField.DEFOCUSV).getDouble(1), -8950., DELTA);
    // the angle only depends on the sign of defocus V.
    Assert.assertEquals(res.getColumn(StarField.DEFOCUSANGLE).getDouble(0), 45., DELTA);
    Assert.assertEquals(res.getColumn(StarField.DEFOCUSANGLE).getDouble(1), -135., DELTA);
  }

  @Test(expectedExceptions = FieldNotFoundException.class)
  public void defocusWithoutPixelSize() {
    StarTable table = identityOrientations(1);
    table.putDoubles("rlnDefocusU", new double[] { 1. });
    table.putDoubles("rlnDefocusV", new double[] { 1. });
    transformer.transform(table, MatrixUtils.createRealIdentityMatrix(3), Translation.vector(0., 0., 1.), false, true,
        true, null, false);
  }

  @Test
  public void failedDefocusAdjustmentLeavesTableUnchanged() {
    // GIVEN
    StarTable table = table(new double[] { 10. }, new double[] { 20. }, new double[] { 30. });
    table.putDoubles("rlnOriginX", new double[] { 1.5 });
    table.putDoubles("rlnDefocusU", new double[] { 10000. });
    table.putDoubles("rlnDefocusV", new double[] { 9000. });
    StarTable before = table.copy();

    // WHEN
    try {
      transformer.transform(table, ROT_X_90, Translation.vector(2., 3., 4.), false, true, true, null, true);
      Assert.fail("Expected FieldNotFoundException");
    } catch (FieldNotFoundException e) {
      // expected, no pixel size
    }

    // THEN
    Assert.assertEquals(table, before, "Expected angles and origins to be untouched");
  }

  @Test(expectedExceptions = FieldNotFoundException.class)
  public void noAngles() {
    StarTable table = new StarTable(Arrays.asList(StarColumn.ofDoubles("rlnOriginX", new double[] { 1. })));
    transformer.transform(table, MatrixUtils.createRealIdentityMatrix(3));
  }

  @Test
  public void pixelSize() {
    // GIVEN
    StarTable table = new StarTable(Arrays.asList( //
        StarColumn.ofDoubles("rlnDetectorPixelSize", new double[] { 14., 1. }), //
        StarColumn.ofDoubles("rlnMagnification", new double[] { 10000., 1. })));

    // WHEN / THEN
    Assert.assertEquals(PixelSize.calculatePixelSize(table).getAsDouble(), 14., DELTA);
    Assert.assertEquals(PixelSize.calculatePixelSize(table.getRecord(1)).getAsDouble(), 10000., DELTA);
    Assert.assertFalse(PixelSize.calculatePixelSize(new StarTable(1)).isPresent());
  }
}
