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

import java.util.OptionalDouble;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starmeta.context.AutoInstatiate;
import org.starmeta.data.FieldNotFoundException;
import org.starmeta.data.StarTable;
import org.starmeta.data.schema.StarField;
import org.starmeta.geom.EulerAngles;

import com.google.common.base.Preconditions;

/**
 * Applies a rotation and an optional translation to the orientations and origins of all records of a table.
 *
 * <p>
 * The orientation of each record (given by its Euler angles) is right-multiplied by the rotation. Applying R1 and then
 * R2 is therefore the same as applying R1&middot;R2 once.
 *
 * <p>
 * A vector translation is rotated by the new orientation of each record (or, when inverting, by the old orientation
 * and negated) and added to the origins. A scalar translation is a distance along the Z axis of the new (old)
 * orientation.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class GeometricTransformer {
  private static final Logger logger = LoggerFactory.getLogger(GeometricTransformer.class);

  /**
   * Rotate all records of a copy of the table.
   */
  public StarTable transform(StarTable table, RealMatrix rotation) {
    return transform(table, rotation, null, false, true, false, null, false);
  }

  /**
   * Rotate and translate all records of a copy of the table.
   */
  public StarTable transform(StarTable table, RealMatrix rotation, Translation translation) {
    return transform(table, rotation, translation, false, true, false, null, false);
  }

  /**
   * Transform all records of a table.
   *
   * @param rotation
   *          3x3 rotation matrix. May be a 3x4 matrix if no translation is given, in which case the 4th column is used
   *          as translation vector.
   * @param translation
   *          The translation or <code>null</code>.
   * @param invert
   *          Apply the inverse transformation.
   * @param rotate
   *          Whether to write the new orientations to the angle fields. If <code>false</code>, only the origins are
   *          changed.
   * @param adjustDefocus
   *          Add the Z component of the translation (scaled by the pixel size) to the defocus values and recompute the
   *          defocus angle.
   * @param orientations
   *          The current orientation matrix of each record or <code>null</code> to calculate it from the angle fields.
   * @param inPlace
   *          <code>true</code> to change and return the given table, <code>false</code> to work on a copy.
   * @return The transformed table.
   * @throws IllegalArgumentException
   *           if the matrix has an unsupported shape.
   * @throws FieldNotFoundException
   *           if the angle fields are needed but not available or if the defocus should be adjusted but the pixel size
   *           is not available.
   */
  public StarTable transform(StarTable table, RealMatrix rotation, Translation translation, boolean invert,
      boolean rotate, boolean adjustDefocus, RealMatrix[] orientations, boolean inPlace)
      throws IllegalArgumentException, FieldNotFoundException {
    Preconditions.checkArgument(rotation.getRowDimension() == 3, "Rotation matrix needs 3 rows, but has %s",
        rotation.getRowDimension());
    RealMatrix r = rotation;
    Translation t = translation;
    if (r.getColumnDimension() == 4 && t == null) {
      t = Translation.vector(r.getColumnVector(3));
      r = r.getSubMatrix(0, 2, 0, 2);
    }
    Preconditions.checkArgument(r.getColumnDimension() == 3, "Rotation matrix needs to be 3x3, but is 3x%s",
        r.getColumnDimension());

    StarTable res = inPlace ? table : table.copy();
    int rows = res.getNumberOfRows();

    RealMatrix[] rots = orientations;
    if (rots == null)
      rots = EulerAngles.eulerDegreesToMatrices(res.getColumn(StarField.ANGLEROT).toDoubleArray(),
          res.getColumn(StarField.ANGLETILT).toDoubleArray(), res.getColumn(StarField.ANGLEPSI).toDoubleArray());
    Preconditions.checkArgument(rots.length == rows, "Got %s orientations for %s records", rots.length, rows);

    boolean shift = t != null && t.getNorm() > 0;
    // check all fields before changing anything.
    double pixelSize = Double.NaN;
    if (shift && adjustDefocus) {
      OptionalDouble apix = PixelSize.calculatePixelSize(res);
      if (!apix.isPresent())
        throw new FieldNotFoundException("Cannot adjust defocus, as the pixel size is not available.");
      pixelSize = apix.getAsDouble();
      res.getColumn(StarField.DEFOCUSU);
      res.getColumn(StarField.DEFOCUSV);
    }

    if (invert)
      r = r.transpose();

    RealMatrix[] newRots = new RealMatrix[rows];
    for (int i = 0; i < rows; i++)
      newRots[i] = rots[i].multiply(r);

    if (rotate) {
      double[][] angles = EulerAngles.matricesToEulerDegrees(newRots);
      double[] rot = new double[rows];
      double[] tilt = new double[rows];
      double[] psi = new double[rows];
      for (int i = 0; i < rows; i++) {
        rot[i] = angles[i][0];
        tilt[i] = angles[i][1];
        psi[i] = angles[i][2];
      }
      res.putDoubles(StarField.ANGLEROT.getFieldName(), rot);
      res.putDoubles(StarField.ANGLETILT.getFieldName(), tilt);
      res.putDoubles(StarField.ANGLEPSI.getFieldName(), psi);
    }

    if (shift) {
      double[][] shifts = new double[rows][];
      for (int i = 0; i < rows; i++)
        shifts[i] = shift(t, rots[i], newRots[i], invert);

      addToColumn(res, StarField.ORIGINX, shifts, 0);
      addToColumn(res, StarField.ORIGINY, shifts, 1);
      addToColumn(res, StarField.ORIGINZ, shifts, 2);

      if (adjustDefocus)
        adjustDefocus(res, shifts, pixelSize);
    }

    logger.debug("Transformed {} records.", rows);
    return res;
  }

  private double[] shift(Translation t, RealMatrix rot, RealMatrix newRot, boolean invert) {
    if (t.isScalar()) {
      if (invert)
        return rot.getColumnVector(2).mapMultiply(-t.getScalar()).toArray();
      return newRot.getColumnVector(2).mapMultiply(t.getScalar()).toArray();
    }
    RealVector v = t.getVector();
    if (invert)
      return rot.operate(v).mapMultiply(-1.).toArray();
    return newRot.operate(v).toArray();
  }

  private void addToColumn(StarTable table, StarField field, double[][] shifts, int component) {
    if (!table.hasColumn(field))
      return;
    double[] values = table.getColumn(field).toDoubleArray();
    for (int i = 0; i < values.length; i++)
      values[i] += shifts[i][component];
    table.putDoubles(field.getFieldName(), values);
  }

  private void adjustDefocus(StarTable table, double[][] shifts, double pixelSize) {
    double[] defocusU = table.getColumn(StarField.DEFOCUSU).toDoubleArray();
    double[] defocusV = table.getColumn(StarField.DEFOCUSV).toDoubleArray();
    double[] defocusAngle = new double[defocusU.length];
    for (int i = 0; i < defocusU.length; i++) {
      double dz = shifts[i][2] * pixelSize;
      defocusU[i] += dz;
      defocusV[i] += dz;
      // TODO the angle is derived from V only, check whether U should contribute here.
      defocusAngle[i] = FastMath.toDegrees(FastMath.atan2(defocusV[i], defocusV[i]));
    }
    table.putDoubles(StarField.DEFOCUSU.getFieldName(), defocusU);
    table.putDoubles(StarField.DEFOCUSV.getFieldName(), defocusV);
    table.putDoubles(StarField.DEFOCUSANGLE.getFieldName(), defocusAngle);
  }
}
