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
package org.starmeta.geom;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Conversion between Euler angles and rotation matrices.
 *
 * <p>
 * Angles are (rot, tilt, psi) in degrees in the ZYZ convention of Relion: the matrix of angles (a, b, g) is
 * R<sub>z</sub>(g) R<sub>y</sub>(b) R<sub>z</sub>(a). Internally all computation is done in radians.
 *
 * <p>
 * The batched methods work on one set of angles/one matrix per record of a table.
 *
 * @author Bastian Gloeckle
 */
public class EulerAngles {
  /** Below this value sin(tilt) is considered to be 0 (gimbal lock). */
  private static final double GIMBAL_LOCK_EPSILON = 16 * Math.ulp(1.0f);

  private static final double SIN_EPSILON = Math.ulp(1.0f);

  /**
   * @return The rotation matrix of the given Euler angles in degrees.
   */
  public static RealMatrix eulerDegreesToMatrix(double rot, double tilt, double psi) {
    double a = FastMath.toRadians(rot);
    double b = FastMath.toRadians(tilt);
    double g = FastMath.toRadians(psi);

    double ca = FastMath.cos(a);
    double cb = FastMath.cos(b);
    double cg = FastMath.cos(g);
    double sa = FastMath.sin(a);
    double sb = FastMath.sin(b);
    double sg = FastMath.sin(g);
    double cc = cb * ca;
    double cs = cb * sa;
    double sc = sb * ca;
    double ss = sb * sa;

    return MatrixUtils.createRealMatrix(new double[][] { //
        { cg * cc - sg * sa, cg * cs + sg * ca, -cg * sb }, //
        { -sg * cc - cg * sa, -sg * cs + cg * ca, sg * sb }, //
        { sc, ss, cb } });
  }

  /**
   * @param angles
   *          Array of rot, tilt, psi, in degrees.
   * @return The rotation matrix of the given Euler angles in degrees.
   */
  public static RealMatrix eulerDegreesToMatrix(double[] angles) {
    checkAngles(angles);
    return eulerDegreesToMatrix(angles[0], angles[1], angles[2]);
  }

  /**
   * Batched version of {@link #eulerDegreesToMatrix(double, double, double)}.
   *
   * @param rot
   *          rot angle of each record.
   * @param tilt
   *          tilt angle of each record.
   * @param psi
   *          psi angle of each record.
   * @return One rotation matrix per record.
   */
  public static RealMatrix[] eulerDegreesToMatrices(double[] rot, double[] tilt, double[] psi) {
    if (rot.length != tilt.length || rot.length != psi.length)
      throw new IllegalArgumentException("Angle arrays of different lengths.");

    RealMatrix[] res = new RealMatrix[rot.length];
    for (int i = 0; i < rot.length; i++)
      res[i] = eulerDegreesToMatrix(rot[i], tilt[i], psi[i]);
    return res;
  }

  /**
   * Decompose a rotation matrix into Euler angles.
   *
   * <p>
   * If tilt is 0 or 180 degrees, rot and psi are not independent; rot is then set to 0.
   *
   * @return rot, tilt, psi in degrees.
   */
  public static double[] matrixToEulerDegrees(RealMatrix r) {
    if (r.getRowDimension() != 3 || r.getColumnDimension() != 3)
      throw new IllegalArgumentException(
          "Expected a 3x3 matrix, but got " + r.getRowDimension() + "x" + r.getColumnDimension());

    double alpha;
    double beta;
    double gamma;

    double absSb = FastMath.sqrt(r.getEntry(0, 2) * r.getEntry(0, 2) + r.getEntry(1, 2) * r.getEntry(1, 2));
    if (absSb > GIMBAL_LOCK_EPSILON) {
      gamma = FastMath.atan2(r.getEntry(1, 2), -r.getEntry(0, 2));
      alpha = FastMath.atan2(r.getEntry(2, 1), r.getEntry(2, 0));
      double signSb;
      if (FastMath.abs(FastMath.sin(gamma)) < SIN_EPSILON)
        signSb = FastMath.signum(-r.getEntry(0, 2) / FastMath.cos(gamma));
      else
        signSb = (FastMath.sin(gamma) > 0) ? FastMath.signum(r.getEntry(1, 2)) : -FastMath.signum(r.getEntry(1, 2));
      beta = FastMath.atan2(signSb * absSb, r.getEntry(2, 2));
    } else if (r.getEntry(2, 2) > 0) {
      alpha = 0.;
      beta = 0.;
      gamma = FastMath.atan2(-r.getEntry(1, 0), r.getEntry(0, 0));
    } else {
      alpha = 0.;
      beta = FastMath.PI;
      gamma = FastMath.atan2(r.getEntry(1, 0), -r.getEntry(0, 0));
    }

    return new double[] { FastMath.toDegrees(alpha), FastMath.toDegrees(beta), FastMath.toDegrees(gamma) };
  }

  /**
   * Batched version of {@link #matrixToEulerDegrees(RealMatrix)}.
   *
   * @return For each input matrix an array of rot, tilt, psi in degrees.
   */
  public static double[][] matricesToEulerDegrees(RealMatrix[] matrices) {
    double[][] res = new double[matrices.length][];
    for (int i = 0; i < matrices.length; i++)
      res[i] = matrixToEulerDegrees(matrices[i]);
    return res;
  }

  private static void checkAngles(double[] angles) {
    if (angles.length != 3)
      throw new IllegalArgumentException("Expected 3 angles, but got " + angles.length);
  }

  private EulerAngles() {
  }
}
