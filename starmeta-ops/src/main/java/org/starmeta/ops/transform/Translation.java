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

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

import com.google.common.base.Preconditions;

/**
 * A translation applied by {@link GeometricTransformer}: either a 3D vector or a scalar distance along the local Z axis
 * of each record's orientation.
 *
 * @author Bastian Gloeckle
 */
public final class Translation {
  private final RealVector vector;
  private final double scalar;

  private Translation(RealVector vector, double scalar) {
    this.vector = vector;
    this.scalar = scalar;
  }

  public static Translation vector(double x, double y, double z) {
    return new Translation(new ArrayRealVector(new double[] { x, y, z }), 0.);
  }

  public static Translation vector(RealVector vector) {
    Preconditions.checkArgument(vector.getDimension() == 3, "Translation needs 3 components, but has %s",
        vector.getDimension());
    return new Translation(vector.copy(), 0.);
  }

  public static Translation scalar(double distance) {
    return new Translation(null, distance);
  }

  public boolean isScalar() {
    return vector == null;
  }

  /**
   * @throws IllegalStateException
   *           if this is a vector translation.
   */
  public double getScalar() {
    Preconditions.checkState(isScalar(), "Not a scalar translation");
    return scalar;
  }

  /**
   * @return A copy of the vector.
   * @throws IllegalStateException
   *           if this is a scalar translation.
   */
  public RealVector getVector() {
    Preconditions.checkState(!isScalar(), "Not a vector translation");
    return vector.copy();
  }

  /**
   * @return Length of the translation.
   */
  public double getNorm() {
    return isScalar() ? Math.abs(scalar) : vector.getNorm();
  }

  @Override
  public String toString() {
    return isScalar() ? "Translation[" + scalar + "]" : "Translation" + vector;
  }
}
