/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.gbif.wcs.common.coords;

import java.io.Serializable;

import lombok.Value;

/**
 * An immutable 2×2 matrix in FITS axis order: index 0 is the first FITS axis (X, usually right ascension) and index 1
 * the second (Y, usually declination).  As a CD matrix it maps the pixel offsets (dx, dy) from the reference pixel to
 * the intermediate world offsets (CD1_1·dx + CD1_2·dy, CD2_1·dx + CD2_2·dy).
 */
@Value
public class TransformMatrix implements Serializable {
  private static final long serialVersionUID = -1457362850263119878L;

  public static final TransformMatrix IDENTITY = new TransformMatrix(1, 0, 0, 1);

  double m11;
  double m12;
  double m21;
  double m22;

  /**
   * Builds the matrix for the given steps and rotation, following equation 189 of Calabretta &amp; Greisen,
   * A&amp;A 395, 1077 (2002), where the rotation plays the part of CROTA2.
   * @param stepX the increment per pixel along X (CDELT1)
   * @param stepY the increment per pixel along Y (CDELT2)
   * @param rotationDeg the angle between celestial north and the Y axis of the array, in degrees
   */
  public static TransformMatrix fromStepsAndRotation(double stepX, double stepY, double rotationDeg) {
    double rho = Math.toRadians(rotationDeg);
    double sin = Math.sin(rho);
    double cos = Math.cos(rho);
    return new TransformMatrix(stepX * cos, -stepY * sin, stepX * sin, stepY * cos);
  }

  /**
   * The matrix {@code [[cos θ, -sin θ], [sin θ, cos θ]]}; multiplying a CD matrix by it on the right turns the
   * image by θ relative to the sky.
   */
  public static TransformMatrix rotation(double thetaDeg) {
    double theta = Math.toRadians(thetaDeg);
    double sin = Math.sin(theta);
    double cos = Math.cos(theta);
    return new TransformMatrix(cos, -sin, sin, cos);
  }

  public static TransformMatrix diagonal(double d1, double d2) {
    return new TransformMatrix(d1, 0, 0, d2);
  }

  /**
   * @return this × other
   */
  public TransformMatrix multiply(TransformMatrix other) {
    return new TransformMatrix(m11 * other.m11 + m12 * other.m21, m11 * other.m12 + m12 * other.m22,
                               m21 * other.m11 + m22 * other.m21, m21 * other.m12 + m22 * other.m22);
  }

  /**
   * Scales the first row by f1 and the second row by f2, as when CDELTi multiplies row i of a PC matrix.
   */
  public TransformMatrix scaleRows(double f1, double f2) {
    return new TransformMatrix(m11 * f1, m12 * f1, m21 * f2, m22 * f2);
  }

  /**
   * @return the vector {@code this × (v1, v2)}
   */
  public double[] apply(double v1, double v2) {
    return new double[] {m11 * v1 + m12 * v2, m21 * v1 + m22 * v2};
  }

  public double determinant() {
    return m11 * m22 - m12 * m21;
  }

  /**
   * @return true if every cell is finite and the matrix can be inverted
   */
  public boolean isUsable() {
    return Double.isFinite(m11) && Double.isFinite(m12) && Double.isFinite(m21) && Double.isFinite(m22)
           && determinant() != 0;
  }

  /**
   * @throws NoStandardCoordinateSystemException if the matrix is singular or not finite
   */
  public TransformMatrix inverse() {
    if (!isUsable()) {
      throw new NoStandardCoordinateSystemException("Transform matrix cannot be inverted: " + this);
    }
    double det = determinant();
    return new TransformMatrix(m22 / det, -m12 / det, -m21 / det, m11 / det);
  }

  /**
   * @return the Euclidean norm of the first row (the step along X)
   */
  public double norm1() {
    return Math.hypot(m11, m12);
  }

  /**
   * @return the Euclidean norm of the second row (the step along Y)
   */
  public double norm2() {
    return Math.hypot(m21, m22);
  }
}
