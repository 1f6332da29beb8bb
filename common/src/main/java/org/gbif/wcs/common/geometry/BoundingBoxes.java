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
package org.gbif.wcs.common.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Computes the smallest box of array indexes enclosing a rotated rectangle or ellipse, as needed to cut out or
 * mask a region of an image.
 * <p/>
 * Regions are given by their center in floating point array indexes (y, x), their half-height and half-width, and
 * a position angle in degrees.  At a position angle of 0 the width lies along the X axis of the array and the height
 * along the Y axis; positive angles rotate the region anti-clockwise.  Radii may be given in world units, in which
 * case the per-pixel step of each axis converts them to pixels (use a step of 1 for radii already in pixels).
 * <p/>
 * This class is threadsafe.
 */
public final class BoundingBoxes {
  private static final Logger LOG = LoggerFactory.getLogger(BoundingBoxes.class);

  private BoundingBoxes() {}

  /**
   * As {@link #boundingBox(RegionShape, Double2D, Double2D, double, Int2D, Double2D)} with the kind given by name.
   * @throws org.gbif.wcs.common.coords.InvalidShapeKindException if the kind is neither rectangle nor ellipse
   */
  public static IndexRange[] boundingBox(String kind, Double2D center, Double2D radii, double posAngle,
                                         Int2D shape, Double2D step) {
    return boundingBox(RegionShape.fromString(kind), center, radii, posAngle, shape, step);
  }

  /**
   * As {@link #boundingBox(RegionShape, Double2D, Double2D, double, Int2D, Double2D)} for a square or a circle.
   */
  public static IndexRange[] boundingBox(RegionShape kind, Double2D center, double radius, double posAngle,
                                         Int2D shape, Double2D step) {
    return boundingBox(kind, center, Double2D.square(radius), posAngle, shape, step);
  }

  /**
   * Returns the row and column ranges of the region of the array that just encloses the shape.  Parts of the shape
   * falling outside the array are clipped, so both ranges are always within the array.
   *
   * @param kind the region kind
   * @param center the center of the region in array indexes (y, x)
   * @param radii the half-height and half-width of the region (y, x)
   * @param posAngle the anti-clockwise rotation of the region in degrees
   * @param shape the dimensions of the array (ny, nx)
   * @param step the world increment per pixel along each axis (y, x)
   * @return the row range and the column range, each half-open
   */
  public static IndexRange[] boundingBox(RegionShape kind, Double2D center, Double2D radii, double posAngle,
                                         Int2D shape, Double2D step) {
    Preconditions.checkNotNull(kind, "A region kind is required");
    Preconditions.checkArgument(shape.getY() > 0 && shape.getX() > 0, "Array shape must be positive: %s", shape);
    Preconditions.checkArgument(step.getY() != 0 && step.getX() != 0, "Pixel steps cannot be zero: %s", step);
    Preconditions.checkArgument(radii.getY() >= 0 && radii.getX() >= 0, "Radii must be non-negative numbers: %s",
                                radii);

    double rx = radii.getX();
    double ry = radii.getY();
    double pa = Math.toRadians(posAngle);
    double sinPa = Math.sin(pa);
    double cosPa = Math.cos(pa);

    double xmax;
    double ymax;
    if (kind == RegionShape.RECTANGLE) {
      // furthest corner of the rotated rectangle along each axis
      xmax = Math.abs(rx * cosPa) + Math.abs(ry * sinPa);
      ymax = Math.abs(rx * sinPa) + Math.abs(ry * cosPa);

    } else {
      // The unrotated ellipse is x = rx cos(t), y = ry sin(t).  Rotated anti-clockwise by pa:
      //   x(t) = rx cos(t) cos(pa) - ry sin(t) sin(pa)
      //   y(t) = rx cos(t) sin(pa) + ry sin(t) cos(pa)
      // Setting dx/dt and dy/dt to zero gives the parametric angles of the extremes.
      double tXmax = Math.atan2(-ry * sinPa, rx * cosPa);
      double tYmax = Math.atan2(ry * cosPa, rx * sinPa);
      xmax = Math.abs(rx * Math.cos(tXmax) * cosPa - ry * Math.sin(tXmax) * sinPa);
      ymax = Math.abs(rx * Math.cos(tYmax) * sinPa + ry * Math.sin(tYmax) * cosPa);
    }

    double halfHeight = ymax / step.getY();
    double halfWidth = xmax / step.getX();

    // truncation towards zero, then clipping to the array
    int rowMin = clip((int) (center.getY() - halfHeight), shape.getY());
    int rowMax = clip((int) (center.getY() + halfHeight), shape.getY());
    int colMin = clip((int) (center.getX() - halfWidth), shape.getX());
    int colMax = clip((int) (center.getX() + halfWidth), shape.getX());

    LOG.debug("{} at {} radii {} pa {} spans rows [{}, {}] cols [{}, {}]", kind, center, radii, posAngle, rowMin,
              rowMax, colMin, colMax);
    return new IndexRange[] {new IndexRange(rowMin, rowMax + 1), new IndexRange(colMin, colMax + 1)};
  }

  private static int clip(int index, int length) {
    return Math.min(Math.max(index, 0), length - 1);
  }
}
