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

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import org.gbif.wcs.common.geometry.Double2D;
import org.gbif.wcs.common.geometry.IndexRange;
import org.gbif.wcs.common.geometry.Int2D;
import org.gbif.wcs.common.header.WcsHeader;
import org.gbif.wcs.common.unit.AxisUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import lombok.Builder;

/**
 * The world coordinates of the two spatial axes of an image or cube.
 * <p/>
 * Images are indexed [y, x] and every pair handled here follows that order: pixels are (row, column) and world
 * positions are (dec, ra), or (y, x) for linear systems.  The array axes are cartesian axes of a flat projection of
 * the sky around the reference position and may be rotated away from the celestial axes; when the rotation is zero
 * the Y axis is parallel to the declination axis.  Pixels need not be square on the sky: {@link #getStep()} gives the
 * world increment per pixel of each axis and {@link #getRotation()} the angle between celestial north and the Y axis,
 * in the sense of an eastward rotation of north from the Y axis.
 * <p/>
 * Internally the system is a FITS CD matrix, a 1-based reference pixel and the world value at that pixel, resolved
 * once when the instance is built whichever representation the metadata used.  Linear systems (type LINEAR or
 * PIXEL) map pixels to world coordinates affinely; celestial systems use the gnomonic (TAN) projection around the
 * reference value.
 * <p/>
 * Instances are mutable through their setters and {@link #rotate(double)}, and are not threadsafe.  Each image owns
 * its own instance; every derived system ({@link #slice}, {@link #resample}, {@link #rebin}) is independent of its
 * source.
 */
public class CelestialWCS {
  private static final Logger LOG = LoggerFactory.getLogger(CelestialWCS.class);

  private static final ImmutableSet<String> LINEAR_TYPES = ImmutableSet.of("LINEAR", "PIXEL");
  private static final String[] CD_KEYS = {"CD1_1", "CD1_2", "CD2_1", "CD2_2"};
  private static final String[] PC_KEYS = {"PC1_1", "PC1_2", "PC2_1", "PC2_2"};

  /**
   * The ways a header may describe the linear part of the transform; all are resolved into a CD matrix.
   */
  private enum MatrixForm {
    /** CDi_j cells. */
    CD,
    /** CDELTi scales and a PCi_j rotation matrix. */
    PC,
    /** CDELTi scales and the deprecated CROTA2 angle. */
    CROTA
  }

  private TransformMatrix cd;
  private double crpix1;
  private double crpix2;
  private double crval1;
  private double crval2;
  private final String ctype1;
  private final String ctype2;
  private final AxisUnit unit;
  private int naxis1;
  private int naxis2;
  private final String radesys;
  private final Double equinox;
  private final DiagnosticListener diagnostics;

  private CelestialWCS(TransformMatrix cd, double crpix1, double crpix2, double crval1, double crval2,
                       String ctype1, String ctype2, AxisUnit unit, int naxis1, int naxis2,
                       String radesys, Double equinox, DiagnosticListener diagnostics) {
    if (!cd.isUsable()) {
      throw new NoStandardCoordinateSystemException("Degenerate transform matrix: " + cd);
    }
    Preconditions.checkArgument(naxis1 >= 0 && naxis2 >= 0, "Axis lengths cannot be negative: %s, %s", naxis1,
                                naxis2);
    this.cd = cd;
    this.crpix1 = crpix1;
    this.crpix2 = crpix2;
    this.crval1 = crval1;
    this.crval2 = crval2;
    this.ctype1 = ctype1;
    this.ctype2 = ctype2;
    this.unit = unit;
    this.naxis1 = naxis1;
    this.naxis2 = naxis2;
    this.radesys = radesys;
    this.equinox = equinox;
    this.diagnostics = diagnostics;
  }

  /**
   * Builds a system from explicit parameters.
   *
   * @param crpix the 1-based reference pixel (y, x); defaults to the center of the image when the shape is given,
   * otherwise to (1, 1)
   * @param crval the world coordinates (dec, ra) of the reference pixel; defaults to (0, 0)
   * @param cdelt the increments per pixel (y, x), conventionally negative along X; defaults to (1, 1)
   * @param deg if true the world coordinates are celestial, in degrees (RA---TAN / DEC--TAN), otherwise linear
   * @param rotation the angle between celestial north and the Y axis of the image, in degrees, used with cdelt to
   * build the CD matrix
   * @param shape the dimensions of the image (ny, nx), optional
   * @param cd an explicit CD matrix, which takes precedence over cdelt and rotation
   * @param diagnostics receives warnings, logged when null
   */
  @Builder(builderMethodName = "builder")
  private static CelestialWCS create(Double2D crpix, Double2D crval, Double2D cdelt, boolean deg, double rotation,
                                     Int2D shape, TransformMatrix cd, DiagnosticListener diagnostics) {
    Double2D ref;
    if (crpix != null) {
      ref = crpix;
    } else if (shape == null) {
      ref = new Double2D(1d, 1d);
    } else {
      ref = new Double2D((shape.getY() + 1) / 2d, (shape.getX() + 1) / 2d);
    }
    Double2D value = crval == null ? new Double2D(0d, 0d) : crval;
    Double2D step = cdelt == null ? new Double2D(1d, 1d) : cdelt;
    TransformMatrix matrix = cd != null ? cd
                                        : TransformMatrix.fromStepsAndRotation(step.getX(), step.getY(), rotation);
    return new CelestialWCS(matrix, ref.getX(), ref.getY(), value.getX(), value.getY(),
                            deg ? "RA---TAN" : "LINEAR", deg ? "DEC--TAN" : "LINEAR",
                            deg ? AxisUnit.DEGREE : AxisUnit.PIXEL,
                            shape == null ? 0 : shape.getX(), shape == null ? 0 : shape.getY(),
                            null, null, diagnostics == null ? DiagnosticListener.LOGGING : diagnostics);
  }

  public static CelestialWCS fromMetadata(WcsHeader header) {
    return fromMetadata(header, null, DiagnosticListener.LOGGING);
  }

  /**
   * Reads the spatial axes (1 and 2) of a header.  The transform is taken from the CDi_j cells when any is present,
   * otherwise from the CDELTi scales with either the PCi_j matrix or the CROTA2 angle.
   *
   * @param header the metadata record
   * @param shape the image dimensions (ny, nx) used when the header has no NAXIS1/NAXIS2
   * @param diagnostics receives warnings, logged when null
   * @throws MalformedCoordinateMetadataException if the reference pixel or value, or every transform keyword, is
   * missing, or if the axis units cannot be used together
   * @throws NoStandardCoordinateSystemException if the transform found is singular
   */
  public static CelestialWCS fromMetadata(WcsHeader header, Int2D shape, DiagnosticListener diagnostics) {
    Preconditions.checkNotNull(header, "A header is required");
    DiagnosticListener listener = diagnostics == null ? DiagnosticListener.LOGGING : diagnostics;

    double crpix1 = header.getDouble("CRPIX1");
    double crpix2 = header.getDouble("CRPIX2");
    double crval1 = header.getDouble("CRVAL1");
    double crval2 = header.getDouble("CRVAL2");
    String ctype1 = header.getString("CTYPE1", "LINEAR").toUpperCase(Locale.ROOT);
    String ctype2 = header.getString("CTYPE2", "LINEAR").toUpperCase(Locale.ROOT);
    boolean celestial = !LINEAR_TYPES.contains(ctype1);

    MatrixForm form = detectForm(header, listener);
    TransformMatrix cd = resolveMatrix(header, form);

    AxisUnit defaultUnit = celestial ? AxisUnit.DEGREE : AxisUnit.PIXEL;
    AxisUnit unit1 = header.contains("CUNIT1") ? AxisUnit.parse(header.getString("CUNIT1", null)) : defaultUnit;
    AxisUnit unit2 = header.contains("CUNIT2") ? AxisUnit.parse(header.getString("CUNIT2", null)) : defaultUnit;
    if (celestial && !(unit1.isAngular() && unit2.isAngular())) {
      throw new MalformedCoordinateMetadataException("Celestial axes need angular units, found " + unit1 + " and "
                                                     + unit2);
    }
    if (unit1 != unit2) {
      if (!unit1.isCompatible(unit2)) {
        throw new MalformedCoordinateMetadataException("Incompatible units on x- and y-axes: " + unit1 + ", "
                                                       + unit2);
      }
      listener.warn(CelestialWCS.class, "different units on x- and y-axes, using " + unit1);
      double factor = unit2.convert(1d, unit1);
      crval2 = crval2 * factor;
      cd = cd.scaleRows(1d, factor);
    }
    if (celestial && !ctype1.endsWith("-TAN")) {
      listener.warn(CelestialWCS.class, "Projection of " + ctype1 + " is not supported, using TAN");
    }

    int naxis1;
    int naxis2;
    if (header.contains("NAXIS1") && header.contains("NAXIS2")) {
      naxis1 = header.getInt("NAXIS1");
      naxis2 = header.getInt("NAXIS2");
    } else if (shape != null) {
      naxis1 = shape.getX();
      naxis2 = shape.getY();
    } else {
      naxis1 = 0;
      naxis2 = 0;
    }

    String radesys = ReferenceFrames.determine(header).orElse(null);
    Double equinox = header.getDoubleOrNull(ReferenceFrames.EQUINOX);

    if (LOG.isDebugEnabled()) {
      LOG.debug("Spatial axes read from {} form: cd={} crpix=({}, {}) crval=({}, {}) {} {}", form, cd, crpix1, crpix2,
                crval1, crval2, ctype1, unit1);
    }
    return new CelestialWCS(cd, crpix1, crpix2, crval1, crval2, ctype1, ctype2, unit1, naxis1, naxis2, radesys,
                            equinox, listener);
  }

  private static MatrixForm detectForm(WcsHeader header, DiagnosticListener diagnostics) {
    boolean hasCd = header.containsAny(CD_KEYS);
    boolean hasPc = header.containsAny(PC_KEYS);
    if (hasCd) {
      if (hasPc) {
        diagnostics.warn(CelestialWCS.class, "Header has both CDi_j and PCi_j keywords, using CDi_j");
      }
      return MatrixForm.CD;
    } else if (hasPc) {
      return MatrixForm.PC;
    } else if (header.containsAny("CROTA2", "CROTA1")) {
      return MatrixForm.CROTA;
    } else if (header.containsAny("CDELT1", "CDELT2")) {
      return MatrixForm.PC;
    }
    throw new MalformedCoordinateMetadataException("Header has no CDi_j, PCi_j, CDELTi or CROTAi keywords");
  }

  private static TransformMatrix resolveMatrix(WcsHeader header, MatrixForm form) {
    switch (form) {
      case CD:
        return new TransformMatrix(header.getDouble("CD1_1", 0d), header.getDouble("CD1_2", 0d),
                                   header.getDouble("CD2_1", 0d), header.getDouble("CD2_2", 0d));
      case CROTA:
        double crota = header.getDouble("CROTA2", header.getDouble("CROTA1", 0d));
        return TransformMatrix.fromStepsAndRotation(header.getDouble("CDELT1", 1d), header.getDouble("CDELT2", 1d),
                                                    crota);
      case PC:
      default:
        TransformMatrix pc = new TransformMatrix(header.getDouble("PC1_1", 1d), header.getDouble("PC1_2", 0d),
                                                 header.getDouble("PC2_1", 0d), header.getDouble("PC2_2", 1d));
        return pc.scaleRows(header.getDouble("CDELT1", 1d), header.getDouble("CDELT2", 1d));
    }
  }

  /**
   * @return a deep, independent copy
   */
  public CelestialWCS copy() {
    return new CelestialWCS(cd, crpix1, crpix2, crval1, crval2, ctype1, ctype2, unit, naxis1, naxis2, radesys,
                            equinox, diagnostics);
  }

  public Double2D pixelToWorld(Double2D pixel) {
    return pixelToWorld(pixel, null);
  }

  /**
   * Converts a 0-based (row, column) pixel position into world coordinates (dec, ra).
   * @param pixel the pixel, possibly fractional
   * @param target the unit of the result, or null for the unit of the system
   */
  public Double2D pixelToWorld(Double2D pixel, AxisUnit target) {
    double[] world = toWorld(pixel.getX(), pixel.getY());
    return new Double2D(unit.convert(world[1], target), unit.convert(world[0], target));
  }

  public List<Double2D> pixelToWorld(List<Double2D> pixels, AxisUnit target) {
    return pixels.stream().map(p -> pixelToWorld(p, target)).collect(Collectors.toList());
  }

  /**
   * As {@link #pixelToWorld(Double2D, AxisUnit)} for an (n, 2) array of (row, column) pairs.
   * @throws InvalidCoordinateShapeException unless every row holds exactly two values
   */
  public double[][] pixelToWorld(double[][] pixels, AxisUnit target) {
    checkPairs(pixels, "pixelToWorld");
    double[][] result = new double[pixels.length][];
    for (int i = 0; i < pixels.length; i++) {
      result[i] = pixelToWorld(pixels[i], target);
    }
    return result;
  }

  /**
   * As {@link #pixelToWorld(Double2D, AxisUnit)} for a single (row, column) pair.
   * @throws InvalidCoordinateShapeException unless exactly two values are given
   */
  public double[] pixelToWorld(double[] pixel, AxisUnit target) {
    checkPair(pixel, "pixelToWorld");
    Double2D world = pixelToWorld(new Double2D(pixel[0], pixel[1]), target);
    return new double[] {world.getY(), world.getX()};
  }

  public Double2D worldToPixel(Double2D world) {
    return worldToPixel(world, false, null);
  }

  /**
   * Converts world coordinates (dec, ra) into a 0-based (row, column) pixel position.
   *
   * @param world the world coordinates
   * @param nearest if true returns the nearest integer pixel, clamped into the image when its size is known
   * @param source the unit of the world coordinates, or null for the unit of the system
   * @throws OutsideProjectionException for celestial systems, if the position is 90° or more away from the reference
   * value; such positions have no pixel, nearest or not
   */
  public Double2D worldToPixel(Double2D world, boolean nearest, AxisUnit source) {
    double w1 = source == null ? world.getX() : source.convert(world.getX(), unit);
    double w2 = source == null ? world.getY() : source.convert(world.getY(), unit);
    double[] pixel = toPixel(w1, w2);
    double col = pixel[0];
    double row = pixel[1];
    if (nearest) {
      col = Math.floor(col + 0.5);
      row = Math.floor(row + 0.5);
      if (naxis1 != 0 && naxis2 != 0) {
        col = Math.min(Math.max(col, 0), naxis1 - 1);
        row = Math.min(Math.max(row, 0), naxis2 - 1);
      }
    }
    return new Double2D(row, col);
  }

  public List<Double2D> worldToPixel(List<Double2D> world, boolean nearest, AxisUnit source) {
    return world.stream().map(w -> worldToPixel(w, nearest, source)).collect(Collectors.toList());
  }

  /**
   * As {@link #worldToPixel(Double2D, boolean, AxisUnit)} for an (n, 2) array of (dec, ra) pairs.
   * @throws InvalidCoordinateShapeException unless every row holds exactly two values
   */
  public double[][] worldToPixel(double[][] world, boolean nearest, AxisUnit source) {
    checkPairs(world, "worldToPixel");
    double[][] result = new double[world.length][];
    for (int i = 0; i < world.length; i++) {
      result[i] = worldToPixel(world[i], nearest, source);
    }
    return result;
  }

  /**
   * As {@link #worldToPixel(Double2D, boolean, AxisUnit)} for a single (dec, ra) pair.
   * @throws InvalidCoordinateShapeException unless exactly two values are given
   */
  public double[] worldToPixel(double[] world, boolean nearest, AxisUnit source) {
    checkPair(world, "worldToPixel");
    Double2D pixel = worldToPixel(new Double2D(world[0], world[1]), nearest, source);
    return new double[] {pixel.getY(), pixel.getX()};
  }

  /**
   * @return {world1, world2} in the unit of the system for the 0-based column and row
   */
  private double[] toWorld(double col, double row) {
    double[] offset = cd.apply(col + 1 - crpix1, row + 1 - crpix2);
    if (!isDeg()) {
      return new double[] {crval1 + offset[0], crval2 + offset[1]};
    }
    double k = unit.convert(1d, AxisUnit.DEGREE);
    double[] sky = TangentPlane.toSphere(offset[0] * k, offset[1] * k, crval1 * k, crval2 * k);
    return new double[] {sky[0] / k, sky[1] / k};
  }

  /**
   * @return {column, row}, 0-based, for the world coordinates in the unit of the system
   */
  private double[] toPixel(double w1, double w2) {
    double[] offset;
    if (isDeg()) {
      double k = unit.convert(1d, AxisUnit.DEGREE);
      double[] plane = TangentPlane.toPlane(w1 * k, w2 * k, crval1 * k, crval2 * k);
      offset = new double[] {plane[0] / k, plane[1] / k};
    } else {
      offset = new double[] {w1 - crval1, w2 - crval2};
    }
    double[] d = cd.inverse().apply(offset[0], offset[1]);
    return new double[] {d[0] + crpix1 - 1, d[1] + crpix2 - 1};
  }

  private static void checkPairs(double[][] points, String operation) {
    if (points == null) {
      throw new InvalidCoordinateShapeException("invalid input coordinates for " + operation + ": null");
    }
    for (double[] point : points) {
      checkPair(point, operation);
    }
  }

  private static void checkPair(double[] point, String operation) {
    if (point == null || point.length != 2) {
      String found = point == null ? "null" : point.length + " values";
      throw new InvalidCoordinateShapeException("invalid input coordinates for " + operation
                                                + ": expected (y, x) pairs, found " + found);
    }
  }

  public boolean isEqual(CelestialWCS other) {
    return isEqual(other, Tolerances.DEFAULT);
  }

  /**
   * Two systems are equal when their image dimensions are identical and the world position of pixel (0, 0), the steps
   * and the rotation agree within the tolerance, once expressed in the unit of this system.  Systems with the same
   * world coordinates but from images of different dimensions are different.  The comparison is reflexive and
   * symmetric but, being tolerance based, not transitive.
   */
  public boolean isEqual(CelestialWCS other, Tolerances tolerances) {
    if (other == null || !unit.isCompatible(other.unit)) {
      return false;
    }
    double tolerance = tolerances.getCelestialEquality();
    Double2D x1 = pixelToWorld(new Double2D(0, 0));
    Double2D x2 = other.pixelToWorld(new Double2D(0, 0), unit);
    Double2D step1 = getStep();
    Double2D step2 = other.getStep(unit);
    return naxis1 == other.naxis1
           && naxis2 == other.naxis2
           && close(x1, x2, tolerance)
           && close(step1, step2, tolerance)
           && Math.abs(getRotation() - other.getRotation()) <= tolerance;
  }

  public boolean sameStep(CelestialWCS other) {
    return sameStep(other, Tolerances.DEFAULT);
  }

  /**
   * @return true if both systems have the same pixel sizes, whatever their rotation and dimensions
   */
  public boolean sameStep(CelestialWCS other, Tolerances tolerances) {
    return other != null && unit.isCompatible(other.unit)
           && close(getStep(), other.getStep(unit), tolerances.getStepEquality());
  }

  private static boolean close(Double2D a, Double2D b, double tolerance) {
    return Math.abs(a.getY() - b.getY()) <= tolerance && Math.abs(a.getX() - b.getX()) <= tolerance;
  }

  /**
   * Returns the system of a sub-image.  Ends are clamped to the image and negative ends count back from the end of
   * the axis.  The reference pixel is shifted by the offset of the slice, so it may lie outside the sub-image.
   *
   * @param rows the range along Y
   * @param cols the range along X
   * @throws UnsupportedStrideException if either range has a step other than 1
   */
  public CelestialWCS slice(IndexRange rows, IndexRange cols) {
    if (rows.getStep() != 1 || cols.getStep() != 1) {
      throw new UnsupportedStrideException("Index steps are not supported: " + rows + ", " + cols);
    }
    int[] x = cols.resolve(naxis1);
    int[] y = rows.resolve(naxis2);
    CelestialWCS res = copy();
    res.crpix1 = crpix1 - x[0];
    res.crpix2 = crpix2 - y[0];
    res.naxis1 = Math.max(x[1] - x[0], 0);
    res.naxis2 = Math.max(y[1] - y[0], 0);
    return res;
  }

  public Double2D getStep() {
    return getStep(null);
  }

  /**
   * @return the world increments per pixel (dy, dx), always positive
   */
  public Double2D getStep(AxisUnit target) {
    return new Double2D(unit.convert(cd.norm2(), target), unit.convert(cd.norm1(), target));
  }

  public double getRotation() {
    return getRotation(AxisUnit.DEGREE);
  }

  /**
   * @param target an angular unit
   * @return the angle between celestial north and the Y axis of the image
   */
  public double getRotation(AxisUnit target) {
    return AxisUnit.DEGREE.convert(Math.toDegrees(Math.atan2(cd.getM21(), cd.getM22())), target);
  }

  public Double2D[] getRange() {
    return getRange(null);
  }

  /**
   * @return {(min dec, min ra), (max dec, max ra)} over the four corner pixels of the image
   */
  public Double2D[] getRange(AxisUnit target) {
    Double2D[] corners = {
      pixelToWorld(new Double2D(0, 0), target),
      pixelToWorld(new Double2D(naxis2 - 1, 0), target),
      pixelToWorld(new Double2D(0, naxis1 - 1), target),
      pixelToWorld(new Double2D(naxis2 - 1, naxis1 - 1), target)
    };
    double minY = Double.POSITIVE_INFINITY;
    double minX = Double.POSITIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    for (Double2D corner : corners) {
      minY = Math.min(minY, corner.getY());
      minX = Math.min(minX, corner.getX());
      maxY = Math.max(maxY, corner.getY());
      maxX = Math.max(maxX, corner.getX());
    }
    return new Double2D[] {new Double2D(minY, minX), new Double2D(maxY, maxX)};
  }

  public Double2D getStart() {
    return getStart(null);
  }

  /**
   * @return the world coordinates of pixel (0, 0)
   */
  public Double2D getStart(AxisUnit target) {
    return pixelToWorld(new Double2D(0, 0), target);
  }

  public Double2D getEnd() {
    return getEnd(null);
  }

  /**
   * @return the world coordinates of the last pixel (naxis2 - 1, naxis1 - 1)
   */
  public Double2D getEnd(AxisUnit target) {
    return pixelToWorld(new Double2D(naxis2 - 1, naxis1 - 1), target);
  }

  /**
   * Replaces the increments per pixel, keeping the current rotation.
   * @param step the new increments (dy, dx)
   * @param source the unit of the step, or null for the unit of the system
   */
  public void setStep(Double2D step, AxisUnit source) {
    double dy = source == null ? step.getY() : source.convert(step.getY(), unit);
    double dx = source == null ? step.getX() : source.convert(step.getX(), unit);
    double theta = getRotation();
    boolean rotated = Math.abs(theta) > Tolerances.DEFAULT.getRotationThreshold();
    // east to the left for celestial axes
    TransformMatrix matrix = TransformMatrix.diagonal(isDeg() ? -dx : dx, dy);
    if (rotated) {
      matrix = matrix.multiply(TransformMatrix.rotation(theta));
    }
    cd = checkUsable(matrix);
  }

  /**
   * Rotates the image relative to the sky: afterwards {@link #getRotation()} has grown by theta.
   * @param theta the rotation in degrees
   */
  public void rotate(double theta) {
    cd = checkUsable(cd.multiply(TransformMatrix.rotation(theta)));
  }

  /**
   * Returns a system sampling the same region of the sky on a new grid.  The reference pixel of the new system is
   * (1, 1); its size is the number of new pixels needed to reach the far edge of the old image from the new start.
   *
   * @param step the new increments (dy, dx)
   * @param start the world coordinates of the new pixel (0, 0); by default new pixels are centred so that the first
   * one overlaps the first old pixel, i.e. the old start minus half the old step plus half the new step
   * @param source the unit of step and start, or null for the unit of the system
   * @return the new system, of size 0 along any axis whose new start lies beyond the far edge of the image
   */
  public CelestialWCS resample(Double2D step, Double2D start, AxisUnit source) {
    Double2D newStep = source == null ? step
                                      : new Double2D(source.convert(step.getY(), unit),
                                                     source.convert(step.getX(), unit));
    Double2D cdelt = getStep();
    Double2D oldStart = getStart();
    Double2D newStart;
    if (start == null) {
      newStart = new Double2D(oldStart.getY() - 0.5 * cdelt.getY() + 0.5 * newStep.getY(),
                              oldStart.getX() - 0.5 * cdelt.getX() + 0.5 * newStep.getX());
    } else if (source == null) {
      newStart = start;
    } else {
      newStart = new Double2D(source.convert(start.getY(), unit), source.convert(start.getX(), unit));
    }

    CelestialWCS res = copy();
    res.crpix1 = 1d;
    res.crpix2 = 1d;
    res.crval1 = newStart.getX();
    res.crval2 = newStart.getY();
    res.setStep(newStep, null);
    // a start beyond the far edge leaves nothing to sample
    res.naxis1 = Math.max(0, (int) Math.ceil((naxis1 * cdelt.getX() - newStart.getX() + oldStart.getX())
                                             / newStep.getX()));
    res.naxis2 = Math.max(0, (int) Math.ceil((naxis2 * cdelt.getY() - newStart.getY() + oldStart.getY())
                                             / newStep.getY()));
    LOG.debug("Resampled {} onto step {} from {}", this, newStep, newStart);
    return res;
  }

  /**
   * Returns the system of the image rebinned by integer factors.  The matrix rows are scaled by the factors and the
   * reference pixel is moved so that the centre of each new pixel is the centre of the group of old pixels it replaces.
   * Dimensions that are not multiples of the factor are truncated, dropping the incomplete last group, and reported to
   * the diagnostic listener.
   *
   * @param factor the number of old pixels per new pixel (fy, fx)
   */
  public CelestialWCS rebin(Int2D factor) {
    Preconditions.checkArgument(factor.getY() > 0 && factor.getX() > 0, "Rebinning factors must be positive: %s",
                                factor);
    if (naxis1 % factor.getX() != 0 || naxis2 % factor.getY() != 0) {
      diagnostics.warn(CelestialWCS.class, String.format(Locale.ROOT, "Rebinning %dx%d pixels by %s drops pixels",
                                                         naxis2, naxis1, factor));
    }
    Double2D oldStep = getStep();
    CelestialWCS res = copy();
    res.cd = checkUsable(cd.scaleRows(factor.getX(), factor.getY()));
    Double2D newStep = res.getStep();
    res.crpix1 = (crpix1 * oldStep.getX() - oldStep.getX() / 2d + newStep.getX() / 2d) / newStep.getX();
    res.crpix2 = (crpix2 * oldStep.getY() - oldStep.getY() / 2d + newStep.getY() / 2d) / newStep.getY();
    res.naxis1 = naxis1 / factor.getX();
    res.naxis2 = naxis2 / factor.getY();
    return res;
  }

  private static TransformMatrix checkUsable(TransformMatrix matrix) {
    if (!matrix.isUsable()) {
      throw new NoStandardCoordinateSystemException("Operation would leave a degenerate transform matrix: " + matrix);
    }
    return matrix;
  }

  /**
   * @return true if the world coordinates are celestial (in an angular unit), false for LINEAR or PIXEL axes
   */
  public boolean isDeg() {
    return !LINEAR_TYPES.contains(ctype1);
  }

  public TransformMatrix getCd() {
    return cd;
  }

  /**
   * @return the 1-based reference pixel along X; pixel 1 is array index 0
   */
  public double getCrpix1() {
    return crpix1;
  }

  /**
   * @return the 1-based reference pixel along Y; pixel 1 is array index 0
   */
  public double getCrpix2() {
    return crpix2;
  }

  public void setCrpix1(double crpix1) {
    this.crpix1 = crpix1;
  }

  public void setCrpix2(double crpix2) {
    this.crpix2 = crpix2;
  }

  public double getCrval1() {
    return crval1;
  }

  public double getCrval1(AxisUnit target) {
    return unit.convert(crval1, target);
  }

  public double getCrval2() {
    return crval2;
  }

  public double getCrval2(AxisUnit target) {
    return unit.convert(crval2, target);
  }

  public void setCrval1(double value, AxisUnit source) {
    crval1 = source == null ? value : source.convert(value, unit);
  }

  public void setCrval2(double value, AxisUnit source) {
    crval2 = source == null ? value : source.convert(value, unit);
  }

  /**
   * @return the length of the X axis, 0 when unknown
   */
  public int getNaxis1() {
    return naxis1;
  }

  /**
   * @return the length of the Y axis, 0 when unknown
   */
  public int getNaxis2() {
    return naxis2;
  }

  public void setNaxis1(int naxis1) {
    Preconditions.checkArgument(naxis1 >= 0, "Axis length cannot be negative: %s", naxis1);
    this.naxis1 = naxis1;
  }

  public void setNaxis2(int naxis2) {
    Preconditions.checkArgument(naxis2 >= 0, "Axis length cannot be negative: %s", naxis2);
    this.naxis2 = naxis2;
  }

  public String getCtype1() {
    return ctype1;
  }

  public String getCtype2() {
    return ctype2;
  }

  public AxisUnit getUnit() {
    return unit;
  }

  /**
   * @return the celestial reference frame carried from the header (e.g. FK5, ICRS), if any
   */
  public Optional<String> getReferenceFrame() {
    return Optional.ofNullable(radesys);
  }

  public Optional<Double> getEquinox() {
    return Optional.ofNullable(equinox);
  }

  /**
   * Writes the system as header keywords, always as a CD matrix whatever form it was read from.
   */
  public WcsHeader toHeader() {
    WcsHeader header = new WcsHeader()
      .put("WCSAXES", 2)
      .put("CRPIX1", crpix1)
      .put("CRPIX2", crpix2)
      .put("CRVAL1", crval1)
      .put("CRVAL2", crval2)
      .put("CTYPE1", ctype1)
      .put("CTYPE2", ctype2)
      .put("CUNIT1", unit.getFitsName())
      .put("CUNIT2", unit.getFitsName())
      .put("CD1_1", cd.getM11())
      .put("CD1_2", cd.getM12())
      .put("CD2_1", cd.getM21())
      .put("CD2_2", cd.getM22());
    if (radesys != null) {
      header.put(ReferenceFrames.RADESYS, radesys);
    }
    if (equinox != null) {
      header.put(ReferenceFrames.EQUINOX, equinox);
    }
    return header;
  }

  /**
   * Writes the spatial keywords followed by the spectral ones as axis 3 of a cube.
   * @param wave the spectral axis, may be null
   */
  public WcsHeader toCubeHeader(SpectralWCS wave) {
    WcsHeader header = toHeader();
    if (wave != null) {
      header.putAll(wave.toHeader(3, true));
    }
    return header;
  }

  /**
   * Logs a one line summary: center, size and step in arcsec and rotation for celestial systems, corner coordinates
   * and step otherwise.
   */
  public void info() {
    if (isDeg()) {
      Double2D step = getStep(AxisUnit.ARCSEC);
      Double2D center = pixelToWorld(new Double2D((naxis2 - 1) / 2d, (naxis1 - 1) / 2d), AxisUnit.DEGREE);
      String[] sexa = Sexagesimal.deg2sexa(center);
      LOG.info("center:({},{}) size in arcsec:({},{}) step in arcsec:({},{}) rot:{} deg", sexa[0], sexa[1],
               decimals(step.getY() * naxis2, 3), decimals(step.getX() * naxis1, 3), decimals(step.getY(), 3),
               decimals(step.getX(), 3), decimals(getRotation(), 1));
    } else {
      Double2D start = getStart();
      Double2D end = getEnd();
      Double2D step = getStep();
      LOG.info("spatial coord ({}): min:({},{}) max:({},{}) step:({},{}) rot:{} deg", unit.getFitsName(),
               decimals(start.getY(), 1), decimals(start.getX(), 1), decimals(end.getY(), 1), decimals(end.getX(), 1),
               decimals(step.getY(), 1), decimals(step.getX(), 1), decimals(getRotation(), 1));
    }
  }

  private static String decimals(double value, int places) {
    return String.format(Locale.ROOT, "%." + places + "f", value);
  }


  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("cd", cd)
      .add("crpix", crpix1 + "," + crpix2)
      .add("crval", crval1 + "," + crval2)
      .add("ctype", ctype1 + "," + ctype2)
      .add("unit", unit)
      .add("naxis", naxis1 + "x" + naxis2)
      .toString();
  }
}
