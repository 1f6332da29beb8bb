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

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import org.gbif.wcs.common.geometry.IndexRange;
import org.gbif.wcs.common.header.WcsHeader;
import org.gbif.wcs.common.unit.AxisUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import lombok.Builder;

/**
 * The world coordinates along the spectral (wavelength) axis of a spectrum or cube.
 * <p/>
 * Pixels are 0-based array indexes; the reference pixel follows the FITS convention and is 1-based.  The length of
 * the axis is optional: without it single pixel conversions work, but anything needing the last pixel fails with a
 * {@link MissingLengthException}.
 * <p/>
 * Instances are mutable through their setters and {@link #rebin(int)}, and are not threadsafe.  Each spectrum or cube
 * owns its own instance; use {@link #copy()} before sharing.
 */
public class SpectralWCS {
  private static final Logger LOG = LoggerFactory.getLogger(SpectralWCS.class);

  static final String DEFAULT_CTYPE = "LINEAR";
  private static final AxisUnit DEFAULT_UNIT = AxisUnit.ANGSTROM;

  private AffineAxisMap axis;
  private final AxisUnit unit;
  private Integer shape;
  private final DiagnosticListener diagnostics;

  private SpectralWCS(AffineAxisMap axis, AxisUnit unit, Integer shape, DiagnosticListener diagnostics) {
    Preconditions.checkArgument(shape == null || shape >= 0, "Spectral axis length cannot be negative: %s", shape);
    this.axis = axis;
    this.unit = unit;
    this.shape = shape;
    this.diagnostics = diagnostics;
  }

  /**
   * Builds an axis from explicit parameters.  Defaults: crpix 1, cdelt 1, crval 1, angstrom, LINEAR, no length and
   * warnings logged.
   */
  @Builder(builderMethodName = "builder")
  private static SpectralWCS create(Double crpix, Double cdelt, Double crval, AxisUnit unit, String ctype,
                                    Integer shape, DiagnosticListener diagnostics) {
    AffineAxisMap axis = new AffineAxisMap(crpix == null ? 1d : crpix,
                                           crval == null ? 1d : crval,
                                           cdelt == null ? 1d : cdelt,
                                           ctype == null ? DEFAULT_CTYPE : ctype);
    return new SpectralWCS(axis, unit == null ? DEFAULT_UNIT : unit, shape,
                           diagnostics == null ? DiagnosticListener.LOGGING : diagnostics);
  }

  public static SpectralWCS fromMetadata(WcsHeader header) {
    return fromMetadata(header, null, DiagnosticListener.LOGGING);
  }

  /**
   * Reads the spectral axis of a header: axis 1 for a spectrum (NAXIS = 1), axis 3 for a cube.  The step is taken from
   * CDn_n if present, otherwise from CDELTn × PCn_n.
   *
   * @param header the metadata record
   * @param shape the length of the axis, overriding NAXISn when not null
   * @param diagnostics receives warnings
   * @throws MalformedCoordinateMetadataException if the axis number cannot be determined or CRVALn is missing
   */
  public static SpectralWCS fromMetadata(WcsHeader header, Integer shape, DiagnosticListener diagnostics) {
    Preconditions.checkNotNull(header, "A header is required");
    int naxis;
    Integer length = null;
    if (header.contains("NAXIS") && header.contains("NAXIS" + header.getInt("NAXIS"))) {
      naxis = header.getInt("NAXIS");
      length = header.getInt("NAXIS" + naxis);
    } else if (header.contains("WCSAXES")) {
      naxis = header.getInt("WCSAXES");
    } else if (header.contains("NAXIS")) {
      naxis = header.getInt("NAXIS");
    } else {
      throw new MalformedCoordinateMetadataException("Header has neither NAXIS nor WCSAXES");
    }
    int n = naxis == 1 ? 1 : 3;

    double step;
    if (header.contains("CD" + n + "_" + n)) {
      step = header.getDouble("CD" + n + "_" + n);
    } else {
      step = header.getDouble("CDELT" + n, 1d) * header.getDouble("PC" + n + "_" + n, 1d);
    }
    AffineAxisMap axis = new AffineAxisMap(header.getDouble("CRPIX" + n, 1d),
                                           header.getDouble("CRVAL" + n),
                                           step,
                                           header.getString("CTYPE" + n, DEFAULT_CTYPE));
    AxisUnit unit = header.contains("CUNIT" + n) ? AxisUnit.parse(header.getString("CUNIT" + n, null))
                                                 : DEFAULT_UNIT;
    LOG.debug("Spectral axis {} read from header: {} {}", n, axis, unit);
    return new SpectralWCS(axis, unit, shape != null ? shape : length,
                           diagnostics == null ? DiagnosticListener.LOGGING : diagnostics);
  }

  /**
   * @return an independent copy
   */
  public SpectralWCS copy() {
    return new SpectralWCS(axis, unit, shape, diagnostics);
  }

  /**
   * @return the coordinates of every pixel of the axis
   * @throws MissingLengthException if the length is undeclared
   */
  public double[] coord() {
    return coord((AxisUnit) null);
  }

  public double[] coord(AxisUnit target) {
    int length = requireShape();
    double[] pixels = new double[length];
    Arrays.setAll(pixels, i -> i);
    return coord(pixels, target);
  }

  public double coord(double pixel) {
    return coord(pixel, null);
  }

  /**
   * @param pixel a 0-based pixel, possibly fractional
   * @param target the unit of the result, or null for the axis unit
   */
  public double coord(double pixel, AxisUnit target) {
    return unit.convert(axis.toWorld(pixel), target);
  }

  public double[] coord(double[] pixels, AxisUnit target) {
    double[] result = new double[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      result[i] = coord(pixels[i], target);
    }
    return result;
  }

  public double pixel(double lbda) {
    return pixel(lbda, false, null);
  }

  /**
   * Returns the fractional pixel of a wavelength or, with nearest, the closest pixel within the axis.
   * @param lbda the wavelength
   * @param nearest if true rounds to the nearest pixel, clamped at 0 and at the last pixel when the length is known
   * @param source the unit of lbda, or null for the axis unit
   */
  public double pixel(double lbda, boolean nearest, AxisUnit source) {
    double value = source == null ? lbda : source.convert(lbda, unit);
    double pix = axis.toPixel(value);
    if (nearest) {
      pix = Math.max(Math.floor(pix + 0.5), 0);
      if (shape != null) {
        pix = Math.min(pix, shape - 1);
      }
    }
    return pix;
  }

  public double[] pixel(double[] lbda, boolean nearest, AxisUnit source) {
    double[] result = new double[lbda.length];
    for (int i = 0; i < lbda.length; i++) {
      result[i] = pixel(lbda[i], nearest, source);
    }
    return result;
  }

  /**
   * @param index a pixel index, negative values counting back from the end
   * @return the coordinate of the pixel
   * @throws MissingLengthException for a negative index when the length is undeclared
   */
  public double slice(int index) {
    return coord(index >= 0 ? index : requireShape() + index);
  }

  /**
   * Returns the axis of the selected pixels.  The new step is the spacing between the first two selected
   * coordinates, so strided selections are allowed.  Open ends follow the direction of the step: with a negative step
   * the selection starts at the last pixel and runs down to the first one.
   *
   * @throws MissingLengthException if an open or negative end needs the undeclared length
   * @throws InsufficientPointsException if fewer than two pixels are selected
   */
  public SpectralWCS slice(IndexRange range) {
    boolean reversed = range.getStep() < 0;
    int start;
    if (range.getStart() == null) {
      start = reversed ? requireShape() - 1 : 0;
    } else {
      start = range.getStart() >= 0 ? range.getStart() : requireShape() + range.getStart();
    }
    int stop;
    if (range.getStop() == null) {
      // one before the first pixel when walking backwards
      stop = reversed ? -1 : requireShape();
    } else {
      stop = range.getStop() >= 0 ? range.getStop() : requireShape() + range.getStop();
    }
    int dim = new IndexRange(start, stop, range.getStep()).length();
    if (dim < 2) {
      throw new InsufficientPointsException("Spectral slice " + range + " selects " + dim + " pixel(s)");
    }
    double first = coord(start);
    double cdelt = coord(start + range.getStep()) - first;
    AffineAxisMap sliced = new AffineAxisMap(1d, first, cdelt, axis.getCtype());
    return new SpectralWCS(sliced, unit, dim, diagnostics);
  }

  /**
   * Returns a new axis sampling the same wavelength range with another step.
   *
   * @param step the new step
   * @param start the coordinate of the new first pixel; by default new pixels are centred so that the first one
   * overlaps the first old pixel, i.e. the old start minus half the old step plus half the new step
   * @param source the unit of step and start, or null for the axis unit
   * @return the new axis, of length 0 when the new start lies beyond the far edge of the axis
   * @throws MissingLengthException if the length is undeclared
   */
  public SpectralWCS resample(double step, Double start, AxisUnit source) {
    Preconditions.checkArgument(step != 0, "Resampling step cannot be zero");
    int length = requireShape();
    double newStep = source == null ? step : source.convert(step, unit);
    double cdelt = getStep();
    double oldStart = getStart();
    double newStart;
    if (start == null) {
      newStart = oldStart - 0.5 * cdelt + 0.5 * newStep;
    } else {
      newStart = source == null ? start : source.convert(start, unit);
    }
    // a start beyond the far edge leaves nothing to sample
    int newLength = Math.max(0, (int) Math.ceil((length * cdelt - newStart + oldStart) / newStep));
    AffineAxisMap resampled = new AffineAxisMap(1d, newStart, newStep, axis.getCtype());
    LOG.debug("Resampled {} onto step {} from {}: {} pixels", this, newStep, newStart, newLength);
    return new SpectralWCS(resampled, unit, newLength, diagnostics);
  }

  /**
   * Rebins the axis in place: the step grows by the factor and the reference pixel moves so that the centre of each
   * new pixel is the centre of the group of old pixels it replaces.  A length that is not a multiple of the factor
   * is truncated, dropping the incomplete last group, and reported to the diagnostic listener.
   *
   * @param factor the number of old pixels per new pixel
   */
  public void rebin(int factor) {
    Preconditions.checkArgument(factor > 0, "Rebinning factor must be positive: %s", factor);
    double oldStep = axis.getCdelt();
    double newStep = oldStep * factor;
    double crpix = (axis.getCrpix() * oldStep - oldStep / 2d + newStep / 2d) / newStep;
    Integer newShape = shape;
    if (shape != null) {
      if (shape % factor != 0) {
        diagnostics.warn(SpectralWCS.class, String.format(Locale.ROOT, "Rebinning %d pixels by %d drops the last %d",
                                                          shape, factor, shape % factor));
      }
      newShape = shape / factor;
    }
    axis = axis.withCdelt(newStep).withCrpix(crpix);
    shape = newShape;
  }

  public boolean isEqual(SpectralWCS other) {
    return isEqual(other, Tolerances.DEFAULT);
  }

  /**
   * Two axes are equal when their lengths are identical, the coordinates of their first pixels and their steps agree
   * within the tolerance after conversion to the unit of this axis, and their types are identical.
   */
  public boolean isEqual(SpectralWCS other, Tolerances tolerances) {
    if (other == null || !unit.isCompatible(other.unit)) {
      return false;
    }
    double tolerance = tolerances.getSpectralEquality();
    return Objects.equals(shape, other.shape)
           && Math.abs(coord(0) - other.coord(0, unit)) <= tolerance
           && Math.abs(getStep() - other.getStep(unit)) <= tolerance
           && axis.getCtype().equals(other.axis.getCtype());
  }

  public double getStep() {
    return axis.getCdelt();
  }

  public double getStep(AxisUnit target) {
    return unit.convert(axis.getCdelt(), target);
  }

  public void setStep(double step, AxisUnit source) {
    axis = axis.withCdelt(source == null ? step : source.convert(step, unit));
  }

  public double getStart() {
    return coord(0);
  }

  public double getStart(AxisUnit target) {
    return coord(0, target);
  }

  /**
   * @throws MissingLengthException if the length is undeclared
   */
  public double getEnd(AxisUnit target) {
    return coord(requireShape() - 1, target);
  }

  public double getEnd() {
    return getEnd(null);
  }

  /**
   * @return {first, last} coordinates of the axis
   * @throws MissingLengthException if the length is undeclared
   */
  public double[] getRange(AxisUnit target) {
    return coord(new double[] {0, requireShape() - 1}, target);
  }

  public double[] getRange() {
    return getRange(null);
  }

  public double getCrpix() {
    return axis.getCrpix();
  }

  public void setCrpix(double crpix) {
    axis = axis.withCrpix(crpix);
  }

  public double getCrval() {
    return axis.getCrval();
  }

  public double getCrval(AxisUnit target) {
    return unit.convert(axis.getCrval(), target);
  }

  public void setCrval(double crval, AxisUnit source) {
    axis = axis.withCrval(source == null ? crval : source.convert(crval, unit));
  }

  public String getCtype() {
    return axis.getCtype();
  }

  public AxisUnit getUnit() {
    return unit;
  }

  /**
   * @return the length of the axis, or null if undeclared
   */
  public Integer getShape() {
    return shape;
  }

  public void setShape(Integer shape) {
    Preconditions.checkArgument(shape == null || shape >= 0, "Spectral axis length cannot be negative: %s", shape);
    this.shape = shape;
  }

  @VisibleForTesting
  AffineAxisMap getAxis() {
    return axis;
  }

  DiagnosticListener getDiagnostics() {
    return diagnostics;
  }

  public WcsHeader toHeader() {
    return toHeader(1, false);
  }

  /**
   * Writes the axis as header keywords.
   * @param naxis the FITS axis number to write (1 for a spectrum, 3 for a cube)
   * @param useCd if true and the axis is 3, writes CD3_3 and zero cross terms instead of CDELT3, to sit alongside a
   * spatial CD matrix
   */
  public WcsHeader toHeader(int naxis, boolean useCd) {
    WcsHeader header = new WcsHeader()
      .put("WCSAXES", naxis)
      .put("CRVAL" + naxis, axis.getCrval())
      .put("CRPIX" + naxis, axis.getCrpix())
      .put("CUNIT" + naxis, unit.getFitsName())
      .put("CTYPE" + naxis, axis.getCtype());
    if (useCd && naxis == 3) {
      header.put("CD3_3", axis.getCdelt())
        .put("CD1_3", 0d)
        .put("CD2_3", 0d)
        .put("CD3_1", 0d)
        .put("CD3_2", 0d);
    } else {
      header.put("CDELT" + naxis, axis.getCdelt());
    }
    return header;
  }

  /**
   * Logs a one line summary of the axis.
   */
  public void info() {
    if (shape == null) {
      LOG.info("wavelength: min:{} step:{} {}", twoDecimals(getStart()), twoDecimals(getStep()), unit.getFitsName());
    } else {
      LOG.info("wavelength: min:{} max:{} step:{} {}", twoDecimals(getStart()), twoDecimals(getEnd()),
               twoDecimals(getStep()), unit.getFitsName());
    }
  }

  private static String twoDecimals(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }


  private int requireShape() {
    if (shape == null) {
      throw new MissingLengthException("Wavelength coordinates without dimension");
    }
    return shape;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("crpix", axis.getCrpix())
      .add("crval", axis.getCrval())
      .add("cdelt", axis.getCdelt())
      .add("ctype", axis.getCtype())
      .add("unit", unit)
      .add("shape", shape)
      .toString();
  }
}
