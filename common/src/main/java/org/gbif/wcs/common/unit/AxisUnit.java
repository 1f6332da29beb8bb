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
package org.gbif.wcs.common.unit;

import java.util.Locale;

import org.gbif.wcs.common.coords.IncompatibleUnitsException;
import org.gbif.wcs.common.coords.MalformedCoordinateMetadataException;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * The units an axis of a coordinate system may be expressed in.
 * <p/>
 * Each unit carries its size relative to the smallest unit of its family (arcsec for angles, angstrom for
 * wavelengths) so that the common conversions between neighbouring units are exact in floating point.
 */
public enum AxisUnit {
  DEGREE(UnitFamily.ANGLE, 3600d, "deg"),
  ARCMIN(UnitFamily.ANGLE, 60d, "arcmin"),
  ARCSEC(UnitFamily.ANGLE, 1d, "arcsec"),
  RADIAN(UnitFamily.ANGLE, 3600d * 180d / Math.PI, "rad"),
  PIXEL(UnitFamily.PIXEL, 1d, "pixel"),
  ANGSTROM(UnitFamily.WAVELENGTH, 1d, "Angstrom"),
  NANOMETER(UnitFamily.WAVELENGTH, 10d, "nm"),
  MICROMETER(UnitFamily.WAVELENGTH, 1e4, "um"),
  METER(UnitFamily.WAVELENGTH, 1e10, "m");

  // spellings found in headers written by various pipelines, all lower case
  private static final ImmutableMap<String, AxisUnit> SPELLINGS = ImmutableMap.<String, AxisUnit>builder()
    .put("deg", DEGREE).put("degree", DEGREE).put("degrees", DEGREE)
    .put("arcmin", ARCMIN).put("arcminute", ARCMIN)
    .put("arcsec", ARCSEC).put("arcsecond", ARCSEC)
    .put("rad", RADIAN).put("radian", RADIAN)
    .put("pixel", PIXEL).put("pix", PIXEL).put("pixels", PIXEL)
    .put("angstrom", ANGSTROM).put("a", ANGSTROM).put("aa", ANGSTROM).put("angstroms", ANGSTROM)
    .put("nm", NANOMETER).put("nanometer", NANOMETER)
    .put("um", MICROMETER).put("micron", MICROMETER).put("microns", MICROMETER).put("micrometer", MICROMETER)
    .put("m", METER).put("meter", METER)
    .build();

  private final UnitFamily family;
  private final double scale;
  private final String fitsName;

  AxisUnit(UnitFamily family, double scale, String fitsName) {
    this.family = family;
    this.scale = scale;
    this.fitsName = fitsName;
  }

  /**
   * Parses a FITS CUNIT value.
   * @param value the header value, case insensitive
   * @return the unit
   * @throws MalformedCoordinateMetadataException if the spelling is unknown
   */
  public static AxisUnit parse(String value) {
    String key = Strings.nullToEmpty(value).trim().toLowerCase(Locale.ROOT);
    AxisUnit unit = SPELLINGS.get(key);
    if (unit == null) {
      throw new MalformedCoordinateMetadataException("Unsupported axis unit: [" + value + "]");
    }
    return unit;
  }

  /**
   * Converts a value expressed in this unit into the target unit.  A null target returns the value untouched.
   * @throws IncompatibleUnitsException if the units belong to different families
   */
  public double convert(double value, AxisUnit target) {
    if (target == null || target == this) {
      return value;
    }
    if (!isCompatible(target)) {
      throw new IncompatibleUnitsException("Cannot convert " + this + " to " + target);
    }
    return value * scale / target.scale;
  }

  public boolean isCompatible(AxisUnit other) {
    return other != null && family == other.family;
  }

  public UnitFamily getFamily() {
    return family;
  }

  public boolean isAngular() {
    return family == UnitFamily.ANGLE;
  }

  /**
   * @return the spelling written to a CUNIT keyword
   */
  public String getFitsName() {
    return fitsName;
  }
}
