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

import org.gbif.wcs.common.geometry.Double2D;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.primitives.Doubles;

/**
 * Conversions between decimal degrees and the sexagesimal strings used to display equatorial coordinates: right
 * ascension as hours:minutes:seconds and declination as degrees:arcminutes:arcseconds, both with seconds to three
 * decimals.  Pairs are in (dec, ra) order, as everywhere else in this package.
 */
public final class Sexagesimal {

  private static final Splitter COLON = Splitter.on(':').trimResults();
  private static final long MILLIS_PER_UNIT = 3_600_000L;

  private Sexagesimal() {}

  /**
   * @param degrees an angle, wrapped into [0, 360)
   * @return the angle as hours:minutes:seconds, e.g. {@code 23:51:41.268}
   */
  public static String deg2hms(double degrees) {
    return format(TangentPlane.normalizeRa(degrees) / 15d);
  }

  /**
   * @param hms hours:minutes:seconds, optionally signed
   * @return the angle in degrees
   */
  public static double hms2deg(String hms) {
    return parse(hms) * 15d;
  }

  /**
   * @param degrees an angle
   * @return the angle as degrees:arcminutes:arcseconds, e.g. {@code -26:04:43.032}
   */
  public static String deg2dms(double degrees) {
    return format(degrees);
  }

  /**
   * @param dms degrees:arcminutes:arcseconds, optionally signed
   * @return the angle in degrees
   */
  public static double dms2deg(String dms) {
    return parse(dms);
  }

  /**
   * @param decRa a (dec, ra) pair in degrees
   * @return {dec as d:m:s, ra as h:m:s}
   */
  public static String[] deg2sexa(Double2D decRa) {
    return new String[] {deg2dms(decRa.getY()), deg2hms(decRa.getX())};
  }

  /**
   * @return the (dec, ra) pair in degrees
   */
  public static Double2D sexa2deg(String dec, String ra) {
    return new Double2D(dms2deg(dec), hms2deg(ra));
  }

  private static String format(double value) {
    // round once on the total so that 59.9996 seconds carries into the minutes
    long total = Math.round(Math.abs(value) * MILLIS_PER_UNIT);
    long units = total / MILLIS_PER_UNIT;
    long minutes = (total / 60_000L) % 60;
    double seconds = (total % 60_000L) / 1000d;
    String sign = value < 0 && total > 0 ? "-" : "";
    return String.format(Locale.ROOT, "%s%02d:%02d:%06.3f", sign, units, minutes, seconds);
  }

  private static double parse(String value) {
    Preconditions.checkArgument(value != null, "Sexagesimal value cannot be null");
    List<String> fields = COLON.splitToList(value.trim());
    Preconditions.checkArgument(fields.size() == 3, "Expected three colon separated fields: %s", value);
    boolean negative = fields.get(0).startsWith("-");
    double units = Math.abs(number(fields.get(0), value));
    double minutes = number(fields.get(1), value);
    double seconds = number(fields.get(2), value);
    Preconditions.checkArgument(minutes >= 0 && minutes < 60 && seconds >= 0 && seconds < 60,
                                "Minutes and seconds must be in [0, 60): %s", value);
    double result = units + minutes / 60d + seconds / 3600d;
    return negative ? -result : result;
  }

  private static double number(String field, String value) {
    Double parsed = Doubles.tryParse(field);
    Preconditions.checkArgument(parsed != null, "Not a sexagesimal value: %s", value);
    return parsed;
  }
}
