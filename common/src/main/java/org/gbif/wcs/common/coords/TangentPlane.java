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

/**
 * The gnomonic (TAN) projection between the celestial sphere and the plane tangent to it at a reference point.  All
 * angles are in degrees; plane coordinates are the FITS intermediate world coordinates (x towards increasing right
 * ascension, y towards the north), for a native longitude of the celestial pole of 180°.
 * <p/>
 * This class is threadsafe.
 */
final class TangentPlane {

  private TangentPlane() {}

  /**
   * Projects the plane coordinates back onto the sphere.
   * @param x the intermediate coordinate along right ascension
   * @param y the intermediate coordinate along declination
   * @param ra0 the right ascension of the tangent point
   * @param dec0 the declination of the tangent point
   * @return {ra, dec} with ra in [0, 360)
   */
  static double[] toSphere(double x, double y, double ra0, double dec0) {
    double xi = Math.toRadians(x);
    double eta = Math.toRadians(y);
    double d0 = Math.toRadians(dec0);
    double sinD0 = Math.sin(d0);
    double cosD0 = Math.cos(d0);

    double denominator = cosD0 - eta * sinD0;
    double ra = ra0 + Math.toDegrees(Math.atan2(xi, denominator));
    double dec = Math.toDegrees(Math.atan2(sinD0 + eta * cosD0, Math.hypot(xi, denominator)));
    return new double[] {normalizeRa(ra), dec};
  }

  /**
   * Projects a point of the sphere onto the plane.
   * @return {x, y}
   * @throws OutsideProjectionException for points 90° or more away from the tangent point, which have no image on
   * the plane
   */
  static double[] toPlane(double ra, double dec, double ra0, double dec0) {
    double d = Math.toRadians(dec);
    double d0 = Math.toRadians(dec0);
    double dRa = Math.toRadians(ra - ra0);
    double cosC = Math.sin(d0) * Math.sin(d) + Math.cos(d0) * Math.cos(d) * Math.cos(dRa);
    if (cosC <= 0) {
      throw new OutsideProjectionException("(" + ra + ", " + dec + ") is beyond the horizon of the tangent plane at ("
                                           + ra0 + ", " + dec0 + ")");
    }
    double xi = Math.cos(d) * Math.sin(dRa) / cosC;
    double eta = (Math.cos(d0) * Math.sin(d) - Math.sin(d0) * Math.cos(d) * Math.cos(dRa)) / cosC;
    return new double[] {Math.toDegrees(xi), Math.toDegrees(eta)};
  }

  static double normalizeRa(double ra) {
    double normalized = ra % 360;
    return normalized < 0 ? normalized + 360 : normalized;
  }
}
