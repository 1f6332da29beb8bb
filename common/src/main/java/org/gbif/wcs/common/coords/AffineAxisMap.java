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
import lombok.With;

/**
 * The linear map of a single axis: a reference pixel (1-based, as in FITS), the world value at that pixel, the world
 * increment per pixel and the FITS type code of the axis.  Pixels on the Java side are 0-based.
 */
@Value
@With
public class AffineAxisMap implements Serializable {
  private static final long serialVersionUID = 6609419512372451068L;

  double crpix;
  double crval;
  double cdelt;
  String ctype;

  /**
   * @param pixel a 0-based pixel index, possibly fractional
   * @return the world value at that pixel
   */
  public double toWorld(double pixel) {
    return crval + cdelt * (pixel + 1 - crpix);
  }

  /**
   * @param world a world value
   * @return the 0-based fractional pixel of the value
   * @throws NoStandardCoordinateSystemException if the step is zero, so that every pixel has the same value
   */
  public double toPixel(double world) {
    if (cdelt == 0 || !Double.isFinite(cdelt)) {
      throw new NoStandardCoordinateSystemException("Axis step of " + cdelt + " cannot be inverted");
    }
    return (world - crval) / cdelt + crpix - 1;
  }
}
