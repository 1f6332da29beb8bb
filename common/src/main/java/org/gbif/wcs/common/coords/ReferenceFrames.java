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

import java.util.Locale;
import java.util.Optional;

import org.gbif.wcs.common.header.WcsHeader;

/**
 * Determines the celestial reference frame declared by a header.  Frames are carried through untouched; nothing here
 * validates them against the equinox or epoch.
 */
public final class ReferenceFrames {

  static final String RADESYS = "RADESYS";
  static final String RADECSYS = "RADECSYS";
  static final String EQUINOX = "EQUINOX";

  // equinoxes before this year imply the Bessel-Newcomb (FK4) system
  private static final double FK4_BEFORE = 1984d;

  private ReferenceFrames() {}

  /**
   * Returns the frame named by RADESYS, else by the deprecated RADECSYS, else implied by EQUINOX (FK4 before 1984,
   * FK5 otherwise).
   * @return the frame, or empty if the header declares none
   */
  public static Optional<String> determine(WcsHeader header) {
    if (header.contains(RADESYS)) {
      return Optional.of(header.getString(RADESYS, null).toUpperCase(Locale.ROOT));
    } else if (header.contains(RADECSYS)) {
      return Optional.of(header.getString(RADECSYS, null).toUpperCase(Locale.ROOT));
    } else if (header.contains(EQUINOX)) {
      return Optional.of(header.getDouble(EQUINOX) < FK4_BEFORE ? "FK4" : "FK5");
    }
    return Optional.empty();
  }
}
