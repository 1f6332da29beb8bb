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

import lombok.Builder;
import lombok.Value;

/**
 * Absolute tolerances used when comparing coordinate systems.  Quantities of different natural scales (positions,
 * steps, angles in degrees) share a single tolerance per comparison, so callers working at unusual scales should
 * supply their own.
 */
@Value
@Builder(toBuilder = true)
public class Tolerances implements Serializable {
  private static final long serialVersionUID = 2811659410093786525L;

  public static final Tolerances DEFAULT = Tolerances.builder().build();

  /** World position of the first pixel, steps and rotation of image coordinate systems. */
  @Builder.Default
  double celestialEquality = 1e-3;

  /** Step magnitudes compared by {@code sameStep}. */
  @Builder.Default
  double stepEquality = 1e-7;

  /** First coordinate and step of spectral coordinate systems. */
  @Builder.Default
  double spectralEquality = 1e-2;

  /** Rotations (degrees) below which a system is treated as axis-aligned when its step is replaced. */
  @Builder.Default
  double rotationThreshold = 1e-3;
}
