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

import java.util.Locale;

import org.gbif.wcs.common.coords.InvalidShapeKindException;

/**
 * The kinds of region whose enclosing index box can be computed.
 */
public enum RegionShape {
  RECTANGLE,
  ELLIPSE;

  /**
   * @param kind "rectangle" or "ellipse", case insensitive
   * @throws InvalidShapeKindException for anything else
   */
  public static RegionShape fromString(String kind) {
    if (kind != null) {
      switch (kind.trim().toLowerCase(Locale.ROOT)) {
        case "rectangle": return RECTANGLE;
        case "ellipse": return ELLIPSE;
        default: break;
      }
    }
    throw new InvalidShapeKindException("The region kind should be 'rectangle' or 'ellipse', not: " + kind);
  }
}
