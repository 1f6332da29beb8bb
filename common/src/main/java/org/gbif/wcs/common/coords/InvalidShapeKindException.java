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
 * Thrown for a bounding box region kind other than rectangle or ellipse.
 */
public class InvalidShapeKindException extends CoordinateException {
  private static final long serialVersionUID = -4702285510981937316L;

  public InvalidShapeKindException(String message) {
    super(message);
  }
}
