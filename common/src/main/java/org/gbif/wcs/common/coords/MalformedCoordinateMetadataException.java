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
 * Thrown when a metadata record lacks the keys needed to build a coordinate system, or holds values that cannot
 * be read.
 */
public class MalformedCoordinateMetadataException extends CoordinateException {
  private static final long serialVersionUID = 7319480175326410915L;

  public MalformedCoordinateMetadataException(String message) {
    super(message);
  }

  public MalformedCoordinateMetadataException(String message, Throwable cause) {
    super(message, cause);
  }
}
