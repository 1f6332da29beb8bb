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
 * Base class of the failures raised by the coordinate systems.  They are all programming or data-integrity errors
 * and are never retried.
 */
public class CoordinateException extends RuntimeException {
  private static final long serialVersionUID = -2418870213405576120L;

  public CoordinateException(String message) {
    super(message);
  }

  public CoordinateException(String message, Throwable cause) {
    super(message, cause);
  }
}
