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

import org.slf4j.LoggerFactory;

/**
 * Receives the warnings raised while building or deriving coordinate systems: conditions worth reporting that do
 * not prevent the operation from completing (mixed axis units, an unsupported projection code, a rebinning factor
 * that does not divide the array).  The listener is handed to a coordinate system when it is built and is carried
 * over to every system derived from it, so the caller decides how warnings are surfaced.
 */
@FunctionalInterface
public interface DiagnosticListener {

  /**
   * Forwards warnings to the slf4j logger of the reporting class.
   */
  DiagnosticListener LOGGING = (source, message) -> LoggerFactory.getLogger(source).warn(message);

  /**
   * Discards warnings.
   */
  DiagnosticListener IGNORE = (source, message) -> { };

  /**
   * @param source the class reporting the warning
   * @param message a human readable description
   */
  void warn(Class<?> source, String message);
}
