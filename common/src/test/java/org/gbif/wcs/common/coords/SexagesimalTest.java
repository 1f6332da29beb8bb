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

import org.gbif.wcs.common.geometry.Double2D;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.AssertOnDouble2D.assertEquals;

public class SexagesimalTest {

  @Test
  public void testDeg2sexa() {
    String[] sexa = Sexagesimal.deg2sexa(new Double2D(-26.07862, 357.92195));
    assertArrayEquals(new String[] {"-26:04:43.032", "23:51:41.268"}, sexa);

    assertEquals("-00:30:00.000", Sexagesimal.deg2dms(-0.5));
    assertEquals("00:00:00.000", Sexagesimal.deg2hms(360));
    // rounding carries into the minutes and degrees
    assertEquals("11:00:00.000", Sexagesimal.deg2dms(10.99999999999));
  }

  @Test
  public void testSexa2deg() {
    assertEquals(new Double2D(-26.07862, 357.92195), Sexagesimal.sexa2deg("-26:04:43.032", "23:51:41.268"), 1e-6);
    assertEquals(-0.5, Sexagesimal.dms2deg("-00:30:00"), 0);
    assertEquals(187.5, Sexagesimal.hms2deg("12:30:00"), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingField() {
    Sexagesimal.dms2deg("12:34");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMinutesOutOfRange() {
    Sexagesimal.hms2deg("12:75:00");
  }
}
