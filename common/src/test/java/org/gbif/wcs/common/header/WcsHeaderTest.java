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
package org.gbif.wcs.common.header;

import java.util.Arrays;
import java.util.Map;

import org.gbif.wcs.common.coords.MalformedCoordinateMetadataException;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class WcsHeaderTest {

  @Test
  public void testKeysAreCaseInsensitive() {
    WcsHeader header = new WcsHeader().put("crval1", 10).put("Ctype1", "RA---TAN");
    assertTrue(header.contains("CRVAL1"));
    assertEquals(10, header.getDouble("CrVal1"), 0);
    assertEquals("RA---TAN", header.getString("CTYPE1", null));
    assertEquals(Arrays.asList("CRVAL1", "CTYPE1"), Lists.newArrayList(header.keys()));
  }

  @Test
  public void testNumbers() {
    WcsHeader header = WcsHeader.of(ImmutableMap.of("CDELT3", " 1.25 ", "NAXIS", 3, "CUNIT3", "Angstrom "));
    assertEquals(1.25, header.getDouble("CDELT3"), 0);
    assertEquals(3, header.getInt("NAXIS"));
    assertEquals(7.5, header.getDouble("CRPIX3", 7.5), 0);
    assertNull(header.getDoubleOrNull("CRPIX3"));
    assertNull(header.getIntOrNull("NAXIS3"));
    assertEquals("Angstrom", header.getString("CUNIT3", "m"));
    assertEquals("m", header.getString("CUNIT1", "m"));
  }

  @Test(expected = MalformedCoordinateMetadataException.class)
  public void testMissing() {
    new WcsHeader().getDouble("CRPIX1");
  }

  @Test(expected = MalformedCoordinateMetadataException.class)
  public void testNotNumeric() {
    new WcsHeader().put("CRPIX1", "centre").getDouble("CRPIX1");
  }

  @Test(expected = MalformedCoordinateMetadataException.class)
  public void testNotIntegral() {
    new WcsHeader().put("NAXIS1", 12.5).getInt("NAXIS1");
  }

  @Test
  public void testCopyIsIndependent() {
    WcsHeader header = new WcsHeader().put("CRPIX1", 1).put("CRPIX2", 2);
    WcsHeader copy = header.copy();
    assertEquals(header, copy);

    copy.remove("CRPIX2");
    copy.putAll(new WcsHeader().put("CRPIX1", 5));
    assertTrue(header.contains("CRPIX2"));
    assertEquals(1, header.getDouble("CRPIX1"), 0);
    assertEquals(5, copy.getDouble("CRPIX1"), 0);
    assertFalse(copy.containsAny("CRPIX2", "CRPIX3"));

    Map<String, Object> snapshot = header.asMap();
    header.put("CRPIX3", 3);
    assertEquals(2, snapshot.size());
    assertEquals(3, header.size());
  }
}
